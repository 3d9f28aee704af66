package com.harness.alertmigration.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.harness.alertmigration.enums.MatchMode;
import com.harness.alertmigration.enums.PredicateKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON document stored on every alert rule.
 *
 * <p>{@code filterMatch} is absent until the rule has been migrated. Filters and trigger
 * conditions share the stored {@code conditions} list and are told apart by identifier,
 * see {@link #filters()} and {@link #triggerConditions()}.
 *
 * <p>Keys that are not modelled, and match values that are not a known {@link MatchMode},
 * are kept in {@code extra} and written back as they were read.
 */
public record RuleData(
    MatchMode actionMatch,
    MatchMode filterMatch,
    List<ConditionDto> conditions,
    List<Map<String, Object>> actions,
    Integer frequency,
    Map<String, Object> extra
) {

  public static final String ACTION_MATCH = "action_match";
  public static final String FILTER_MATCH = "filter_match";
  public static final String CONDITIONS = "conditions";
  public static final String ACTIONS = "actions";
  public static final String FREQUENCY = "frequency";

  public RuleData {
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
    actions = actions == null ? List.of() : List.copyOf(actions);
    extra = extra == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
  }

  public RuleData(MatchMode actionMatch,
                  MatchMode filterMatch,
                  List<ConditionDto> conditions,
                  List<Map<String, Object>> actions,
                  Integer frequency) {
    this(actionMatch, filterMatch, conditions, actions, frequency, Map.of());
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static RuleData fromJson(Map<String, Object> json) {
    Map<String, Object> extra = new LinkedHashMap<>(json == null ? Map.of() : json);
    MatchMode actionMatch = takeMatch(extra, ACTION_MATCH);
    MatchMode filterMatch = takeMatch(extra, FILTER_MATCH);
    List<ConditionDto> conditions = readConditions(extra.remove(CONDITIONS));
    List<Map<String, Object>> actions = readActions(extra.remove(ACTIONS));
    Integer frequency = null;
    if (extra.get(FREQUENCY) instanceof Number number) {
      frequency = number.intValue();
      extra.remove(FREQUENCY);
    }
    return new RuleData(actionMatch, filterMatch, conditions, actions, frequency, extra);
  }

  @JsonValue
  public Map<String, Object> toJson() {
    Map<String, Object> json = new LinkedHashMap<>();
    if (actionMatch != null) {
      json.put(ACTION_MATCH, actionMatch.value());
    }
    if (filterMatch != null) {
      json.put(FILTER_MATCH, filterMatch.value());
    }
    json.put(CONDITIONS, conditions);
    json.put(ACTIONS, actions);
    if (frequency != null) {
      json.put(FREQUENCY, frequency);
    }
    extra.forEach(json::putIfAbsent);
    return json;
  }

  public RuleData withConditions(List<ConditionDto> newConditions) {
    return new RuleData(actionMatch, filterMatch, newConditions, actions, frequency, extra);
  }

  public RuleData withActionMatch(MatchMode newActionMatch) {
    return new RuleData(newActionMatch, filterMatch, conditions, actions, frequency,
        without(ACTION_MATCH));
  }

  public RuleData withFilterMatch(MatchMode newFilterMatch) {
    return new RuleData(actionMatch, newFilterMatch, conditions, actions, frequency,
        without(FILTER_MATCH));
  }

  /**
   * Sets the filter match to whatever is stored as the action match, including a value
   * that is not a known {@link MatchMode}.
   */
  public RuleData withFilterMatchFromActionMatch() {
    if (actionMatch != null || !extra.containsKey(ACTION_MATCH)) {
      return withFilterMatch(actionMatch);
    }
    Map<String, Object> copy = new LinkedHashMap<>(extra);
    copy.put(FILTER_MATCH, extra.get(ACTION_MATCH));
    return new RuleData(actionMatch, null, conditions, actions, frequency, copy);
  }

  public List<ConditionDto> triggerConditions() {
    return conditions.stream()
        .filter(condition -> condition.kind() != PredicateKind.FILTER)
        .toList();
  }

  public List<ConditionDto> filters() {
    return conditions.stream()
        .filter(condition -> condition.kind() == PredicateKind.FILTER)
        .toList();
  }

  private Map<String, Object> without(String key) {
    if (!extra.containsKey(key)) {
      return extra;
    }
    Map<String, Object> copy = new LinkedHashMap<>(extra);
    copy.remove(key);
    return copy;
  }

  // Unknown match values stay behind in the extra map.
  private static MatchMode takeMatch(Map<String, Object> json, String key) {
    if (json.get(key) instanceof String value) {
      MatchMode mode = MatchMode.fromValue(value);
      if (mode != null) {
        json.remove(key);
        return mode;
      }
    }
    return null;
  }

  @SuppressWarnings("unchecked")
  private static List<ConditionDto> readConditions(Object value) {
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof List<?> list)) {
      throw new IllegalArgumentException("Rule conditions are not a list: " + value);
    }
    List<ConditionDto> conditions = new ArrayList<>();
    for (Object entry : list) {
      if (!(entry instanceof Map<?, ?> map)) {
        throw new IllegalArgumentException("Rule condition is not an object: " + entry);
      }
      conditions.add(ConditionDto.fromJson((Map<String, Object>) map));
    }
    return conditions;
  }

  @SuppressWarnings("unchecked")
  private static List<Map<String, Object>> readActions(Object value) {
    if (value == null) {
      return List.of();
    }
    if (!(value instanceof List<?> list)) {
      throw new IllegalArgumentException("Rule actions are not a list: " + value);
    }
    List<Map<String, Object>> actions = new ArrayList<>();
    for (Object entry : list) {
      if (!(entry instanceof Map<?, ?> map)) {
        throw new IllegalArgumentException("Rule action is not an object: " + entry);
      }
      actions.add((Map<String, Object>) map);
    }
    return actions;
  }
}
