package com.harness.alertmigration.support;

import com.harness.alertmigration.enums.MatchMode;
import com.harness.alertmigration.migration.ConditionFilterMapping;
import com.harness.alertmigration.model.AlertRule;
import com.harness.alertmigration.model.ConditionDto;
import com.harness.alertmigration.model.RuleData;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class RuleFixtures {

  public static final String FIRST_SEEN_CONDITION =
      "sentry.rules.conditions.first_seen_event.FirstSeenEventCondition";
  public static final String REGRESSION_CONDITION =
      "sentry.rules.conditions.regression_event.RegressionEventCondition";
  public static final String AGE_COMPARISON_FILTER =
      "sentry.rules.filters.age_comparison.AgeComparisonFilter";
  public static final String NOTIFY_ACTION =
      "sentry.rules.actions.notify_event.NotifyEventAction";

  private RuleFixtures() {}

  public static ConditionDto firstSeen() {
    return ConditionDto.of(FIRST_SEEN_CONDITION);
  }

  public static ConditionDto regression() {
    return ConditionDto.of(REGRESSION_CONDITION);
  }

  public static ConditionDto everyEvent() {
    return ConditionDto.of(ConditionFilterMapping.EVERY_EVENT_CONDITION);
  }

  public static ConditionDto tagged(String key, String value) {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("key", key);
    params.put("match", "eq");
    params.put("value", value);
    return new ConditionDto(ConditionFilterMapping.TAGGED_EVENT_CONDITION, params);
  }

  public static ConditionDto level(String level) {
    return new ConditionDto(
        ConditionFilterMapping.LEVEL_CONDITION, Map.of("match", "gte", "level", level));
  }

  public static ConditionDto attribute(String attribute, String value) {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("attribute", attribute);
    params.put("match", "co");
    params.put("value", value);
    return new ConditionDto(ConditionFilterMapping.EVENT_ATTRIBUTE_CONDITION, params);
  }

  public static ConditionDto ageFilter() {
    return new ConditionDto(
        AGE_COMPARISON_FILTER, Map.of("comparison_type", "older", "value", 3, "time", "day"));
  }

  public static List<Map<String, Object>> notifyActions() {
    return List.of(Map.of("id", NOTIFY_ACTION));
  }

  public static RuleData data(MatchMode actionMatch, ConditionDto... conditions) {
    return new RuleData(actionMatch, null, List.of(conditions), notifyActions(), 30);
  }

  public static AlertRule rule(Long id, Long projectId, MatchMode actionMatch, ConditionDto... conditions) {
    return new AlertRule(id, projectId, 7L, "Rule " + id, data(actionMatch, conditions));
  }
}
