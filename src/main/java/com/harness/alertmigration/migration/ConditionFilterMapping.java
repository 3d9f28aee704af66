package com.harness.alertmigration.migration;

import com.harness.alertmigration.enums.PredicateKind;
import java.util.Map;
import java.util.Optional;

/**
 * Identifiers of the rule predicates touched by the filter migration.
 *
 * <p>Conditions listed in {@link #CONDITIONS_TO_FILTERS} have an equivalent in the filter
 * namespace. Every other condition stays a trigger.
 */
public final class ConditionFilterMapping {

  public static final String FILTER_PREFIX = "sentry.rules.filters";

  public static final String EVERY_EVENT_CONDITION =
      "sentry.rules.conditions.every_event.EveryEventCondition";

  public static final String TAGGED_EVENT_CONDITION =
      "sentry.rules.conditions.tagged_event.TaggedEventCondition";
  public static final String EVENT_ATTRIBUTE_CONDITION =
      "sentry.rules.conditions.event_attribute.EventAttributeCondition";
  public static final String LEVEL_CONDITION =
      "sentry.rules.conditions.level.LevelCondition";

  public static final String TAGGED_EVENT_FILTER =
      "sentry.rules.filters.tagged_event.TaggedEventFilter";
  public static final String EVENT_ATTRIBUTE_FILTER =
      "sentry.rules.filters.event_attribute.EventAttributeFilter";
  public static final String LEVEL_FILTER =
      "sentry.rules.filters.level.LevelFilter";

  private static final Map<String, String> CONDITIONS_TO_FILTERS = Map.of(
      TAGGED_EVENT_CONDITION, TAGGED_EVENT_FILTER,
      EVENT_ATTRIBUTE_CONDITION, EVENT_ATTRIBUTE_FILTER,
      LEVEL_CONDITION, LEVEL_FILTER
  );

  private ConditionFilterMapping() {}

  public static PredicateKind kindOf(String id) {
    if (CONDITIONS_TO_FILTERS.containsKey(id)) {
      return PredicateKind.MIGRATABLE_CONDITION;
    }
    if (id.startsWith(FILTER_PREFIX)) {
      return PredicateKind.FILTER;
    }
    return PredicateKind.CONDITION;
  }

  public static Optional<String> filterFor(String conditionId) {
    return Optional.ofNullable(CONDITIONS_TO_FILTERS.get(conditionId));
  }
}
