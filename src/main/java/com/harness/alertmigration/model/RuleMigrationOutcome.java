package com.harness.alertmigration.model;

import com.harness.alertmigration.enums.MigrationStrategy;
import java.util.Optional;

/**
 * Result of migrating a single rule.
 *
 * @param strategy strategy chosen for the rule
 * @param modified whether {@code updatedOriginal} differs from the stored rule and must be saved
 * @param updatedOriginal the original rule in its migrated shape
 * @param newRule rule split off from the original, present only for {@link MigrationStrategy#SPLIT_RULE}
 */
public record RuleMigrationOutcome(
    MigrationStrategy strategy,
    boolean modified,
    AlertRule updatedOriginal,
    Optional<NewRuleRequest> newRule
) {

  public static RuleMigrationOutcome unchanged(MigrationStrategy strategy, AlertRule rule) {
    return new RuleMigrationOutcome(strategy, false, rule, Optional.empty());
  }

  public static RuleMigrationOutcome updated(MigrationStrategy strategy, AlertRule rule) {
    return new RuleMigrationOutcome(strategy, true, rule, Optional.empty());
  }

  public static RuleMigrationOutcome split(AlertRule rule, NewRuleRequest newRule) {
    return new RuleMigrationOutcome(MigrationStrategy.SPLIT_RULE, true, rule, Optional.of(newRule));
  }
}
