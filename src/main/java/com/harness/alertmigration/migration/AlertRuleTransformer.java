package com.harness.alertmigration.migration;

import com.harness.alertmigration.enums.MatchMode;
import com.harness.alertmigration.enums.MigrationStrategy;
import com.harness.alertmigration.enums.PredicateKind;
import com.harness.alertmigration.model.AlertRule;
import com.harness.alertmigration.model.ConditionDto;
import com.harness.alertmigration.model.NewRuleRequest;
import com.harness.alertmigration.model.RuleData;
import com.harness.alertmigration.model.RuleMigrationOutcome;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Rewrites a rule into the conditions + filters model.
 *
 * <p>Transforms are pure: the returned {@link RuleMigrationOutcome} describes the rule to
 * save and, for split rules, the rule to create. Persisting both is left to the caller.
 */
@Component
public class AlertRuleTransformer {

  static final String ORIGINAL_RULE_SUFFIX = " (1)";
  static final String SPLIT_RULE_SUFFIX = " (2)";

  private final MigrationStrategyClassifier classifier;
  private final ConditionReclassifier reclassifier;

  public AlertRuleTransformer(MigrationStrategyClassifier classifier,
                              ConditionReclassifier reclassifier) {
    this.classifier = classifier;
    this.reclassifier = reclassifier;
  }

  public RuleMigrationOutcome migrate(AlertRule rule) {
    RuleData data = rule.data();
    MigrationStrategy strategy = classifier.classify(data.actionMatch(), data.conditions());
    return switch (strategy) {
      case SIMPLE_MIGRATE -> simpleMigrate(rule);
      case SPLIT_RULE -> splitRule(rule);
      case MODIFY_NONE_RULE -> modifyNoneRule(rule);
    };
  }

  /**
   * Moves migratable conditions over to filters and carries the old match over to the
   * filters. Rules without a migratable condition are left alone, which is what makes a
   * second run a no-op.
   */
  RuleMigrationOutcome simpleMigrate(AlertRule rule) {
    RuleData data = rule.data();
    boolean needsMigration = data.conditions().stream()
        .anyMatch(condition -> condition.kind() == PredicateKind.MIGRATABLE_CONDITION);
    if (!needsMigration) {
      return RuleMigrationOutcome.unchanged(MigrationStrategy.SIMPLE_MIGRATE, rule);
    }

    RuleData migrated = data
        .withConditions(reclassifyAll(data.conditions()))
        .withFilterMatchFromActionMatch();
    if (data.actionMatch() == MatchMode.NONE) {
      migrated = migrated.withActionMatch(MatchMode.ALL);
    }
    return RuleMigrationOutcome.updated(MigrationStrategy.SIMPLE_MIGRATE, rule.withData(migrated));
  }

  /**
   * Splits an 'any' rule that mixes triggers and filters into two rules sharing the same
   * actions: the original keeps the triggers, the new one gets the filters.
   *
   * <p>This is best effort. Both rules now fire on their own, so an event matching a
   * trigger and a filter runs the actions twice.
   */
  RuleMigrationOutcome splitRule(AlertRule rule) {
    RuleData data = rule.data();
    List<ConditionDto> filters = new ArrayList<>();
    List<ConditionDto> triggers = new ArrayList<>();
    for (ConditionDto condition : data.conditions()) {
      if (condition.kind() == PredicateKind.CONDITION) {
        triggers.add(condition);
      } else {
        filters.add(reclassifier.reclassify(condition));
      }
    }

    String originalLabel = rule.label();
    AlertRule original = rule
        .withLabel(originalLabel + ORIGINAL_RULE_SUFFIX)
        .withData(data.withConditions(triggers));

    RuleData filterRuleData = new RuleData(
        MatchMode.ANY,
        MatchMode.ANY,
        filters,
        data.actions(),
        data.frequency()
    );
    NewRuleRequest filterRule = new NewRuleRequest(
        rule.projectId(),
        rule.environmentId(),
        originalLabel + SPLIT_RULE_SUFFIX,
        filterRuleData
    );
    return RuleMigrationOutcome.split(original, filterRule);
  }

  /**
   * Migrates a 'none' rule that still has triggers. 'none' cannot be expressed over
   * conditions any more, so the conditions switch to 'any' and the filters keep 'none'.
   * This changes which events fire the rule.
   */
  RuleMigrationOutcome modifyNoneRule(AlertRule rule) {
    RuleData data = rule.data();
    List<ConditionDto> migrated = data.conditions().stream()
        .filter(condition -> !ConditionFilterMapping.EVERY_EVENT_CONDITION.equals(condition.id()))
        .map(reclassifier::reclassify)
        .toList();

    RuleData updated = data
        .withConditions(migrated)
        .withFilterMatch(MatchMode.NONE)
        .withActionMatch(MatchMode.ANY);
    return RuleMigrationOutcome.updated(MigrationStrategy.MODIFY_NONE_RULE, rule.withData(updated));
  }

  private List<ConditionDto> reclassifyAll(List<ConditionDto> conditions) {
    return conditions.stream().map(reclassifier::reclassify).toList();
  }
}
