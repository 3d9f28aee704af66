package com.harness.alertmigration.migration;

import com.harness.alertmigration.enums.MatchMode;
import com.harness.alertmigration.enums.MigrationStrategy;
import com.harness.alertmigration.enums.PredicateKind;
import com.harness.alertmigration.model.ConditionDto;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Picks how a rule has to be migrated so that it keeps firing on the same events once
 * conditions and filters are matched separately.
 */
@Component
public class MigrationStrategyClassifier {

  public MigrationStrategy classify(MatchMode actionMatch, List<ConditionDto> conditions) {
    boolean hasMigratableConditions = false;
    boolean hasOldConditions = false;
    for (ConditionDto condition : conditions) {
      PredicateKind kind = condition.kind();
      if (kind == PredicateKind.MIGRATABLE_CONDITION) {
        hasMigratableConditions = true;
      } else if (kind == PredicateKind.CONDITION) {
        hasOldConditions = true;
      }
    }

    if (actionMatch == MatchMode.NONE && hasOldConditions) {
      // 'none' is no longer available for conditions once filters are split out.
      return MigrationStrategy.MODIFY_NONE_RULE;
    }
    if (actionMatch == MatchMode.ANY && hasMigratableConditions && hasOldConditions) {
      // AND-ing an 'any' over conditions with an 'any' over filters would narrow the rule.
      return MigrationStrategy.SPLIT_RULE;
    }
    return MigrationStrategy.SIMPLE_MIGRATE;
  }
}
