package com.harness.alertmigration.migration;

import static com.harness.alertmigration.support.RuleFixtures.ageFilter;
import static com.harness.alertmigration.support.RuleFixtures.everyEvent;
import static com.harness.alertmigration.support.RuleFixtures.firstSeen;
import static com.harness.alertmigration.support.RuleFixtures.level;
import static com.harness.alertmigration.support.RuleFixtures.tagged;
import static org.assertj.core.api.Assertions.assertThat;

import com.harness.alertmigration.enums.MatchMode;
import com.harness.alertmigration.enums.MigrationStrategy;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MigrationStrategyClassifierTest {

  private MigrationStrategyClassifier classifier;

  @BeforeEach
  void setUp() {
    classifier = new MigrationStrategyClassifier();
  }

  @Test
  void noneMatchWithTriggersNeedsNoneRuleRewrite() {
    assertThat(classifier.classify(MatchMode.NONE, List.of(firstSeen(), tagged("env", "prod"))))
        .isEqualTo(MigrationStrategy.MODIFY_NONE_RULE);
    assertThat(classifier.classify(MatchMode.NONE, List.of(everyEvent())))
        .isEqualTo(MigrationStrategy.MODIFY_NONE_RULE);
  }

  @Test
  void noneMatchWithOnlyFilterShapedConditionsIsSimple() {
    assertThat(classifier.classify(MatchMode.NONE, List.of(tagged("env", "prod"), ageFilter())))
        .isEqualTo(MigrationStrategy.SIMPLE_MIGRATE);
  }

  @Test
  void anyMatchMixingTriggersAndMigratableConditionsIsSplit() {
    assertThat(classifier.classify(MatchMode.ANY, List.of(firstSeen(), level("40"))))
        .isEqualTo(MigrationStrategy.SPLIT_RULE);
  }

  @Test
  void anyMatchWithTriggersAndOnlyExistingFiltersIsSimple() {
    assertThat(classifier.classify(MatchMode.ANY, List.of(firstSeen(), ageFilter())))
        .isEqualTo(MigrationStrategy.SIMPLE_MIGRATE);
  }

  @Test
  void allMatchIsAlwaysSimple() {
    assertThat(classifier.classify(MatchMode.ALL, List.of(firstSeen(), level("40"))))
        .isEqualTo(MigrationStrategy.SIMPLE_MIGRATE);
    assertThat(classifier.classify(MatchMode.ALL, List.of()))
        .isEqualTo(MigrationStrategy.SIMPLE_MIGRATE);
  }

  @Test
  void missingMatchIsSimple() {
    assertThat(classifier.classify(null, List.of(firstSeen(), level("40"))))
        .isEqualTo(MigrationStrategy.SIMPLE_MIGRATE);
  }
}
