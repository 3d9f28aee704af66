package com.harness.alertmigration.migration;

import com.harness.alertmigration.config.MigrationProperties;
import com.harness.alertmigration.enums.MigrationStrategy;
import com.harness.alertmigration.model.AlertRule;
import com.harness.alertmigration.model.MigrationReport;
import com.harness.alertmigration.model.OrganizationDto;
import com.harness.alertmigration.model.ProjectDto;
import com.harness.alertmigration.model.ProjectMigrationFailure;
import com.harness.alertmigration.model.ProjectMigrationResult;
import com.harness.alertmigration.model.RuleMigrationOutcome;
import com.harness.alertmigration.store.AlertRuleStore;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Moves every active project's issue alert rules over to conditions and filters and turns
 * on alert filters for the project.
 *
 * <p>Projects are migrated one at a time, each in its own transaction, grouped by
 * organization so that an organization mostly sees the change at once. A project that
 * fails is rolled back, logged and skipped. Every transform is idempotent, so the fix for
 * a failed project is to run the migration again.
 */
@Service
public class AlertFilterMigrationService {

  private static final Logger log = LoggerFactory.getLogger(AlertFilterMigrationService.class);

  private final AlertRuleStore store;
  private final AlertRuleTransformer transformer;
  private final MigrationProperties properties;
  private final Clock clock;
  private final AtomicBoolean running = new AtomicBoolean(false);

  @Autowired
  public AlertFilterMigrationService(AlertRuleStore store,
                                     AlertRuleTransformer transformer,
                                     MigrationProperties properties) {
    this(store, transformer, properties, Clock.systemUTC());
  }

  AlertFilterMigrationService(AlertRuleStore store,
                              AlertRuleTransformer transformer,
                              MigrationProperties properties,
                              Clock clock) {
    this.store = store;
    this.transformer = transformer;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Fire-and-forget entry point. Failures only show up in the logs.
   */
  public void migrateAllOrganizations() {
    runMigration();
  }

  public MigrationReport runMigration() {
    if (!running.compareAndSet(false, true)) {
      throw new MigrationAlreadyRunningException();
    }
    try {
      return migrate();
    } finally {
      running.set(false);
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  private MigrationReport migrate() {
    boolean dryRun = properties.dryRun();
    MigrationReport.Builder report = MigrationReport.builder(clock.instant(), dryRun);
    log.info("Starting alert filter migration (dryRun={})", dryRun);

    for (OrganizationDto organization : store.listActiveOrganizations()) {
      for (ProjectDto project : store.listActiveProjects(organization)) {
        report.record(migrateProject(organization, project, dryRun));
      }
      report.organizationProcessed();
      if (report.organizationsProcessed() % properties.progressLogInterval() == 0) {
        log.info("Alert filter migration progress: {} organizations processed, last organization {}",
            report.organizationsProcessed(), organization.id());
      }
    }

    MigrationReport result = report.build(clock.instant());
    log.info(
        "Alert filter migration finished: organizations={}, projectsMigrated={}, projectsFailed={}, "
            + "rulesUpdated={}, rulesCreated={}, dryRun={}",
        result.organizationsProcessed(),
        result.migratedProjectIds().size(),
        result.failures().size(),
        result.rulesUpdated(),
        result.rulesCreated(),
        result.dryRun()
    );
    if (!result.failures().isEmpty()) {
      log.warn("Alert filter migration failed for projects {}; re-run the migration once fixed",
          result.failures().stream().map(ProjectMigrationFailure::projectId).toList());
    }
    return result;
  }

  ProjectMigrationResult migrateProject(OrganizationDto organization, ProjectDto project, boolean dryRun) {
    try {
      return store.withTransaction(dryRun, () -> migrateProjectRules(project));
    } catch (Exception e) {
      log.error("Error migrating project {} of organization {}", project.id(), organization.id(), e);
      return ProjectMigrationResult.failed(
          ProjectMigrationFailure.of(organization.id(), project.id(), e));
    }
  }

  private ProjectMigrationResult migrateProjectRules(ProjectDto project) {
    List<AlertRule> rules = store.listActiveRules(project);
    int updated = 0;
    int created = 0;
    EnumMap<MigrationStrategy, Integer> strategies = new EnumMap<>(MigrationStrategy.class);

    for (AlertRule rule : rules) {
      RuleMigrationOutcome outcome = transformer.migrate(rule);
      if (!outcome.modified()) {
        log.debug("Rule {} of project {} needs no migration", rule.id(), project.id());
        continue;
      }
      log.debug("Migrating rule {} of project {} with {}", rule.id(), project.id(), outcome.strategy());
      strategies.merge(outcome.strategy(), 1, Integer::sum);
      store.saveRule(outcome.updatedOriginal());
      updated++;
      if (outcome.newRule().isPresent()) {
        store.createRule(project.id(), outcome.newRule().get());
        created++;
      }
    }

    store.saveProject(project.withHasAlertFilters(true));
    log.debug("Project {} migrated: rules={}, updated={}, created={}",
        project.id(), rules.size(), updated, created);
    return ProjectMigrationResult.succeeded(project.id(), rules.size(), updated, created, strategies);
  }
}
