package com.harness.alertmigration.store;

import com.harness.alertmigration.model.AlertRule;
import com.harness.alertmigration.model.NewRuleRequest;
import com.harness.alertmigration.model.OrganizationDto;
import com.harness.alertmigration.model.ProjectDto;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Storage used by the alert filter migration. Writes are expected to run inside
 * {@link #withTransaction(boolean, Supplier)}.
 */
public interface AlertRuleStore {

  /** Active organizations in id order. Fetched lazily, a page at a time. */
  Iterable<OrganizationDto> listActiveOrganizations();

  List<ProjectDto> listActiveProjects(OrganizationDto organization);

  List<AlertRule> listActiveRules(ProjectDto project);

  Optional<ProjectDto> findProject(Long projectId);

  AlertRule createRule(Long projectId, NewRuleRequest request);

  AlertRule saveRule(AlertRule rule);

  ProjectDto saveProject(ProjectDto project);

  /**
   * Runs {@code work} in a single transaction. Any exception thrown by {@code work} rolls
   * the transaction back and is rethrown. With {@code rollbackOnly} the transaction is
   * rolled back even when {@code work} completes.
   */
  <T> T withTransaction(boolean rollbackOnly, Supplier<T> work);

  default <T> T withTransaction(Supplier<T> work) {
    return withTransaction(false, work);
  }
}
