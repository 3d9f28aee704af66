package com.harness.alertmigration.model;

import com.harness.alertmigration.enums.MigrationStrategy;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of migrating one project's rules: either the counters of a committed project or
 * the failure that rolled it back.
 */
public record ProjectMigrationResult(
    Long projectId,
    int rulesExamined,
    int rulesUpdated,
    int rulesCreated,
    Map<MigrationStrategy, Integer> strategyCounts,
    ProjectMigrationFailure failure
) {

  public ProjectMigrationResult {
    strategyCounts = strategyCounts == null
        ? Map.of()
        : Map.copyOf(strategyCounts);
  }

  public static ProjectMigrationResult succeeded(
      Long projectId,
      int rulesExamined,
      int rulesUpdated,
      int rulesCreated,
      EnumMap<MigrationStrategy, Integer> strategyCounts) {
    return new ProjectMigrationResult(
        projectId, rulesExamined, rulesUpdated, rulesCreated, strategyCounts, null);
  }

  public static ProjectMigrationResult failed(ProjectMigrationFailure failure) {
    return new ProjectMigrationResult(failure.projectId(), 0, 0, 0, Map.of(), failure);
  }

  public boolean isSuccess() {
    return failure == null;
  }
}
