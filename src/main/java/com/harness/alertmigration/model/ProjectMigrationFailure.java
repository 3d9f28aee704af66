package com.harness.alertmigration.model;

/**
 * A project whose rules could not be migrated. Its transaction was rolled back, so the
 * project is picked up again by the next run.
 */
public record ProjectMigrationFailure(
    Long organizationId,
    Long projectId,
    String errorType,
    String message
) {

  public static ProjectMigrationFailure of(Long organizationId, Long projectId, Throwable error) {
    return new ProjectMigrationFailure(
        organizationId,
        projectId,
        error.getClass().getName(),
        error.getMessage()
    );
  }
}
