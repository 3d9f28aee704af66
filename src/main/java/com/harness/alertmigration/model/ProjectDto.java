package com.harness.alertmigration.model;

public record ProjectDto(
    Long id,
    Long organizationId,
    String slug,
    String name,
    boolean hasAlertFilters
) {

  public ProjectDto withHasAlertFilters(boolean enabled) {
    return new ProjectDto(id, organizationId, slug, name, enabled);
  }
}
