package com.harness.alertmigration.model;

public record AlertRule(
    Long id,
    Long projectId,
    Long environmentId,
    String label,
    RuleData data
) {

  public AlertRule withLabel(String newLabel) {
    return new AlertRule(id, projectId, environmentId, newLabel, data);
  }

  public AlertRule withData(RuleData newData) {
    return new AlertRule(id, projectId, environmentId, label, newData);
  }
}
