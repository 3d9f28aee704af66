package com.harness.alertmigration.model;

/**
 * A rule that a migration wants created. Persisted by the migration driver, never by the
 * transformer that produced it.
 */
public record NewRuleRequest(
    Long projectId,
    Long environmentId,
    String label,
    RuleData data
) {}
