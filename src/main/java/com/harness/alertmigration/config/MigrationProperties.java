package com.harness.alertmigration.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Settings under {@code migration.alert-filters}.
 *
 * @param runOnStartup run the migration once when the application starts
 * @param dryRun migrate every project but roll back each project's transaction
 * @param organizationBatchSize number of organizations fetched per page
 * @param progressLogInterval log progress every this many organizations
 */
@Validated
@ConfigurationProperties(prefix = "migration.alert-filters")
public record MigrationProperties(
    @DefaultValue("false") boolean runOnStartup,
    @DefaultValue("false") boolean dryRun,
    @DefaultValue("100") @Min(1) int organizationBatchSize,
    @DefaultValue("100") @Min(1) int progressLogInterval
) {}
