package com.harness.alertmigration.config;

import com.harness.alertmigration.migration.AlertFilterMigrationService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(MigrationProperties.class)
public class MigrationConfig {

  @Bean
  @ConditionalOnProperty(prefix = "migration.alert-filters", name = "run-on-startup", havingValue = "true")
  public CommandLineRunner alertFilterMigrationRunner(AlertFilterMigrationService migrationService) {
    return args -> migrationService.migrateAllOrganizations();
  }
}
