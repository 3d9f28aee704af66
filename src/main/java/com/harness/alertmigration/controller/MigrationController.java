package com.harness.alertmigration.controller;

import com.harness.alertmigration.migration.AlertFilterMigrationService;
import com.harness.alertmigration.model.MigrationReport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/migrations/alert-filters")
public class MigrationController {

  private final AlertFilterMigrationService migrationService;

  public MigrationController(AlertFilterMigrationService migrationService) {
    this.migrationService = migrationService;
  }

  /**
   * Runs the migration synchronously. Responds 409 while another run is in progress.
   */
  @PostMapping
  public ResponseEntity<MigrationReport> runMigration() {
    return ResponseEntity.ok(migrationService.runMigration());
  }
}
