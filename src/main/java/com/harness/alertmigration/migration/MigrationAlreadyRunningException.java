package com.harness.alertmigration.migration;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class MigrationAlreadyRunningException extends RuntimeException {

  public MigrationAlreadyRunningException() {
    super("Alert filter migration is already running");
  }
}
