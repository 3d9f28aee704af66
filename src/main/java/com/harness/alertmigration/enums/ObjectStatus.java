package com.harness.alertmigration.enums;

public enum ObjectStatus {
  ACTIVE,
  DISABLED,
  PENDING_DELETION,
  DELETION_IN_PROGRESS
}
