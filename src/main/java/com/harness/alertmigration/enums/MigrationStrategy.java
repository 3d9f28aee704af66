package com.harness.alertmigration.enums;

public enum MigrationStrategy {
  SIMPLE_MIGRATE,
  SPLIT_RULE,
  MODIFY_NONE_RULE
}
