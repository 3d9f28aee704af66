package com.harness.alertmigration.enums;

public enum PredicateKind {
  /** Already in the filter namespace. */
  FILTER,
  /** A condition with a known filter equivalent. */
  MIGRATABLE_CONDITION,
  /** Any other condition; stays a trigger. */
  CONDITION
}
