package com.harness.alertmigration.model;

import com.harness.alertmigration.enums.MigrationStrategy;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record MigrationReport(
    Instant startedAt,
    Instant finishedAt,
    boolean dryRun,
    int organizationsProcessed,
    List<Long> migratedProjectIds,
    List<ProjectMigrationFailure> failures,
    int rulesUpdated,
    int rulesCreated,
    Map<MigrationStrategy, Integer> strategyCounts
) {

  public static Builder builder(Instant startedAt, boolean dryRun) {
    return new Builder(startedAt, dryRun);
  }

  public static final class Builder {

    private final Instant startedAt;
    private final boolean dryRun;
    private int organizationsProcessed;
    private final List<Long> migratedProjectIds = new ArrayList<>();
    private final List<ProjectMigrationFailure> failures = new ArrayList<>();
    private int rulesUpdated;
    private int rulesCreated;
    private final EnumMap<MigrationStrategy, Integer> strategyCounts =
        new EnumMap<>(MigrationStrategy.class);

    private Builder(Instant startedAt, boolean dryRun) {
      this.startedAt = startedAt;
      this.dryRun = dryRun;
    }

    public Builder organizationProcessed() {
      organizationsProcessed++;
      return this;
    }

    public Builder record(ProjectMigrationResult result) {
      if (!result.isSuccess()) {
        failures.add(result.failure());
        return this;
      }
      migratedProjectIds.add(result.projectId());
      rulesUpdated += result.rulesUpdated();
      rulesCreated += result.rulesCreated();
      result.strategyCounts().forEach((strategy, count) ->
          strategyCounts.merge(strategy, count, Integer::sum));
      return this;
    }

    public int organizationsProcessed() {
      return organizationsProcessed;
    }

    public MigrationReport build(Instant finishedAt) {
      return new MigrationReport(
          startedAt,
          finishedAt,
          dryRun,
          organizationsProcessed,
          List.copyOf(migratedProjectIds),
          List.copyOf(failures),
          rulesUpdated,
          rulesCreated,
          Map.copyOf(strategyCounts)
      );
    }
  }
}
