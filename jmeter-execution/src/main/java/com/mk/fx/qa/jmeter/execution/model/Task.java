package com.mk.fx.qa.jmeter.execution.model;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.Builder;

/**
 * One execution attempt of a definition file.
 *
 * <p>Instances are immutable snapshots. Only {@link
 * com.mk.fx.qa.jmeter.execution.repository.TaskRepository} produces new snapshots, so {@code
 * startedAt} is set iff the status is not PENDING and {@code finishedAt} is set iff the status is
 * terminal.
 */
@Builder(toBuilder = true)
public record Task(
    UUID taskId,
    String definitionName,
    TaskStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    String outputLogRef,
    String reportRef,
    Integer exitCode,
    String errorMessage) {

  /** Wall-clock time spent between start and finish, or zero while unfinished. */
  public long durationMillis() {
    if (startedAt == null || finishedAt == null) {
      return 0L;
    }
    return Duration.between(startedAt, finishedAt).toMillis();
  }
}
