package com.mk.fx.qa.jmeter.execution.storage;

import java.nio.file.Path;

/**
 * Absolute locations of one run's files. Every path is derived from the task id.
 *
 * @param directory run directory, {@code runs/<taskId>}
 * @param resultLog raw result log written by the engine
 * @param engineLog the engine's own log file
 * @param stdout captured standard output, appended
 * @param stderr captured standard error, appended
 */
public record RunPaths(Path directory, Path resultLog, Path engineLog, Path stdout, Path stderr) {}
