package com.mk.fx.qa.jmeter.execution.engine;

import com.mk.fx.qa.jmeter.execution.cfg.RunnerCfg;
import com.google.common.annotations.VisibleForTesting;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Spawns an external command, waits for it within a deadline and reports an {@link
 * ExecutionOutcome}.
 *
 * <p>Output is appended to files rather than buffered in memory. Where {@code setsid} is
 * available every command starts as the leader of its own process group. When a deadline passes
 * or a run is cancelled the whole group gets a graceful terminate and is killed after the grace
 * period, which also reaches grandchildren whose parent already exited. Descendants reachable
 * from the process are terminated the same way on systems without {@code setsid}.
 */
@Slf4j
@Component
public class ProcessRunner {

  static final int SIGNAL_EXIT_BASE = 128;
  private static final List<String> SETSID_LOCATIONS = List.of("/usr/bin/setsid", "/bin/setsid");

  private final Duration killGrace;
  private final String setsid;
  private final Set<Long> groupLeaders = ConcurrentHashMap.newKeySet();

  public ProcessRunner(RunnerCfg properties) {
    this.killGrace = properties.getExecution().getKillGrace();
    this.setsid =
        SETSID_LOCATIONS.stream()
            .filter(location -> Files.isExecutable(Path.of(location)))
            .findFirst()
            .orElse(null);
    if (setsid == null) {
      log.warn("setsid not found, orphaned engine processes cannot be terminated as a group");
    }
  }

  @VisibleForTesting
  boolean isolatesProcessGroups() {
    return setsid != null;
  }

  public ExecutionOutcome run(
      List<String> command, Path stdout, Path stderr, Duration timeout, ExecutionHandle handle) {
    if (setsid != null && !isLaunchable(command.get(0))) {
      log.error("Failed to start {}: not an executable file", command.get(0));
      return ExecutionOutcome.launchFailed(
          "failed to start engine: " + command.get(0) + " is not an executable file");
    }
    List<String> argv =
        setsid == null ? command : Stream.concat(Stream.of(setsid), command.stream()).toList();
    var builder =
        new ProcessBuilder(argv)
            .redirectOutput(ProcessBuilder.Redirect.appendTo(stdout.toFile()))
            .redirectError(ProcessBuilder.Redirect.appendTo(stderr.toFile()));

    Process process;
    try {
      process = builder.start();
    } catch (IOException e) {
      log.error("Failed to start {}: {}", command.get(0), e.getMessage());
      return ExecutionOutcome.launchFailed("failed to start engine: " + e.getMessage());
    }
    log.info("Process {} started for task {}", process.pid(), handle.getTaskId());
    if (setsid != null) {
      groupLeaders.add(process.pid());
    }
    try {
      return await(process, timeout, handle);
    } finally {
      groupLeaders.remove(process.pid());
    }
  }

  /** setsid reports a failed exec only as an exit code, so the executable is resolved up front. */
  private static boolean isLaunchable(String executable) {
    if (executable.contains("/")) {
      return Files.isExecutable(Path.of(executable));
    }
    String searchPath = System.getenv("PATH");
    if (searchPath == null) {
      return false;
    }
    return Stream.of(searchPath.split(File.pathSeparator))
        .filter(dir -> !dir.isEmpty())
        .anyMatch(dir -> Files.isExecutable(Path.of(dir, executable)));
  }

  private ExecutionOutcome await(Process process, Duration timeout, ExecutionHandle handle) {
    if (!handle.attach(process)) {
      terminateTree(process);
      return ExecutionOutcome.cancelled();
    }

    try {
      boolean exited = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!exited) {
        log.warn(
            "Process {} exceeded timeout of {}s, terminating", process.pid(), timeout.toSeconds());
        terminateTree(process);
        return ExecutionOutcome.timedOut("timeout exceeded after " + timeout.toSeconds() + "s");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      terminateTree(process);
      return ExecutionOutcome.failed(null, "interrupted while waiting for engine");
    }

    if (handle.isCancelled()) {
      return ExecutionOutcome.cancelled();
    }
    int exitCode = process.exitValue();
    log.info("Process {} exited with code {}", process.pid(), exitCode);
    if (exitCode == 0) {
      return ExecutionOutcome.succeeded();
    }
    return ExecutionOutcome.failed(exitCode, describeExit(exitCode));
  }

  static String describeExit(int exitCode) {
    return exitCode > SIGNAL_EXIT_BASE
        ? "engine killed by signal " + (exitCode - SIGNAL_EXIT_BASE)
        : "engine exited with code " + exitCode;
  }

  /** Terminates the process and everything it spawned. Blocks for at most the grace period. */
  public void terminateTree(Process process) {
    boolean group = groupLeaders.contains(process.pid());
    List<ProcessHandle> tree = new ArrayList<>();
    process.descendants().forEach(tree::add);
    tree.add(process.toHandle());

    if (group) {
      signalGroup(process.pid(), "TERM");
    }
    tree.forEach(ProcessHandle::destroy);
    long deadline = System.nanoTime() + killGrace.toNanos();
    for (ProcessHandle member : tree) {
      long remaining = Math.max(0L, deadline - System.nanoTime());
      member.onExit().completeOnTimeout(member, remaining, TimeUnit.NANOSECONDS).join();
    }

    // members outside the snapshot cannot be awaited; they get KILL once the snapshot is settled
    if (group) {
      signalGroup(process.pid(), "KILL");
    }
    int survivors = 0;
    for (ProcessHandle member : tree) {
      if (member.isAlive()) {
        member.destroyForcibly();
        survivors++;
      }
    }
    if (survivors > 0) {
      log.warn("Killed {} process(es) of tree {} after grace period", survivors, process.pid());
    }
  }

  private void signalGroup(long groupId, String signal) {
    try {
      Process kill =
          new ProcessBuilder("kill", "-" + signal, "--", "-" + groupId)
              .redirectErrorStream(true)
              .redirectOutput(ProcessBuilder.Redirect.DISCARD)
              .start();
      if (!kill.waitFor(killGrace.toMillis(), TimeUnit.MILLISECONDS)) {
        kill.destroyForcibly();
        log.warn("kill -{} for process group {} did not return in time", signal, groupId);
      }
    } catch (IOException e) {
      log.warn("Failed to signal process group {}: {}", groupId, e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while signalling process group {}", groupId);
    }
  }
}
