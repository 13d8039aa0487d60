package com.mk.fx.qa.jmeter.execution.engine;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.mk.fx.qa.jmeter.execution.Fixtures;
import com.mk.fx.qa.jmeter.execution.cfg.RunnerCfg;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessRunnerTest {

  private static final Duration LONG = Duration.ofSeconds(30);

  @TempDir Path dir;

  private ProcessRunner runner;
  private Path stdout;
  private Path stderr;

  @BeforeEach
  void setUp() {
    RunnerCfg cfg = new RunnerCfg();
    cfg.getExecution().setKillGrace(Duration.ofSeconds(1));
    runner = new ProcessRunner(cfg);
    stdout = dir.resolve("stdout.log");
    stderr = dir.resolve("stderr.log");
  }

  private ExecutionOutcome run(Duration timeout, String script) {
    return runner.run(
        List.of("/bin/sh", "-c", script),
        stdout,
        stderr,
        timeout,
        new ExecutionHandle(UUID.randomUUID()));
  }

  private static boolean alive(long pid) {
    return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
  }

  @Test
  void run_zeroExit_succeedsAndCapturesOutput() throws Exception {
    var outcome = run(LONG, "echo hello; echo oops 1>&2");

    assertTrue(outcome.isSuccess());
    assertEquals(0, outcome.exitCode());
    assertTrue(Files.readString(stdout).contains("hello"));
    assertTrue(Files.readString(stderr).contains("oops"));
  }

  @Test
  void run_outputIsAppended() throws Exception {
    run(LONG, "echo first");
    run(LONG, "echo second");

    assertEquals("first\nsecond\n", Files.readString(stdout));
  }

  @Test
  void run_nonZeroExit_fails() {
    var outcome = run(LONG, "exit 3");

    assertEquals(ExecutionOutcome.Kind.FAILED, outcome.kind());
    assertEquals(3, outcome.exitCode());
    assertEquals("engine exited with code 3", outcome.message());
  }

  @Test
  void run_missingExecutable_isLaunchFailure() {
    var outcome =
        runner.run(
            List.of(dir.resolve("no-such-engine").toString()),
            stdout,
            stderr,
            LONG,
            new ExecutionHandle(UUID.randomUUID()));

    assertEquals(ExecutionOutcome.Kind.LAUNCH_FAILED, outcome.kind());
    assertTrue(outcome.message().startsWith("failed to start engine"));
  }

  @Test
  void run_timeout_killsWholeTree() throws Exception {
    Path childPid = dir.resolve("child.pid");

    var outcome =
        run(Duration.ofSeconds(1), "sleep 30 & echo $! > '" + childPid + "'; wait");

    assertEquals(ExecutionOutcome.Kind.TIMED_OUT, outcome.kind());
    assertEquals("timeout exceeded after 1s", outcome.message());
    long pid = Long.parseLong(Files.readString(childPid).trim());
    await().atMost(Duration.ofSeconds(5)).until(() -> !alive(pid));
  }

  @Test
  void run_timeout_killsGrandchildWhoseParentExited() throws Exception {
    assumeTrue(runner.isolatesProcessGroups(), "setsid not available");
    Path grandchildPid = dir.resolve("grandchild.pid");

    var outcome =
        run(
            Duration.ofSeconds(1),
            "sh -c 'sleep 30 & echo $! > \"" + grandchildPid + "\"'; sleep 30");

    assertEquals(ExecutionOutcome.Kind.TIMED_OUT, outcome.kind());
    long pid = Long.parseLong(Files.readString(grandchildPid).trim());
    await().atMost(Duration.ofSeconds(5)).until(() -> !alive(pid));
  }

  @Test
  void run_killedBySignal_namesSignal() {
    var outcome = run(LONG, "kill -9 $$");

    assertEquals(ExecutionOutcome.Kind.FAILED, outcome.kind());
    assertEquals(137, outcome.exitCode());
    assertEquals("engine killed by signal 9", outcome.message());
  }

  @Test
  void describeExit_distinguishesCodesFromSignals() {
    assertEquals("engine exited with code 2", ProcessRunner.describeExit(2));
    assertEquals("engine exited with code 128", ProcessRunner.describeExit(128));
    assertEquals("engine killed by signal 15", ProcessRunner.describeExit(143));
  }

  @Test
  void run_cancelledBeforeSpawn_terminatesImmediately() {
    var handle = new ExecutionHandle(UUID.randomUUID());
    assertNull(handle.cancel());

    long started = System.nanoTime();
    var outcome = runner.run(List.of("/bin/sh", "-c", "sleep 30"), stdout, stderr, LONG, handle);

    assertEquals(ExecutionOutcome.Kind.CANCELLED, outcome.kind());
    assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started) < 10);
  }

  @Test
  void run_cancelledWhileRunning_terminatesTree() throws Exception {
    var handle = new ExecutionHandle(UUID.randomUUID());
    Path ready = dir.resolve("ready");
    var result =
        CompletableFuture.supplyAsync(
            () ->
                runner.run(
                    List.of("/bin/sh", "-c", "touch '" + ready + "'; sleep 30"),
                    stdout,
                    stderr,
                    LONG,
                    handle));
    await().atMost(Duration.ofSeconds(5)).until(() -> Files.exists(ready));

    Process process = handle.cancel();
    assertNotNull(process);
    runner.terminateTree(process);

    var outcome = result.get(10, TimeUnit.SECONDS);
    assertEquals(ExecutionOutcome.Kind.CANCELLED, outcome.kind());
    assertFalse(process.isAlive());
  }

  @Test
  void terminateTree_forceKillsProcessesIgnoringTerm() throws Exception {
    Path ready = dir.resolve("ready");
    String body = "trap '' TERM; touch '" + ready + "'; while true; do sleep 1; done";
    Process process = new ProcessBuilder("/bin/sh", "-c", body).start();
    await().atMost(Duration.ofSeconds(5)).until(() -> Files.exists(ready));

    runner.terminateTree(process);

    assertTrue(process.waitFor(5, TimeUnit.SECONDS));
  }
}
