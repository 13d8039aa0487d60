package com.mk.fx.qa.jmeter.execution.storage;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.jmeter.execution.Fixtures;
import com.mk.fx.qa.jmeter.execution.cfg.ObjectMapperConfig;
import com.mk.fx.qa.jmeter.execution.exception.ConflictException;
import com.mk.fx.qa.jmeter.execution.exception.StorageException;
import com.mk.fx.qa.jmeter.execution.model.ArtifactKind;
import com.mk.fx.qa.jmeter.execution.validation.ValidationResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArtifactStoreTest {

  @TempDir Path workspace;

  private ArtifactStore store;

  @BeforeEach
  void setUp() {
    store =
        new ArtifactStore(
            Fixtures.cfg(workspace),
            ObjectMapperConfig.create(),
            Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
  }

  private static ValidationResult accepted(String name, String sha) {
    return ValidationResult.accepted(name, 10, sha, "application/xml");
  }

  @Test
  void constructor_createsLayout() {
    assertTrue(Files.isDirectory(workspace.resolve("definitions")));
    assertTrue(Files.isDirectory(workspace.resolve("runs")));
    assertTrue(Files.isDirectory(workspace.resolve("reports")));
  }

  @Test
  void storeDefinition_writesUnderServerGeneratedKey() throws Exception {
    byte[] content = Fixtures.plan();

    var stored = store.storeDefinition(accepted("smoke.jmx", "abc"), content);

    assertEquals("smoke.jmx", stored.name());
    assertEquals(ArtifactStore.storageKey("smoke.jmx"), stored.storageKey());
    assertEquals(64, stored.storageKey().length());
    assertEquals(Instant.parse("2024-05-01T10:00:00Z"), stored.uploadedAt());
    Path path = store.definitionPath(stored);
    assertTrue(path.startsWith(workspace.resolve("definitions")));
    assertFalse(path.getFileName().toString().contains("smoke"));
    assertArrayEquals(content, Files.readAllBytes(path));
  }

  @Test
  void storeDefinition_sameContentTwice_isIdempotent() {
    var first = store.storeDefinition(accepted("smoke.jmx", "abc"), Fixtures.plan());
    var second = store.storeDefinition(accepted("smoke.jmx", "abc"), Fixtures.plan());

    assertEquals(first, second);
    assertEquals(1, store.listDefinitions().size());
  }

  @Test
  void storeDefinition_differentContentUnderSameName_conflicts() {
    store.storeDefinition(accepted("smoke.jmx", "abc"), Fixtures.plan("A"));

    assertThrows(
        ConflictException.class,
        () -> store.storeDefinition(accepted("smoke.jmx", "def"), Fixtures.plan("B")));
  }

  @Test
  void storeDefinition_rejectsUnvalidatedResult() {
    var rejected =
        ValidationResult.rejected(
            com.mk.fx.qa.jmeter.execution.validation.ValidationErrorKind.EMPTY_FILE, "empty");

    assertThrows(
        IllegalArgumentException.class, () -> store.storeDefinition(rejected, new byte[0]));
  }

  @Test
  void findDefinition_roundTripsMetadata() {
    var stored = store.storeDefinition(accepted("smoke.jmx", "abc"), Fixtures.plan());

    assertEquals(stored, store.findDefinition("smoke.jmx").orElseThrow());
    assertTrue(store.findDefinition("other.jmx").isEmpty());
    assertTrue(store.findDefinition(null).isEmpty());
  }

  @Test
  void prepareRun_pathsDeriveFromTaskIdOnly() {
    UUID taskId = UUID.randomUUID();

    var paths = store.prepareRun(taskId);

    assertEquals(workspace.resolve("runs").resolve(taskId.toString()), paths.directory());
    assertTrue(Files.isDirectory(paths.directory()));
    assertEquals("result.jtl", paths.resultLog().getFileName().toString());
    assertEquals("jmeter.log", paths.engineLog().getFileName().toString());
    assertEquals(paths.stdout(), store.artifactPath(taskId, ArtifactKind.STDOUT));
  }

  @Test
  void prepareReportDirectory_removesPreviousReport() throws Exception {
    UUID taskId = UUID.randomUUID();
    Path dir = store.prepareReportDirectory(taskId);
    Files.createDirectories(dir.resolve("content"));
    Files.writeString(dir.resolve("content/index.html"), "old");

    Path again = store.prepareReportDirectory(taskId);

    assertEquals(dir, again);
    assertFalse(Files.exists(again));
    assertTrue(Files.isDirectory(again.getParent()));
  }

  @Test
  void refs_resolveInsideWorkspaceOnly() throws Exception {
    var paths = store.prepareRun(UUID.randomUUID());
    Files.writeString(paths.resultLog(), "<testResults/>");

    String ref = store.toRef(paths.resultLog());

    assertFalse(Path.of(ref).isAbsolute());
    assertEquals(paths.resultLog(), store.resolve(ref));
    assertTrue(store.exists(ref));
    assertFalse(store.exists(null));
    assertThrows(StorageException.class, () -> store.resolve("../outside.txt"));
    assertThrows(StorageException.class, () -> store.toRef(workspace.getParent()));
  }
}
