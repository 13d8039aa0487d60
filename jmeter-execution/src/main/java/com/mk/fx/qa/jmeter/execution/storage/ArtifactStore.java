package com.mk.fx.qa.jmeter.execution.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.hash.Hashing;
import com.mk.fx.qa.jmeter.execution.cfg.RunnerCfg;
import com.mk.fx.qa.jmeter.execution.exception.ConflictException;
import com.mk.fx.qa.jmeter.execution.exception.StorageException;
import com.mk.fx.qa.jmeter.execution.model.ArtifactKind;
import com.mk.fx.qa.jmeter.execution.model.DefinitionFile;
import com.mk.fx.qa.jmeter.execution.validation.ValidationResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Filesystem storage for definitions, run outputs and reports.
 *
 * <p>Layout under the workspace root:
 *
 * <pre>
 * definitions/&lt;sha256(name)&gt;.jmx    definition bytes
 * definitions/&lt;sha256(name)&gt;.json   {@link DefinitionFile} metadata
 * runs/&lt;taskId&gt;/                    stdout.log, stderr.log, result.jtl, jmeter.log
 * reports/&lt;taskId&gt;/                 generated report
 * </pre>
 *
 * <p>Client-supplied names never become path segments. Artifact references are paths relative to
 * the workspace root and are resolved only inside it.
 */
@Slf4j
@Component
public class ArtifactStore {

  static final String DEFINITIONS = "definitions";
  static final String RUNS = "runs";
  static final String REPORTS = "reports";
  private static final String DEFINITION_SUFFIX = ".jmx";
  private static final String METADATA_SUFFIX = ".json";

  private final Path root;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Object definitionWriteLock = new Object();

  public ArtifactStore(RunnerCfg properties, ObjectMapper objectMapper, Clock clock) {
    this.root = Path.of(properties.getWorkspace()).toAbsolutePath().normalize();
    this.objectMapper = objectMapper;
    this.clock = clock;
    createDirectories(root.resolve(DEFINITIONS));
    createDirectories(root.resolve(RUNS));
    createDirectories(root.resolve(REPORTS));
    log.info("Artifact store initialised at {}", root);
  }

  public Path getRoot() {
    return root;
  }

  // -----------------------------------------------------
  // Definitions
  // -----------------------------------------------------

  /**
   * Stores an accepted definition. Storing the same name with identical bytes again returns the
   * existing record; different bytes under an existing name are a conflict because definitions
   * are immutable.
   */
  public DefinitionFile storeDefinition(ValidationResult accepted, byte[] content) {
    if (!accepted.accepted()) {
      throw new IllegalArgumentException("Only accepted definitions can be stored");
    }
    String name = accepted.sanitizedName();
    synchronized (definitionWriteLock) {
      Optional<DefinitionFile> existing = findDefinition(name);
      if (existing.isPresent()) {
        if (existing.get().sha256().equals(accepted.sha256())) {
          log.info("Definition {} already stored with identical content", name);
          return existing.get();
        }
        throw new ConflictException("Definition " + name + " already exists with other content");
      }

      String key = storageKey(name);
      DefinitionFile definition =
          new DefinitionFile(
              name,
              key,
              accepted.sizeBytes(),
              accepted.sha256(),
              accepted.contentType(),
              Instant.now(clock));
      Path definitionsDir = root.resolve(DEFINITIONS);
      writeAtomically(definitionsDir.resolve(key + DEFINITION_SUFFIX), content);
      writeAtomically(definitionsDir.resolve(key + METADATA_SUFFIX), toJson(definition));
      log.info("Stored definition {} ({} bytes) as {}", name, definition.sizeBytes(), key);
      return definition;
    }
  }

  public Optional<DefinitionFile> findDefinition(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    Path metadata = root.resolve(DEFINITIONS).resolve(storageKey(name) + METADATA_SUFFIX);
    if (!Files.isRegularFile(metadata)) {
      return Optional.empty();
    }
    return Optional.of(readMetadata(metadata));
  }

  /** Returns all stored definitions, newest upload first. */
  public List<DefinitionFile> listDefinitions() {
    List<DefinitionFile> definitions = new ArrayList<>();
    try (DirectoryStream<Path> stream =
        Files.newDirectoryStream(root.resolve(DEFINITIONS), "*" + METADATA_SUFFIX)) {
      for (Path metadata : stream) {
        definitions.add(readMetadata(metadata));
      }
    } catch (IOException e) {
      throw new StorageException("Failed to list definitions", e);
    }
    definitions.sort(Comparator.comparing(DefinitionFile::uploadedAt).reversed());
    return definitions;
  }

  public Path definitionPath(DefinitionFile definition) {
    return root.resolve(DEFINITIONS).resolve(definition.storageKey() + DEFINITION_SUFFIX);
  }

  // -----------------------------------------------------
  // Runs and reports
  // -----------------------------------------------------

  public RunPaths runPaths(UUID taskId) {
    Path dir = root.resolve(RUNS).resolve(taskId.toString());
    return new RunPaths(
        dir,
        dir.resolve(ArtifactKind.RESULT.fileName()),
        dir.resolve(ArtifactKind.ENGINE_LOG.fileName()),
        dir.resolve(ArtifactKind.STDOUT.fileName()),
        dir.resolve(ArtifactKind.STDERR.fileName()));
  }

  /** Creates the run directory and returns its paths. */
  public RunPaths prepareRun(UUID taskId) {
    RunPaths paths = runPaths(taskId);
    createDirectories(paths.directory());
    return paths;
  }

  /** Returns an empty report directory for the task, removing a previous one. */
  public Path prepareReportDirectory(UUID taskId) {
    Path dir = root.resolve(REPORTS).resolve(taskId.toString());
    deleteRecursively(dir);
    createDirectories(dir.getParent());
    return dir;
  }

  public Path artifactPath(UUID taskId, ArtifactKind kind) {
    return runPaths(taskId).directory().resolve(kind.fileName());
  }

  // -----------------------------------------------------
  // References
  // -----------------------------------------------------

  public String toRef(Path path) {
    Path normalised = path.toAbsolutePath().normalize();
    if (!normalised.startsWith(root)) {
      throw new StorageException("Path is outside the workspace: " + path);
    }
    return root.relativize(normalised).toString().replace('\\', '/');
  }

  public Path resolve(String ref) {
    Path resolved = root.resolve(ref).normalize();
    if (!resolved.startsWith(root)) {
      throw new StorageException("Reference escapes the workspace: " + ref);
    }
    return resolved;
  }

  public boolean exists(String ref) {
    return ref != null && Files.exists(resolve(ref));
  }

  // -----------------------------------------------------
  // Helpers
  // -----------------------------------------------------

  @VisibleForTesting
  static String storageKey(String name) {
    return Hashing.sha256().hashString(name, StandardCharsets.UTF_8).toString();
  }

  private void writeAtomically(Path target, byte[] content) {
    Path temp = null;
    try {
      temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
      Files.write(temp, content);
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      deleteIfExists(temp);
      throw new StorageException("Failed to write " + target.getFileName(), e);
    }
  }

  private byte[] toJson(DefinitionFile definition) {
    try {
      return objectMapper.writeValueAsBytes(definition);
    } catch (IOException e) {
      throw new StorageException("Failed to serialise definition " + definition.name(), e);
    }
  }

  private DefinitionFile readMetadata(Path metadata) {
    try {
      return objectMapper.readValue(metadata.toFile(), DefinitionFile.class);
    } catch (IOException e) {
      throw new StorageException("Failed to read definition metadata " + metadata.getFileName(), e);
    }
  }

  private static void createDirectories(Path dir) {
    try {
      Files.createDirectories(dir);
    } catch (IOException e) {
      throw new StorageException("Failed to create directory " + dir, e);
    }
  }

  private static void deleteIfExists(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Failed to delete temporary file {}: {}", path, e.getMessage());
    }
  }

  private static void deleteRecursively(Path dir) {
    if (!Files.exists(dir)) {
      return;
    }
    try (Stream<Path> walk = Files.walk(dir)) {
      List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
      for (Path path : paths) {
        Files.delete(path);
      }
      log.info("Removed existing directory {}", dir);
    } catch (IOException e) {
      throw new StorageException("Failed to remove " + dir, e);
    }
  }
}
