package com.mk.fx.qa.jmeter.execution.resource;

import com.mk.fx.qa.jmeter.execution.dto.controllerresponse.HealthResponse;
import com.mk.fx.qa.jmeter.execution.dto.controllerresponse.QueueStatusResponse;
import com.mk.fx.qa.jmeter.execution.dto.controllerresponse.ReportResponse;
import com.mk.fx.qa.jmeter.execution.dto.controllerresponse.StartRunRequest;
import com.mk.fx.qa.jmeter.execution.dto.controllerresponse.TaskCancellationResponse;
import com.mk.fx.qa.jmeter.execution.dto.controllerresponse.TaskHistoryEntry;
import com.mk.fx.qa.jmeter.execution.dto.controllerresponse.TaskMetricsResponse;
import com.mk.fx.qa.jmeter.execution.dto.controllerresponse.TaskStatusResponse;
import com.mk.fx.qa.jmeter.execution.dto.controllerresponse.TaskSubmissionResponse;
import com.mk.fx.qa.jmeter.execution.model.ArtifactKind;
import com.mk.fx.qa.jmeter.execution.model.TaskFilter;
import com.mk.fx.qa.jmeter.execution.model.TaskStatus;
import com.mk.fx.qa.jmeter.execution.service.LoadRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@Slf4j
@Tag(
    name = "Runs",
    description = "Endpoints for starting, monitoring, and managing JMeter test runs")
@RestController
@RequestMapping("/api/runs")
@RequiredArgsConstructor
public class RunController {

  static final int MAX_PAGE_SIZE = 100;

  private final LoadRunService loadRunService;
  private final TaskMapper taskMapper;
  private final ApiResponseFactory responseFactory;

  // -----------------------------------------------------
  // Run submission
  // -----------------------------------------------------
  @Operation(summary = "Start a run", description = "Queues a run of an uploaded definition.")
  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<TaskSubmissionResponse> startRun(
      @Valid @RequestBody StartRunRequest request) {
    log.info("Received run request for definition {}", request.definitionName());
    var task = loadRunService.startRun(request.definitionName());
    return responseFactory.accepted(taskMapper.toSubmissionResponse(task, "Run queued"));
  }

  @Operation(
      summary = "Upload and run",
      description = "Validates and stores a .jmx file, then queues a run of it.")
  @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<TaskSubmissionResponse> uploadAndRun(
      @RequestPart("file") MultipartFile file) {
    log.info("Received upload-and-run for {}", file.getOriginalFilename());
    var task = loadRunService.uploadAndRun(Uploads.bytes(file), file.getOriginalFilename());
    return responseFactory.accepted(taskMapper.toSubmissionResponse(task, "Run queued"));
  }

  // -----------------------------------------------------
  // Run status and control
  // -----------------------------------------------------
  @Operation(summary = "Get run status", description = "Returns current status of a run.")
  @GetMapping("/{taskId}")
  public ResponseEntity<TaskStatusResponse> getRun(@PathVariable UUID taskId) {
    return responseFactory.ok(taskMapper.toStatusResponse(loadRunService.getTask(taskId)));
  }

  @Operation(summary = "Cancel run", description = "Cancels a pending or running run.")
  @DeleteMapping("/{taskId}")
  public ResponseEntity<?> cancelRun(@PathVariable UUID taskId) {
    var result = loadRunService.cancelRun(taskId);
    log.info("Cancellation requested for {} -> {}", taskId, result.getState());
    return switch (result.getState()) {
      case NOT_FOUND -> responseFactory.error(HttpStatus.NOT_FOUND, "Not Found", "Task not found");
      case NOT_CANCELLABLE -> responseFactory.error(
          HttpStatus.CONFLICT,
          "Conflict",
          "Task cannot be cancelled in its current state: " + result.getTaskStatus());
      case CANCELLED -> responseFactory.ok(
          new TaskCancellationResponse(taskId, result.getTaskStatus(), "Task cancelled"));
    };
  }

  @Operation(
      summary = "List runs",
      description = "Lists runs in creation order, optionally filtered by status and definition.")
  @GetMapping
  public ResponseEntity<List<TaskStatusResponse>> listRuns(
      @RequestParam(required = false) String status,
      @RequestParam(required = false) String definition,
      @RequestParam(defaultValue = "50") int limit,
      @RequestParam(defaultValue = "0") int offset) {
    if (limit > MAX_PAGE_SIZE) {
      throw new IllegalArgumentException("limit must not exceed " + MAX_PAGE_SIZE);
    }
    TaskStatus taskStatus = status == null ? null : TaskStatus.fromValue(status);
    var filter = new TaskFilter(taskStatus, definition, offset, limit);
    return responseFactory.ok(taskMapper.toStatusResponses(loadRunService.listTasks(filter)));
  }

  // -----------------------------------------------------
  // Reports and artifacts
  // -----------------------------------------------------
  @Operation(
      summary = "Generate report",
      description = "Generates the HTML report of a completed run, or returns the existing one.")
  @PostMapping("/{taskId}/report")
  public ResponseEntity<ReportResponse> requestReport(@PathVariable UUID taskId) {
    String reportRef = loadRunService.requestReport(taskId);
    return responseFactory.ok(new ReportResponse(taskId, reportRef));
  }

  @Operation(
      summary = "Download artifact",
      description = "Downloads result, stdout, stderr or engine-log of a run.")
  @GetMapping("/{taskId}/artifacts/{kind}")
  public ResponseEntity<Resource> downloadArtifact(
      @PathVariable UUID taskId, @PathVariable String kind) {
    ArtifactKind artifactKind = ArtifactKind.fromValue(kind);
    var path = loadRunService.artifact(taskId, artifactKind);
    return ResponseEntity.ok()
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment()
                .filename(taskId + "-" + artifactKind.fileName())
                .build()
                .toString())
        .contentType(MediaType.APPLICATION_OCTET_STREAM)
        .body(new FileSystemResource(path));
  }

  // -----------------------------------------------------
  // Queue, metrics and history
  // -----------------------------------------------------
  @Operation(summary = "Run history", description = "Returns recently finished runs.")
  @GetMapping("/history")
  public ResponseEntity<List<TaskHistoryEntry>> getHistory() {
    return responseFactory.ok(taskMapper.toHistoryEntries(loadRunService.getTaskHistory()));
  }

  @Operation(summary = "Queue status", description = "Returns current queue load.")
  @GetMapping("/queue")
  public ResponseEntity<QueueStatusResponse> getQueueStatus() {
    return responseFactory.ok(loadRunService.getQueueStatus());
  }

  @Operation(summary = "Overall metrics", description = "Returns aggregate metrics across runs.")
  @GetMapping("/metrics")
  public ResponseEntity<TaskMetricsResponse> getMetrics() {
    return responseFactory.ok(loadRunService.getMetrics());
  }

  @Operation(summary = "Health check", description = "Verifies engine, workspace and pool.")
  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    var health = loadRunService.getHealth();
    log.debug("Health check: {}", health.status());
    return "UP".equals(health.status())
        ? responseFactory.ok(health)
        : responseFactory.unavailable(health);
  }
}
