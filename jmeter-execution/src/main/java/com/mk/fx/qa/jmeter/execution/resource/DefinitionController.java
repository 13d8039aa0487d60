package com.mk.fx.qa.jmeter.execution.resource;

import com.mk.fx.qa.jmeter.execution.dto.controllerresponse.DefinitionResponse;
import com.mk.fx.qa.jmeter.execution.service.LoadRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@Slf4j
@Tag(name = "Definitions", description = "Upload and list JMeter test plans")
@RestController
@RequestMapping("/api/definitions")
@RequiredArgsConstructor
public class DefinitionController {

  private final LoadRunService loadRunService;
  private final TaskMapper taskMapper;
  private final ApiResponseFactory responseFactory;

  @Operation(
      summary = "Upload a test plan",
      description = "Validates and stores a .jmx file. Re-uploading identical content is a no-op.")
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<DefinitionResponse> upload(@RequestPart("file") MultipartFile file) {
    log.info(
        "Received definition upload {} ({} bytes)", file.getOriginalFilename(), file.getSize());
    var definition =
        loadRunService.submitDefinition(Uploads.bytes(file), file.getOriginalFilename());
    return responseFactory.created(taskMapper.toDefinitionResponse(definition));
  }

  @Operation(summary = "List test plans", description = "Lists stored definitions, newest first.")
  @GetMapping
  public ResponseEntity<List<DefinitionResponse>> list() {
    return responseFactory.ok(taskMapper.toDefinitionResponses(loadRunService.listDefinitions()));
  }
}
