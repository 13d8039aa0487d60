package com.mk.fx.qa.jmeter.execution.resource;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.mk.fx.qa.jmeter.execution.exception.ConflictException;
import com.mk.fx.qa.jmeter.execution.exception.DefinitionValidationException;
import com.mk.fx.qa.jmeter.execution.model.DefinitionFile;
import com.mk.fx.qa.jmeter.execution.service.LoadRunService;
import com.mk.fx.qa.jmeter.execution.validation.ValidationErrorKind;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = DefinitionController.class)
@Import({ApiResponseFactory.class, GlobalExceptionHandler.class, TaskMapperImpl.class})
class DefinitionControllerTest {

  @Autowired MockMvc mvc;

  @MockBean LoadRunService loadRunService;

  private static DefinitionFile definition(String name) {
    return new DefinitionFile(
        name, "c0ffee", 321, "abc123", "application/xml", Instant.parse("2024-05-01T10:00:00Z"));
  }

  private static MockMultipartFile upload(String name) {
    return new MockMultipartFile("file", name, "application/xml", "<jmeterTestPlan/>".getBytes());
  }

  @Test
  void upload_created() throws Exception {
    when(loadRunService.submitDefinition(any(), eq("smoke.jmx")))
        .thenReturn(definition("smoke.jmx"));

    mvc.perform(multipart("/api/definitions").file(upload("smoke.jmx")))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.name").value("smoke.jmx"))
        .andExpect(jsonPath("$.sha256").value("abc123"))
        .andExpect(jsonPath("$.storageKey").doesNotExist());
  }

  @Test
  void upload_rejected_badRequestWithKind() throws Exception {
    when(loadRunService.submitDefinition(any(), eq("plan.txt")))
        .thenThrow(
            new DefinitionValidationException(
                ValidationErrorKind.BAD_EXTENSION, "File extension not allowed"));

    mvc.perform(multipart("/api/definitions").file(upload("plan.txt")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.kind").value("BAD_EXTENSION"))
        .andExpect(jsonPath("$.details").value("File extension not allowed"));
  }

  @Test
  void upload_sameNameDifferentContent_conflict() throws Exception {
    when(loadRunService.submitDefinition(any(), eq("smoke.jmx")))
        .thenThrow(new ConflictException("Definition smoke.jmx already exists with other content"));

    mvc.perform(multipart("/api/definitions").file(upload("smoke.jmx")))
        .andExpect(status().isConflict());
  }

  @Test
  void upload_missingFilePart_badRequest() throws Exception {
    mvc.perform(multipart("/api/definitions")).andExpect(status().isBadRequest());
  }

  @Test
  void list_returnsMetadata() throws Exception {
    when(loadRunService.listDefinitions())
        .thenReturn(List.of(definition("b.jmx"), definition("a.jmx")));

    mvc.perform(get("/api/definitions"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].name").value("b.jmx"))
        .andExpect(jsonPath("$[1].name").value("a.jmx"));
  }
}
