package com.mk.fx.qa.jmeter.execution.resource;

import com.mk.fx.qa.jmeter.execution.dto.controllerresponse.DefinitionResponse;
import com.mk.fx.qa.jmeter.execution.dto.controllerresponse.TaskHistoryEntry;
import com.mk.fx.qa.jmeter.execution.dto.controllerresponse.TaskStatusResponse;
import com.mk.fx.qa.jmeter.execution.dto.controllerresponse.TaskSubmissionResponse;
import com.mk.fx.qa.jmeter.execution.model.DefinitionFile;
import com.mk.fx.qa.jmeter.execution.model.Task;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface TaskMapper {

  @Mapping(
      target = "durationMillis",
      expression = "java(task.finishedAt() == null ? null : task.durationMillis())")
  TaskStatusResponse toStatusResponse(Task task);

  List<TaskStatusResponse> toStatusResponses(List<Task> tasks);

  @Mapping(target = "durationMillis", expression = "java(task.durationMillis())")
  TaskHistoryEntry toHistoryEntry(Task task);

  List<TaskHistoryEntry> toHistoryEntries(List<Task> tasks);

  DefinitionResponse toDefinitionResponse(DefinitionFile definition);

  List<DefinitionResponse> toDefinitionResponses(List<DefinitionFile> definitions);

  default TaskSubmissionResponse toSubmissionResponse(Task task, String message) {
    return new TaskSubmissionResponse(
        task.taskId(), task.definitionName(), task.status(), message);
  }
}
