package com.mk.fx.qa.jmeter.execution.dto.controllerresponse;

import jakarta.validation.constraints.NotBlank;

/** Request body for starting a run of an uploaded definition. */
public record StartRunRequest(
    @NotBlank(message = "definitionName is required") String definitionName) {}
