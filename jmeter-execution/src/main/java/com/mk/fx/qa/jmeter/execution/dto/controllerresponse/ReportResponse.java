package com.mk.fx.qa.jmeter.execution.dto.controllerresponse;

import java.util.UUID;

public record ReportResponse(UUID taskId, String reportRef) {}
