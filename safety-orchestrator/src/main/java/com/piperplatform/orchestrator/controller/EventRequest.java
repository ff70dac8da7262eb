package com.piperplatform.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.piperplatform.common.event.SafetyEvent;
import com.piperplatform.common.model.TaskContext;

public record EventRequest(
    @JsonProperty("event") SafetyEvent event,
    @JsonProperty("task")  TaskContext task
) {}
