package com.piperplatform.orchestrator.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChoiceRequest(
    @JsonProperty("action") String action
) {}
