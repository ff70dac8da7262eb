package com.piperplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Card context as the pipeline consumes it: target answers joined into one expected string.
 */
public record TaskContext(
    @JsonProperty("cardType")     String       cardType,
    @JsonProperty("category")     String       category,
    @JsonProperty("question")     String       question,
    @JsonProperty("targetAnswer") String       targetAnswer,
    @JsonProperty("imageLabels")  List<String> imageLabels
) {}
