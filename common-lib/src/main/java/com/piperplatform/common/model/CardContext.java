package com.piperplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The card currently displayed to the child, as supplied by the game.
 */
public record CardContext(
    @JsonProperty("category")      String       category,
    @JsonProperty("question")      String       question,
    @JsonProperty("targetAnswers") List<String> targetAnswers,
    @JsonProperty("imageLabels")   List<String> imageLabels
) {
    public CardContext {
        targetAnswers = targetAnswers == null ? List.of() : List.copyOf(targetAnswers);
        imageLabels   = imageLabels == null ? List.of() : List.copyOf(imageLabels);
    }

    public TaskContext toTaskContext() {
        return new TaskContext("single-answer", category, question,
            String.join(", ", targetAnswers), imageLabels);
    }
}
