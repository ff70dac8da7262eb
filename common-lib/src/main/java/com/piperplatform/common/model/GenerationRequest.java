package com.piperplatform.common.model;

/**
 * Request-scoped bundle driving one generation call and validating its result.
 */
public record GenerationRequest(
    String              systemPrompt,
    ResponseContext     context,
    ResponseConstraints constraints,
    ResponseReasoning   reasoning
) {}
