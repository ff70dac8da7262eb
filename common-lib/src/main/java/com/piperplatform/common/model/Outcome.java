package com.piperplatform.common.model;

/**
 * What happened on this turn, as seen by the prompt and the fallback text.
 */
public enum Outcome {
    CORRECT_RESPONSE,
    INCORRECT_RESPONSE,
    CHILD_INACTIVE
}
