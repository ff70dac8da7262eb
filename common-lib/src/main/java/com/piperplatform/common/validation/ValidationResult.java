package com.piperplatform.common.validation;

import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link ResponseValidator#validate}.
 *
 * @param valid        true only when every check passed
 * @param checks       check name &rarr; passed, in evaluation order
 * @param failedChecks names of failed checks, in evaluation order
 * @param reason       null when valid
 */
public record ValidationResult(
    boolean              valid,
    Map<String, Boolean> checks,
    List<String>         failedChecks,
    String               reason
) {}
