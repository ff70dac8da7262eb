package com.piperplatform.orchestrator.pipeline;

import com.piperplatform.common.model.TurnAssessment;
import com.piperplatform.common.model.UIPackage;

/**
 * Output of {@link SafetyGatePipeline#process} for one event.
 *
 * @param uiPackage         what the transport layer delivers
 * @param assessment        the deterministic half, for logging and session bookkeeping
 * @param usedFallback      true when the spoken line is the deterministic fallback
 * @param scheduledBreakDue periodic break threshold reached
 */
public record TurnResult(
    UIPackage      uiPackage,
    TurnAssessment assessment,
    boolean        usedFallback,
    boolean        scheduledBreakDue
) {}
