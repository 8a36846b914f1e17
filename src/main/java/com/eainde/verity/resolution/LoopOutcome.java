package com.eainde.verity.resolution;

import com.eainde.verity.model.LoopDecision;
import com.eainde.verity.model.ResolutionStatus;

public record LoopOutcome(LoopDecision decision, ResolutionStatus resolutionStatus, String reason) {
}
