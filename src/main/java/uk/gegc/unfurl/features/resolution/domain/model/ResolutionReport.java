package uk.gegc.unfurl.features.resolution.domain.model;

import uk.gegc.unfurl.features.decoder.domain.model.ResolutionOutcome;
import uk.gegc.unfurl.features.retry.domain.model.ScheduleDecision;

/**
 * One attempt on a tracked article: what the decoder produced and what the scheduler did with it.
 */
public record ResolutionReport(Long articleId, ResolutionOutcome outcome, ScheduleDecision decision) {
}
