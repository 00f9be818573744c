package io.harvestmesh.processing;

import io.harvestmesh.model.ListingRecord;

/**
 * Result of one processing attempt.
 *
 * @param then          outcome after a resolved challenge, set only for {@link Classification#RATE_LIMITED_RESOLVED}
 * @param record        extracted fields, set only when content was found
 * @param failureReason free-form reason for non-terminal classifications
 */
public record ProcessingOutcome(
        Classification classification,
        Classification then,
        ListingRecord record,
        String failureReason
) {
    public ProcessingOutcome {
        if (classification == null) {
            throw new IllegalArgumentException("classification must not be null");
        }
        if (classification == Classification.RATE_LIMITED_RESOLVED) {
            if (then == null || then == Classification.RATE_LIMITED_RESOLVED) {
                throw new IllegalArgumentException("rate_limited_resolved needs a follow-up classification");
            }
        } else if (then != null) {
            throw new IllegalArgumentException("only rate_limited_resolved carries a follow-up classification");
        }
    }

    public static ProcessingOutcome contentFound(ListingRecord record) {
        return new ProcessingOutcome(Classification.CONTENT_FOUND, null, record == null ? ListingRecord.empty() : record, null);
    }

    public static ProcessingOutcome contentRemoved() {
        return new ProcessingOutcome(Classification.CONTENT_REMOVED, null, null, null);
    }

    public static ProcessingOutcome blockedHard(String reason) {
        return new ProcessingOutcome(Classification.BLOCKED_HARD, null, null, reason);
    }

    public static ProcessingOutcome rateLimitedUnresolved(String reason) {
        return new ProcessingOutcome(Classification.RATE_LIMITED_UNRESOLVED, null, null, reason);
    }

    public static ProcessingOutcome extractionFailed(String reason) {
        return new ProcessingOutcome(Classification.EXTRACTION_FAILED, null, null, reason);
    }

    public static ProcessingOutcome unexpected(String reason) {
        return new ProcessingOutcome(Classification.UNEXPECTED, null, null, reason);
    }

    /**
     * Wraps the outcome observed after a challenge was solved.
     */
    public static ProcessingOutcome resolvedThen(ProcessingOutcome next) {
        return new ProcessingOutcome(Classification.RATE_LIMITED_RESOLVED, next.classification(), next.record(), next.failureReason());
    }

    /**
     * The classification that decides the task, looking through a resolved challenge.
     */
    public Classification effective() {
        return then == null ? classification : then;
    }
}
