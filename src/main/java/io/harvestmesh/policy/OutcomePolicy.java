package io.harvestmesh.policy;

import io.harvestmesh.model.ResultStatus;
import io.harvestmesh.processing.Classification;
import io.harvestmesh.processing.ProcessingOutcome;

/**
 * Maps the classification of one processing attempt to what the worker does with the task and
 * its proxy.
 *
 * <pre>
 * classification                      terminal  rotate  result
 * blocked_hard                        no        yes     -
 * rate_limited_unresolved             no        yes     -
 * rate_limited_resolved(content_found)   yes    no      success
 * rate_limited_resolved(content_removed) yes    no      unavailable
 * rate_limited_resolved(other)        no        no      -
 * content_found                       yes       no      success
 * content_removed                     yes       no      unavailable
 * extraction_failed                   no        no      -
 * unexpected                          no        no      -
 * </pre>
 */
public final class OutcomePolicy {
    private OutcomePolicy() {
    }

    public static Decision decide(ProcessingOutcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
        return switch (outcome.classification()) {
            case BLOCKED_HARD, RATE_LIMITED_UNRESOLVED -> Decision.RETRY_ROTATE;
            case RATE_LIMITED_RESOLVED -> afterResolvedChallenge(outcome.then());
            case CONTENT_FOUND -> Decision.SUCCESS;
            case CONTENT_REMOVED -> Decision.UNAVAILABLE;
            case EXTRACTION_FAILED, UNEXPECTED -> Decision.RETRY;
        };
    }

    private static Decision afterResolvedChallenge(Classification then) {
        if (then == Classification.CONTENT_FOUND) {
            return Decision.SUCCESS;
        }
        if (then == Classification.CONTENT_REMOVED) {
            return Decision.UNAVAILABLE;
        }
        return Decision.RETRY;
    }

    /**
     * @param resultStatus status of the result row to write, null for non-terminal decisions
     */
    public record Decision(boolean terminal, boolean rotateProxy, ResultStatus resultStatus) {
        public static final Decision SUCCESS = new Decision(true, false, ResultStatus.SUCCESS);
        public static final Decision UNAVAILABLE = new Decision(true, false, ResultStatus.UNAVAILABLE);
        public static final Decision RETRY = new Decision(false, false, null);
        public static final Decision RETRY_ROTATE = new Decision(false, true, null);
    }
}
