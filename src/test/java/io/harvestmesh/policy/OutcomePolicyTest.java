package io.harvestmesh.policy;

import io.harvestmesh.model.ListingRecord;
import io.harvestmesh.model.ResultStatus;
import io.harvestmesh.processing.ProcessingOutcome;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class OutcomePolicyTest {

    @Test
    void blockingSignalsRetryAndRotate() {
        Assertions.assertEquals(OutcomePolicy.Decision.RETRY_ROTATE,
                OutcomePolicy.decide(ProcessingOutcome.blockedHard("403")));
        Assertions.assertEquals(OutcomePolicy.Decision.RETRY_ROTATE,
                OutcomePolicy.decide(ProcessingOutcome.rateLimitedUnresolved("captcha")));
    }

    @Test
    void contentIsTerminalAndKeepsProxy() {
        OutcomePolicy.Decision found = OutcomePolicy.decide(ProcessingOutcome.contentFound(ListingRecord.empty()));
        Assertions.assertTrue(found.terminal());
        Assertions.assertFalse(found.rotateProxy());
        Assertions.assertEquals(ResultStatus.SUCCESS, found.resultStatus());

        OutcomePolicy.Decision removed = OutcomePolicy.decide(ProcessingOutcome.contentRemoved());
        Assertions.assertTrue(removed.terminal());
        Assertions.assertFalse(removed.rotateProxy());
        Assertions.assertEquals(ResultStatus.UNAVAILABLE, removed.resultStatus());
    }

    @Test
    void resolvedChallengeDefersToFollowUp() {
        Assertions.assertEquals(OutcomePolicy.Decision.SUCCESS,
                OutcomePolicy.decide(ProcessingOutcome.resolvedThen(ProcessingOutcome.contentFound(null))));
        Assertions.assertEquals(OutcomePolicy.Decision.UNAVAILABLE,
                OutcomePolicy.decide(ProcessingOutcome.resolvedThen(ProcessingOutcome.contentRemoved())));
        Assertions.assertEquals(OutcomePolicy.Decision.RETRY,
                OutcomePolicy.decide(ProcessingOutcome.resolvedThen(ProcessingOutcome.extractionFailed("no title"))));
        Assertions.assertEquals(OutcomePolicy.Decision.RETRY,
                OutcomePolicy.decide(ProcessingOutcome.resolvedThen(ProcessingOutcome.blockedHard("403"))));
    }

    @Test
    void extractionProblemsRetryOnSameProxy() {
        OutcomePolicy.Decision failed = OutcomePolicy.decide(ProcessingOutcome.extractionFailed("selector"));
        Assertions.assertFalse(failed.terminal());
        Assertions.assertFalse(failed.rotateProxy());
        Assertions.assertNull(failed.resultStatus());
        Assertions.assertEquals(OutcomePolicy.Decision.RETRY, OutcomePolicy.decide(ProcessingOutcome.unexpected("boom")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> OutcomePolicy.decide(null));
    }
}
