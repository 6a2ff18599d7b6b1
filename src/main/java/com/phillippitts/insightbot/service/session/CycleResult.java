package com.phillippitts.insightbot.service.session;

import com.phillippitts.insightbot.domain.CycleOutcome;

/**
 * Outcome of one cycle plus the context to carry forward.
 *
 * @param newContext replacement context, {@code null} when the context must stay unchanged
 */
record CycleResult(CycleOutcome outcome, String newContext) {

    static CycleResult of(CycleOutcome outcome) {
        return new CycleResult(outcome, null);
    }
}
