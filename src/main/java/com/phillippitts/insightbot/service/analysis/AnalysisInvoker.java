package com.phillippitts.insightbot.service.analysis;

import com.phillippitts.insightbot.domain.AnalysisResult;

/**
 * Blocking boundary to the analysis backend.
 *
 * <p>Calls take seconds to tens of seconds and must not run on a session's scheduling thread.
 * Implementations report every failure as an {@link AnalysisResult}; they do not throw for
 * backend, network or credential problems.
 */
public interface AnalysisInvoker {

    AnalysisResult analyze(AnalysisRequest request);
}
