package com.phillippitts.insightbot.service.session;

import com.phillippitts.insightbot.config.properties.SessionProperties;
import com.phillippitts.insightbot.domain.AnalysisResult;
import com.phillippitts.insightbot.domain.CycleOutcome;
import com.phillippitts.insightbot.domain.SpeakerId;
import com.phillippitts.insightbot.service.analysis.AnalysisInvoker;
import com.phillippitts.insightbot.service.analysis.AnalysisRequest;
import com.phillippitts.insightbot.service.audio.ArtifactPipeline;
import com.phillippitts.insightbot.service.audio.ConvertedBatch;
import com.phillippitts.insightbot.service.publish.PublishTarget;
import com.phillippitts.insightbot.service.publish.ReportPublisher;
import com.phillippitts.insightbot.service.speaker.SpeakerNameResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * One flush → convert → analyze → publish → cleanup pass.
 *
 * <p>Conversion and analysis run on the analysis worker pool; the calling session thread only
 * waits for them. Temporary files are released before {@link #run} returns on every path.
 * The returned context is non-null only after a non-empty successful report.
 */
@Component
public class AnalysisCycle {

    private static final Logger LOG = LogManager.getLogger(AnalysisCycle.class);

    private final ArtifactPipeline pipeline;
    private final AnalysisInvoker invoker;
    private final SpeakerNameResolver nameResolver;
    private final ReportPublisher reportPublisher;
    private final Executor worker;
    private final int contextMaxChars;

    public AnalysisCycle(ArtifactPipeline pipeline,
                         AnalysisInvoker invoker,
                         SpeakerNameResolver nameResolver,
                         ReportPublisher reportPublisher,
                         @Qualifier("analysisExecutor") Executor worker,
                         SessionProperties props) {
        this.pipeline = Objects.requireNonNull(pipeline);
        this.invoker = Objects.requireNonNull(invoker);
        this.nameResolver = Objects.requireNonNull(nameResolver);
        this.reportPublisher = Objects.requireNonNull(reportPublisher);
        this.worker = Objects.requireNonNull(worker);
        this.contextMaxChars = props.getContextMaxChars();
    }

    CycleResult run(CycleRequest request) {
        Map<SpeakerId, byte[]> raw = request.accumulator().flush();
        if (raw.isEmpty()) {
            LOG.debug("No audio buffered: trigger={}", request.trigger());
            if (request.trigger().isFinal()) {
                notice(request.target(), CycleOutcome.NO_AUDIO, null);
            }
            return CycleResult.of(CycleOutcome.NO_AUDIO);
        }

        Map<SpeakerId, String> names = nameResolver.resolve(request.guildId(), raw.keySet());

        try (ConvertedBatch batch = offload(() -> pipeline.convert(request.sessionStamp(), raw))) {
            if (batch.isEmpty()) {
                LOG.warn("No speaker could be converted: speakers={}", raw.size());
                return CycleResult.of(CycleOutcome.NO_ARTIFACTS);
            }
            AnalysisRequest analysisRequest = new AnalysisRequest(
                    batch.artifacts(), request.context(), names, request.mode(), request.credential());
            AnalysisResult result = offload(() -> invokeSafely(analysisRequest));
            return handleResult(request, result);
        } catch (RejectedExecutionException e) {
            LOG.error("Analysis worker pool rejected the cycle: trigger={}: {}", request.trigger(), e.getMessage());
            notice(request.target(), CycleOutcome.FAILED, "analysis workers unavailable");
            return CycleResult.of(CycleOutcome.FAILED);
        }
    }

    private CycleResult handleResult(CycleRequest request, AnalysisResult result) {
        if (!result.isSuccess()) {
            CycleOutcome outcome = CycleOutcome.of(result.kind());
            LOG.warn("Analysis did not produce a report: outcome={}, detail={}", outcome, result.detail());
            notice(request.target(), outcome, result.detail());
            return CycleResult.of(outcome);
        }
        String report = result.report();
        if (report.isBlank()) {
            notice(request.target(), CycleOutcome.EMPTY_REPORT, null);
            return CycleResult.of(CycleOutcome.EMPTY_REPORT);
        }
        try {
            reportPublisher.publishReport(request.target(), request.trigger(), report);
        } catch (RuntimeException e) {
            LOG.error("Failed to publish report: trigger={}", request.trigger(), e);
        }
        return new CycleResult(CycleOutcome.REPORTED, contextTail(report, contextMaxChars));
    }

    private AnalysisResult invokeSafely(AnalysisRequest request) {
        try {
            return invoker.analyze(request);
        } catch (RuntimeException e) {
            LOG.error("Analysis invoker threw unexpectedly", e);
            return AnalysisResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void notice(PublishTarget target, CycleOutcome outcome, String detail) {
        try {
            reportPublisher.publishNotice(target, outcome, detail);
        } catch (RuntimeException e) {
            LOG.warn("Failed to publish notice: outcome={}: {}", outcome, e.getMessage());
        }
    }

    private <T> T offload(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, worker).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    /**
     * Last {@code max} characters of a report; a leading orphaned low surrogate is dropped.
     */
    static String contextTail(String report, int max) {
        if (report.length() <= max) {
            return report;
        }
        int start = report.length() - max;
        if (Character.isLowSurrogate(report.charAt(start))) {
            start++;
        }
        return report.substring(start);
    }
}
