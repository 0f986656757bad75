package com.climbassessment.service.logger;

import com.climbassessment.common.model.AssessmentReport;
import com.climbassessment.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of an assessment request without touching the pipeline.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}:  landmark stream accepted by the controller</li>
 *   <li>{@link #SESSION_COMPLETED}: engine produced the report</li>
 *   <li>{@link #REPORT_DISPATCHED}: response handed back to the caller</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads traceId from Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(AssessmentFlowLogger.SESSION_COMPLETED))
 * </pre>
 */
@Component
public class AssessmentFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AssessmentFlowLogger.class);

    public static final String REQUEST_RECEIVED  = "REQUEST_RECEIVED";
    public static final String SESSION_COMPLETED = "SESSION_COMPLETED";
    public static final String REPORT_DISPATCHED = "REPORT_DISPATCHED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on {@code onNext}.
     * Bridges Context → MDC only for the duration of the log call.
     */
    public Consumer<Signal<AssessmentReport>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext() || signal.get() == null) return;
            AssessmentReport report = signal.get();
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, report.sessionId(), () ->
                log.info("[AssessmentFlow] stage={} sessionId={} grade={} overall={} traceId={}",
                    stageName, report.sessionId(), report.profile().grade(),
                    report.profile().overallScore(), traceId)
            );
        };
    }

    /** Logs a stage when the traceId is already at hand, outside a reactive signal. */
    public void logWithTraceId(String stageName, String traceId, String sessionId) {
        TraceContextUtil.withMdc(traceId, sessionId, () ->
            log.info("[AssessmentFlow] stage={} sessionId={} traceId={}", stageName, sessionId, traceId)
        );
    }
}
