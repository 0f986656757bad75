package com.climbassessment.service.service;

import com.climbassessment.common.model.AssessmentReport;
import com.climbassessment.common.model.GradeBracket;
import com.climbassessment.common.session.AssessmentEngine;
import com.climbassessment.common.trace.TraceContextUtil;
import com.climbassessment.service.dto.AssessmentRequest;
import com.climbassessment.service.logger.AssessmentFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.UUID;

/**
 * Runs one assessment per request on the bounded-elastic scheduler. Each call
 * gets a brand-new session from the shared, immutable engine.
 */
@Service
public class AssessmentService {

    private static final Logger log = LoggerFactory.getLogger(AssessmentService.class);

    private final AssessmentEngine engine;
    private final AssessmentFlowLogger flowLogger;
    private final GradeBracket defaultGradeBracket;

    public AssessmentService(AssessmentEngine engine, AssessmentFlowLogger flowLogger,
                             GradeBracket defaultGradeBracket) {
        this.engine = engine;
        this.flowLogger = flowLogger;
        this.defaultGradeBracket = defaultGradeBracket;
    }

    public Mono<AssessmentReport> assess(AssessmentRequest request, String traceId) {
        String sessionId = request.sessionId() == null || request.sessionId().isBlank()
            ? UUID.randomUUID().toString()
            : request.sessionId();
        GradeBracket bracket = request.gradeBracket() != null ? request.gradeBracket() : defaultGradeBracket;
        int frameCount = request.frames() == null ? 0 : request.frames().size();

        flowLogger.logWithTraceId(AssessmentFlowLogger.REQUEST_RECEIVED, traceId, sessionId);
        log.info("[AssessmentService] Assessing sessionId={} bracket={} frames={}",
            sessionId, bracket.label(), frameCount);

        Mono<AssessmentReport> pipeline = Mono.fromCallable(() -> engine.assess(sessionId, bracket, request.frames()))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnEach(flowLogger.stage(AssessmentFlowLogger.SESSION_COMPLETED))
            .doOnError(e -> TraceContextUtil.withMdc(traceId, sessionId, () ->
                log.warn("[AssessmentService] Assessment failed sessionId={} reason={}", sessionId, e.getMessage())));
        return TraceContextUtil.withTraceId(pipeline, traceId);
    }
}
