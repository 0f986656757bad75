package com.climbassessment.service.controller;

import com.climbassessment.common.exception.EmptySessionException;
import com.climbassessment.common.model.AssessmentReport;
import com.climbassessment.common.trace.TraceContextUtil;
import com.climbassessment.service.dto.AssessmentRequest;
import com.climbassessment.service.logger.AssessmentFlowLogger;
import com.climbassessment.service.service.AssessmentService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/assessments")
public class AssessmentController {

    private static final String TRACE_HEADER = "X-Trace-Id";

    private final AssessmentService assessmentService;
    private final AssessmentFlowLogger flowLogger;

    public AssessmentController(AssessmentService assessmentService, AssessmentFlowLogger flowLogger) {
        this.assessmentService = assessmentService;
        this.flowLogger = flowLogger;
    }

    @PostMapping
    public Mono<ResponseEntity<AssessmentReport>> assess(
            @RequestBody AssessmentRequest request,
            @RequestHeader(value = TRACE_HEADER, required = false) String traceIdHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceIdHeader);
        return assessmentService.assess(request, traceId)
            .map(report -> {
                flowLogger.logWithTraceId(AssessmentFlowLogger.REPORT_DISPATCHED, traceId, report.sessionId());
                return ResponseEntity.ok().header(TRACE_HEADER, traceId).body(report);
            })
            .onErrorResume(EmptySessionException.class, e ->
                Mono.just(ResponseEntity.badRequest().header(TRACE_HEADER, traceId).<AssessmentReport>build()));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
