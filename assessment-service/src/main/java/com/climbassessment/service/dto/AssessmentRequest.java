package com.climbassessment.service.dto;

import com.climbassessment.common.model.GradeBracket;
import com.climbassessment.common.model.PoseFrame;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code POST /api/v1/assessments}.
 *
 * @param sessionId    caller-chosen id; generated when absent
 * @param gradeBracket climber's grade bracket ({@code 5a-5c}, {@code 6a-6b}, {@code 6c-7a}, {@code 7b+});
 *                     the configured default when absent
 * @param frames       landmark stream in capture order
 */
public record AssessmentRequest(
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("gradeBracket") GradeBracket gradeBracket,
    @JsonProperty("frames") List<PoseFrame> frames
) {}
