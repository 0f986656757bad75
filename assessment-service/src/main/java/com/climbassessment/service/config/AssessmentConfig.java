package com.climbassessment.service.config;

import com.climbassessment.common.buffer.BufferConfig;
import com.climbassessment.common.model.GradeBracket;
import com.climbassessment.common.session.AssessmentEngine;
import com.climbassessment.common.session.EngineConfig;
import com.climbassessment.common.template.TemplateResolver;
import com.climbassessment.common.template.TemplateSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Wires the assessment core. The template set is loaded once at startup and
 * shared read-only by every request.
 */
@Configuration
public class AssessmentConfig {

    private static final Logger log = LoggerFactory.getLogger(AssessmentConfig.class);

    @Value("${assessment.templates.location:classpath:templates/technique-templates.yml}")
    private String templatesLocation;

    @Value("${assessment.default-grade-bracket:6a-6b}")
    private String defaultGradeBracket;

    @Value("${assessment.buffer.capacity:3600}")
    private int bufferCapacity;

    @Value("${assessment.buffer.min-confidence:0.5}")
    private double minConfidence;

    @Value("${assessment.buffer.max-hold-seconds:0.5}")
    private double maxHoldSeconds;

    @Bean
    public TemplateSet templateSet(ResourceLoader resourceLoader) {
        TemplateResolver resolver = new TemplateResolver();
        Resource resource = resourceLoader.getResource(templatesLocation);
        if (!resource.exists()) {
            return resolver.resolve((InputStream) null, templatesLocation);
        }
        try (InputStream in = resource.getInputStream()) {
            return resolver.resolve(in, templatesLocation);
        } catch (IOException e) {
            log.warn("[AssessmentConfig] Template resource unreadable, using defaults location={} err={}",
                templatesLocation, e.toString());
            return resolver.defaults();
        }
    }

    @Bean
    public EngineConfig engineConfig() {
        BufferConfig buffer = BufferConfig.defaults()
            .withCapacity(bufferCapacity)
            .withDefaultMinConfidence(minConfidence)
            .withMaxHoldSeconds(maxHoldSeconds);
        return EngineConfig.defaults().withBuffer(buffer);
    }

    @Bean
    public AssessmentEngine assessmentEngine(EngineConfig engineConfig, TemplateSet templateSet) {
        return new AssessmentEngine(engineConfig, templateSet);
    }

    @Bean
    public GradeBracket defaultGradeBracket() {
        return GradeBracket.fromLabel(defaultGradeBracket);
    }
}
