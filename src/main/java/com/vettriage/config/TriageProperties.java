package com.vettriage.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Engine configuration, read from application.yml under the "triage" prefix:
 *
 * triage:
 *   catalog-location: classpath:catalog/vet-triage-catalog.json
 *   max-turns: 8
 *   prefer-higher-severity-exploration: false
 *   opening-prompt: What symptoms is your pet experiencing?
 *   fallback-advice: ...
 *   session-idle-timeout: PT30M
 *   session-sweep-interval: PT1M
 */
@ConfigurationProperties(prefix = "triage")
public record TriageProperties(
    @DefaultValue("classpath:catalog/vet-triage-catalog.json") String catalogLocation,
    @DefaultValue("8") int maxTurns,
    @DefaultValue("false") boolean preferHigherSeverityExploration,
    @DefaultValue("What symptoms is your pet experiencing?") String openingPrompt,
    @DefaultValue("Insufficient data for confident triage. Monitor your pet closely and contact your veterinarian if symptoms persist or worsen.")
    String fallbackAdvice,
    @DefaultValue("PT30M") Duration sessionIdleTimeout,
    @DefaultValue("PT1M") Duration sessionSweepInterval
) {

    public TriageProperties {
        if (maxTurns < 1) {
            throw new IllegalArgumentException("triage.max-turns must be >= 1");
        }
    }
}
