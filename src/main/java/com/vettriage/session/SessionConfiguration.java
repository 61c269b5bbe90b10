package com.vettriage.session;

import com.vettriage.config.TriageProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SessionConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionStore sessionStore(Clock clock, TriageProperties properties) {
        return new InMemorySessionStore(clock, properties.sessionIdleTimeout(), properties.sessionSweepInterval());
    }
}
