package com.vettriage.matching;

import com.vettriage.config.TriageProperties;
import com.vettriage.rules.RuleRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MatchingConfiguration {

    @Bean
    public RuleMatcher ruleMatcher(RuleRepository ruleRepository, TriageProperties properties) {
        return new RuleMatcher(ruleRepository, properties.preferHigherSeverityExploration());
    }

    @Bean
    public FollowUpSelector followUpSelector() {
        return new FollowUpSelector();
    }
}
