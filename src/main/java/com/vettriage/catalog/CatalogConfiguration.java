package com.vettriage.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vettriage.config.TriageProperties;
import com.vettriage.rules.RuleRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class CatalogConfiguration {

    @Bean
    public RuleCatalog ruleCatalog(ResourceLoader resourceLoader, ObjectMapper objectMapper,
                                   TriageProperties properties) {
        return new RuleCatalogLoader(objectMapper)
            .load(resourceLoader.getResource(properties.catalogLocation()));
    }

    @Bean
    public RuleRepository ruleRepository(RuleCatalog catalog) {
        return catalog.rules();
    }

    @Bean
    public ConditionVocabulary conditionVocabulary(RuleCatalog catalog) {
        return catalog.vocabulary();
    }

    @Bean
    public QuestionTemplates questionTemplates(RuleCatalog catalog) {
        return catalog.questions();
    }
}
