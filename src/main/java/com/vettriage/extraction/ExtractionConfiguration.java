package com.vettriage.extraction;

import com.vettriage.catalog.ConditionVocabulary;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExtractionConfiguration {

    /**
     * Keyword extractor over the catalog vocabulary. A language-model backed
     * extractor replaces it by declaring its own {@link ConditionExtractor} bean.
     */
    @Bean
    @ConditionalOnMissingBean(ConditionExtractor.class)
    public ConditionExtractor conditionExtractor(ConditionVocabulary vocabulary) {
        return new KeywordConditionExtractor(vocabulary);
    }
}
