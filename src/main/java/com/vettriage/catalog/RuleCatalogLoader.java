package com.vettriage.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vettriage.rules.InvalidRuleException;
import com.vettriage.rules.Rule;
import com.vettriage.rules.RuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Reads a catalog document and materializes the rule repository, vocabulary and
 * question templates. Any inconsistency aborts loading.
 */
public class RuleCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleCatalogLoader.class);

    private final ObjectMapper objectMapper;

    public RuleCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RuleCatalog load(Resource resource) {
        CatalogDocument document;
        try (InputStream in = resource.getInputStream()) {
            document = objectMapper.readValue(in, CatalogDocument.class);
        } catch (IOException ex) {
            throw new InvalidRuleException("cannot read rule catalog " + resource.getDescription(), ex);
        }
        if (document == null) {
            throw new InvalidRuleException("rule catalog " + resource.getDescription() + " is empty");
        }

        RuleCatalog catalog = build(document);
        log.info("Loaded rule catalog from {}: {} rules, {} condition keys, {} rules per level",
            resource.getDescription(), catalog.rules().size(), catalog.vocabulary().keys().size(),
            countByLevel(catalog.rules()));
        return catalog;
    }

    public RuleCatalog build(CatalogDocument document) {
        ConditionVocabulary vocabulary = ConditionVocabulary.of(document.conditions());
        RuleRepository repository = RuleRepository.load(document.rules());

        for (Rule rule : repository.all()) {
            rule.requiredConditions().forEach((key, value) -> {
                if (!vocabulary.isKnownKey(key)) {
                    throw new InvalidRuleException("rule " + rule.id() + " references unknown condition key: " + key);
                }
                if (!vocabulary.accepts(key, value)) {
                    throw new InvalidRuleException("rule " + rule.id() + " requires " + key + "=" + value
                        + ", outside the domain " + vocabulary.domain(key));
                }
            });
        }

        QuestionTemplates questions = QuestionTemplates.from(vocabulary);
        for (String key : repository.referencedKeys()) {
            if (!questions.hasTemplate(key)) {
                log.warn("Condition key '{}' is used by rules but has no question; a generic prompt will be used", key);
            }
        }
        return new RuleCatalog(repository, vocabulary, questions);
    }

    private Map<String, Long> countByLevel(RuleRepository repository) {
        return repository.all().stream()
            .collect(Collectors.groupingBy(r -> r.triageLevel().getValue(), TreeMap::new, Collectors.counting()));
    }
}
