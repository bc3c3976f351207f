package com.entity.extraction.extraction;

import com.entity.extraction.core.model.AttributeKeys;
import com.entity.extraction.core.model.AttributeValue;
import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Extracts entities with heuristic rules applied in registration order.
 * Each entity records the producing rule in its {@code RuleName} attribute along with
 * the rule's own attributes.
 */
public class RuleBasedEntityExtractor extends AbstractEntityExtractor {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedEntityExtractor.class);

    public static final String NAME = "RuleBased";

    private volatile List<ExtractionRule> rules = List.of();

    public RuleBasedEntityExtractor() {
        this(ExtractionOptions.defaults());
    }

    public RuleBasedEntityExtractor(ExtractionOptions options) {
        super(NAME, options.getContextWindow());
        if (options.isIncludeDefaultRules()) {
            DefaultExtractionRules.all().forEach(this::addRule);
        }
    }

    @Override
    protected List<Entity> doExtract(String text, String sourceId, String tenantId) {
        List<Entity> entities = new ArrayList<>();
        for (ExtractionRule rule : rules) {
            try {
                List<Entity> found = new ArrayList<>();
                for (RuleMatch match : rule.apply(text)) {
                    found.add(toEntity(rule, match, text, sourceId, tenantId));
                }
                entities.addAll(found);
            } catch (RuntimeException e) {
                log.error("extraction.rule.error rule={} error={}", rule.getName(), e.getMessage(), e);
            }
        }
        return entities;
    }

    private Entity toEntity(ExtractionRule rule, RuleMatch match, String text, String sourceId, String tenantId) {
        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        attributes.put(AttributeKeys.RULE_NAME, AttributeValue.text(rule.getName()));
        match.attributes().forEach((key, value) -> attributes.put(key, AttributeValue.text(value)));
        int start = Math.min(match.start(), text.length());
        int length = Math.min(match.length(), text.length() - start);
        return createEntity(match.value(), rule.getEntityType(), rule.getConfidence(), text,
                start, length, sourceId, tenantId, attributes);
    }

    @Override
    public Set<EntityType> getSupportedEntityTypes() {
        Set<EntityType> types = new LinkedHashSet<>();
        for (ExtractionRule rule : rules) {
            types.add(rule.getEntityType());
        }
        return types;
    }

    /**
     * Appends a rule; it runs after the rules already registered.
     */
    public void addRule(ExtractionRule rule) {
        if (rule == null) {
            throw new IllegalArgumentException("rule must not be null");
        }
        synchronized (this) {
            List<ExtractionRule> copy = new ArrayList<>(rules);
            copy.add(rule);
            rules = List.copyOf(copy);
        }
        log.debug("extraction.rule.added rule={} type={}", rule.getName(), rule.getEntityType());
    }

    public void addRule(String name, EntityType type, ExtractionRule.Matcher matcher, double confidence) {
        addRule(ExtractionRule.builder()
                .name(name)
                .entityType(type)
                .matcher(matcher)
                .confidence(confidence)
                .build());
    }

    public void addRule(String name, EntityType type, ExtractionRule.Matcher matcher) {
        addRule(ExtractionRule.builder()
                .name(name)
                .entityType(type)
                .matcher(matcher)
                .build());
    }

    public List<ExtractionRule> getRules() {
        return rules;
    }
}
