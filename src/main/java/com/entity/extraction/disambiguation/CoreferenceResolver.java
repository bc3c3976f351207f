package com.entity.extraction.disambiguation;

import com.entity.extraction.core.model.AttributeKeys;
import com.entity.extraction.core.model.AttributeValue;
import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;
import com.entity.extraction.logging.LogContext;
import com.entity.extraction.metrics.MetricsService;
import com.entity.extraction.metrics.NoOpMetricsService;
import com.entity.extraction.tracing.NoOpTracingService;
import com.entity.extraction.tracing.Span;
import com.entity.extraction.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Links pronouns and generic organization references ("the company") to the closest
 * preceding person or organization mention.
 *
 * <p>Every resolved reference becomes a derived entity of the antecedent's type that
 * shares the antecedent's disambiguation id. An antecedent without an id receives a
 * fresh one. Pronoun gender is not matched against the antecedent: the nearest
 * preceding person wins.</p>
 */
public class CoreferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(CoreferenceResolver.class);

    public static final double REFERENCE_CONFIDENCE = 0.7;
    public static final int DEFAULT_CONTEXT_WINDOW = 75;
    public static final String PRONOUN = "Pronoun";
    public static final String ORGANIZATION_REFERENCE = "OrganizationReference";

    private static final List<Pattern> PRONOUN_PATTERNS = List.of(
            Pattern.compile("\\b(he|him|his)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(she|her|hers)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(they|them|their|theirs)\\b", Pattern.CASE_INSENSITIVE));

    private static final Pattern ORGANIZATION_PHRASE = Pattern.compile(
            "\\b(the company|the organization|the firm|the corporation|the business)\\b",
            Pattern.CASE_INSENSITIVE);

    private final int contextWindow;
    private final DisambiguationIdGenerator idGenerator;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public CoreferenceResolver() {
        this(DEFAULT_CONTEXT_WINDOW, new RandomDisambiguationIdGenerator());
    }

    public CoreferenceResolver(int contextWindow, DisambiguationIdGenerator idGenerator) {
        this(contextWindow, idGenerator, null, null);
    }

    public CoreferenceResolver(int contextWindow, DisambiguationIdGenerator idGenerator,
                               MetricsService metricsService, TracingService tracingService) {
        if (contextWindow < 0) {
            throw new IllegalArgumentException("contextWindow must not be negative");
        }
        this.contextWindow = contextWindow;
        this.idGenerator = idGenerator != null ? idGenerator : new RandomDisambiguationIdGenerator();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
    }

    /**
     * Resolves references in {@code text} against the given entities.
     *
     * @return the input entities (antecedents possibly carrying a newly assigned
     * disambiguation id) followed by one derived entity per resolved reference
     * @throws IllegalArgumentException if text is null or empty, entities is null or
     *                                  tenantId is blank
     */
    public List<Entity> resolveCoreferences(String text, List<Entity> entities, String tenantId) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("text must not be null or empty");
        }
        if (entities == null) {
            throw new IllegalArgumentException("entities must not be null");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (entities.isEmpty()) {
            log.debug("coreference.skipped tenantId={} reason=no-entities", tenantId);
            return List.of();
        }

        long startNanos = System.nanoTime();
        try (LogContext ignored = LogContext.forCoreference(tenantId);
             Span span = tracingService.startSpan("entity.coreference", Map.of("tenantId", tenantId))) {
            try {
                List<Entity> result = new ArrayList<>(entities);
                List<Integer> people = anchoredIndices(result, EntityType.PERSON, tenantId);
                List<Integer> organizations = anchoredIndices(result, EntityType.ORGANIZATION, tenantId);

                List<Entity> derived = new ArrayList<>();
                int pronounLinks = 0;
                if (!people.isEmpty()) {
                    for (Pattern pattern : PRONOUN_PATTERNS) {
                        Matcher m = pattern.matcher(text);
                        while (m.find()) {
                            if (link(result, people, m, text, tenantId, PRONOUN, derived)) {
                                pronounLinks++;
                            }
                        }
                    }
                }

                int organizationLinks = 0;
                if (!organizations.isEmpty()) {
                    Matcher m = ORGANIZATION_PHRASE.matcher(text);
                    while (m.find()) {
                        if (link(result, organizations, m, text, tenantId, ORGANIZATION_REFERENCE, derived)) {
                            organizationLinks++;
                        }
                    }
                }

                result.addAll(derived);
                metricsService.incrementCoreferenceLinks(PRONOUN, pronounLinks);
                metricsService.incrementCoreferenceLinks(ORGANIZATION_REFERENCE, organizationLinks);
                span.setAttribute("referenceCount", derived.size());
                log.info("coreference.completed tenantId={} pronouns={} organizationReferences={}",
                        tenantId, pronounLinks, organizationLinks);
                return result;
            } catch (RuntimeException e) {
                span.fail(e);
                log.error("coreference.error tenantId={} error={}", tenantId, e.getMessage(), e);
                throw e;
            }
        } finally {
            metricsService.recordStageDuration("coreference", Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    private List<Integer> anchoredIndices(List<Entity> entities, EntityType type, String tenantId) {
        List<Integer> indices = new ArrayList<>();
        int foreign = 0;
        for (int i = 0; i < entities.size(); i++) {
            Entity entity = entities.get(i);
            if (entity.getType() != type || !entity.hasPosition()) {
                continue;
            }
            if (tenantId.equals(entity.getTenantId())) {
                indices.add(i);
            } else {
                foreign++;
            }
        }
        if (foreign > 0) {
            log.warn("coreference.tenant.mismatch tenantId={} type={} skipped={}", tenantId, type, foreign);
        }
        return indices;
    }

    /**
     * Links the matched reference to the closest preceding candidate, if any.
     */
    private boolean link(List<Entity> result, List<Integer> candidates, Matcher match, String text,
                         String tenantId, String referenceType, List<Entity> derived) {
        int position = match.start();
        int antecedentIndex = -1;
        for (int index : candidates) {
            int start = result.get(index).getStartPosition();
            if (start < position
                    && (antecedentIndex < 0 || start > result.get(antecedentIndex).getStartPosition())) {
                antecedentIndex = index;
            }
        }
        if (antecedentIndex < 0) {
            return false;
        }

        Entity antecedent = result.get(antecedentIndex);
        if (!antecedent.isDisambiguated()) {
            antecedent = antecedent.withDisambiguationId(idGenerator.nextId());
            result.set(antecedentIndex, antecedent);
        }

        String value = match.group();
        derived.add(Entity.builder()
                .name(value)
                .type(antecedent.getType())
                .confidenceScore(REFERENCE_CONFIDENCE)
                .sourceId(antecedent.getSourceId())
                .tenantId(tenantId)
                .span(position, position + value.length())
                .originalContext(contextAround(text, position, value.length()))
                .disambiguationId(antecedent.getDisambiguationId())
                .attribute(AttributeKeys.REFERENCE_TYPE, AttributeValue.text(referenceType))
                .attribute(AttributeKeys.REFERENCE_TARGET, AttributeValue.entityRef(antecedent.getId()))
                .build());
        log.debug("coreference.linked reference={} position={} antecedent={} type={}",
                value, position, antecedent.getName(), referenceType);
        return true;
    }

    private String contextAround(String text, int position, int length) {
        int start = Math.max(0, position - contextWindow);
        int contextLength = Math.min(text.length() - start, length + 2 * contextWindow);
        return text.substring(start, start + contextLength);
    }

    public int getContextWindow() {
        return contextWindow;
    }
}
