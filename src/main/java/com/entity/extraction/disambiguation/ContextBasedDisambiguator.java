package com.entity.extraction.disambiguation;

import com.entity.extraction.core.model.AttributeKeys;
import com.entity.extraction.core.model.AttributeValue;
import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;
import com.entity.extraction.metrics.MetricsService;
import com.entity.extraction.repository.KnownEntityRepository;
import com.entity.extraction.similarity.JaccardSimilarity;
import com.entity.extraction.tracing.TracingService;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups entities of the same type whose surrounding text shares key terms.
 * Context similarity is the Jaccard coefficient of the key-term sets of the two
 * {@code OriginalContext} snippets; entities without context are ignored.
 * Members that join a seed record the score in {@code ContextSimilarityScore}.
 */
public class ContextBasedDisambiguator extends AbstractEntityDisambiguator {

    public static final String METHOD = "Context";
    public static final double DEFAULT_THRESHOLD = 0.6;

    private static final Set<EntityType> SUPPORTED_TYPES = Set.copyOf(EnumSet.of(
            EntityType.PERSON,
            EntityType.ORGANIZATION,
            EntityType.LOCATION,
            EntityType.PRODUCT,
            EntityType.TECHNICAL_TERM,
            EntityType.JOB_TITLE,
            EntityType.DATABASE_TABLE,
            EntityType.DATABASE_COLUMN,
            EntityType.API));

    private final JaccardSimilarity contextSimilarity = new JaccardSimilarity();

    public ContextBasedDisambiguator() {
        this(DEFAULT_THRESHOLD, new RandomDisambiguationIdGenerator());
    }

    public ContextBasedDisambiguator(double threshold, DisambiguationIdGenerator idGenerator) {
        this(threshold, idGenerator, null, null, null);
    }

    public ContextBasedDisambiguator(double threshold, DisambiguationIdGenerator idGenerator,
                                     KnownEntityRepository repository,
                                     MetricsService metricsService, TracingService tracingService) {
        super(threshold, idGenerator, repository, metricsService, tracingService);
    }

    @Override
    public double similarity(Entity a, Entity b) {
        if (a == null || b == null || a.getType() != b.getType() || !a.hasContext() || !b.hasContext()) {
            return 0.0;
        }
        return contextSimilarity.compute(a.getOriginalContext(), b.getOriginalContext());
    }

    @Override
    protected PairScorer scorerFor(List<Entity> candidates) {
        Map<String, Set<String>> keyTerms = new HashMap<>();
        return (a, b) -> {
            if (a.getType() != b.getType() || !a.hasContext() || !b.hasContext()) {
                return 0.0;
            }
            return contextSimilarity.compute(terms(keyTerms, a), terms(keyTerms, b));
        };
    }

    private Set<String> terms(Map<String, Set<String>> cache, Entity entity) {
        return cache.computeIfAbsent(entity.getId(),
                id -> contextSimilarity.getTermExtractor().extract(entity.getOriginalContext()));
    }

    @Override
    protected boolean isCandidate(Entity entity) {
        return entity.hasContext();
    }

    @Override
    protected Map<String, AttributeValue> memberAttributes(double score) {
        return Map.of(AttributeKeys.CONTEXT_SIMILARITY_SCORE, AttributeValue.number(score));
    }

    @Override
    public Set<EntityType> getSupportedEntityTypes() {
        return SUPPORTED_TYPES;
    }

    @Override
    public String getMethodName() {
        return METHOD;
    }
}
