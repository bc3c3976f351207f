package com.entity.extraction.disambiguation;

import com.entity.extraction.core.model.AttributeKeys;
import com.entity.extraction.core.model.AttributeValue;
import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;
import com.entity.extraction.logging.LogContext;
import com.entity.extraction.metrics.MetricsService;
import com.entity.extraction.metrics.NoOpMetricsService;
import com.entity.extraction.repository.KnownEntityRepository;
import com.entity.extraction.similarity.LevenshteinSimilarity;
import com.entity.extraction.tracing.NoOpTracingService;
import com.entity.extraction.tracing.Span;
import com.entity.extraction.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single-pass clustering shared by the disambiguators.
 *
 * <p>Entities are visited in input order, one entity type at a time. Each ungrouped
 * entity not yet visited seeds a group and pulls in every later-unvisited entity whose
 * similarity reaches the threshold. Entities that arrived with a disambiguation id are
 * never seeds and are never modified, but they are still compared: a seed matching one
 * of them joins that existing identity instead of minting a new one, taking over the
 * group size and method recorded on it.</p>
 *
 * <p>Only entities of the call's tenant are considered; others pass through untouched.</p>
 */
public abstract class AbstractEntityDisambiguator implements EntityDisambiguator {

    private static final Logger log = LoggerFactory.getLogger(AbstractEntityDisambiguator.class);

    /**
     * Scores a pair of entities of the same type during one pass.
     */
    @FunctionalInterface
    protected interface PairScorer {
        double score(Entity a, Entity b);
    }

    private final double threshold;
    private final DisambiguationIdGenerator idGenerator;
    private final KnownEntityRepository repository;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final LevenshteinSimilarity nameSimilarity = new LevenshteinSimilarity();

    protected AbstractEntityDisambiguator(double threshold, DisambiguationIdGenerator idGenerator,
                                          KnownEntityRepository repository,
                                          MetricsService metricsService, TracingService tracingService) {
        this.threshold = Math.max(0.0, Math.min(1.0, threshold));
        this.idGenerator = idGenerator != null ? idGenerator : new RandomDisambiguationIdGenerator();
        this.repository = repository;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
    }

    @Override
    public List<Entity> disambiguateEntities(List<Entity> entities, String tenantId) {
        if (entities == null) {
            throw new IllegalArgumentException("entities must not be null");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (entities.isEmpty()) {
            return List.of();
        }

        long startNanos = System.nanoTime();
        try (LogContext ignored = LogContext.forDisambiguation(tenantId, getMethodName());
             Span span = tracingService.startSpan("entity.disambiguate",
                     Map.of("method", getMethodName(), "tenantId", tenantId))) {
            try {
                List<Entity> result = new ArrayList<>(entities);
                int groups = cluster(result, tenantId);
                span.setAttribute("entityCount", entities.size());
                span.setAttribute("groupCount", groups);
                metricsService.incrementGroupsFormed(getMethodName(), groups);
                log.info("disambiguation.completed method={} entities={} groups={}",
                        getMethodName(), entities.size(), groups);
                return result;
            } catch (RuntimeException e) {
                span.fail(e);
                log.error("disambiguation.error method={} tenantId={} error={}",
                        getMethodName(), tenantId, e.getMessage(), e);
                throw e;
            }
        } finally {
            metricsService.recordStageDuration("disambiguate." + getMethodName(),
                    Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    /**
     * Groups the eligible entities of {@code result} in place (by index) and returns the
     * number of newly minted groups.
     */
    private int cluster(List<Entity> result, String tenantId) {
        Map<EntityType, List<Integer>> byType = new EnumMap<>(EntityType.class);
        int foreign = 0;
        for (int i = 0; i < result.size(); i++) {
            Entity entity = result.get(i);
            if (entity == null) {
                throw new IllegalArgumentException("entities must not contain null elements");
            }
            if (!tenantId.equals(entity.getTenantId())) {
                foreign++;
                continue;
            }
            if (getSupportedEntityTypes().contains(entity.getType()) && isCandidate(entity)) {
                byType.computeIfAbsent(entity.getType(), t -> new ArrayList<>()).add(i);
            }
        }
        if (foreign > 0) {
            log.warn("disambiguation.tenant.mismatch method={} tenantId={} skipped={}",
                    getMethodName(), tenantId, foreign);
        }

        int newGroups = 0;
        for (Map.Entry<EntityType, List<Integer>> entry : byType.entrySet()) {
            List<Integer> indices = entry.getValue();
            List<Entity> candidates = new ArrayList<>(indices.size());
            for (int index : indices) {
                candidates.add(result.get(index));
            }
            PairScorer scorer = scorerFor(candidates);
            boolean[] visited = new boolean[indices.size()];

            for (int s = 0; s < indices.size(); s++) {
                Entity seed = result.get(indices.get(s));
                if (visited[s] || seed.isDisambiguated()) {
                    continue;
                }
                visited[s] = true;

                List<Integer> members = new ArrayList<>();
                List<Double> scores = new ArrayList<>();
                members.add(indices.get(s));
                scores.add(1.0);
                Entity anchor = null;

                for (int c = 0; c < indices.size(); c++) {
                    if (c == s || visited[c]) {
                        continue;
                    }
                    Entity other = result.get(indices.get(c));
                    double score = scorer.score(seed, other);
                    if (score < threshold) {
                        continue;
                    }
                    if (other.isDisambiguated()) {
                        if (anchor == null) {
                            anchor = other;
                        }
                    } else {
                        visited[c] = true;
                        members.add(indices.get(c));
                        scores.add(score);
                    }
                }

                if (anchor != null) {
                    joinExisting(result, members, scores, anchor);
                } else if (members.size() > 1) {
                    assignNewGroup(result, members, scores);
                    newGroups++;
                }
            }
        }
        return newGroups;
    }

    private void assignNewGroup(List<Entity> result, List<Integer> members, List<Double> scores) {
        String disambiguationId = idGenerator.nextId();
        int primary = members.get(0);
        for (int index : members) {
            // Strictly greater: on ties the earliest member stays primary.
            if (result.get(index).getConfidenceScore() > result.get(primary).getConfidenceScore()) {
                primary = index;
            }
        }
        for (int m = 0; m < members.size(); m++) {
            int index = members.get(m);
            result.set(index, tag(result.get(index), disambiguationId, index == primary,
                    members.size(), m == 0 ? null : scores.get(m)));
        }
        log.debug("disambiguation.group.created method={} disambiguationId={} size={}",
                getMethodName(), disambiguationId, members.size());
    }

    /**
     * Adds the members to the anchor's group without touching the entities already in it:
     * joiners copy the group's recorded size and method, so every entity sharing the id
     * reports the same group attributes. None of them becomes primary.
     */
    private void joinExisting(List<Entity> result, List<Integer> members, List<Double> scores, Entity anchor) {
        String disambiguationId = anchor.getDisambiguationId();
        for (int m = 0; m < members.size(); m++) {
            int index = members.get(m);
            Map<String, AttributeValue> attributes = new LinkedHashMap<>();
            attributes.put(AttributeKeys.IS_PRIMARY_ENTITY, AttributeValue.flag(false));
            anchor.getAttribute(AttributeKeys.ENTITY_GROUP_SIZE)
                    .ifPresent(size -> attributes.put(AttributeKeys.ENTITY_GROUP_SIZE, size));
            anchor.getAttribute(AttributeKeys.DISAMBIGUATION_METHOD)
                    .ifPresent(method -> attributes.put(AttributeKeys.DISAMBIGUATION_METHOD, method));
            if (m > 0) {
                attributes.putAll(memberAttributes(scores.get(m)));
            }
            result.set(index, Entity.builder(result.get(index))
                    .disambiguationId(disambiguationId)
                    .attributes(attributes)
                    .build());
        }
        log.debug("disambiguation.group.joined method={} disambiguationId={} added={}",
                getMethodName(), disambiguationId, members.size());
    }

    private Entity tag(Entity entity, String disambiguationId, boolean primary, int groupSize, Double score) {
        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        attributes.put(AttributeKeys.IS_PRIMARY_ENTITY, AttributeValue.flag(primary));
        attributes.put(AttributeKeys.ENTITY_GROUP_SIZE, AttributeValue.number(groupSize));
        attributes.put(AttributeKeys.DISAMBIGUATION_METHOD, AttributeValue.text(getMethodName()));
        if (score != null) {
            attributes.putAll(memberAttributes(score));
        }
        return Entity.builder(entity)
                .disambiguationId(disambiguationId)
                .attributes(attributes)
                .build();
    }

    @Override
    public List<Entity> findRelatedEntities(Entity entity, String tenantId) {
        if (entity == null) {
            throw new IllegalArgumentException("entity must not be null");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (repository == null || !getSupportedEntityTypes().contains(entity.getType())) {
            return List.of();
        }

        List<Entity> known = repository.findByType(tenantId, entity.getType());
        PairScorer scorer = scorerFor(known);
        List<Entity> related = new ArrayList<>();
        for (Entity candidate : known) {
            if (!candidate.getId().equals(entity.getId()) && scorer.score(entity, candidate) >= threshold) {
                related.add(candidate);
            }
        }
        log.debug("disambiguation.related method={} entityId={} known={} related={}",
                getMethodName(), entity.getId(), known.size(), related.size());
        return related;
    }

    /**
     * Default pairwise similarity: 0 across types, 1 for names equal ignoring case,
     * otherwise normalized Levenshtein similarity of the lower-cased names.
     * Symmetric in its arguments.
     */
    public double similarity(Entity a, Entity b) {
        if (a == null || b == null || a.getType() != b.getType()) {
            return 0.0;
        }
        if (a.getName().equalsIgnoreCase(b.getName())) {
            return 1.0;
        }
        return nameSimilarity.compute(a.getName(), b.getName());
    }

    /**
     * Returns the scorer for one pass over {@code candidates}. Subclasses may precompute
     * per-entity features here.
     */
    protected PairScorer scorerFor(List<Entity> candidates) {
        return this::similarity;
    }

    /**
     * Whether an entity of a supported type takes part in grouping at all.
     */
    protected boolean isCandidate(Entity entity) {
        return true;
    }

    /**
     * Extra attributes recorded on a member that joined a seed with the given score.
     */
    protected Map<String, AttributeValue> memberAttributes(double score) {
        return Map.of();
    }

    public double getThreshold() {
        return threshold;
    }
}
