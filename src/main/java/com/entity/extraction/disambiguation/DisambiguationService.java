package com.entity.extraction.disambiguation;

import com.entity.extraction.core.model.Entity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the configured disambiguators in sequence, then resolves coreferences.
 * Each disambiguator receives the previous one's output, so the first to group an
 * entity decides its disambiguation id.
 */
public class DisambiguationService {

    private static final Logger log = LoggerFactory.getLogger(DisambiguationService.class);

    private final List<EntityDisambiguator> disambiguators;
    private final CoreferenceResolver coreferenceResolver;
    private final int maxEntitiesPerPass;

    public DisambiguationService(List<EntityDisambiguator> disambiguators, CoreferenceResolver coreferenceResolver) {
        this(disambiguators, coreferenceResolver, DisambiguationOptions.defaults().getMaxEntitiesPerPass());
    }

    public DisambiguationService(List<EntityDisambiguator> disambiguators, CoreferenceResolver coreferenceResolver,
                                 int maxEntitiesPerPass) {
        if (disambiguators == null) {
            throw new IllegalArgumentException("disambiguators must not be null");
        }
        if (coreferenceResolver == null) {
            throw new IllegalArgumentException("coreferenceResolver must not be null");
        }
        if (maxEntitiesPerPass <= 0) {
            throw new IllegalArgumentException("maxEntitiesPerPass must be positive");
        }
        this.disambiguators = List.copyOf(disambiguators);
        this.coreferenceResolver = coreferenceResolver;
        this.maxEntitiesPerPass = maxEntitiesPerPass;
    }

    /**
     * Applies every disambiguator in order.
     *
     * @throws IllegalArgumentException if entities is null or exceeds the per-pass cap
     */
    public List<Entity> processEntities(List<Entity> entities, String tenantId) {
        if (entities == null) {
            throw new IllegalArgumentException("entities must not be null");
        }
        if (entities.size() > maxEntitiesPerPass) {
            throw new IllegalArgumentException("entities exceeds maxEntitiesPerPass: "
                    + entities.size() + " > " + maxEntitiesPerPass);
        }
        if (entities.isEmpty()) {
            log.debug("disambiguation.skipped tenantId={} reason=no-entities", tenantId);
            return List.of();
        }

        List<Entity> processed = entities;
        for (EntityDisambiguator disambiguator : disambiguators) {
            log.debug("disambiguation.apply method={} entities={}", disambiguator.getMethodName(), processed.size());
            processed = disambiguator.disambiguateEntities(processed, tenantId);
        }
        return processed;
    }

    /**
     * Links pronouns and organization references in {@code text} to the entities.
     */
    public List<Entity> resolveCoreferences(String text, List<Entity> entities, String tenantId) {
        return coreferenceResolver.resolveCoreferences(text, entities, tenantId);
    }

    /**
     * Disambiguates the entities, then resolves coreferences against the source text.
     */
    public List<Entity> process(String text, List<Entity> entities, String tenantId) {
        List<Entity> disambiguated = processEntities(entities, tenantId);
        if (disambiguated.isEmpty()) {
            return disambiguated;
        }
        return resolveCoreferences(text, disambiguated, tenantId);
    }

    /**
     * Finds known entities related to the given one, using the first disambiguator that
     * supports its type. Returns an empty list when none does.
     */
    public List<Entity> resolveAgainstKnowledgeGraph(Entity entity, String tenantId) {
        if (entity == null) {
            throw new IllegalArgumentException("entity must not be null");
        }
        for (EntityDisambiguator disambiguator : disambiguators) {
            if (disambiguator.getSupportedEntityTypes().contains(entity.getType())) {
                return disambiguator.findRelatedEntities(entity, tenantId);
            }
        }
        log.warn("disambiguation.related.unsupported type={}", entity.getType());
        return List.of();
    }

    public int getMaxEntitiesPerPass() {
        return maxEntitiesPerPass;
    }

    public List<EntityDisambiguator> getDisambiguators() {
        return disambiguators;
    }

    public CoreferenceResolver getCoreferenceResolver() {
        return coreferenceResolver;
    }
}
