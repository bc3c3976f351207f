package com.entity.extraction.disambiguation;

import com.entity.extraction.core.model.Entity;
import com.entity.extraction.core.model.EntityType;
import com.entity.extraction.metrics.MetricsService;
import com.entity.extraction.repository.KnownEntityRepository;
import com.entity.extraction.tracing.TracingService;

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Groups entities whose names are similar by normalized edit distance.
 * People sharing a surname ("J. Smith", "John Smith") score at least
 * {@value #SURNAME_MATCH_SIMILARITY}.
 */
public class NameBasedDisambiguator extends AbstractEntityDisambiguator {

    public static final String METHOD = "Name";
    public static final double DEFAULT_THRESHOLD = 0.8;
    public static final double SURNAME_MATCH_SIMILARITY = 0.7;

    private static final Set<EntityType> SUPPORTED_TYPES = Set.copyOf(EnumSet.of(
            EntityType.PERSON,
            EntityType.ORGANIZATION,
            EntityType.LOCATION,
            EntityType.PRODUCT,
            EntityType.PROJECT,
            EntityType.TECHNICAL_TERM,
            EntityType.JOB_TITLE));

    private static final Pattern NAME_SEPARATORS = Pattern.compile("[ \\-_.]+");

    public NameBasedDisambiguator() {
        this(DEFAULT_THRESHOLD, new RandomDisambiguationIdGenerator());
    }

    public NameBasedDisambiguator(double threshold, DisambiguationIdGenerator idGenerator) {
        this(threshold, idGenerator, null, null, null);
    }

    public NameBasedDisambiguator(double threshold, DisambiguationIdGenerator idGenerator,
                                  KnownEntityRepository repository,
                                  MetricsService metricsService, TracingService tracingService) {
        super(threshold, idGenerator, repository, metricsService, tracingService);
    }

    @Override
    public double similarity(Entity a, Entity b) {
        double similarity = super.similarity(a, b);
        if (similarity < SURNAME_MATCH_SIMILARITY
                && a.getType() == EntityType.PERSON && b.getType() == EntityType.PERSON
                && sameSurname(a.getName(), b.getName())) {
            return SURNAME_MATCH_SIMILARITY;
        }
        return similarity;
    }

    private static boolean sameSurname(String name1, String name2) {
        String[] parts1 = tokens(name1);
        String[] parts2 = tokens(name2);
        return parts1.length > 1 && parts2.length > 1
                && parts1[parts1.length - 1].equalsIgnoreCase(parts2[parts2.length - 1]);
    }

    private static String[] tokens(String name) {
        return NAME_SEPARATORS.splitAsStream(name.trim())
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
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
