package com.entity.extraction.disambiguation;

/**
 * Source of fresh disambiguation ids. Injected into disambiguators and the
 * coreference resolver so tests can supply deterministic ids.
 */
@FunctionalInterface
public interface DisambiguationIdGenerator {

    String nextId();
}
