package com.entity.extraction.disambiguation;

import java.util.UUID;

/**
 * Generates ids of the form {@code dis-<32 hex digits>} from random UUIDs.
 */
public class RandomDisambiguationIdGenerator implements DisambiguationIdGenerator {

    public static final String PREFIX = "dis-";

    @Override
    public String nextId() {
        return PREFIX + UUID.randomUUID().toString().replace("-", "");
    }
}
