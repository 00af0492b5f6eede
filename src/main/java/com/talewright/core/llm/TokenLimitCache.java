package com.talewright.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Output-token limits learned from provider errors, per model, so later calls do not repeat
 * the same failure.
 */
@Component
public class TokenLimitCache {

    private static final Logger log = LoggerFactory.getLogger(TokenLimitCache.class);

    private final ConcurrentHashMap<String, Integer> limits = new ConcurrentHashMap<>();

    public void record(String model, int limit) {
        Integer merged = limits.merge(model, limit, Math::min);
        log.info("Learned output token limit {} for model {}", merged, model);
    }

    public OptionalInt limitFor(String model) {
        Integer limit = limits.get(model);
        return limit == null ? OptionalInt.empty() : OptionalInt.of(limit);
    }

    /** The requested budget, lowered to the learned limit when one is known. */
    public int apply(String model, int requested) {
        Integer limit = limits.get(model);
        return limit == null ? requested : Math.min(requested, limit);
    }
}
