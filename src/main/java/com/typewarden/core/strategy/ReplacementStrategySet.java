package com.typewarden.core.strategy;

import com.typewarden.core.model.AnyTypeCategory;
import com.typewarden.core.model.ClassificationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered registry holding exactly one strategy per category.
 * Strategies are consulted in ascending priority and the first valid one wins.
 */
@Component
public class ReplacementStrategySet {

    private static final Logger log = LoggerFactory.getLogger(ReplacementStrategySet.class);

    private final List<ReplacementStrategy> ordered;
    private final Map<AnyTypeCategory, ReplacementStrategy> byCategory;

    public ReplacementStrategySet() {
        this(ReplacementStrategies.defaults());
    }

    /**
     * @throws IllegalStateException if a category is registered twice or not at all
     */
    public ReplacementStrategySet(List<ReplacementStrategy> strategies) {
        var map = new EnumMap<AnyTypeCategory, ReplacementStrategy>(AnyTypeCategory.class);
        for (ReplacementStrategy strategy : strategies) {
            if (map.put(strategy.category(), strategy) != null) {
                throw new IllegalStateException("Duplicate replacement strategy for category " + strategy.category());
            }
        }
        for (AnyTypeCategory category : AnyTypeCategory.values()) {
            if (!map.containsKey(category)) {
                throw new IllegalStateException("No replacement strategy registered for category " + category);
            }
        }
        var sorted = new ArrayList<>(strategies);
        sorted.sort(Comparator.comparingInt(ReplacementStrategy::priority));
        this.ordered = List.copyOf(sorted);
        this.byCategory = map;
    }

    /**
     * First strategy, in ascending priority, whose validator accepts the context.
     */
    public Optional<ReplacementStrategy> select(ClassificationContext context) {
        for (ReplacementStrategy strategy : ordered) {
            if (strategy.validate(context)) {
                return Optional.of(strategy);
            }
        }
        return Optional.empty();
    }

    public Optional<ReplacementStrategy.Proposal> propose(ClassificationContext context) {
        Optional<ReplacementStrategy.Proposal> proposal = select(context).flatMap(s -> s.propose(context));
        if (proposal.isEmpty()) {
            log.debug("No strategy applies to {}:{}", context.filePath(), context.lineNumber());
        }
        return proposal;
    }

    public ReplacementStrategy strategyFor(AnyTypeCategory category) {
        return byCategory.get(category);
    }

    public List<ReplacementStrategy> strategies() {
        return ordered;
    }
}
