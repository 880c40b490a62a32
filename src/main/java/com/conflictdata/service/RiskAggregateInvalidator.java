package com.conflictdata.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;

/**
 * Decides what happens to cached risk scores when conflict records change.
 *
 * <p>With {@code conflictdata.risk-score.invalidate-on-change=false} (the default)
 * cached scores are left stale until removed out of band. With {@code true},
 * the aggregate of every changed country is evicted and recomputed on next read.
 */
@Component
public class RiskAggregateInvalidator {

    private static final Logger log = LoggerFactory.getLogger(RiskAggregateInvalidator.class);

    private final RiskAggregateStore aggregateStore;
    private final boolean invalidateOnChange;

    public RiskAggregateInvalidator(RiskAggregateStore aggregateStore,
                                    @Value("${conflictdata.risk-score.invalidate-on-change:false}") boolean invalidateOnChange) {
        this.aggregateStore = aggregateStore;
        this.invalidateOnChange = invalidateOnChange;
    }

    public boolean isEnabled() {
        return invalidateOnChange;
    }

    /**
     * @return number of cached aggregates removed
     */
    public int recordsChanged(Collection<String> countries) {
        if (!invalidateOnChange) {
            log.debug("Keeping cached risk scores for changed countries {}", countries);
            return 0;
        }
        int evicted = 0;
        for (String country : new LinkedHashSet<>(countries)) {
            if (aggregateStore.evict(country)) {
                evicted++;
            }
        }
        return evicted;
    }
}
