package com.overseer.core.risk;

import com.overseer.core.model.RiskTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session-scoped record of tiers assigned to tasks. A recorded tier can only be escalated.
 */
public class RiskLedger {

    private static final Logger log = LoggerFactory.getLogger(RiskLedger.class);

    private final ConcurrentHashMap<String, RiskTier> tiers = new ConcurrentHashMap<>();

    /**
     * Records {@code tier} for {@code key} and returns the tier now in force, which is the
     * higher of the recorded and the offered tier.
     */
    public RiskTier escalate(String key, RiskTier tier) {
        RiskTier merged = tiers.merge(key, tier, RiskTier::max);
        if (merged != tier) {
            log.debug("Kept tier {} for '{}' (offered {})", merged, key, tier);
        }
        return merged;
    }

    public Optional<RiskTier> tierFor(String key) {
        return Optional.ofNullable(tiers.get(key));
    }

    public Map<String, RiskTier> snapshot() {
        return Map.copyOf(tiers);
    }

    public int size() {
        return tiers.size();
    }
}
