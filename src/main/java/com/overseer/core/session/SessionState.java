package com.overseer.core.session;

import com.overseer.core.risk.RiskLedger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Versioned, explicitly passed session context. Hooks contribute to it through state patches;
 * every applied patch bumps the version.
 */
public class SessionState {

    public static final String PATTERNS = "patterns";

    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final RiskLedger riskLedger = new RiskLedger();
    private long version;

    public synchronized long version() {
        return version;
    }

    public synchronized Map<String, Object> snapshot() {
        return Map.copyOf(attributes);
    }

    public synchronized Optional<Object> get(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    /**
     * Applies {@code patch} (later keys overwrite earlier values) and returns the new version.
     * An empty patch leaves the version unchanged.
     */
    public synchronized long merge(Map<String, Object> patch) {
        if (patch == null || patch.isEmpty()) {
            return version;
        }
        patch.forEach((key, value) -> {
            if (value == null) {
                attributes.remove(key);
            } else {
                attributes.put(key, value);
            }
        });
        return ++version;
    }

    public synchronized List<String> patterns() {
        Object raw = attributes.get(PATTERNS);
        if (raw instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    public RiskLedger riskLedger() {
        return riskLedger;
    }
}
