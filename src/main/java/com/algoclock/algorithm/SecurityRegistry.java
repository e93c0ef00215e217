package com.algoclock.algorithm;

import com.algoclock.domain.model.Security;
import com.algoclock.exception.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The securities an algorithm currently holds subscriptions for, keyed by symbol.
 *
 * <p>Iteration follows registration order so that events created per security are registered
 * with the scheduler in a reproducible order. Thread-safe.
 */
public class SecurityRegistry {

    private final Map<String, Security> securities = new LinkedHashMap<>();

    /**
     * Registers a security, replacing any security with the same symbol.
     *
     * @return true if the symbol was not registered before
     */
    public synchronized boolean add(Security security) {
        return securities.put(security.getSymbol(), security) == null;
    }

    public synchronized Optional<Security> remove(String symbol) {
        return Optional.ofNullable(securities.remove(symbol));
    }

    public synchronized Optional<Security> find(String symbol) {
        return Optional.ofNullable(securities.get(symbol));
    }

    /**
     * Returns the registered security.
     *
     * @throws ResourceNotFoundException if the symbol is not registered
     */
    public synchronized Security get(String symbol) {
        Security security = securities.get(symbol);
        if (security == null) {
            throw new ResourceNotFoundException("Security", symbol);
        }
        return security;
    }

    public synchronized boolean contains(String symbol) {
        return securities.containsKey(symbol);
    }

    /** Snapshot in registration order. */
    public synchronized List<Security> getAll() {
        return new ArrayList<>(securities.values());
    }

    public synchronized int size() {
        return securities.size();
    }
}
