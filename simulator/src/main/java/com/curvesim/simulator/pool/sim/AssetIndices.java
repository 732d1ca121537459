package com.curvesim.simulator.pool.sim;

import com.curvesim.simulator.common.errors.InvalidConfigurationError;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Coin name to pool index lookup, built once per pool.
 * Aliases let several names resolve to the same index.
 */
public final class AssetIndices {

    private final List<String> names;
    private final Map<String, Integer> indices;

    public AssetIndices(List<String> names) {
        this(names, Map.of());
    }

    public AssetIndices(List<String> names, Map<String, Integer> aliases) {
        this.names = List.copyOf(names);
        Map<String, Integer> lookup = new LinkedHashMap<>();
        for (int k = 0; k < this.names.size(); k++) {
            if (lookup.put(this.names.get(k), k) != null) {
                throw new InvalidConfigurationError("Duplicate coin name: " + this.names.get(k));
            }
        }
        lookup.putAll(aliases);
        this.indices = Map.copyOf(lookup);
    }

    public List<String> names() {
        return names;
    }

    public int indexOf(String name) {
        Integer index = indices.get(name);
        if (index == null) {
            throw new InvalidConfigurationError("Unknown coin: " + name + " (known: " + names + ")");
        }
        return index;
    }

    /**
     * Resolves each name in order.
     *
     * @throws InvalidConfigurationError if two names resolve to the same index
     */
    public int[] indicesOf(String... coins) {
        int[] resolved = new int[coins.length];
        Set<Integer> seen = new HashSet<>();
        for (int k = 0; k < coins.length; k++) {
            resolved[k] = indexOf(coins[k]);
            if (!seen.add(resolved[k])) {
                throw new InvalidConfigurationError("Duplicate coin indices.");
            }
        }
        return resolved;
    }
}
