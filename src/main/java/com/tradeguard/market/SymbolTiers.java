package com.tradeguard.market;

import java.util.Collection;
import java.util.Set;

/** Classifies symbols into tiers from the configured hot and warm lists; everything else is cold. */
public class SymbolTiers {

    private final Set<String> hot;
    private final Set<String> warm;

    public SymbolTiers(Collection<String> hot, Collection<String> warm) {
        this.hot = Set.copyOf(hot);
        this.warm = Set.copyOf(warm);
    }

    public SymbolTier tierOf(String symbol) {
        if (hot.contains(symbol)) {
            return SymbolTier.HOT;
        }
        if (warm.contains(symbol)) {
            return SymbolTier.WARM;
        }
        return SymbolTier.COLD;
    }
}
