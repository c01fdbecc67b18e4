package com.project.image.selection.floodfill;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Seeds a tile worker hands over to neighbouring tiles, keyed by destination tile. Destinations
 * are not validated here; the orchestrator drops ids that fall outside the grid.
 */
public final class TilePropagation<S> {
    private final Map<TileId, List<S>> targets = new LinkedHashMap<>();

    public void add(TileId destination, S seed) {
        targets.computeIfAbsent(destination, k -> new ArrayList<>()).add(seed);
    }

    public Map<TileId, List<S>> targets() {
        return Collections.unmodifiableMap(targets);
    }

    public boolean isEmpty() {
        return targets.isEmpty();
    }
}
