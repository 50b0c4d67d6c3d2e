package com.isobolt.generator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable registry of bolt and thread geometries keyed by nominal diameter.
 *
 * Entries keep their registration order. Instances are built through
 * {@link #builder()}; the ISO metric coarse-thread series is available via
 * {@link #defaultTable()}.
 */
public final class GeometryTable {

    private final Map<Integer, BoltGeometry> bolts;
    private final Map<Integer, ThreadGeometry> threads;

    private GeometryTable(Map<Integer, BoltGeometry> bolts, Map<Integer, ThreadGeometry> threads) {
        this.bolts = Collections.unmodifiableMap(new LinkedHashMap<>(bolts));
        this.threads = Collections.unmodifiableMap(new LinkedHashMap<>(threads));
    }

    /**
     * Returns the shared ISO metric table, building it on first access.
     */
    public static GeometryTable defaultTable() {
        return DefaultHolder.INSTANCE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<BoltGeometry> getBoltGeometries() {
        return List.copyOf(bolts.values());
    }

    public List<ThreadGeometry> getThreadGeometries() {
        return List.copyOf(threads.values());
    }

    /**
     * Returns the bolt geometry for a nominal diameter.
     *
     * @throws GeometryNotFoundException if the diameter is not registered
     */
    public BoltGeometry get(int diameter) {
        BoltGeometry geometry = bolts.get(diameter);
        if (geometry == null) {
            throw new GeometryNotFoundException(diameter);
        }
        return geometry;
    }

    public Optional<ThreadGeometry> findThread(int diameter) {
        return Optional.ofNullable(threads.get(diameter));
    }

    /**
     * Registered nominal diameters in ascending order.
     */
    public List<Integer> getNominalDiameters() {
        List<Integer> diameters = new ArrayList<>(bolts.keySet());
        Collections.sort(diameters);
        return diameters;
    }

    public int size() {
        return bolts.size();
    }

    public boolean isEmpty() {
        return bolts.isEmpty();
    }

    private static final class DefaultHolder {
        private static final GeometryTable INSTANCE = IsoMetricGeometries.createTable();
    }

    /**
     * Collects geometries. A duplicate diameter is a programming error.
     */
    public static final class Builder {

        private final Map<Integer, BoltGeometry> bolts = new LinkedHashMap<>();
        private final Map<Integer, ThreadGeometry> threads = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder bolt(BoltGeometry geometry) {
            if (bolts.putIfAbsent(geometry.getD(), geometry) != null) {
                throw new IllegalStateException("Duplicate bolt geometry M" + geometry.getD());
            }
            return this;
        }

        public Builder thread(ThreadGeometry geometry) {
            if (threads.putIfAbsent(geometry.getD(), geometry) != null) {
                throw new IllegalStateException("Duplicate thread geometry M" + geometry.getD());
            }
            return this;
        }

        /**
         * Registers the bolt and a thread geometry with the same diameter and pitch.
         */
        public Builder boltWithThread(BoltGeometry geometry) {
            bolt(geometry);
            return thread(new ThreadGeometry(geometry.getD(), geometry.getP()));
        }

        public GeometryTable build() {
            return new GeometryTable(bolts, threads);
        }
    }
}
