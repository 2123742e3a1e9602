package net.littleredcomputer.cnfanalysis.features;

import com.google.common.collect.ImmutableSortedMap;

import java.util.Map;
import java.util.Objects;

/**
 * The outcome of analysing one formula: metadata (keys carry the reserved {@link #META_PREFIX})
 * and metrics (plain names). Integral values are held as {@link Long}, fractional ones as
 * {@link Double}; booleans and strings are kept as they are.
 */
public final class FeatureReport {
    public static final String META_PREFIX = "@";

    private final ImmutableSortedMap<String, Object> metadata;
    private final ImmutableSortedMap<String, Object> metrics;

    private FeatureReport(ImmutableSortedMap<String, Object> metadata, ImmutableSortedMap<String, Object> metrics) {
        this.metadata = metadata;
        this.metrics = metrics;
    }

    /**
     * @param metadata keys must start with {@link #META_PREFIX}
     * @param metrics  keys must not start with {@link #META_PREFIX}
     */
    public static FeatureReport of(Map<String, ?> metadata, Map<String, ?> metrics) {
        ImmutableSortedMap.Builder<String, Object> mb = ImmutableSortedMap.naturalOrder();
        metadata.forEach((k, v) -> {
            if (!isMetaKey(k)) throw new IllegalArgumentException("metadata key lacks " + META_PREFIX + ": " + k);
            mb.put(k, normalize(k, v));
        });
        ImmutableSortedMap.Builder<String, Object> fb = ImmutableSortedMap.naturalOrder();
        metrics.forEach((k, v) -> {
            if (isMetaKey(k)) throw new IllegalArgumentException("metric key must not start with " + META_PREFIX + ": " + k);
            fb.put(k, normalize(k, v));
        });
        return new FeatureReport(mb.build(), fb.build());
    }

    public static boolean isMetaKey(String key) { return key.startsWith(META_PREFIX); }

    public static String metaKey(String attribute) { return META_PREFIX + attribute; }

    public static String attribute(String metaKey) {
        if (!isMetaKey(metaKey)) throw new IllegalArgumentException("not a metadata key: " + metaKey);
        return metaKey.substring(META_PREFIX.length());
    }

    private static Object normalize(String key, Object v) {
        if (v == null) throw new IllegalArgumentException("null value for " + key);
        if (v instanceof Integer || v instanceof Short || v instanceof Byte) return ((Number) v).longValue();
        if (v instanceof Float) return ((Float) v).doubleValue();
        if (v instanceof Long || v instanceof Double || v instanceof Boolean || v instanceof String) return v;
        throw new IllegalArgumentException("unsupported value type " + v.getClass().getName() + " for " + key);
    }

    public ImmutableSortedMap<String, Object> metadata() { return metadata; }

    public ImmutableSortedMap<String, Object> metrics() { return metrics; }

    public Object metric(String name) {
        Object v = metrics.get(name);
        if (v == null) throw new IllegalArgumentException("no metric " + name);
        return v;
    }

    public long longMetric(String name) { return ((Number) metric(name)).longValue(); }

    public double doubleMetric(String name) { return ((Number) metric(name)).doubleValue(); }

    public boolean booleanMetric(String name) { return (Boolean) metric(name); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureReport)) return false;
        FeatureReport that = (FeatureReport) o;
        return metadata.equals(that.metadata) && metrics.equals(that.metrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metadata, metrics);
    }

    @Override
    public String toString() {
        return "FeatureReport{metadata=" + metadata + ", metrics=" + metrics + '}';
    }
}
