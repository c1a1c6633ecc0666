package com.baselinesentinel.core.model;

import java.util.Objects;

/**
 * Memory held by one key of a key-value store node.
 *
 * @since 1.1.0
 */
public final class KeyUsage {

    private final String node;
    private final String key;
    private final String type;
    private final long bytes;

    public KeyUsage(String node, String key, String type, long bytes) {
        this.node = Objects.requireNonNull(node, "Node must not be null");
        this.key = Objects.requireNonNull(key, "Key must not be null");
        this.type = type != null ? type : LabeledSeries.UNKNOWN;
        if (bytes < 0) {
            throw new IllegalArgumentException("bytes must be >= 0, got: " + bytes);
        }
        this.bytes = bytes;
    }

    public String getNode() {
        return node;
    }

    public String getKey() {
        return key;
    }

    public String getType() {
        return type;
    }

    public long getBytes() {
        return bytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof KeyUsage that))
            return false;
        return bytes == that.bytes && node.equals(that.node) && key.equals(that.key) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(node, key, type, bytes);
    }

    @Override
    public String toString() {
        return "KeyUsage{node='" + node + "', key='" + key + "', type='" + type + "', bytes=" + bytes + '}';
    }
}
