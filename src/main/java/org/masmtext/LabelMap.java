package org.masmtext;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Address to symbol name table. Keys are unsigned 64-bit addresses. Built once, read-only
 * afterwards, so it can be shared by concurrent renderers.
 */
public final class LabelMap {
    private static final LabelMap EMPTY = new LabelMap(Collections.emptyMap());

    private final Map<Long, String> labels;

    private LabelMap(Map<Long, String> labels) {
        this.labels = labels;
    }

    public static LabelMap empty() { return EMPTY; }

    public static LabelMap of(Map<Long, String> labels) {
        if (labels.isEmpty()) return EMPTY;
        return new LabelMap(Collections.unmodifiableMap(new HashMap<>(labels)));
    }

    public static Builder builder() { return new Builder(); }

    String get(long address) { return labels.get(address); }

    public int size() { return labels.size(); }

    public Map<Long, String> asMap() { return labels; }

    public static final class Builder {
        private final Map<Long, String> labels = new HashMap<>();

        private Builder() {}

        public Builder put(long address, String name) {
            if (name == null || name.isEmpty())
                throw new IllegalArgumentException("empty label for 0x" + Long.toHexString(address));
            String prev = labels.putIfAbsent(address, name);
            if (prev != null && !prev.equals(name))
                throw new IllegalArgumentException("duplicate label for 0x" + Long.toHexString(address)
                        + ": " + prev + ", " + name);
            return this;
        }

        public LabelMap build() { return LabelMap.of(labels); }
    }
}
