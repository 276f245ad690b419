package org.masmtext;

import java.util.Optional;

public final class LabelResolver {
    private LabelResolver() {}

    /** Name for {@code address}; address 0 is "no value" and never looked up. */
    public static Optional<String> resolve(long address, LabelMap labels) {
        if (address == 0 || labels == null) return Optional.empty();
        return Optional.ofNullable(labels.get(address));
    }
}
