package com.clinical.icdlookup.service.offline;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Node type in the MMS hierarchy.
 */
public enum ClassKind {

    CHAPTER("chapter", false),
    BLOCK("block", false),
    CATEGORY("category", true),
    WINDOW("window", false);

    private final String wireName;

    private final boolean assignable;

    ClassKind(final String wireName, final boolean assignable) {
        this.wireName = wireName;
        this.assignable = assignable;
    }

    /**
     * @return the lowercase name used by the registry and the seed dataset
     */
    public String wireName() {
        return wireName;
    }

    /**
     * @return whether a diagnosis may be coded with a node of this kind
     */
    public boolean isAssignable() {
        return assignable;
    }

    public static Set<ClassKind> assignableKinds() {
        EnumSet<ClassKind> kinds = EnumSet.noneOf(ClassKind.class);
        for (ClassKind kind : values()) {
            if (kind.assignable) {
                kinds.add(kind);
            }
        }
        return kinds;
    }

    public static Optional<ClassKind> fromWireName(final String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(k -> k.wireName.equals(normalized))
                .findFirst();
    }
}
