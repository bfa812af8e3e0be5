package org.crawljav;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered magnet labels, stored as a single ", " separated column.
 */
public record Tags(List<String> values) {
    public static final Tags EMPTY = new Tags(List.of());
    private static final String SEPARATOR = ", ";

    public Tags {
        values = List.copyOf(values);
    }

    public static Tags of(List<String> values) {
        if (values == null || values.isEmpty()) return EMPTY;
        var cleaned = new ArrayList<String>(values.size());
        for (String value : values) {
            if (value == null) continue;
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) cleaned.add(trimmed);
        }
        return new Tags(cleaned);
    }

    public static Tags parse(@Nullable String column) {
        if (column == null || column.isBlank()) return EMPTY;
        return of(List.of(column.split(",")));
    }

    public @Nullable String joinedOrNull() {
        return values.isEmpty() ? null : String.join(SEPARATOR, values);
    }

    @Override
    public String toString() {
        return String.join(SEPARATOR, values);
    }
}
