package org.tcgstats.metalens_api.modules.meta_analytics.engine;

import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Categorical field that ranking rows can be collapsed on.
 */
public enum GroupBy {
    COLOR_IDENTITY("color_identity"),
    STRATEGY("strategy");

    private final String parameter;

    GroupBy(String parameter) {
        this.parameter = parameter;
    }

    public String parameter() {
        return parameter;
    }

    /**
     * Parses a request parameter, case-insensitively.
     *
     * @return the field, or {@code null} when the parameter is absent or blank
     * @throws MetaValidationException when the value names no known field
     */
    public static @Nullable GroupBy fromParameter(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (GroupBy field : values()) {
            if (field.parameter.equals(normalized)) {
                return field;
            }
        }
        throw new MetaValidationException("group_by must be one of %s, got '%s'".formatted(
                Arrays.stream(values()).map(GroupBy::parameter).collect(Collectors.joining(", ")), value));
    }
}
