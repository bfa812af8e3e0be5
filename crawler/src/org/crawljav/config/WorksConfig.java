package org.crawljav.config;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Listing filters for actor works.
 *
 * @param tags     tag codes sent as the {@code t} query parameter, e.g. ["s", "d"]
 * @param sortType value of the {@code sort_type} query parameter
 */
public record WorksConfig(
        List<String> tags,
        @Nullable String sortType
) {
    public WorksConfig {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
