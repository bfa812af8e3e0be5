package org.crawljav;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Resumable position of an in-progress stage. The cursor shape depends on the stage.
 */
public record Checkpoint(
        Map<String, Object> cursor,
        @JsonProperty("updated_at") Instant updatedAt) {
}
