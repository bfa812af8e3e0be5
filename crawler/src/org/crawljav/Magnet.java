package org.crawljav;

import org.jetbrains.annotations.Nullable;

/**
 * A stored magnet link. {@code size} is kept as the source printed it and parsed only when
 * picking.
 */
public record Magnet(long id, long workId, String magnet, Tags tags, @Nullable String size) {
}
