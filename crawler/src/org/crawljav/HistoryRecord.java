package org.crawljav;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One completed stage run.
 *
 * @param scope actor names the run was restricted to, or null for a full run
 */
public record HistoryRecord(String stage, Instant time, @Nullable List<String> scope, Map<String, Long> counters) {
}
