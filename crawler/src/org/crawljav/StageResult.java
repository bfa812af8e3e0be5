package org.crawljav;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one stage run.
 *
 * @param status   COMPLETED when every unit in scope succeeded, INCOMPLETE when some unit failed
 *                 and the checkpoint was kept for a retry
 * @param counters aggregate counters, also written to the history log on completion
 */
public record StageResult(Stage stage, Status status, Map<String, Long> counters) {
    public StageResult {
        counters = Collections.unmodifiableMap(new LinkedHashMap<>(counters));
    }

    public enum Status {
        COMPLETED, INCOMPLETE
    }

    public boolean completed() {
        return status == Status.COMPLETED;
    }

    public long counter(String name) {
        return counters.getOrDefault(name, 0L);
    }
}
