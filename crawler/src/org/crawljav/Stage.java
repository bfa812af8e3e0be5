package org.crawljav;

/**
 * The three crawl phases, in the order they run.
 */
public enum Stage {
    ACTORS("collect_actors"),
    WORKS("actor_works"),
    MAGNETS("work_magnets");

    private final String key;

    Stage(String key) {
        this.key = key;
    }

    /**
     * Name used in the checkpoint document and history log.
     */
    public String key() {
        return key;
    }
}
