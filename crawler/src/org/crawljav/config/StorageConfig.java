package org.crawljav.config;

/**
 * Storage locations, relative to the job directory.
 *
 * @param database    SQLite catalog
 * @param checkpoints stage checkpoint document
 * @param history     completed stage log
 * @param picks       directory for the best magnet of each work, one file per actor
 */
public record StorageConfig(
        String database,
        String checkpoints,
        String history,
        String picks
) {
}
