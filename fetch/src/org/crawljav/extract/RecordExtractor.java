package org.crawljav.extract;

import org.crawljav.fetch.Page;
import org.crawljav.util.Url;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Turns page content into typed records. Implementations are pure functions of the page: when the
 * expected container is missing they log a diagnostic and return an empty list.
 */
public interface RecordExtractor {
    List<ActorRecord> extractActors(Page page);

    List<WorkRecord> extractWorks(Page page);

    List<MagnetRecord> extractMagnets(Page page);

    @Nullable
    Url extractNextPageUrl(Page page);
}
