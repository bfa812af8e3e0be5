package org.crawljav.fetch;

import org.crawljav.util.Url;

/**
 * Fetches raw pages from the source. Implementations carry their own credentials.
 */
public interface PageFetcher {
    /**
     * @throws FetchException on network failure or a non-success status; never retried here
     */
    Page fetch(Url url) throws FetchException;
}
