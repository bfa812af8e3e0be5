package org.crawljav.config;

/**
 * Root configuration.
 *
 * @param site        where to crawl and how to identify
 * @param crawl       pacing and traversal behavior
 * @param credentials cookie file and required cookie names
 * @param works       filters applied to actor work listings
 * @param storage     file names inside the job directory
 */
public record CrawlerConfig(
        SiteConfig site,
        CrawlConfig crawl,
        CredentialsConfig credentials,
        WorksConfig works,
        StorageConfig storage
) {
    public CrawlerConfig withWorks(WorksConfig works) {
        return new CrawlerConfig(site, crawl, credentials, works, storage);
    }

    public CrawlerConfig withCredentials(CredentialsConfig credentials) {
        return new CrawlerConfig(site, crawl, credentials, works, storage);
    }
}
