package org.crawljav;

import org.crawljav.config.CrawlerConfig;
import org.crawljav.extract.RecordExtractor;
import org.crawljav.fetch.PageFetcher;

/**
 * Everything a stage needs to run, passed explicitly instead of through globals.
 */
public record CrawlContext(
        CrawlerConfig config,
        Catalog catalog,
        CheckpointStore checkpoints,
        HistoryLog history,
        PageFetcher fetcher,
        RecordExtractor extractor,
        Politeness politeness,
        Paginator paginator
) {
    public static CrawlContext create(CrawlerConfig config, Catalog catalog, CheckpointStore checkpoints,
                                      HistoryLog history, PageFetcher fetcher, RecordExtractor extractor,
                                      Politeness politeness) {
        var paginator = new Paginator(fetcher, extractor, politeness, config.crawl().earlyStop());
        return new CrawlContext(config, catalog, checkpoints, history, fetcher, extractor, politeness, paginator);
    }
}
