package org.crawljav;

import org.crawljav.extract.RecordExtractor;
import org.crawljav.fetch.FetchException;
import org.crawljav.fetch.Page;
import org.crawljav.fetch.PageFetcher;
import org.crawljav.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Walks a paginated listing following its "next page" links and collects records until the
 * listing ends or an already known record shows up.
 * <p>
 * Early stop assumes the listing is ordered newest first: once a known record is seen every later
 * record is assumed to be known as well. Nothing here can verify that. For sources that don't
 * guarantee the order construct the paginator with {@code earlyStop = false}, which ignores the
 * known keys and always walks to the last page.
 */
public class Paginator {
    private static final Logger log = LoggerFactory.getLogger(Paginator.class);
    private final PageFetcher fetcher;
    private final RecordExtractor extractor;
    private final Politeness politeness;
    private final boolean earlyStop;

    public Paginator(PageFetcher fetcher, RecordExtractor extractor, Politeness politeness, boolean earlyStop) {
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.politeness = politeness;
        this.earlyStop = earlyStop;
    }

    /**
     * Collects the records that are new since the last crawl, in listing order.
     *
     * @param start     first page of the listing
     * @param knownKeys keys of records already stored, may be empty
     * @param extract   extracts the records of one page
     * @param keyOf     identifies a record
     * @throws FetchException if any page can't be fetched; nothing is returned in that case
     */
    public <T> List<T> walk(Url start, Set<String> knownKeys, Function<Page, List<T>> extract,
                            Function<T, String> keyOf) throws FetchException, InterruptedException {
        var records = new ArrayList<T>();
        Set<Url> visited = new HashSet<>();
        Url url = start;
        int pageNumber = 1;
        while (true) {
            visited.add(url);
            log.info("Fetching page {}: {}", pageNumber, url);
            Page page = fetcher.fetch(url);
            List<T> pageRecords = extract.apply(page);
            log.info("Page {} has {} records", pageNumber, pageRecords.size());

            for (T record : pageRecords) {
                String key = keyOf.apply(record);
                if (earlyStop && key != null && knownKeys.contains(key)) {
                    log.info("Reached known record {} on page {}, stopping", key, pageNumber);
                    return records;
                }
                records.add(record);
            }

            Url next = extractor.extractNextPageUrl(page);
            if (next == null || next.equals(url) || visited.contains(next)) {
                break;
            }
            url = next;
            pageNumber++;
            politeness.pause();
        }
        log.info("Listing {} finished after {} pages, {} new records", start, pageNumber, records.size());
        return records;
    }
}
