package org.crawljav.extract;

import org.crawljav.fetch.Page;
import org.crawljav.util.Url;
import org.jetbrains.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts records from the source's HTML with jsoup selectors.
 */
public class JavdbExtractor implements RecordExtractor {
    private static final Logger log = LoggerFactory.getLogger(JavdbExtractor.class);
    static final String NEXT_PAGE_TEXT = "下一頁";

    private static Document parse(Page page) {
        return Jsoup.parse(page.body(), page.url().toString());
    }

    @Override
    public List<ActorRecord> extractActors(Page page) {
        Document doc = parse(page);
        // a page without <section> is usually a login or challenge page
        if (doc.selectFirst("section") == null) {
            log.warn("No <section> in {}, probably a login/challenge page or expired cookies", page.url());
        }
        var actors = new ArrayList<ActorRecord>();
        for (Element box : doc.select("div#actors div.box.actor-box")) {
            Element link = box.selectFirst("a[href]");
            if (link == null) continue;
            String href = link.absUrl("href");
            Element strong = box.selectFirst("strong");
            String name = strong != null ? strong.text().trim() : link.text().trim();
            if (!href.isEmpty() && !name.isEmpty()) {
                actors.add(new ActorRecord(name, new Url(href)));
            }
        }
        return actors;
    }

    @Override
    public List<WorkRecord> extractWorks(Page page) {
        Document doc = parse(page);
        Element grid = doc.selectFirst("body > section > div > div.movie-list.h.cols-4.vcols-8");
        if (grid == null) grid = doc.selectFirst("div.movie-list.h.cols-4.vcols-8");
        if (grid == null) grid = doc.selectFirst("div.movie-list");
        if (grid == null) {
            log.warn("No div.movie-list container in {}", page.url());
            return List.of();
        }
        var works = new ArrayList<WorkRecord>();
        for (Element card : grid.children()) {
            if (!card.tagName().equals("div")) continue;
            Element link = card.selectFirst("a[href]");
            if (link == null) continue;
            String href = link.absUrl("href");
            Element strong = link.selectFirst("div.video-title > strong");
            String code = strong != null ? strong.text().trim() : "";
            Element titleNode = link.selectFirst("div.video-title");
            String title = titleNode != null ? titleNode.text().trim() : code;
            if (!code.isEmpty()) {
                works.add(new WorkRecord(code, title, Url.orNull(href)));
            }
        }
        return works;
    }

    @Override
    public List<MagnetRecord> extractMagnets(Page page) {
        Document doc = parse(page);
        Element root = doc.selectFirst("#magnets-content");
        if (root == null) {
            log.warn("No #magnets-content in {} (blocked or layout changed)", page.url());
            return List.of();
        }
        var magnets = new ArrayList<MagnetRecord>();
        for (Element entry : root.children()) {
            if (!entry.tagName().equals("div")) continue;
            Element anchor = entry.selectFirst("div.magnet-name.column.is-four-fifths a[href^=magnet:]");
            if (anchor == null) anchor = entry.selectFirst("a[href^=magnet:]");
            if (anchor == null) continue;
            String href = anchor.attr("href").trim();
            if (!href.startsWith("magnet:")) continue;

            var tags = new ArrayList<String>();
            for (Element span : anchor.select("div span")) {
                if (span.hasClass("name") || span.hasClass("meta")) continue;
                String text = span.text().trim();
                if (!text.isEmpty()) tags.add(text);
            }
            Element sizeNode = anchor.selectFirst("span.meta");
            String size = sizeNode != null ? sizeNode.text().trim() : "";
            magnets.add(new MagnetRecord(href, tags, size));
        }

        if (magnets.isEmpty()) {
            Elements links = root.select("a[href^=magnet:]");
            for (Element link : links) {
                String href = link.attr("href").trim();
                if (!href.isEmpty()) magnets.add(new MagnetRecord(href, List.of(), ""));
            }
        }

        Set<String> seen = new LinkedHashSet<>();
        var deduped = new ArrayList<MagnetRecord>(magnets.size());
        for (var magnet : magnets) {
            if (seen.add(magnet.uri())) deduped.add(magnet);
        }
        return deduped;
    }

    @Override
    public @Nullable Url extractNextPageUrl(Page page) {
        Document doc = parse(page);
        for (Element link : doc.select("a[href]")) {
            if (link.text().contains(NEXT_PAGE_TEXT)) {
                return Url.orNull(link.absUrl("href"));
            }
        }
        return null;
    }
}
