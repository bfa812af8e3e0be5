package org.crawljav.extract;

import java.util.List;

/**
 * A magnet link listed on a work page.
 *
 * @param uri  the magnet URI
 * @param tags labels shown next to the link, in page order
 * @param size free-form size text, e.g. "4.73GB, 2個文件"
 */
public record MagnetRecord(String uri, List<String> tags, String size) {
    public MagnetRecord {
        tags = tags == null ? List.of() : List.copyOf(tags);
        size = size == null ? "" : size.trim();
    }

    public boolean isValid() {
        return uri != null && !uri.isBlank();
    }
}
