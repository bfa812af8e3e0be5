package org.crawljav.select;

import org.crawljav.Magnet;
import org.crawljav.Tags;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the best magnet of a work: the largest one, then the one carrying the most priority
 * keywords, then the first one fetched. Magnets without a readable size are never picked.
 */
public class MagnetSelector {
    public static final Set<String> KEYWORDS = Set.of("高清", "字幕");
    private static final Pattern SIZE_PATTERN = Pattern.compile("([\\d.]+)\\s*GB", Pattern.CASE_INSENSITIVE);

    /**
     * Size in gigabytes, taken from the first {@code <number> GB} in the string.
     */
    public static OptionalDouble parseSize(@Nullable String size) {
        if (size == null || size.isEmpty()) return OptionalDouble.empty();
        Matcher matcher = SIZE_PATTERN.matcher(size);
        if (!matcher.find()) return OptionalDouble.empty();
        try {
            return OptionalDouble.of(Double.parseDouble(matcher.group(1)));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    public static int keywordHits(Tags tags) {
        int hits = 0;
        for (String tag : tags.values()) {
            if (KEYWORDS.contains(tag)) hits++;
        }
        return hits;
    }

    /**
     * @param magnets magnets of one work in the order they were fetched
     */
    public Optional<Magnet> select(List<Magnet> magnets) {
        Magnet best = null;
        double bestSize = -1;
        int bestHits = -1;
        for (Magnet magnet : magnets) {
            if (magnet.magnet() == null || magnet.magnet().isEmpty()) continue;
            OptionalDouble size = parseSize(magnet.size());
            if (size.isEmpty()) continue;
            int hits = keywordHits(magnet.tags());
            // strict comparisons keep the earlier magnet on a full tie
            if (size.getAsDouble() > bestSize || (size.getAsDouble() == bestSize && hits > bestHits)) {
                best = magnet;
                bestSize = size.getAsDouble();
                bestHits = hits;
            }
        }
        return Optional.ofNullable(best);
    }
}
