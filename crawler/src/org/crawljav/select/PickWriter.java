package org.crawljav.select;

import org.crawljav.Magnet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardOpenOption.APPEND;
import static java.nio.file.StandardOpenOption.CREATE;

/**
 * Writes the best magnet of each work to one text file per actor. Files are only ever appended
 * to, and a magnet already present in the file is not written again.
 */
public class PickWriter {
    private static final Logger log = LoggerFactory.getLogger(PickWriter.class);
    private final Path directory;
    private final MagnetSelector selector;

    public PickWriter(Path directory, MagnetSelector selector) {
        this.directory = directory;
        this.selector = selector;
    }

    public record Summary(int added, int picked) {
    }

    /**
     * @param magnets actor name → work code → magnets, as returned by
     *                {@link org.crawljav.Catalog#groupedMagnetsByActorAndWork()}
     */
    public Summary write(Map<String, ? extends Map<String, List<Magnet>>> magnets) throws IOException {
        int added = 0;
        int picked = 0;
        for (var actorEntry : magnets.entrySet()) {
            String actor = actorEntry.getKey();
            var picks = new ArrayList<String>();
            for (var workEntry : new TreeMap<>(actorEntry.getValue()).entrySet()) {
                selector.select(workEntry.getValue()).ifPresent(magnet -> picks.add(magnet.magnet()));
            }
            if (picks.isEmpty()) {
                log.info("No magnet of {} qualifies", actor);
                continue;
            }
            picked += picks.size();
            Path file = directory.resolve(fileName(actor) + ".txt");
            int written = append(file, picks);
            added += written;
            if (written > 0) {
                log.info("Added {} magnets to {}", written, file);
            } else {
                log.info("All magnets of {} already in {}", actor, file);
            }
        }
        if (added == 0) {
            if (picked > 0) {
                log.info("All picks already written");
            } else {
                log.warn("Nothing picked, no stored magnet has a readable size");
            }
        }
        return new Summary(added, picked);
    }

    private static int append(Path file, List<String> picks) throws IOException {
        Set<String> existing = new HashSet<>();
        if (Files.exists(file)) {
            for (String line : Files.readAllLines(file, UTF_8)) {
                if (!line.isBlank()) existing.add(line.strip());
            }
        }
        var fresh = new LinkedHashSet<String>();
        for (String pick : picks) {
            if (!existing.contains(pick)) fresh.add(pick);
        }
        if (fresh.isEmpty()) return 0;
        Files.createDirectories(file.toAbsolutePath().getParent());
        var builder = new StringBuilder();
        for (String pick : fresh) builder.append(pick).append('\n');
        Files.writeString(file, builder, UTF_8, CREATE, APPEND);
        return fresh.size();
    }

    static String fileName(String actor) {
        String name = actor.replaceAll("[\\\\/:*?\"<>|]", "_").strip();
        return name.isEmpty() ? "actor" : name;
    }
}
