package org.crawljav;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardOpenOption.APPEND;
import static java.nio.file.StandardOpenOption.CREATE;

/**
 * Append-only log of completed stage runs, one JSON object per line. The crawler only ever
 * appends to it.
 */
public class HistoryLog {
    private final Path file;
    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public HistoryLog(Path file) {
        this.file = file;
    }

    public synchronized void append(HistoryRecord record) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Files.writeString(file, mapper.writeValueAsString(record) + "\n", UTF_8, CREATE, APPEND);
    }

    public List<HistoryRecord> readAll() throws IOException {
        var records = new ArrayList<HistoryRecord>();
        if (!Files.exists(file)) return records;
        for (String line : Files.readAllLines(file, UTF_8)) {
            if (line.isBlank()) continue;
            records.add(mapper.readValue(line, HistoryRecord.class));
        }
        return records;
    }

    public Path file() {
        return file;
    }
}
