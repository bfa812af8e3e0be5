package org.crawljav;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.crawljav.config.CrawlerConfig;
import org.crawljav.config.WorksConfig;
import org.crawljav.extract.JavdbExtractor;
import org.crawljav.fetch.Credentials;
import org.crawljav.fetch.CredentialsException;
import org.crawljav.fetch.HttpPageFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

public class Crawljav {
    private static final Logger log = LoggerFactory.getLogger(Crawljav.class);
    static final int EXIT_INCOMPLETE = 3;

    public static void main(String[] args) throws Exception {
        Path jobDir = Path.of("userdata");
        String cookieFile = null;
        List<String> tags = null;
        String sortType = null;
        var actors = new ArrayList<String>();
        var stages = EnumSet.allOf(Stage.class);
        boolean skipSelect = false;
        boolean dumpConfig = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--dump-config" -> dumpConfig = true;
                case "--job-dir", "-j" -> jobDir = Path.of(args[++i]);
                case "--cookie" -> cookieFile = args[++i];
                case "--tags" -> tags = splitList(args[++i]);
                case "--sort-type" -> sortType = args[++i];
                case "--actor" -> actors.addAll(splitList(args[++i]));
                case "--skip-collect" -> stages.remove(Stage.ACTORS);
                case "--skip-works" -> stages.remove(Stage.WORKS);
                case "--skip-magnets" -> stages.remove(Stage.MAGNETS);
                case "--skip-select" -> skipSelect = true;
                case "--help", "-h" -> {
                    System.out.println("Usage: crawljav [options]");
                    System.out.println("Options:");
                    System.out.println("  -h, --help");
                    System.out.println("      --actor NAME[,NAME]  Only fetch works and magnets of these actors");
                    System.out.println("      --cookie FILE        Cookie JSON file (default cookie.json)");
                    System.out.println("      --dump-config        Print the effective configuration and exit");
                    System.out.println("  -j, --job-dir DIR        Directory for the database and state (default userdata)");
                    System.out.println("      --skip-collect       Skip collecting actors");
                    System.out.println("      --skip-works         Skip fetching works");
                    System.out.println("      --skip-magnets       Skip fetching magnets");
                    System.out.println("      --skip-select        Skip writing the best magnet picks");
                    System.out.println("      --sort-type TYPE     sort_type parameter for works listings, e.g. 0");
                    System.out.println("      --tags TAG[,TAG]     Tag filter for works listings, e.g. s,d");
                    System.exit(0);
                }
                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    System.exit(1);
                }
            }
        }

        CrawlerConfig config = loadConfig(jobDir);
        if (tags != null || sortType != null) {
            WorksConfig works = config.works();
            config = config.withWorks(new WorksConfig(tags != null ? tags : works.tags(),
                    sortType != null ? sortType : works.sortType()));
        }
        if (cookieFile != null) {
            config = config.withCredentials(config.credentials().withFile(cookieFile));
        }
        if (dumpConfig) {
            System.out.println(yamlMapper().writerWithDefaultPrettyPrinter().writeValueAsString(config));
            System.exit(0);
        }

        Credentials credentials;
        try {
            credentials = Credentials.load(Path.of(config.credentials().file()))
                    .require(config.credentials().required(), config.credentials().recommended());
        } catch (CredentialsException e) {
            log.error("Unusable credentials: {}", e.getMessage());
            System.exit(2);
            return;
        }

        var site = config.site();
        var fetcher = new HttpPageFetcher(credentials, site.baseUrl(), site.userAgent(), site.acceptLanguage(),
                site.timeout());
        int status;
        try (var job = new CrawlJob(jobDir, config, fetcher, new JavdbExtractor())) {
            status = exitStatus(job.run(stages, actors));
            if (skipSelect) {
                log.info("Skipping magnet selection");
            } else {
                try {
                    var summary = job.writePicks();
                    log.info("Picked {} magnets, {} newly written", summary.picked(), summary.added());
                } catch (IOException e) {
                    log.error("Writing magnet picks failed", e);
                }
            }
            log.info("Catalog now holds {}", job.context().catalog().counts());
        }
        if (status != 0) System.exit(status);
    }

    /**
     * Logs the stages that left work behind. Nonzero when a rerun is needed to finish.
     */
    static int exitStatus(List<StageResult> results) {
        int status = 0;
        for (StageResult result : results) {
            if (!result.completed()) {
                log.atWarn().addKeyValue("stage", result.stage().key())
                        .addKeyValue("counters", result.counters())
                        .log("Stage incomplete, rerun to resume it");
                status = EXIT_INCOMPLETE;
            }
        }
        return status;
    }

    private static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Loads the built-in defaults overlaid with {@code config.yaml} from the job directory, if
     * there is one.
     */
    static CrawlerConfig loadConfig(Path jobDir) throws IOException {
        var mapper = yamlMapper();
        Path configFile = jobDir.resolve("config.yaml");
        JsonNode configTree;
        try (var stream = Crawljav.class.getResourceAsStream("config/defaults.yaml")) {
            configTree = mapper.readTree(stream);
        }
        if (Files.exists(configFile)) {
            JsonNode override = mapper.readTree(configFile.toFile());
            // an empty file reads as a missing node
            if (override != null && override.isObject()) {
                configTree = deepMerge(configTree, override);
            }
        }
        return mapper.treeToValue(configTree, CrawlerConfig.class);
    }

    private static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }

    private static List<String> splitList(String value) {
        var items = new ArrayList<String>();
        for (String item : value.split(",")) {
            if (!item.isBlank()) items.add(item.trim());
        }
        return items;
    }
}
