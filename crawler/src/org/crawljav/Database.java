package org.crawljav;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.crawljav.db.ActorDAO;
import org.crawljav.db.MagnetDAO;
import org.crawljav.db.WorkDAO;
import org.crawljav.util.Url;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;
import org.jdbi.v3.core.statement.SqlLogger;
import org.jdbi.v3.core.statement.SqlStatements;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.CreateSqlObject;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.jdbi.v3.sqlobject.transaction.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Types;
import java.time.Duration;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * SQLite catalog of actors, works and magnets.
 */
public interface Database extends AutoCloseable, Transactional<Database> {
    String DATA_SOURCE = "crawljav.dataSource";

    static Database inMemory() {
        return open("jdbc:sqlite::memory:");
    }

    static Database open(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        return open("jdbc:sqlite:" + path);
    }

    static Database open(String jdbcUrl) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setConnectionInitSql("PRAGMA foreign_keys = ON");
        // one connection: all access is serialized and an in-memory database lives as long as it
        config.setMaximumPoolSize(1);
        var dataSource = new HikariDataSource(config);

        var jdbi = Jdbi.create(dataSource)
                .installPlugin(new SqlObjectPlugin())
                .registerColumnMapper(Url.class, (rs, col, ctx) -> Url.orNull(rs.getString(col)))
                .registerColumnMapper(Tags.class, (rs, col, ctx) -> Tags.parse(rs.getString(col)))
                .registerArgument(new AbstractArgumentFactory<Url>(Types.VARCHAR) {
                    @Override
                    protected Argument build(Url value, ConfigRegistry config) {
                        return (position, statement, ctx) -> statement.setString(position, value.toString());
                    }
                })
                .registerArgument(new AbstractArgumentFactory<Tags>(Types.VARCHAR) {
                    @Override
                    protected Argument build(Tags value, ConfigRegistry config) {
                        return (position, statement, ctx) -> statement.setString(position, value.joinedOrNull());
                    }
                })
                .setSqlLogger(new SlowStatementLogger(Duration.ofMillis(100)))
                .define(DATA_SOURCE, dataSource);
        Database db = jdbi.onDemand(Database.class);
        db.init();
        return db;
    }

    default void init() {
        try (InputStream stream = Database.class.getResourceAsStream("schema.sql")) {
            if (stream == null) throw new IllegalStateException("schema.sql missing from classpath");
            String schema = new String(stream.readAllBytes(), UTF_8);
            // the sqlite driver runs only the first statement of a multi-statement string
            useHandle(handle -> handle.createScript(schema).executeAsSeparateStatements());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @CreateSqlObject
    ActorDAO actors();

    @CreateSqlObject
    WorkDAO works();

    @CreateSqlObject
    MagnetDAO magnets();

    default void close() {
        var dataSource = (HikariDataSource) withHandle(handle ->
                handle.getConfig(SqlStatements.class).getAttribute(DATA_SOURCE));
        dataSource.close();
    }

    /**
     * Warns about statements slower than a threshold.
     */
    class SlowStatementLogger implements SqlLogger {
        private static final Logger log = LoggerFactory.getLogger(Database.class);
        private final Duration threshold;

        SlowStatementLogger(Duration threshold) {
            this.threshold = threshold;
        }

        @Override
        public void logAfterExecution(StatementContext context) {
            if (context.getExecutionMoment() == null || context.getCompletionMoment() == null) return;
            Duration elapsed = Duration.between(context.getExecutionMoment(), context.getCompletionMoment());
            if (elapsed.compareTo(threshold) > 0) {
                log.atWarn().addKeyValue("millis", elapsed.toMillis())
                        .log("Slow statement: " + context.getRawSql());
            }
        }
    }
}
