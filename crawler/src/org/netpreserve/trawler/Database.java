package org.netpreserve.trawler;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;
import org.jdbi.v3.core.config.JdbiConfig;
import org.jdbi.v3.core.statement.ParsedSql;
import org.jdbi.v3.core.statement.SqlLogger;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.CreateSqlObject;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.jdbi.v3.sqlobject.transaction.Transactional;
import org.netpreserve.trawler.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Types;
import java.time.Duration;
import java.util.Objects;

/**
 * The durable frontier database.
 * <p>
 * The connection pool holds exactly one connection so every statement and transaction is serialized. That gives
 * the multi-row pause and resume operations the same isolation as a worker's single-row update.
 */
public interface Database extends AutoCloseable, Transactional<Database> {
    static Database newDatabaseInMemory() {
        return open("jdbc:sqlite::memory:");
    }

    static Database open(Path path) {
        return open("jdbc:sqlite:" + path);
    }

    static Database open(String jdbcUrl) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("busy_timeout", "60000");
        config.setMaximumPoolSize(1);
        // an in-memory database disappears with its connection, so never retire it
        config.setMaxLifetime(0);
        config.setPoolName("frontier");
        var dataSource = new HikariDataSource(config);
        var jdbi = Jdbi.create(dataSource);
        jdbi.installPlugin(new SqlObjectPlugin());
        jdbi.registerColumnMapper(Url.class, (r, col, ctx) -> {
            String value = r.getString(col);
            return value == null ? null : new Url(value);
        });
        jdbi.registerArgument(new AbstractArgumentFactory<Url>(Types.VARCHAR) {
            @Override
            protected Argument build(Url value, ConfigRegistry config) {
                return (pos, stmt, ctx) -> stmt.setString(pos, value.toString());
            }
        });
        jdbi.getConfig(DataSourceHolder.class).dataSource = dataSource;
        jdbi.setSqlLogger(new SqlLogger() {
            private static final Logger log = LoggerFactory.getLogger(Database.class);

            @Override
            public void logAfterExecution(StatementContext context) {
                if (context.getExecutionMoment() == null || context.getCompletionMoment() == null) return;
                var duration = Duration.between(context.getExecutionMoment(), context.getCompletionMoment());
                var durationMillis = duration.toMillis();
                if (durationMillis > 100) {
                    ParsedSql parsedSql = context.getParsedSql();
                    String sql = parsedSql != null ? parsedSql.getSql() : "<sql unavailable>";
                    log.warn("[Slow SQL] {}ms {}", durationMillis, sql);
                }
            }
        });
        Database db = jdbi.onDemand(Database.class);
        db.init();
        return db;
    }

    default void init() {
        // we can't use @SqlScript because we need to use executeAsSeparateStatements() on sqlite
        try (var stream = Objects.requireNonNull(Database.class.getResourceAsStream("schema.sql"), "missing schema.sql")) {
            var schema = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            useHandle(handle -> handle.createScript(schema).executeAsSeparateStatements());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @CreateSqlObject
    FrontierDAO frontier();

    default HikariDataSource dataSource() {
        return withHandle(handle -> handle.getConfig(DataSourceHolder.class).dataSource);
    }

    default void close() {
        dataSource().close();
    }

    class DataSourceHolder implements JdbiConfig<DataSourceHolder> {
        private HikariDataSource dataSource;

        public DataSourceHolder() {
        }

        @Override
        public DataSourceHolder createCopy() {
            var copy = new DataSourceHolder();
            copy.dataSource = dataSource;
            return copy;
        }
    }
}
