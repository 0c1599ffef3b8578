package org.netpreserve.trawler;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.transaction.Transactional;
import org.netpreserve.trawler.util.Url;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(FrontierUrl.class)
@RegisterConstructorMapper(StatusCounts.class)
public interface FrontierDAO extends Transactional<FrontierDAO> {
    /**
     * Applies a {@link StatusUpdate}. Only the supplied fields change and pause_reason is kept in step with the
     * status so that it is set exactly when the URL is paused.
     */
    String SET_STATUS = """
            UPDATE frontier
            SET status = :status,
                last_status_change = :now,
                last_error = CASE WHEN :clearLastError THEN NULL ELSE last_error END,
                is_sitemap = coalesce(:sitemap, is_sitemap),
                pause_reason = CASE WHEN :status = 'PAUSED' THEN coalesce(:pauseReason, pause_reason, 'user-pause')
                                    ELSE NULL END
            """;

    String PREFIX_MATCH = "substr(url, 1, length(:prefix)) = :prefix";

    @SqlUpdate("""
            INSERT INTO frontier (url, status, last_status_change, retry_count, is_sitemap)
            VALUES (:url, :status, :now, 0, :sitemap)
            ON CONFLICT(url) DO NOTHING""")
    int insertIfAbsent(Url url, FrontierUrl.Status status, boolean sitemap, Instant now);

    @SqlQuery("SELECT * FROM frontier WHERE url = ?")
    FrontierUrl find(Url url);

    @SqlUpdate(SET_STATUS + "WHERE url = :url")
    int updateStatus(Url url, FrontierUrl.Status status, @BindMethods StatusUpdate update, Instant now);

    @SqlUpdate(SET_STATUS + "WHERE url = :url AND status = :expected")
    int updateStatusIf(Url url, FrontierUrl.Status expected, FrontierUrl.Status status,
                       @BindMethods StatusUpdate update, Instant now);

    /**
     * Records a failed fetch of a PENDING URL. The retry count and the choice between PENDING and ERROR are
     * decided from the row's own value in one statement, so concurrent failures of the same URL cannot both
     * see a count below the limit.
     */
    @SqlUpdate("""
            UPDATE frontier
            SET retry_count = retry_count + 1,
                status = CASE WHEN retry_count + 1 >= :maxRetries THEN 'ERROR' ELSE 'PENDING' END,
                last_error = :error,
                last_status_change = :now
            WHERE url = :url AND status = 'PENDING'""")
    int recordFailure(Url url, String error, int maxRetries, Instant now);

    @SqlQuery("SELECT url FROM frontier WHERE status = ? ORDER BY id")
    List<Url> listByStatus(FrontierUrl.Status status);

    @SqlQuery("SELECT url FROM frontier WHERE status = :status AND " + PREFIX_MATCH + " ORDER BY id")
    List<Url> listByStatusAndPrefix(FrontierUrl.Status status, String prefix);

    @SqlQuery("SELECT url FROM frontier ORDER BY id")
    List<Url> listAll();

    @SqlUpdate("""
            UPDATE frontier
            SET status = 'PAUSED', pause_reason = :reason, last_status_change = :now
            WHERE status = 'PENDING' AND""" + " " + PREFIX_MATCH)
    int pausePrefix(String prefix, String reason, Instant now);

    @SqlUpdate("""
            UPDATE frontier
            SET status = 'PENDING', pause_reason = NULL, last_status_change = :now
            WHERE status = 'PAUSED' AND""" + " " + PREFIX_MATCH)
    int resumePrefix(String prefix, Instant now);

    @SqlQuery("SELECT url FROM frontier ORDER BY id LIMIT 1")
    Url earliestUrl();

    @SqlQuery("""
            SELECT coalesce(sum(status = 'PENDING'), 0) AS pending,
                   coalesce(sum(status = 'VISITED'), 0) AS visited,
                   coalesce(sum(status = 'PAUSED'), 0)  AS paused,
                   coalesce(sum(status = 'ERROR'), 0)   AS error
            FROM frontier""")
    StatusCounts statusCounts();
}
