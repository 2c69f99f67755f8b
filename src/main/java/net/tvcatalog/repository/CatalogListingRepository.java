package net.tvcatalog.repository;

import net.tvcatalog.dto.Actor;
import net.tvcatalog.dto.Episode;
import net.tvcatalog.dto.Season;
import net.tvcatalog.dto.Show;
import net.tvcatalog.dto.ShowCharacter;
import net.tvcatalog.support.pagination.PaginatedQuery;
import net.tvcatalog.support.pagination.RenderedSql;
import net.tvcatalog.support.pagination.SqlPredicateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the catalog: executes planned page queries against the relational store.
 *
 * <p>Each listing owns a fixed SELECT; the planner supplies WHERE, ORDER BY, LIMIT and OFFSET.
 * Sort and filter expressions reference the aliases used here ({@code s}, {@code a}, {@code se},
 * {@code e}, {@code c}, {@code ec}).</p>
 */
@Repository
public class CatalogListingRepository {

    private static final Logger log = LoggerFactory.getLogger(CatalogListingRepository.class);

    static final String SELECT_SHOWS =
        "SELECT s.id, s.title, s.description, s.year, s.created_at FROM shows s";

    static final String SELECT_ACTORS =
        "SELECT a.id, a.name, a.created_at FROM actors a";

    static final String SELECT_SEASONS =
        "SELECT se.id, se.show_id, se.season_number, se.year, se.created_at FROM seasons se";

    static final String SELECT_EPISODES = """
        SELECT e.id, e.season_id, se.show_id, se.season_number, e.air_date, e.title, e.description, e.created_at
        FROM episodes e
        JOIN seasons se ON se.id = e.season_id""";

    static final String SELECT_CHARACTERS = """
        SELECT c.id, c.show_id, c.name, c.actor_id, ac.name AS actor_name, c.created_at
        FROM characters c
        LEFT JOIN actors ac ON ac.id = c.actor_id""";

    static final String SELECT_EPISODE_CHARACTERS = """
        SELECT c.id, c.show_id, c.name, c.actor_id, ac.name AS actor_name, c.created_at
        FROM episode_characters ec
        JOIN characters c ON c.id = ec.character_id
        LEFT JOIN actors ac ON ac.id = c.actor_id""";

    private final JdbcTemplate jdbcTemplate;

    public CatalogListingRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<Show> fetchShows(PaginatedQuery query) {
        return fetch(SELECT_SHOWS, query, CatalogRowMappers.SHOW);
    }

    public List<Actor> fetchActors(PaginatedQuery query) {
        return fetch(SELECT_ACTORS, query, CatalogRowMappers.ACTOR);
    }

    public List<Season> fetchSeasons(PaginatedQuery query) {
        return fetch(SELECT_SEASONS, query, CatalogRowMappers.SEASON);
    }

    public List<Episode> fetchEpisodes(PaginatedQuery query) {
        return fetch(SELECT_EPISODES, query, CatalogRowMappers.EPISODE);
    }

    public List<ShowCharacter> fetchCharacters(PaginatedQuery query) {
        return fetch(SELECT_CHARACTERS, query, CatalogRowMappers.CHARACTER);
    }

    public List<ShowCharacter> fetchEpisodeCharacters(PaginatedQuery query) {
        return fetch(SELECT_EPISODE_CHARACTERS, query, CatalogRowMappers.CHARACTER);
    }

    /**
     * Resolves a show's season by its number.
     */
    public Optional<Long> findSeasonId(long showId, int seasonNumber) {
        List<Long> ids = jdbcTemplate.query(
            "SELECT id FROM seasons WHERE show_id = ? AND season_number = ?",
            (rs, rowNum) -> rs.getLong("id"), showId, seasonNumber);
        return ids.stream().findFirst();
    }

    public boolean episodeExists(long episodeId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM episodes WHERE id = ?", Integer.class, episodeId);
        return count != null && count > 0;
    }

    public boolean seasonExists(long seasonId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM seasons WHERE id = ?", Integer.class, seasonId);
        return count != null && count > 0;
    }

    /**
     * Round-trips {@code SELECT 1}; data access failures propagate to the caller.
     */
    public boolean ping() {
        Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        return one != null && one == 1;
    }

    private <R> List<R> fetch(String select, PaginatedQuery query, RowMapper<R> rowMapper) {
        RenderedSql tail = SqlPredicateRenderer.renderTail(query);
        String sql = select + tail.sql();
        log.debug("Executing listing query: {} with {} parameter(s)", sql, tail.params().size());
        return jdbcTemplate.query(sql, rowMapper, tail.params().toArray());
    }
}
