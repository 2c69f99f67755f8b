package net.tvcatalog.service;

import lombok.extern.slf4j.Slf4j;
import net.tvcatalog.dto.Actor;
import net.tvcatalog.dto.Episode;
import net.tvcatalog.dto.Season;
import net.tvcatalog.dto.Show;
import net.tvcatalog.dto.ShowCharacter;
import net.tvcatalog.exception.ResourceNotFoundException;
import net.tvcatalog.repository.CatalogListingRepository;
import net.tvcatalog.repository.CatalogOrderSpecs;
import net.tvcatalog.support.pagination.KeysetPaginator;
import net.tvcatalog.support.pagination.KeysetPaginator.ListingQuery;
import net.tvcatalog.support.pagination.KeysetPaginator.PaginationParams;
import net.tvcatalog.support.pagination.LinkTarget;
import net.tvcatalog.support.pagination.PaginatedResponse;
import net.tvcatalog.support.pagination.SqlPredicate;
import net.tvcatalog.support.pagination.SqlPredicate.ComparisonOperator;
import net.tvcatalog.util.DateRangeParser.DateRange;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Serves the catalog list endpoints: builds each endpoint's base filter, picks its ordering
 * and hands the store read to the shared {@link KeysetPaginator}.
 */
@Service
@Slf4j
public class CatalogListingService {

    private final CatalogListingRepository repository;
    private final KeysetPaginator paginator;

    public CatalogListingService(CatalogListingRepository repository, KeysetPaginator paginator) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.paginator = Objects.requireNonNull(paginator, "paginator");
    }

    public PaginatedResponse<Show> listShows(DateRange range, PaginationParams params, LinkTarget target) {
        SqlPredicate filter = createdWithin("s.created_at", range);
        return paginator.paginate(
            new ListingQuery<>(filter, CatalogOrderSpecs.SHOWS, repository::fetchShows, target), params);
    }

    public PaginatedResponse<Actor> listActors(DateRange range, PaginationParams params, LinkTarget target) {
        SqlPredicate filter = createdWithin("a.created_at", range);
        return paginator.paginate(
            new ListingQuery<>(filter, CatalogOrderSpecs.ACTORS, repository::fetchActors, target), params);
    }

    public PaginatedResponse<Season> listSeasonsForShow(long showId, DateRange range,
                                                        PaginationParams params, LinkTarget target) {
        SqlPredicate filter = SqlPredicate.and(
            SqlPredicate.eq("se.show_id", showId),
            createdWithin("se.created_at", range));
        return paginator.paginate(
            new ListingQuery<>(filter, CatalogOrderSpecs.SEASONS, repository::fetchSeasons, target), params);
    }

    public PaginatedResponse<Episode> listEpisodesForShow(long showId, DateRange range,
                                                          PaginationParams params, LinkTarget target) {
        SqlPredicate filter = SqlPredicate.and(
            SqlPredicate.eq("se.show_id", showId),
            createdWithin("e.created_at", range));
        return paginator.paginate(
            new ListingQuery<>(filter, CatalogOrderSpecs.EPISODES, repository::fetchEpisodes, target), params);
    }

    /**
     * @throws ResourceNotFoundException when the season does not exist
     */
    public PaginatedResponse<Episode> listEpisodesForSeason(long seasonId, DateRange range,
                                                            PaginationParams params, LinkTarget target) {
        if (!repository.seasonExists(seasonId)) {
            log.debug("Episode listing requested for unknown season {}", seasonId);
            throw new ResourceNotFoundException("season not found");
        }
        SqlPredicate filter = SqlPredicate.and(
            SqlPredicate.eq("e.season_id", seasonId),
            createdWithin("e.created_at", range));
        return paginator.paginate(
            new ListingQuery<>(filter, CatalogOrderSpecs.EPISODES, repository::fetchEpisodes, target), params);
    }

    /**
     * Episodes of the season numbered {@code seasonNumber} within a show.
     *
     * @throws ResourceNotFoundException when the show has no such season
     */
    public PaginatedResponse<Episode> listEpisodesForShowSeason(long showId, int seasonNumber, DateRange range,
                                                                PaginationParams params, LinkTarget target) {
        long seasonId = repository.findSeasonId(showId, seasonNumber)
            .orElseThrow(() -> {
                log.debug("Show {} has no season {}", showId, seasonNumber);
                return new ResourceNotFoundException("season not found for this show");
            });
        SqlPredicate filter = SqlPredicate.and(
            SqlPredicate.eq("e.season_id", seasonId),
            createdWithin("e.created_at", range));
        return paginator.paginate(
            new ListingQuery<>(filter, CatalogOrderSpecs.EPISODES, repository::fetchEpisodes, target), params);
    }

    public PaginatedResponse<ShowCharacter> listCharactersForShow(long showId, DateRange range,
                                                                  PaginationParams params, LinkTarget target) {
        SqlPredicate filter = SqlPredicate.and(
            SqlPredicate.eq("c.show_id", showId),
            createdWithin("c.created_at", range));
        return paginator.paginate(
            new ListingQuery<>(filter, CatalogOrderSpecs.CHARACTERS, repository::fetchCharacters, target), params);
    }

    /**
     * Characters appearing in an episode; {@code start}/{@code end} bound when the appearance was recorded.
     *
     * @throws ResourceNotFoundException when the episode does not exist
     */
    public PaginatedResponse<ShowCharacter> listCharactersForEpisode(long episodeId, DateRange range,
                                                                     PaginationParams params, LinkTarget target) {
        if (!repository.episodeExists(episodeId)) {
            log.debug("Character listing requested for unknown episode {}", episodeId);
            throw new ResourceNotFoundException("episode not found");
        }
        SqlPredicate filter = SqlPredicate.and(
            SqlPredicate.eq("ec.episode_id", episodeId),
            createdWithin("ec.created_at", range));
        return paginator.paginate(
            new ListingQuery<>(filter, CatalogOrderSpecs.EPISODE_CHARACTERS, repository::fetchEpisodeCharacters, target),
            params);
    }

    static SqlPredicate createdWithin(String column, DateRange range) {
        List<SqlPredicate> bounds = new ArrayList<>(2);
        if (range.start() != null) {
            bounds.add(SqlPredicate.compare(column, ComparisonOperator.GE, range.start()));
        }
        if (range.end() != null) {
            bounds.add(SqlPredicate.compare(column, ComparisonOperator.LE, range.end()));
        }
        return SqlPredicate.and(bounds);
    }
}
