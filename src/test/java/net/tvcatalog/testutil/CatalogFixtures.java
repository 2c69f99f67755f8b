package net.tvcatalog.testutil;

import net.tvcatalog.dto.Episode;
import net.tvcatalog.dto.Show;
import net.tvcatalog.dto.ShowCharacter;
import net.tvcatalog.support.pagination.PaginatedQuery;
import net.tvcatalog.support.pagination.SortValues;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Catalog rows and matching in-memory stores keyed by the repository's SQL expressions.
 */
public final class CatalogFixtures {

    private CatalogFixtures() {
    }

    public static List<Show> shows() {
        return List.of(
            new Show(1, "Lost", "Plane crash survivors", 2004, LocalDateTime.of(2024, 1, 1, 9, 0)),
            new Show(2, "Friends", null, 1994, LocalDateTime.of(2024, 1, 2, 9, 0)),
            new Show(3, "Untitled Pilot", null, null, LocalDateTime.of(2024, 1, 3, 9, 0)),
            new Show(4, "House", "Medical drama", 2004, LocalDateTime.of(2024, 1, 4, 9, 0)),
            new Show(5, "Sherlock", null, 2010, LocalDateTime.of(2024, 1, 5, 9, 0))
        );
    }

    public static InMemoryPageStore<Show> showStore(List<Show> shows) {
        return InMemoryPageStore.over(shows)
            .expression("COALESCE(s.year, 2147483647)", show -> SortValues.intOrSentinel(show.year()))
            .expression("s.title", Show::title)
            .expression("s.id", Show::id)
            .expression("s.created_at", Show::createdAt)
            .build();
    }

    public static List<Episode> episodes() {
        LocalDateTime created = LocalDateTime.of(2024, 2, 1, 0, 0);
        return List.of(
            new Episode(11, 1, 1, 1, LocalDate.of(2004, 9, 22), "Pilot (1)", null, created),
            new Episode(12, 1, 1, 1, LocalDate.of(2004, 9, 29), "Pilot (2)", null, created),
            new Episode(21, 2, 1, 2, null, "Unaired", null, created),
            new Episode(22, 2, 1, 2, LocalDate.of(2005, 9, 21), "Man of Science", null, created),
            new Episode(23, 2, 1, 2, LocalDate.of(2004, 9, 25), "Recap Special", null, created),
            new Episode(31, 3, 2, 1, LocalDate.of(1994, 9, 22), "The One Where It All Began", null, created)
        );
    }

    public static InMemoryPageStore<Episode> episodeStore(List<Episode> episodes) {
        return InMemoryPageStore.over(episodes)
            .expression("se.season_number", Episode::seasonNumber)
            .expression("COALESCE(e.air_date, DATE '9999-12-31')",
                episode -> episode.airDate() == null ? SortValues.NULL_DATE_SENTINEL : episode.airDate())
            .expression("e.id", Episode::id)
            .expression("se.show_id", Episode::showId)
            .expression("e.season_id", Episode::seasonId)
            .expression("e.created_at", Episode::createdAt)
            .build();
    }

    /**
     * A character's appearance in an episode, as joined through {@code episode_characters}.
     */
    public record EpisodeAppearance(long episodeId, ShowCharacter character, LocalDateTime recordedAt) {
    }

    public static List<EpisodeAppearance> appearances() {
        LocalDateTime created = LocalDateTime.of(2024, 3, 1, 0, 0);
        ShowCharacter jack = new ShowCharacter(1, 1, "Jack Shephard", 100L, "Matthew Fox", created);
        ShowCharacter kate = new ShowCharacter(2, 1, "Kate Austen", 101L, "Evangeline Lilly", created);
        ShowCharacter hurley = new ShowCharacter(3, 1, "Hugo Reyes", null, null, created);
        ShowCharacter claire = new ShowCharacter(9, 1, "Claire Littleton", 102L, "Emilie de Ravin", created);
        return List.of(
            new EpisodeAppearance(11, jack, LocalDateTime.of(2024, 3, 2, 0, 0)),
            new EpisodeAppearance(11, kate, LocalDateTime.of(2024, 3, 3, 0, 0)),
            new EpisodeAppearance(11, hurley, LocalDateTime.of(2024, 3, 4, 0, 0)),
            new EpisodeAppearance(11, claire, LocalDateTime.of(2024, 3, 5, 0, 0)),
            new EpisodeAppearance(12, kate, LocalDateTime.of(2024, 3, 6, 0, 0))
        );
    }

    public static InMemoryPageStore<EpisodeAppearance> appearanceStore(List<EpisodeAppearance> appearances) {
        return InMemoryPageStore.over(appearances)
            .expression("c.name", appearance -> appearance.character().name())
            .expression("c.id", appearance -> appearance.character().id())
            .expression("ec.episode_id", EpisodeAppearance::episodeId)
            .expression("ec.created_at", EpisodeAppearance::recordedAt)
            .build();
    }

    /**
     * Runs a query against the appearance store and returns the joined characters.
     */
    public static List<ShowCharacter> charactersOf(InMemoryPageStore<EpisodeAppearance> store, PaginatedQuery query) {
        return store.execute(query).stream().map(EpisodeAppearance::character).toList();
    }
}
