package net.tvcatalog.repository;

import net.tvcatalog.dto.Actor;
import net.tvcatalog.dto.Episode;
import net.tvcatalog.dto.Season;
import net.tvcatalog.dto.Show;
import net.tvcatalog.dto.ShowCharacter;
import net.tvcatalog.support.pagination.OrderKey;
import net.tvcatalog.support.pagination.OrderSpec;
import net.tvcatalog.support.pagination.SortDirection;
import net.tvcatalog.support.pagination.SortValues;

/**
 * Ordering of every list endpoint. Key names end up inside {@code page_info} tokens, so they
 * must not change between releases. Expressions use the table aliases of
 * {@link CatalogListingRepository}.
 */
public final class CatalogOrderSpecs {

    public static final OrderSpec<Show> SHOWS = OrderSpec.of(
        OrderKey.<Show>of("year", "COALESCE(s.year, " + SortValues.NULL_INT_SENTINEL + ")", SortDirection.ASC,
            show -> SortValues.intOrSentinel(show.year()), SortValues::toInteger),
        OrderKey.of("title", "s.title", SortDirection.ASC, Show::title, SortValues::toText),
        OrderKey.of("id", "s.id", SortDirection.ASC, Show::id, SortValues::toLong)
    );

    public static final OrderSpec<Actor> ACTORS = OrderSpec.of(
        OrderKey.of("name", "a.name", SortDirection.ASC, Actor::name, SortValues::toText),
        OrderKey.of("id", "a.id", SortDirection.ASC, Actor::id, SortValues::toLong)
    );

    public static final OrderSpec<Season> SEASONS = OrderSpec.of(
        OrderKey.of("season_number", "se.season_number", SortDirection.ASC, Season::seasonNumber, SortValues::toInteger),
        OrderKey.of("id", "se.id", SortDirection.ASC, Season::id, SortValues::toLong)
    );

    /**
     * Air date first, undated episodes last, across seasons.
     */
    public static final OrderSpec<Episode> EPISODES = OrderSpec.of(
        OrderKey.<Episode>of("air_date", "COALESCE(e.air_date, DATE '" + SortValues.NULL_DATE_SENTINEL + "')", SortDirection.ASC,
            episode -> SortValues.dateOrSentinel(episode.airDate()), SortValues::toLocalDate),
        OrderKey.of("id", "e.id", SortDirection.ASC, Episode::id, SortValues::toLong)
    );

    public static final OrderSpec<ShowCharacter> CHARACTERS = OrderSpec.of(
        OrderKey.of("name", "c.name", SortDirection.ASC, ShowCharacter::name, SortValues::toText),
        OrderKey.of("id", "c.id", SortDirection.ASC, ShowCharacter::id, SortValues::toLong)
    );

    public static final OrderSpec<ShowCharacter> EPISODE_CHARACTERS = OrderSpec.of(
        OrderKey.of("name", "c.name", SortDirection.ASC, ShowCharacter::name, SortValues::toText),
        OrderKey.of("id", "c.id", SortDirection.ASC, ShowCharacter::id, SortValues::toLong)
    );

    private CatalogOrderSpecs() {
        // Constants holder
    }
}
