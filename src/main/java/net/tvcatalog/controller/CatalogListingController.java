package net.tvcatalog.controller;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import net.tvcatalog.controller.support.PaginatedResponses;
import net.tvcatalog.dto.Actor;
import net.tvcatalog.dto.Episode;
import net.tvcatalog.dto.Season;
import net.tvcatalog.dto.Show;
import net.tvcatalog.dto.ShowCharacter;
import net.tvcatalog.service.CatalogListingService;
import net.tvcatalog.support.pagination.KeysetPaginator.PaginationParams;
import net.tvcatalog.support.pagination.LinkTarget;
import net.tvcatalog.util.DateRangeParser;
import net.tvcatalog.util.DateRangeParser.DateRange;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Paginated list endpoints of the catalog.
 *
 * <p>All of them accept {@code limit}, {@code offset}, {@code page_info}, {@code start} and
 * {@code end}; continuation links are returned in the {@code Link} header.</p>
 */
@RestController
@Slf4j
public class CatalogListingController {

    private final CatalogListingService listingService;
    private final String linkBaseUrl;

    public CatalogListingController(CatalogListingService listingService,
                                    @Value("${app.pagination.link-base-url:}") String linkBaseUrl) {
        this.listingService = listingService;
        this.linkBaseUrl = linkBaseUrl;
    }

    /**
     * Query-string parameters shared by every list endpoint; {@code page_info} is read from the request.
     */
    public record ListingFilters(String limit, String offset, String start, String end) {
    }

    @GetMapping("/shows")
    public ResponseEntity<List<Show>> listShows(ListingFilters filters, HttpServletRequest request) {
        return PaginatedResponses.toResponse(
            listingService.listShows(range(filters), params(filters, request), target(request)));
    }

    @GetMapping("/actors")
    public ResponseEntity<List<Actor>> listActors(ListingFilters filters, HttpServletRequest request) {
        return PaginatedResponses.toResponse(
            listingService.listActors(range(filters), params(filters, request), target(request)));
    }

    @GetMapping("/shows/{showId}/seasons")
    public ResponseEntity<List<Season>> listSeasons(@PathVariable("showId") long showId,
                                                    ListingFilters filters,
                                                    HttpServletRequest request) {
        return PaginatedResponses.toResponse(
            listingService.listSeasonsForShow(showId, range(filters), params(filters, request), target(request)));
    }

    @GetMapping("/shows/{showId}/episodes")
    public ResponseEntity<List<Episode>> listShowEpisodes(@PathVariable("showId") long showId,
                                                          ListingFilters filters,
                                                          HttpServletRequest request) {
        return PaginatedResponses.toResponse(
            listingService.listEpisodesForShow(showId, range(filters), params(filters, request), target(request)));
    }

    @GetMapping("/seasons/{seasonId}/episodes")
    public ResponseEntity<List<Episode>> listSeasonEpisodes(@PathVariable("seasonId") long seasonId,
                                                            ListingFilters filters,
                                                            HttpServletRequest request) {
        return PaginatedResponses.toResponse(
            listingService.listEpisodesForSeason(seasonId, range(filters), params(filters, request), target(request)));
    }

    @GetMapping("/shows/{showId}/seasons/{seasonNumber}/episodes")
    public ResponseEntity<List<Episode>> listShowSeasonEpisodes(@PathVariable("showId") long showId,
                                                                @PathVariable("seasonNumber") int seasonNumber,
                                                                ListingFilters filters,
                                                                HttpServletRequest request) {
        return PaginatedResponses.toResponse(listingService.listEpisodesForShowSeason(
            showId, seasonNumber, range(filters), params(filters, request), target(request)));
    }

    @GetMapping("/shows/{showId}/characters")
    public ResponseEntity<List<ShowCharacter>> listCharacters(@PathVariable("showId") long showId,
                                                              ListingFilters filters,
                                                              HttpServletRequest request) {
        return PaginatedResponses.toResponse(
            listingService.listCharactersForShow(showId, range(filters), params(filters, request), target(request)));
    }

    @GetMapping("/episodes/{episodeId}/characters")
    public ResponseEntity<List<ShowCharacter>> listEpisodeCharacters(@PathVariable("episodeId") long episodeId,
                                                                     ListingFilters filters,
                                                                     HttpServletRequest request) {
        return PaginatedResponses.toResponse(
            listingService.listCharactersForEpisode(episodeId, range(filters), params(filters, request), target(request)));
    }

    private static DateRange range(ListingFilters filters) {
        return DateRangeParser.parse(filters.start(), filters.end());
    }

    private static PaginationParams params(ListingFilters filters, HttpServletRequest request) {
        return new PaginationParams(filters.limit(), filters.offset(), request.getParameter("page_info"));
    }

    private LinkTarget target(HttpServletRequest request) {
        return PaginatedResponses.linkTarget(request, linkBaseUrl);
    }
}
