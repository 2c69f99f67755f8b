package net.tvcatalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Episode joined with its season so listings can report the show and season number.
 *
 * @param id primary key
 * @param seasonId owning season
 * @param showId show of the owning season
 * @param seasonNumber number of the owning season
 * @param airDate first air date, may be {@code null}
 * @param title episode title, unique per season
 * @param description free-text description, may be {@code null}
 * @param createdAt row creation time
 */
public record Episode(
    long id,
    @JsonProperty("season_id") long seasonId,
    @JsonProperty("show_id") long showId,
    @JsonProperty("season_number") int seasonNumber,
    @JsonProperty("air_date") LocalDate airDate,
    String title,
    String description,
    @JsonProperty("created_at") LocalDateTime createdAt
) {
}
