package net.tvcatalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * Season of a show. {@code seasonNumber} is unique per show.
 */
public record Season(
    long id,
    @JsonProperty("show_id") long showId,
    @JsonProperty("season_number") int seasonNumber,
    Integer year,
    @JsonProperty("created_at") LocalDateTime createdAt
) {
}
