package net.tvcatalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * Character of a show with the optional actor playing it.
 */
public record ShowCharacter(
    long id,
    @JsonProperty("show_id") long showId,
    String name,
    @JsonProperty("actor_id") Long actorId,
    @JsonProperty("actor_name") String actorName,
    @JsonProperty("created_at") LocalDateTime createdAt
) {
}
