package net.tvcatalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record Actor(
    long id,
    String name,
    @JsonProperty("created_at") LocalDateTime createdAt
) {
}
