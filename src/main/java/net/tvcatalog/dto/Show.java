package net.tvcatalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * Show row as returned by list endpoints.
 *
 * @param id primary key
 * @param title show title
 * @param description free-text description, may be {@code null}
 * @param year premiere year, may be {@code null}
 * @param createdAt row creation time
 */
public record Show(
    long id,
    String title,
    String description,
    Integer year,
    @JsonProperty("created_at") LocalDateTime createdAt
) {
}
