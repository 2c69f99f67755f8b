package net.tvcatalog.repository;

import net.tvcatalog.dto.Actor;
import net.tvcatalog.dto.Episode;
import net.tvcatalog.dto.Season;
import net.tvcatalog.dto.Show;
import net.tvcatalog.dto.ShowCharacter;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;

import static net.tvcatalog.repository.CatalogResultSetSupport.getIntOrNull;
import static net.tvcatalog.repository.CatalogResultSetSupport.getLocalDateOrNull;
import static net.tvcatalog.repository.CatalogResultSetSupport.getLocalDateTimeOrNull;
import static net.tvcatalog.repository.CatalogResultSetSupport.getLongOrNull;

final class CatalogRowMappers {

    static final RowMapper<Show> SHOW = CatalogRowMappers::mapShow;
    static final RowMapper<Actor> ACTOR = CatalogRowMappers::mapActor;
    static final RowMapper<Season> SEASON = CatalogRowMappers::mapSeason;
    static final RowMapper<Episode> EPISODE = CatalogRowMappers::mapEpisode;
    static final RowMapper<ShowCharacter> CHARACTER = CatalogRowMappers::mapCharacter;

    private CatalogRowMappers() {
    }

    private static Show mapShow(ResultSet rs, int rowNum) throws SQLException {
        return new Show(
            rs.getLong("id"),
            rs.getString("title"),
            rs.getString("description"),
            getIntOrNull(rs, "year"),
            getLocalDateTimeOrNull(rs, "created_at")
        );
    }

    private static Actor mapActor(ResultSet rs, int rowNum) throws SQLException {
        return new Actor(
            rs.getLong("id"),
            rs.getString("name"),
            getLocalDateTimeOrNull(rs, "created_at")
        );
    }

    private static Season mapSeason(ResultSet rs, int rowNum) throws SQLException {
        return new Season(
            rs.getLong("id"),
            rs.getLong("show_id"),
            rs.getInt("season_number"),
            getIntOrNull(rs, "year"),
            getLocalDateTimeOrNull(rs, "created_at")
        );
    }

    private static Episode mapEpisode(ResultSet rs, int rowNum) throws SQLException {
        return new Episode(
            rs.getLong("id"),
            rs.getLong("season_id"),
            rs.getLong("show_id"),
            rs.getInt("season_number"),
            getLocalDateOrNull(rs, "air_date"),
            rs.getString("title"),
            rs.getString("description"),
            getLocalDateTimeOrNull(rs, "created_at")
        );
    }

    private static ShowCharacter mapCharacter(ResultSet rs, int rowNum) throws SQLException {
        return new ShowCharacter(
            rs.getLong("id"),
            rs.getLong("show_id"),
            rs.getString("name"),
            getLongOrNull(rs, "actor_id"),
            rs.getString("actor_name"),
            getLocalDateTimeOrNull(rs, "created_at")
        );
    }
}
