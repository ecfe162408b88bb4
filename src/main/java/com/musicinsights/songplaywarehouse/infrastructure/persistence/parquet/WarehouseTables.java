package com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet;

import com.musicinsights.songplaywarehouse.infrastructure.persistence.TableDefinition;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row.*;

/**
 * star schema 다섯 테이블의 컬럼/파티션 정의 모음.
 */
public final class WarehouseTables {
    private WarehouseTables() {}

    public static final TableDefinition<SongRow> SONGS = TableDefinition.<SongRow>builder("songs")
            .column("song_id", "VARCHAR", SongRow::songId)
            .column("title", "VARCHAR", SongRow::title)
            .column("artist_id", "VARCHAR", SongRow::artistId)
            .column("year", "INTEGER", SongRow::year)
            .column("duration", "DOUBLE", SongRow::duration)
            .partitionBy("year", "artist_id")
            .build();

    public static final TableDefinition<ArtistRow> ARTISTS = TableDefinition.<ArtistRow>builder("artists")
            .column("artist_id", "VARCHAR", ArtistRow::artistId)
            .column("name", "VARCHAR", ArtistRow::name)
            .column("location", "VARCHAR", ArtistRow::location)
            .column("latitude", "DOUBLE", ArtistRow::latitude)
            .column("longitude", "DOUBLE", ArtistRow::longitude)
            .build();

    public static final TableDefinition<UserRow> USERS = TableDefinition.<UserRow>builder("users")
            .column("user_id", "VARCHAR", UserRow::userId)
            .column("first_name", "VARCHAR", UserRow::firstName)
            .column("last_name", "VARCHAR", UserRow::lastName)
            .column("gender", "VARCHAR", UserRow::gender)
            .column("level", "VARCHAR", UserRow::level)
            .build();

    public static final TableDefinition<TimeRow> TIME = TableDefinition.<TimeRow>builder("time")
            .column("start_time", "TIMESTAMP", TimeRow::startTime)
            .column("hour", "INTEGER", TimeRow::hour)
            .column("day", "INTEGER", TimeRow::day)
            .column("week", "INTEGER", TimeRow::week)
            .column("month", "INTEGER", TimeRow::month)
            .column("year", "INTEGER", TimeRow::year)
            .partitionBy("year", "month")
            .build();

    public static final TableDefinition<SongplayRow> SONGPLAYS = TableDefinition.<SongplayRow>builder("songplays")
            .column("songplay_id", "BIGINT", SongplayRow::songplayId)
            .column("start_time", "TIMESTAMP", SongplayRow::startTime)
            .column("user_id", "VARCHAR", SongplayRow::userId)
            .column("level", "VARCHAR", SongplayRow::level)
            .column("song_id", "VARCHAR", SongplayRow::songId)
            .column("artist_id", "VARCHAR", SongplayRow::artistId)
            .column("session_id", "BIGINT", SongplayRow::sessionId)
            .column("location", "VARCHAR", SongplayRow::location)
            .column("user_agent", "VARCHAR", SongplayRow::userAgent)
            .column("year", "INTEGER", SongplayRow::year)
            .column("month", "INTEGER", SongplayRow::month)
            .partitionBy("year", "month")
            .build();
}
