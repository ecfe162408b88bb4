package com.musicinsights.songplaywarehouse.infrastructure.mapper;

import com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row.ArtistRow;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row.SongRow;

import java.util.List;

/**
 * Song 파이프라인이 완성한 songs/artists 차원 테이블 묶음.
 * <p>
 * Log 파이프라인의 songplays 매칭({@link SongLookup})에 사용된다.
 *
 * @param songs   songs 테이블 row (song_id 순)
 * @param artists artists 테이블 row
 */
public record SongCatalog(List<SongRow> songs, List<ArtistRow> artists) {

    public SongCatalog {
        songs = List.copyOf(songs);
        artists = List.copyOf(artists);
    }
}
