package com.musicinsights.songplaywarehouse.infrastructure.mapper;

import com.musicinsights.songplaywarehouse.infrastructure.input.json.SongRaw;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row.ArtistRow;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row.SongRow;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.musicinsights.songplaywarehouse.infrastructure.input.json.NormalizeUtils.requireText;

/**
 * {@link SongRaw} 목록을 songs/artists 차원 테이블 row로 변환한다.
 * <p>
 * 컬럼 값은 입력 레코드 값을 그대로 옮긴다.
 * <p>
 * 모든 레코드는 song_id/artist_id가 있어야 하며, 하나라도 없으면
 * {@link com.musicinsights.songplaywarehouse.application.common.error.StructuralRecordException}이 발생한다.
 */
@Component
public class SongTableMapper {

    /**
     * songs 테이블 row를 만든다.
     * <p>
     * song_id로 stable 정렬한 뒤 song_id마다 첫 번째 row만 남긴다.
     *
     * @param records 입력 레코드(scan order)
     * @return song_id 순 songs row
     */
    public List<SongRow> deriveSongs(List<SongRaw> records) {
        List<SongRow> projected = new ArrayList<>(records.size());
        for (SongRaw r : records) {
            requireText(r.songId, "song_id", r);
            requireText(r.artistId, "artist_id", r);

            projected.add(new SongRow(r.songId, r.title, r.artistId, r.year, r.duration));
        }

        // List.sort는 stable이라 같은 song_id 안에서는 scan order가 유지된다
        projected.sort(Comparator.comparing(SongRow::songId));

        Map<String, SongRow> bySongId = new LinkedHashMap<>();
        for (SongRow row : projected) {
            bySongId.putIfAbsent(row.songId(), row);
        }
        return new ArrayList<>(bySongId.values());
    }

    /**
     * artists 테이블 row를 만든다.
     * <p>
     * artist_id마다 scan order로 처음 나온 레코드를 사용한다.
     *
     * @param records 입력 레코드(scan order)
     * @return artists row
     */
    public List<ArtistRow> deriveArtists(List<SongRaw> records) {
        Map<String, ArtistRow> byArtistId = new LinkedHashMap<>();
        for (SongRaw r : records) {
            requireText(r.songId, "song_id", r);
            requireText(r.artistId, "artist_id", r);

            byArtistId.putIfAbsent(r.artistId, new ArtistRow(
                    r.artistId,
                    r.artistName,
                    r.artistLocation,
                    r.artistLatitude,
                    r.artistLongitude
            ));
        }
        return new ArrayList<>(byArtistId.values());
    }

    /**
     * songs/artists를 한 번에 만든다.
     *
     * @param records 입력 레코드(scan order)
     * @return 두 차원 테이블 묶음
     */
    public SongCatalog derive(List<SongRaw> records) {
        return new SongCatalog(deriveSongs(records), deriveArtists(records));
    }
}
