package com.musicinsights.songplaywarehouse.infrastructure.mapper;

import com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row.ArtistRow;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row.SongRow;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static com.musicinsights.songplaywarehouse.infrastructure.input.json.NormalizeUtils.norm;

/**
 * (곡 제목, 아티스트 이름, 곡 길이)로 song_id/artist_id를 찾는 조회 테이블입니다.
 * <p>
 * songs와 artists를 artist_id로 조인해 만들며, 비교는 trim 이후 정확히 일치하는 경우만 인정한다.
 * 같은 key를 가진 곡이 여러 개면 song_id 순으로 먼저 오는 곡이 선택된다.
 */
public class SongLookup {

    /** 조회 key */
    record Key(String title, String artistName, Double duration) {}

    /**
     * 조회 결과.
     *
     * @param songId   곡 식별자
     * @param artistId 아티스트 식별자
     */
    public record Match(String songId, String artistId) {}

    private final Map<Key, Match> byKey;

    private SongLookup(Map<Key, Match> byKey) {
        this.byKey = byKey;
    }

    /**
     * songs/artists 차원 테이블로부터 조회 테이블을 만듭니다.
     *
     * @param catalog song 파이프라인 결과
     * @return 조회 테이블
     */
    public static SongLookup of(SongCatalog catalog) {
        Map<String, String> artistNameById = new HashMap<>();
        for (ArtistRow a : catalog.artists()) {
            artistNameById.putIfAbsent(a.artistId(), a.name());
        }

        Map<Key, Match> byKey = new LinkedHashMap<>();
        for (SongRow s : catalog.songs()) {
            String artistName = artistNameById.get(s.artistId());
            Key key = key(s.title(), artistName, s.duration());
            if (key != null) {
                byKey.putIfAbsent(key, new Match(s.songId(), s.artistId()));
            }
        }
        return new SongLookup(byKey);
    }

    /**
     * 재생 로그의 곡 정보로 song_id/artist_id를 찾습니다.
     *
     * @param title      곡 제목
     * @param artistName 아티스트 이름
     * @param duration   곡 길이(초)
     * @return 일치하는 곡이 있으면 Match, 없으면 empty
     */
    public Optional<Match> find(String title, String artistName, Double duration) {
        Key key = key(title, artistName, duration);
        return key == null ? Optional.empty() : Optional.ofNullable(byKey.get(key));
    }

    int size() {
        return byKey.size();
    }

    private static Key key(String title, String artistName, Double duration) {
        String t = norm(title);
        String a = norm(artistName);
        if (t == null || a == null || duration == null) return null;
        return new Key(t, a, duration);
    }
}
