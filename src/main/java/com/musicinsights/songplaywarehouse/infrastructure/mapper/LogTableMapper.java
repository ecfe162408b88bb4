package com.musicinsights.songplaywarehouse.infrastructure.mapper;

import com.musicinsights.songplaywarehouse.infrastructure.input.json.LogRaw;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row.SongplayRow;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row.TimeRow;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row.UserRow;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.musicinsights.songplaywarehouse.infrastructure.input.json.NormalizeUtils.require;
import static com.musicinsights.songplaywarehouse.infrastructure.input.json.NormalizeUtils.requireText;

/**
 * {@link LogRaw} 목록을 users/time/songplays 테이블 row로 변환한다.
 * <p>
 * 모든 변환은 {@code page == "NextSong"} 레코드만 대상으로 하며, 컬럼 값은 입력 값을 그대로 옮긴다.
 * 재생 레코드에 userId 또는 ts가 없으면
 * {@link com.musicinsights.songplaywarehouse.application.common.error.StructuralRecordException}이 발생한다.
 */
@Component
public class LogTableMapper {

    /** songplays 생성 결과(row + 매칭 실패 건수). */
    public record SongplayBuild(
            List<SongplayRow> rows,
            int unresolved
    ) {}

    /** log 파이프라인이 쓰는 세 테이블 묶음. */
    public record LogExtract(
            List<UserRow> users,
            List<TimeRow> time,
            SongplayBuild songplays
    ) {}

    /** start_time 계산 기준 timezone */
    private final ZoneId zone;

    public LogTableMapper(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * 재생(NextSong) 레코드만 남긴다.
     *
     * @param records 입력 레코드(scan order)
     * @return 재생 레코드(순서 유지)
     */
    public List<LogRaw> filterSongPlays(List<LogRaw> records) {
        return records.stream()
                .filter(LogRaw::isSongPlay)
                .toList();
    }

    /**
     * users 테이블 row를 만든다.
     * <p>
     * user_id마다 처음 나온 재생 레코드를 사용하므로, 이후 level이 바뀌어도 반영되지 않는다.
     *
     * @param records 입력 레코드(scan order)
     * @return users row
     */
    public List<UserRow> deriveUsers(List<LogRaw> records) {
        Map<String, UserRow> byUserId = new LinkedHashMap<>();
        for (LogRaw r : filterSongPlays(records)) {
            requireText(r.userId, "userId", r);
            require(r.ts, "ts", r);

            byUserId.putIfAbsent(r.userId, new UserRow(r.userId, r.firstName, r.lastName, r.gender, r.level));
        }
        return new ArrayList<>(byUserId.values());
    }

    /**
     * time 테이블 row를 만든다. start_time마다 한 row.
     *
     * @param records 입력 레코드(scan order)
     * @return time row
     */
    public List<TimeRow> deriveTime(List<LogRaw> records) {
        Map<LocalDateTime, TimeRow> byStartTime = new LinkedHashMap<>();
        for (LogRaw r : filterSongPlays(records)) {
            requireText(r.userId, "userId", r);
            LocalDateTime startTime = StartTimes.fromEpochMillis(require(r.ts, "ts", r), zone);

            byStartTime.computeIfAbsent(startTime, StartTimes::toTimeRow);
        }
        return new ArrayList<>(byStartTime.values());
    }

    /**
     * songplays 테이블 row를 만든다.
     * <p>
     * (song, artist, length)로 {@link SongLookup}을 조회해 song_id/artist_id를 채우고,
     * 찾지 못하면 null로 남긴 채 row를 만든다. songplay_id는 scan order로 발급한다.
     *
     * @param records 입력 레코드(scan order)
     * @param lookup  songs/artists 조회 테이블
     * @return songplays row + 매칭 실패 건수
     */
    public SongplayBuild deriveSongplays(List<LogRaw> records, SongLookup lookup) {
        SongplayIdSequence ids = new SongplayIdSequence();
        List<SongplayRow> rows = new ArrayList<>();

        for (LogRaw r : filterSongPlays(records)) {
            requireText(r.userId, "userId", r);
            LocalDateTime startTime = StartTimes.fromEpochMillis(require(r.ts, "ts", r), zone);

            Optional<SongLookup.Match> match = lookup.find(r.song, r.artist, r.length);

            rows.add(new SongplayRow(
                    ids.next(),
                    startTime,
                    r.userId,
                    r.level,
                    match.map(SongLookup.Match::songId).orElse(null),
                    match.map(SongLookup.Match::artistId).orElse(null),
                    r.sessionId,
                    r.location,
                    r.userAgent,
                    startTime.getYear(),
                    startTime.getMonthValue()
            ));
        }

        int unresolved = (int) rows.stream().filter(row -> !row.resolved()).count();
        return new SongplayBuild(rows, unresolved);
    }

    /**
     * users/time/songplays를 모두 만든다. 하나라도 실패하면 아무 결과도 반환하지 않는다.
     *
     * @param records 입력 레코드(scan order)
     * @param catalog song 파이프라인 결과
     * @return 세 테이블 묶음
     */
    public LogExtract derive(List<LogRaw> records, SongCatalog catalog) {
        List<LogRaw> plays = filterSongPlays(records);
        return new LogExtract(
                deriveUsers(plays),
                deriveTime(plays),
                deriveSongplays(plays, SongLookup.of(catalog))
        );
    }
}
