package com.musicinsights.songplaywarehouse.infrastructure.mapper;

import com.musicinsights.songplaywarehouse.application.common.error.StructuralRecordException;
import com.musicinsights.songplaywarehouse.infrastructure.input.json.LogRaw;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.row.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link LogTableMapper} 단위 테스트.
 *
 * <p>NextSong 필터, users/time 중복 제거, songplays의 매칭/합성 키 발급,
 * 필수 필드 누락 시 구조 오류를 검증한다.</p>
 */
@DisplayName("log mapper 테스트")
class LogTableMapperTest {

    private final LogTableMapper mapper = new LogTableMapper(ZoneOffset.UTC);

    private final SongCatalog catalog = new SongCatalog(
            List.of(new SongRow("SOZCTXZ12AB0182364", "Setanta matins", "AR5KOSW1187FB35FF4", 0, 269.58322)),
            List.of(new ArtistRow("AR5KOSW1187FB35FF4", "Elena", "Dubai UAE", 49.80388, 15.47491))
    );

    @DisplayName("page가 NextSong이 아닌 레코드는 users/time/songplays 어디에도 나오지 않는다")
    @Test
    void derive_ignoresNonNextSongPages() {
        // given
        LogRaw play = play("26", "free", 1541990258796L);
        LogRaw home = log("99", "Home", 1541990260796L);
        LogRaw logout = log("", "Logout", 1541990270796L); // userId 비어있어도 필터 대상이라 오류 아님

        // when
        LogTableMapper.LogExtract ex = mapper.derive(List.of(home, play, logout), catalog);

        // then
        assertEquals(List.of("26"), ex.users().stream().map(UserRow::userId).toList());
        assertEquals(1, ex.time().size());
        assertEquals(1, ex.songplays().rows().size());
        assertEquals("26", ex.songplays().rows().get(0).userId());
    }

    @DisplayName("users는 user_id마다 처음 나온 레코드의 level을 유지한다")
    @Test
    void deriveUsers_firstOccurrenceWins() {
        LogRaw first = play("26", "free", 1541990258796L);
        first.firstName = "Ryan";
        first.lastName = "Smith";
        first.gender = "M";
        LogRaw upgraded = play("26", "paid", 1541990300000L);
        LogRaw other = play("80", "paid", 1541990264796L);

        List<UserRow> users = mapper.deriveUsers(List.of(first, upgraded, other));

        assertEquals(2, users.size());
        assertEquals(new UserRow("26", "Ryan", "Smith", "M", "free"), users.get(0));
        assertEquals("80", users.get(1).userId());
    }

    @DisplayName("time은 start_time마다 한 row이며 각 필드가 허용 범위 안에 있다")
    @Test
    void deriveTime_uniqueByStartTime_andFieldsInRange() {
        List<LogRaw> input = List.of(
                play("1", "free", 1541990258796L),
                play("2", "free", 1541990258900L), // 같은 초
                play("3", "free", 1541990264796L),
                play("4", "free", 1546300799999L)
        );

        List<TimeRow> rows = mapper.deriveTime(input);

        assertEquals(3, rows.size());
        Set<LocalDateTime> starts = new HashSet<>();
        for (TimeRow r : rows) {
            assertTrue(starts.add(r.startTime()));
            assertTrue(r.hour() >= 0 && r.hour() <= 23);
            assertTrue(r.day() >= 1 && r.day() <= 31);
            assertTrue(r.month() >= 1 && r.month() <= 12);
            assertTrue(r.week() >= 1 && r.week() <= 53);
        }
        assertEquals(new TimeRow(LocalDateTime.of(2018, 11, 12, 2, 37, 38), 2, 12, 46, 11, 2018), rows.get(0));
    }

    @DisplayName("songplays는 재생 레코드마다 한 row이고, id는 scan order로 증가한다")
    @Test
    void deriveSongplays_oneRowPerPlay_idsStrictlyIncreasing() {
        List<LogRaw> input = List.of(
                play("26", "free", 1541990258796L),
                log("99", "Home", 1541990260796L),
                play("80", "paid", 1541990264796L),
                play("26", "paid", 1541990258900L)
        );

        LogTableMapper.SongplayBuild out = mapper.deriveSongplays(input, SongLookup.of(catalog));

        List<SongplayRow> rows = out.rows();
        assertEquals(3, rows.size());
        assertEquals(List.of(1L, 2L, 3L), rows.stream().map(SongplayRow::songplayId).toList());
        assertEquals(List.of("26", "80", "26"), rows.stream().map(SongplayRow::userId).toList());
    }

    @DisplayName("songplays는 (song, artist, length) 매칭으로 song_id/artist_id를 채우고 year/month는 start_time에서 가져온다")
    @Test
    void deriveSongplays_resolvesIds_andCarriesYearMonth() {
        LogRaw r = play("26", "free", 1541990258796L);
        r.sessionId = 583L;
        r.location = "San Jose-Sunnyvale-Santa Clara, CA";
        r.userAgent = "Mozilla/5.0";

        SongplayRow row = mapper.deriveSongplays(List.of(r), SongLookup.of(catalog)).rows().get(0);

        assertEquals(new SongplayRow(
                1L,
                LocalDateTime.of(2018, 11, 12, 2, 37, 38),
                "26",
                "free",
                "SOZCTXZ12AB0182364",
                "AR5KOSW1187FB35FF4",
                583L,
                "San Jose-Sunnyvale-Santa Clara, CA",
                "Mozilla/5.0",
                2018,
                11
        ), row);
        assertTrue(row.resolved());
    }

    @DisplayName("users/songplays의 문자열 컬럼은 입력 값을 그대로 옮기고, 매칭만 공백을 무시한다")
    @Test
    void derive_keepsTextValuesUnchanged() {
        // given
        LogRaw r = play("26", "free", 1541990258796L);
        r.firstName = " Ryan";
        r.lastName = "";
        r.location = "";
        r.userAgent = " Mozilla/5.0 ";
        r.song = " Setanta matins ";

        // when
        LogTableMapper.LogExtract ex = mapper.derive(List.of(r), catalog);

        // then
        assertEquals(new UserRow("26", " Ryan", "", null, "free"), ex.users().get(0));
        SongplayRow row = ex.songplays().rows().get(0);
        assertEquals("", row.location());
        assertEquals(" Mozilla/5.0 ", row.userAgent());
        assertEquals("SOZCTXZ12AB0182364", row.songId());
        assertEquals(0, ex.songplays().unresolved());
    }

    @DisplayName("매칭되는 곡이 없으면 song_id/artist_id를 null로 두고 row는 유지한다")
    @Test
    void deriveSongplays_joinMiss_keepsRowWithNullIds() {
        LogRaw r = play("26", "free", 1541990258796L);
        r.song = "Unknown Song";
        r.artist = "Nobody";
        r.length = 100.0;

        LogTableMapper.SongplayBuild out = mapper.deriveSongplays(List.of(r), SongLookup.of(catalog));

        assertEquals(1, out.rows().size());
        assertEquals(1, out.unresolved());
        assertNull(out.rows().get(0).songId());
        assertNull(out.rows().get(0).artistId());
        assertFalse(out.rows().get(0).resolved());
    }

    @DisplayName("재생 레코드에 userId가 없으면 StructuralRecordException")
    @Test
    void derive_playWithoutUserId_throws() {
        LogRaw bad = play(" ", "free", 1541990258796L);

        StructuralRecordException ex = assertThrows(StructuralRecordException.class,
                () -> mapper.derive(List.of(play("26", "free", 1541990258796L), bad), catalog));
        assertEquals("userId", ex.field());
    }

    @DisplayName("재생 레코드에 ts가 없으면 StructuralRecordException")
    @Test
    void derive_playWithoutTs_throws() {
        LogRaw bad = play("26", "free", 0L);
        bad.ts = null;

        StructuralRecordException ex = assertThrows(StructuralRecordException.class,
                () -> mapper.derive(List.of(bad), catalog));
        assertEquals("ts", ex.field());
    }

    private static LogRaw play(String userId, String level, long ts) {
        LogRaw r = log(userId, LogRaw.NEXT_SONG, ts);
        r.level = level;
        r.song = "Setanta matins";
        r.artist = "Elena";
        r.length = 269.58322;
        return r;
    }

    private static LogRaw log(String userId, String page, long ts) {
        LogRaw r = new LogRaw();
        r.userId = userId;
        r.page = page;
        r.ts = ts;
        return r;
    }
}
