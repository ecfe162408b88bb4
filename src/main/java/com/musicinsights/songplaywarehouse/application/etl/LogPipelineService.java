package com.musicinsights.songplaywarehouse.application.etl;

import com.musicinsights.songplaywarehouse.infrastructure.input.json.JsonRecordReader;
import com.musicinsights.songplaywarehouse.infrastructure.input.json.LogRaw;
import com.musicinsights.songplaywarehouse.infrastructure.mapper.LogTableMapper;
import com.musicinsights.songplaywarehouse.infrastructure.mapper.SongCatalog;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.TableWriteResult;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.TableWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

import static com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.WarehouseTables.*;

/**
 * log_data를 읽어 users/time/songplays 테이블을 만들고 저장하는 서비스입니다.
 * <p>
 * 흐름: 전체 레코드 수집 → NextSong 필터 → users/time/songplays 변환
 * → users → time(year, month) → songplays(year, month) 순서로 저장
 * <p>
 * 세 테이블을 모두 변환한 뒤에 저장을 시작하므로, 구조 오류가 있으면 아무 테이블도 쓰지 않습니다.
 * song/artist 매칭 실패는 row 단위로 null 처리하고 건수만 경고 로그로 남깁니다.
 */
@Service
public class LogPipelineService {

    private static final Logger log = LoggerFactory.getLogger(LogPipelineService.class);

    private final JsonRecordReader reader;
    private final LogTableMapper mapper;
    private final TableWriter writer;

    public LogPipelineService(JsonRecordReader reader, LogTableMapper mapper, TableWriter writer) {
        this.reader = reader;
        this.mapper = mapper;
        this.writer = writer;
    }

    /**
     * Log 파이프라인을 실행합니다.
     *
     * @param paths   입출력 경로
     * @param catalog Song 파이프라인이 완성한 songs/artists
     * @return write 결과
     */
    public Mono<LogPipelineResult> run(WarehousePaths paths, SongCatalog catalog) {
        return reader.readRecords(paths.inputRoot(), paths.logDataPattern(), LogRaw.class)
                .collectList()
                .flatMap(records -> {
                    LogTableMapper.LogExtract ex = mapper.derive(records, catalog);
                    int plays = ex.songplays().rows().size();
                    log.info("Log pipeline: {} records read, {} song plays", records.size(), plays);

                    if (ex.songplays().unresolved() > 0) {
                        log.warn("JOIN_MISS: {} of {} songplays have no matching song/artist",
                                ex.songplays().unresolved(), plays);
                    }

                    return write(ex, paths)
                            .map(tables -> new LogPipelineResult(records.size(), plays, ex.songplays().unresolved(), tables));
                });
    }

    private Mono<List<TableWriteResult>> write(LogTableMapper.LogExtract ex, WarehousePaths paths) {
        return Flux.concat(
                writer.write(USERS, ex.users(), paths.tablePath(USERS), paths.writeMode()),
                writer.write(TIME, ex.time(), paths.tablePath(TIME), paths.writeMode()),
                writer.write(SONGPLAYS, ex.songplays().rows(), paths.tablePath(SONGPLAYS), paths.writeMode())
        ).collectList();
    }
}
