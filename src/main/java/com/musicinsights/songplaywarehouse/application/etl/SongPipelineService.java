package com.musicinsights.songplaywarehouse.application.etl;

import com.musicinsights.songplaywarehouse.infrastructure.input.json.JsonRecordReader;
import com.musicinsights.songplaywarehouse.infrastructure.input.json.SongRaw;
import com.musicinsights.songplaywarehouse.infrastructure.mapper.SongCatalog;
import com.musicinsights.songplaywarehouse.infrastructure.mapper.SongTableMapper;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.TableWriteResult;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.TableWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

import static com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.WarehouseTables.ARTISTS;
import static com.musicinsights.songplaywarehouse.infrastructure.persistence.parquet.WarehouseTables.SONGS;

/**
 * song_data를 읽어 songs/artists 차원 테이블을 만들고 저장하는 서비스입니다.
 * <p>
 * 흐름: 전체 레코드 수집 → songs/artists 변환 → songs(year, artist_id 파티션) → artists 순서로 저장
 * <p>
 * 변환 중 {@link com.musicinsights.songplaywarehouse.application.common.error.StructuralRecordException}이
 * 발생하면 어떤 테이블도 쓰지 않고 에러로 종료합니다.
 */
@Service
public class SongPipelineService {

    private static final Logger log = LoggerFactory.getLogger(SongPipelineService.class);

    private final JsonRecordReader reader;
    private final SongTableMapper mapper;
    private final TableWriter writer;

    public SongPipelineService(JsonRecordReader reader, SongTableMapper mapper, TableWriter writer) {
        this.reader = reader;
        this.mapper = mapper;
        this.writer = writer;
    }

    /**
     * Song 파이프라인을 실행합니다.
     *
     * @param paths 입출력 경로
     * @return 완성된 차원 테이블과 write 결과
     */
    public Mono<SongPipelineResult> run(WarehousePaths paths) {
        return reader.readRecords(paths.inputRoot(), paths.songDataPattern(), SongRaw.class)
                .collectList()
                .flatMap(records -> {
                    log.info("Song pipeline: {} records read from {}", records.size(), paths.inputRoot());
                    SongCatalog catalog = mapper.derive(records);
                    return write(catalog, paths)
                            .map(tables -> new SongPipelineResult(records.size(), catalog, tables));
                });
    }

    private Mono<List<TableWriteResult>> write(
            SongCatalog catalog,
            WarehousePaths paths
    ) {
        return Flux.concat(
                writer.write(SONGS, catalog.songs(), paths.tablePath(SONGS), paths.writeMode()),
                writer.write(ARTISTS, catalog.artists(), paths.tablePath(ARTISTS), paths.writeMode())
        ).collectList();
    }
}
