package com.musicinsights.songplaywarehouse.bootstrap;

import com.musicinsights.songplaywarehouse.application.etl.LogPipelineService;
import com.musicinsights.songplaywarehouse.application.etl.SongPipelineService;
import com.musicinsights.songplaywarehouse.application.etl.WarehousePaths;
import com.musicinsights.songplaywarehouse.application.common.error.EtlException;
import com.musicinsights.songplaywarehouse.infrastructure.persistence.TableWriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * song_data/log_data를 star schema 테이블로 적재하는 {@link CommandLineRunner}.
 *
 * <p>Profile이 {@code etl}일 때만 활성화된다.</p>
 * <p>흐름: Song 파이프라인(songs, artists) 완료 → Log 파이프라인(users, time, songplays) → 요약 로그</p>
 */
@Component
@Profile("etl")
public class WarehouseEtlRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(WarehouseEtlRunner.class);

    private final SongPipelineService songPipeline;
    private final LogPipelineService logPipeline;
    private final WarehousePaths paths;

    public WarehouseEtlRunner(
            SongPipelineService songPipeline,
            LogPipelineService logPipeline,
            WarehousePaths paths
    ) {
        this.songPipeline = songPipeline;
        this.logPipeline = logPipeline;
        this.paths = paths;
    }

    /**
     * 두 파이프라인을 순서대로 실행하고, 끝날 때까지 {@code block()}으로 대기합니다.
     * <p>
     * 어느 단계든 실패하면 예외가 그대로 전파되어 애플리케이션이 실패로 종료됩니다.
     *
     * @param args 사용하지 않음
     */
    @Override
    public void run(String... args) {
        log.info("Warehouse ETL started: input={}, output={}, mode={}",
                paths.inputRoot(), paths.outputRoot(), paths.writeMode());

        List<TableWriteResult> written = songPipeline.run(paths)
                .flatMap(song -> logPipeline.run(paths, song.catalog())
                        .map(logResult -> {
                            List<TableWriteResult> all = new ArrayList<>(song.tables());
                            all.addAll(logResult.tables());
                            return all;
                        }))
                .doOnError(WarehouseEtlRunner::logFailure)
                .block();

        if (written != null) {
            written.forEach(t -> log.info("  {} -> {} rows ({})", t.table(), t.rows(), t.path()));
        }
        log.info("Warehouse ETL finished");
    }

    private static void logFailure(Throwable e) {
        if (e instanceof EtlException etl) {
            log.error("Warehouse ETL failed [{}]: {}", etl.code(), etl.getMessage());
        } else {
            log.error("Warehouse ETL failed: {}", e.toString());
        }
    }
}
