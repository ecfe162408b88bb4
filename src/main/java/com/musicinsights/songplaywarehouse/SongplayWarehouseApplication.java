package com.musicinsights.songplaywarehouse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * song/log JSON 원본을 star schema Parquet 테이블로 적재하는 배치 애플리케이션 진입점.
 *
 * <p>실제 적재는 {@code etl} profile에서 활성화되는
 * {@link com.musicinsights.songplaywarehouse.bootstrap.WarehouseEtlRunner}가 수행한다.</p>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SongplayWarehouseApplication {

    public static void main(String[] args) {
        SpringApplication.run(SongplayWarehouseApplication.class, args);
    }
}
