package com.musicinsights.songplaywarehouse.infrastructure.config;

import com.musicinsights.songplaywarehouse.application.etl.WarehousePaths;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.nio.file.Path;
import java.time.ZoneId;

/**
 * 파이프라인 실행 컨텍스트를 구성하는 설정 클래스입니다.
 * <p>
 * {@link WarehouseProperties}로부터 입출력 경로({@link WarehousePaths})와
 * start_time 변환용 {@link ZoneId}를 만들어 Bean으로 등록합니다.
 */
@Configuration
public class WarehouseConfig {

    /**
     * 설정값으로부터 입력 패턴/출력 경로 묶음을 생성합니다.
     *
     * @param props warehouse 설정
     * @return 파이프라인 경로 묶음
     */
    @Bean
    public WarehousePaths warehousePaths(WarehouseProperties props) {
        return new WarehousePaths(
                Path.of(props.input().root()),
                props.input().songDataPattern(),
                props.input().logDataPattern(),
                Path.of(props.output().root()),
                props.output().writeMode()
        );
    }

    /**
     * start_time 계산에 사용할 timezone.
     *
     * @param props warehouse 설정
     * @return 설정된 ZoneId (기본 UTC)
     */
    @Bean
    public ZoneId warehouseZone(WarehouseProperties props) {
        return ZoneId.of(props.timeZone());
    }

    /** Jackson auto-configuration이 없을 때 사용하는 기본 JSON 매퍼 */
    @Bean
    @ConditionalOnMissingBean(ObjectMapper.class)
    public JsonMapper jsonMapper() {
        return JsonMapper.builder().build();
    }
}
