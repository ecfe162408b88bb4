package com.musicinsights.songplaywarehouse.infrastructure.input.json;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.databind.DatabindException;
import tools.jackson.databind.MappingIterator;
import tools.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.stream.Stream;

/**
 * 루트 디렉터리 아래에서 glob 패턴에 맞는 JSON 파일들을 찾아 레코드 단위로 읽는 리더입니다.
 * <p>
 * 파일 하나에 JSON 객체가 한 개(song_data)든 한 줄에 한 개씩(log_data, NDJSON)이든
 * 같은 방식으로 읽습니다. 파일은 경로 사전순으로, 파일 안에서는 등장 순서대로 방출하므로
 * 같은 입력에 대해 항상 같은 순서(scan order)를 보장합니다.
 * <p>
 * 리소스 생성/사용/해제는 {@link Flux#using}으로 관리하고,
 * 파일 I/O는 blocking 작업이므로 {@link Schedulers#boundedElastic()}에서 실행합니다.
 */
@Component
public class JsonRecordReader {

    private static final Logger log = LoggerFactory.getLogger(JsonRecordReader.class);

    /** JSON → 원본 DTO 변환용 매퍼 */
    private final ObjectMapper mapper;

    public JsonRecordReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * {@code root} 아래에서 {@code pattern}(root 기준 상대 glob)에 맞는 파일의 레코드를 순서대로 반환합니다.
     *
     * @param root    검색 루트 디렉터리
     * @param pattern root 기준 glob 패턴 (예: song_data 아래 세 단계 디렉터리의 {@code *.json})
     * @param type    레코드 DTO 타입
     * @param <T>     레코드 타입
     * @return 모든 파일의 레코드를 scan order로 방출하는 Flux.
     *         파일을 읽지 못하면 {@link UncheckedIOException}(또는 루트가 없을 때의 원래 예외),
     *         JSON이 깨졌으면 {@link IllegalStateException} 에러를 방출한다.
     */
    public <T> Flux<T> readRecords(Path root, String pattern, Class<T> type) {
        return listFiles(root, pattern)
                .concatMap(file -> readFile(file, type))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * 패턴에 맞는 파일 경로를 사전순으로 반환합니다.
     *
     * @param root    검색 루트
     * @param pattern root 기준 glob 패턴
     * @return 정렬된 파일 경로 Flux
     */
    public Flux<Path> listFiles(Path root, String pattern) {
        PathMatcher matcher = root.getFileSystem().getPathMatcher("glob:" + pattern);
        return Flux.using(
                () -> Files.walk(root),
                paths -> Flux.fromStream(paths
                        .filter(Files::isRegularFile)
                        .filter(p -> matcher.matches(root.relativize(p)))
                        .sorted()),
                Stream::close
        );
    }

    private <T> Flux<T> readFile(Path file, Class<T> type) {
        return Flux.using(
                        () -> Files.newBufferedReader(file, StandardCharsets.UTF_8),
                        br -> {
                            MappingIterator<T> it = mapper.readerFor(type).readValues(br);
                            return Flux.fromIterable(() -> it);
                        },
                        br -> close(br, file)
                )
                .onErrorMap(e -> hasCause(e, IOException.class),
                        e -> new UncheckedIOException("read error: " + file, findCause(e, IOException.class)))
                .onErrorMap(e -> hasCause(e, StreamReadException.class) || hasCause(e, DatabindException.class),
                        e -> new IllegalStateException("JSON parse error: " + file, e));
    }

    // Jackson은 I/O 실패(잘못된 UTF-8 포함)를 JacksonIOException으로 감싸므로 원인 IOException을 먼저 확인한다
    private static boolean hasCause(Throwable e, Class<? extends Throwable> type) {
        return findCause(e, type) != null;
    }

    private static <X extends Throwable> X findCause(Throwable e, Class<X> type) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (type.isInstance(t)) return type.cast(t);
        }
        return null;
    }

    private static void close(BufferedReader br, Path file) {
        try {
            br.close();
        } catch (IOException e) {
            log.warn("Failed to close {}: {}", file, e.getMessage());
        }
    }
}
