package com.musicinsights.songplaywarehouse.infrastructure.mapper;

/**
 * songplay_id 발급기.
 * <p>
 * 한 번의 실행 안에서 호출 순서대로 1씩 증가하는 값을 발급하므로,
 * scan order로 호출하면 id 순서가 입력 순서와 같다. 스레드 안전하지 않다.
 */
public class SongplayIdSequence {

    private long next;

    public SongplayIdSequence() {
        this(1L);
    }

    SongplayIdSequence(long start) {
        this.next = start;
    }

    /**
     * 다음 id를 발급합니다.
     *
     * @return 이전에 발급한 값보다 큰 id
     */
    public long next() {
        if (next == Long.MAX_VALUE) throw new IllegalStateException("songplay_id sequence exhausted");
        return next++;
    }
}
