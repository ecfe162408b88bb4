package com.musicinsights.songplaywarehouse.infrastructure.input.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * log_data NDJSON의 "한 줄(= 앱 사용 이벤트 한 건)"을 매핑하기 위한 원본 DTO입니다.
 * <p>
 * {@code page}로 이벤트 종류를 구분하며, 재생 이벤트({@code NextSong})에만
 * song/artist/length가 채워져 있습니다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LogRaw {

    /** 재생 이벤트를 나타내는 page 값 */
    public static final String NEXT_SONG = "NextSong";

    /** 재생한 곡의 아티스트 이름 */
    @JsonProperty("artist")
    public String artist;

    /** 로그인 상태("Logged In"/"Logged Out") */
    @JsonProperty("auth")
    public String auth;

    @JsonProperty("firstName")
    public String firstName;

    /** 성별("M"/"F") */
    @JsonProperty("gender")
    public String gender;

    @JsonProperty("itemInSession")
    public Integer itemInSession;

    @JsonProperty("lastName")
    public String lastName;

    /** 재생한 곡 길이(초) */
    @JsonProperty("length")
    public Double length;

    /** 요금제("free"/"paid") */
    @JsonProperty("level")
    public String level;

    @JsonProperty("location")
    public String location;

    @JsonProperty("method")
    public String method;

    /** 이벤트 종류 (예: "NextSong", "Home") */
    @JsonProperty("page")
    public String page;

    @JsonProperty("registration")
    public Double registration;

    @JsonProperty("sessionId")
    public Long sessionId;

    /** 재생한 곡 제목 */
    @JsonProperty("song")
    public String song;

    @JsonProperty("status")
    public Integer status;

    /** 이벤트 발생 시각(epoch milliseconds) */
    @JsonProperty("ts")
    public Long ts;

    @JsonProperty("userAgent")
    public String userAgent;

    /** 사용자 식별자. 로그아웃 이벤트에서는 빈 문자열 */
    @JsonProperty("userId")
    public String userId;

    /**
     * 재생(NextSong) 이벤트인지 여부.
     *
     * @return page가 정확히 "NextSong"이면 true
     */
    public boolean isSongPlay() {
        return NEXT_SONG.equals(page);
    }

    @Override
    public String toString() {
        return "LogRaw{userId=" + userId + ", ts=" + ts + ", page=" + page + ", song=" + song + "}";
    }
}
