package com.musicinsights.songplaywarehouse.infrastructure.input.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * song_data 파일 한 개(= 곡 메타데이터 레코드 한 건)를 매핑하기 위한 원본 DTO입니다.
 * <p>
 * 원본 필드명을 {@link JsonProperty}로 그대로 매핑하고,
 * 추가 컬럼에 대비해 {@link JsonIgnoreProperties#ignoreUnknown()}를 사용합니다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SongRaw {

    /** 곡 식별자 (예: "SOUPIRU12A6D4FA1E1") */
    @JsonProperty("song_id")
    public String songId;

    /** 곡 제목 */
    @JsonProperty("title")
    public String title;

    /** 아티스트 식별자 */
    @JsonProperty("artist_id")
    public String artistId;

    /** 아티스트 이름 */
    @JsonProperty("artist_name")
    public String artistName;

    /** 아티스트 활동 지역(빈 문자열일 수 있음) */
    @JsonProperty("artist_location")
    public String artistLocation;

    @JsonProperty("artist_latitude")
    public Double artistLatitude;

    @JsonProperty("artist_longitude")
    public Double artistLongitude;

    /** 발매 연도 (모르면 0) */
    @JsonProperty("year")
    public Integer year;

    /** 곡 길이(초) */
    @JsonProperty("duration")
    public Double duration;

    @JsonProperty("num_songs")
    public Integer numSongs;

    @Override
    public String toString() {
        return "SongRaw{songId=" + songId + ", artistId=" + artistId + ", title=" + title + "}";
    }
}
