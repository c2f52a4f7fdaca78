package com.community.movierating.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Envelope for every REST response.
 *
 * @param <T> payload type
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommonResponse<T> implements Serializable {

    // 200, 202, 400, 404, 409, 500, 503
    private Integer code;

    private String message;

    private T data;

    // epoch millis
    private Long timestamp;

    public static <T> CommonResponse<T> success(T data) {
        return of(200, "OK", data);
    }

    public static <T> CommonResponse<T> error(Integer code, String message) {
        return of(code, message, null);
    }

    public static <T> CommonResponse<T> of(Integer code, String message, T data) {
        return new CommonResponse<>(code, message, data, Instant.now().toEpochMilli());
    }
}
