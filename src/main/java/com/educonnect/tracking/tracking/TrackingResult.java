package com.educonnect.tracking.tracking;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

public record TrackingResult<T>(boolean success,
                                String message,
                                @JsonInclude(JsonInclude.Include.NON_NULL) T data,
                                @JsonIgnore Failure failure) {

    public enum Failure {
        VALIDATION,
        NOT_FOUND,
        STORE
    }

    public static <T> TrackingResult<T> ok(String message, T data) {
        return new TrackingResult<>(true, message, data, null);
    }

    public static <T> TrackingResult<T> failed(Failure failure, String message) {
        return new TrackingResult<>(false, message, null, failure);
    }
}
