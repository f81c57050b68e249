package com.baz.contactsapi.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Success wrapper shared by the contact endpoints: {@code {success, data, count, message}}
 * with absent parts omitted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiEnvelope<T>(
        boolean success,
        T data,
        Integer count,
        String message
) {

    public static <T> ApiEnvelope<T> of(T data) {
        return new ApiEnvelope<>(true, data, null, null);
    }

    public static <T> ApiEnvelope<List<T>> ofList(List<T> data) {
        return new ApiEnvelope<>(true, data, data.size(), null);
    }

    public static <T> ApiEnvelope<T> of(T data, String message) {
        return new ApiEnvelope<>(true, data, null, message);
    }

    public static ApiEnvelope<Void> message(String message) {
        return new ApiEnvelope<>(true, null, null, message);
    }
}
