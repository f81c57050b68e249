package com.baz.contactsapi.model.dto;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.Instant;

public record HealthResponse(
        boolean success,
        String message,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
        Instant timestamp
) {
}
