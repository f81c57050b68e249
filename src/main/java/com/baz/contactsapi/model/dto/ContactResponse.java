package com.baz.contactsapi.model.dto;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.Instant;

public record ContactResponse(
        String id,
        String fullName,
        Address address,
        String email,
        String phone,
        String cell,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
        Instant registeredDate,
        Integer age,
        Picture picture
) {
}
