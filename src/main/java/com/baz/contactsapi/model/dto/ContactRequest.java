package com.baz.contactsapi.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Contact document as submitted by clients on create and update.
 * <p>
 * {@code registeredDate} is kept untyped: JSON clients send a string, Java callers may pass a
 * {@link java.time.Instant}. It is resolved into a {@link RegisteredDate} by the mapper.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContactRequest(
        String fullName,
        Address address,
        String email,
        String phone,
        String cell,
        Object registeredDate,
        Integer age,
        Picture picture
) {
}
