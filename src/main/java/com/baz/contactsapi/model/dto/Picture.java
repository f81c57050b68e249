package com.baz.contactsapi.model.dto;

public record Picture(
        String large,
        String medium,
        String thumbnail
) {
}
