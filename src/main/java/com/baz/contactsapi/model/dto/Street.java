package com.baz.contactsapi.model.dto;

public record Street(
        Integer number,
        String name
) {
}
