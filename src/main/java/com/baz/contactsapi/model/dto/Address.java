package com.baz.contactsapi.model.dto;

public record Address(
        Street street,
        String city,
        String country
) {
}
