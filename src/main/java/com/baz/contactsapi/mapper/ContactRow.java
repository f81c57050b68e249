package com.baz.contactsapi.mapper;

/**
 * Flattened contact matching the mapped columns of the {@code contacts} table.
 * {@code registeredDate} is already normalized to ISO-8601.
 */
public record ContactRow(
        String fullName,
        String email,
        String phone,
        String cell,
        String registeredDate,
        Integer age,
        Integer streetNumber,
        String streetName,
        String city,
        String country,
        String pictureLarge,
        String pictureMedium,
        String pictureThumbnail
) {
}
