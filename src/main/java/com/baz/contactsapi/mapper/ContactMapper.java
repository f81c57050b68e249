package com.baz.contactsapi.mapper;

import com.baz.contactsapi.model.dto.Address;
import com.baz.contactsapi.model.dto.ContactRequest;
import com.baz.contactsapi.model.dto.ContactResponse;
import com.baz.contactsapi.model.dto.Picture;
import com.baz.contactsapi.model.dto.RegisteredDate;
import com.baz.contactsapi.model.dto.Street;
import com.baz.contactsapi.model.entity.Contact;
import com.baz.contactsapi.validation.ValidationError;
import com.baz.contactsapi.validation.ValidationResult;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Converts between the nested contact document and the flat {@code contacts} row.
 */
public final class ContactMapper {

    /** Storage format for {@code registered_date}: UTC, millisecond precision. */
    public static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private ContactMapper() {}

    /**
     * Rebuilds the document form of a stored contact. Assumes the row was written through
     * {@link #documentToRow}, so the date parses and address and picture columns are complete.
     */
    public static ContactResponse rowToDocument(Contact row) {
        return new ContactResponse(
                String.valueOf(row.getId()),
                row.getFullName(),
                new Address(
                        new Street(row.getStreetNumber(), row.getStreetName()),
                        row.getCity(),
                        row.getCountry()),
                row.getEmail(),
                row.getPhone(),
                row.getCell(),
                Instant.parse(row.getRegisteredDate()),
                row.getAge(),
                new Picture(row.getPictureLarge(), row.getPictureMedium(), row.getPictureThumbnail())
        );
    }

    /**
     * Flattens a document into its row form and normalizes {@code registeredDate}.
     * Presence of the other required fields is checked by {@code ContactValidator} beforehand.
     */
    public static ValidationResult<ContactRow> documentToRow(ContactRequest contact) {
        return normalizeRegisteredDate(RegisteredDate.from(contact.registeredDate()))
                .map(registeredDate -> new ContactRow(
                        contact.fullName(),
                        contact.email(),
                        contact.phone(),
                        contact.cell(),
                        registeredDate,
                        contact.age(),
                        contact.address().street().number(),
                        contact.address().street().name(),
                        contact.address().city(),
                        contact.address().country(),
                        contact.picture().large(),
                        contact.picture().medium(),
                        contact.picture().thumbnail()));
    }

    public static ValidationResult<String> normalizeRegisteredDate(RegisteredDate registeredDate) {
        if (registeredDate instanceof RegisteredDate.Temporal temporal) {
            return ValidationResult.valid(ISO_MILLIS.format(temporal.instant()));
        }
        if (registeredDate instanceof RegisteredDate.Text text) {
            return parseInstant(text.value())
                    .map(instant -> ValidationResult.valid(ISO_MILLIS.format(instant)))
                    .orElseGet(() -> ValidationResult.<String>invalid(ValidationError.INVALID_DATE_FORMAT));
        }
        return ValidationResult.invalid(ValidationError.UNSUPPORTED_DATE_TYPE);
    }

    /**
     * Accepts ISO-8601 date-times with an offset or zone, local date-times (taken as UTC)
     * and plain dates (midnight UTC).
     */
    static Optional<Instant> parseInstant(String value) {
        String trimmed = value.trim();
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(trimmed, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return Optional.of(zoned.toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException notDateTime) {
            try {
                return Optional.of(LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant());
            } catch (DateTimeParseException notDate) {
                return Optional.empty();
            }
        }
    }
}
