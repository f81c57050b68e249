package com.baz.contactsapi.model.dto;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * The registration date as it arrives at the input boundary: either a date-time value or text
 * still to be parsed. Anything else is carried as {@link Unsupported} so the mapper can reject it.
 */
public sealed interface RegisteredDate
        permits RegisteredDate.Temporal, RegisteredDate.Text, RegisteredDate.Unsupported {

    static RegisteredDate from(Object raw) {
        if (raw instanceof Instant instant) {
            return new Temporal(instant);
        }
        if (raw instanceof OffsetDateTime dateTime) {
            return new Temporal(dateTime.toInstant());
        }
        if (raw instanceof ZonedDateTime dateTime) {
            return new Temporal(dateTime.toInstant());
        }
        if (raw instanceof Date date) {
            return new Temporal(date.toInstant());
        }
        if (raw instanceof CharSequence text) {
            return new Text(text.toString());
        }
        return new Unsupported(raw == null ? "null" : raw.getClass().getSimpleName());
    }

    record Temporal(Instant instant) implements RegisteredDate {
    }

    record Text(String value) implements RegisteredDate {
    }

    record Unsupported(String type) implements RegisteredDate {
    }
}
