package com.baz.contactsapi.exception;

import com.baz.contactsapi.model.dto.ContactRequest;
import com.baz.contactsapi.validation.ValidationError;

/**
 * A submitted contact failed validation or could not be converted to its row form.
 * Carries the rejected document so the error response can echo it back.
 */
public class InvalidContactException extends RuntimeException {

    private final ValidationError error;
    private final transient ContactRequest received;

    public InvalidContactException(ValidationError error, ContactRequest received) {
        super(error.message());
        this.error = error;
        this.received = received;
    }

    public ValidationError getError() {
        return error;
    }

    public ContactRequest getReceived() {
        return received;
    }
}
