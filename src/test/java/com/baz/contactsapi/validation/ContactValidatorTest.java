package com.baz.contactsapi.validation;

import com.baz.contactsapi.model.dto.Address;
import com.baz.contactsapi.model.dto.ContactRequest;
import com.baz.contactsapi.model.dto.Picture;
import com.baz.contactsapi.model.dto.Street;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContactValidatorTest {

    private static final Address ADDRESS = new Address(new Street(1, "Elm St"), null, null);
    private static final Picture PICTURE = new Picture("l", "m", "t");

    @Test
    void validate_completeContact_isValid() {
        var request = new ContactRequest("Ann", ADDRESS, "ann@example.com", null, null,
                "2020-01-01T00:00:00.000Z", null, PICTURE);

        assertTrue(ContactValidator.validate(request).isValid());
    }

    @Test
    void validate_nullBody_isMissingRequiredFields() {
        assertEquals(ValidationError.MISSING_REQUIRED_FIELDS, errorOf(null));
    }

    @Test
    void validate_blankFullName_isMissingRequiredFields() {
        var request = new ContactRequest("  ", ADDRESS, "ann@example.com", null, null,
                "2020-01-01", null, PICTURE);

        assertEquals(ValidationError.MISSING_REQUIRED_FIELDS, errorOf(request));
    }

    @Test
    void validate_missingPicture_isMissingRequiredFields() {
        var request = new ContactRequest("Ann", ADDRESS, "ann@example.com", null, null,
                "2020-01-01", null, null);

        assertEquals(ValidationError.MISSING_REQUIRED_FIELDS, errorOf(request));
    }

    @Test
    void validate_missingStreet_isInvalidAddress() {
        var request = new ContactRequest("Ann", new Address(null, "Paris", "France"), "ann@example.com",
                null, null, "2020-01-01", null, PICTURE);

        assertEquals(ValidationError.INVALID_ADDRESS, errorOf(request));
    }

    @Test
    void validate_missingStreetNumber_isInvalidAddress() {
        var request = new ContactRequest("Ann", new Address(new Street(null, "Elm St"), null, null),
                "ann@example.com", null, null, "2020-01-01", null, PICTURE);

        assertEquals(ValidationError.INVALID_ADDRESS, errorOf(request));
    }

    @Test
    void validate_missingThumbnail_isInvalidPicture() {
        var request = new ContactRequest("Ann", ADDRESS, "ann@example.com", null, null,
                "2020-01-01", null, new Picture("l", "m", null));

        assertEquals(ValidationError.INVALID_PICTURE, errorOf(request));
    }

    @Test
    void validate_missingRegisteredDate_isReportedLast() {
        var request = new ContactRequest("Ann", ADDRESS, "ann@example.com", null, null,
                null, null, PICTURE);

        assertEquals(ValidationError.MISSING_REGISTERED_DATE, errorOf(request));
    }

    @Test
    void validate_emptyRegisteredDate_isMissing() {
        var request = new ContactRequest("Ann", ADDRESS, "ann@example.com", null, null,
                "", null, PICTURE);

        assertEquals(ValidationError.MISSING_REGISTERED_DATE, errorOf(request));
    }

    @Test
    void validate_zeroStreetNumber_isInvalidAddress() {
        var request = new ContactRequest("Ann", new Address(new Street(0, "Elm St"), null, null),
                "ann@example.com", null, null, "2020-01-01", null, PICTURE);

        assertEquals(ValidationError.INVALID_ADDRESS, errorOf(request));
    }

    @Test
    void validate_falseRegisteredDate_isMissing() {
        var request = new ContactRequest("Ann", ADDRESS, "ann@example.com", null, null,
                false, null, PICTURE);

        assertEquals(ValidationError.MISSING_REGISTERED_DATE, errorOf(request));
    }

    @Test
    void validate_zeroRegisteredDate_isMissing() {
        var request = new ContactRequest("Ann", ADDRESS, "ann@example.com", null, null,
                0, null, PICTURE);

        assertEquals(ValidationError.MISSING_REGISTERED_DATE, errorOf(request));
    }

    @Test
    void validate_severalProblems_firstCheckWins() {
        var request = new ContactRequest("Ann", new Address(null, null, null), "ann@example.com",
                null, null, null, null, new Picture(null, null, null));

        assertEquals(ValidationError.INVALID_ADDRESS, errorOf(request));
    }

    private static ValidationError errorOf(ContactRequest request) {
        ValidationResult<ContactRequest> result = ContactValidator.validate(request);
        assertFalse(result.isValid());
        return ((ValidationResult.Invalid<ContactRequest>) result).error();
    }
}
