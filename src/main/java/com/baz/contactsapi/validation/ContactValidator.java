package com.baz.contactsapi.validation;

import com.baz.contactsapi.model.dto.Address;
import com.baz.contactsapi.model.dto.ContactRequest;
import com.baz.contactsapi.model.dto.Picture;
import com.baz.contactsapi.model.dto.Street;
import org.springframework.util.StringUtils;

/**
 * Required-field checks for submitted contacts, applied in a fixed order so the first
 * failure is the one reported. Zero, {@code false} and blank text count as absent.
 */
public final class ContactValidator {

    private ContactValidator() {}

    public static ValidationResult<ContactRequest> validate(ContactRequest request) {
        if (request == null
                || !StringUtils.hasText(request.fullName())
                || !StringUtils.hasText(request.email())
                || request.address() == null
                || request.picture() == null) {
            return ValidationResult.invalid(ValidationError.MISSING_REQUIRED_FIELDS);
        }
        if (!hasStreet(request.address())) {
            return ValidationResult.invalid(ValidationError.INVALID_ADDRESS);
        }
        if (!hasAllSizes(request.picture())) {
            return ValidationResult.invalid(ValidationError.INVALID_PICTURE);
        }
        if (!isPresent(request.registeredDate())) {
            return ValidationResult.invalid(ValidationError.MISSING_REGISTERED_DATE);
        }
        return ValidationResult.valid(request);
    }

    private static boolean hasStreet(Address address) {
        Street street = address.street();
        return street != null && isPresent(street.number()) && StringUtils.hasText(street.name());
    }

    private static boolean hasAllSizes(Picture picture) {
        return StringUtils.hasText(picture.large())
                && StringUtils.hasText(picture.medium())
                && StringUtils.hasText(picture.thumbnail());
    }

    private static boolean isPresent(Object value) {
        if (value instanceof CharSequence text) {
            return StringUtils.hasText(text);
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            double amount = number.doubleValue();
            return amount != 0 && !Double.isNaN(amount);
        }
        return value != null;
    }
}
