package com.baz.contactsapi.validation;

/**
 * Every way a submitted contact can be rejected. Conversion failures are raised while mapping
 * the document to its row form; the rest come from the required-field checks.
 */
public enum ValidationError {

    MISSING_REQUIRED_FIELDS("Missing required fields: fullName, email, address, picture", false),
    INVALID_ADDRESS("Invalid address structure. Required: address.street.number and address.street.name", false),
    INVALID_PICTURE("Invalid picture structure. Required: picture.large, picture.medium, picture.thumbnail", false),
    MISSING_REGISTERED_DATE("registeredDate is required", false),
    INVALID_DATE_FORMAT("Invalid registeredDate format. Use ISO string format: YYYY-MM-DDTHH:mm:ss.sssZ", true),
    UNSUPPORTED_DATE_TYPE("registeredDate must be a Date object or ISO date string", true);

    private final String message;
    private final boolean conversionFailure;

    ValidationError(String message, boolean conversionFailure) {
        this.message = message;
        this.conversionFailure = conversionFailure;
    }

    public String message() {
        return message;
    }

    public boolean isConversionFailure() {
        return conversionFailure;
    }
}
