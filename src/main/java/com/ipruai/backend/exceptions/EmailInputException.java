package com.ipruai.backend.exceptions;

/**
 * Thrown when an email cannot be parsed at all because both subject and body are empty.
 */
public class EmailInputException extends BadRequestException {

    public EmailInputException(String message) {
        super(message);
    }
}
