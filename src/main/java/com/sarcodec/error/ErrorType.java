package com.sarcodec.error;

/**
 * Types of errors that can occur while planning, reading or writing a container.
 */
public enum ErrorType {
    MALFORMED_HEADER,
    FIELD_OVERFLOW,
    INVALID_FIELD_VALUE,
    LAYOUT_ERROR,
    NOT_TRANSCODABLE,
    MALFORMED_XML,
    PAYLOAD_MISMATCH,
    INCOMPLETE_WRITE,
    CLOSED_SOURCE,
    OUT_OF_RANGE,
    UNSUPPORTED_FORMAT
}
