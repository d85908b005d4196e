package com.bitaware.error;

/**
 * Types of errors that can occur when declaring flag sets or constructing bit-aware values.
 */
public enum ErrorType {
    INVALID_FLAG_DEFINITION,
    TYPE_MISMATCH,
    NON_POSITIVE_VALUE,
    VALUE_OUT_OF_RANGE,
    FLAG_NOT_FOUND
}
