package com.bitaware.error;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BitAwareExceptionTest {

    @Test
    void shouldCarryErrorType() {
        var cause = new IllegalStateException("boom");
        var exception = new BitAwareException(ErrorType.FLAG_NOT_FOUND, "9 is not a valid Mode", cause);

        assertThat(exception.getErrorType()).isEqualTo(ErrorType.FLAG_NOT_FOUND);
        assertThat(exception.getMessage()).isEqualTo("9 is not a valid Mode");
        assertThat(exception.getCause()).isSameAs(cause);
    }

    @Test
    void shouldIncludeTypeInToString() {
        var exception = new BitAwareException(ErrorType.NON_POSITIVE_VALUE, "value must be positive: 0");

        assertThat(exception.toString())
                .isEqualTo("BitAwareException{type=NON_POSITIVE_VALUE, message='value must be positive: 0'}");
    }
}
