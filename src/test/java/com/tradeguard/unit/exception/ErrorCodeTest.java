package com.tradeguard.unit.exception;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradeguard.exception.ErrorCode;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class ErrorCodeTest {

    @Test
    @DisplayName("Every code renders under its own name with a real HTTP status")
    void codesMatchNames() {
        for (ErrorCode errorCode : ErrorCode.values()) {
            assertThat(errorCode.getCode()).isEqualTo(errorCode.name());
            assertThat(HttpStatus.resolve(errorCode.getHttpStatus())).isNotNull();
        }
    }

    @Test
    @DisplayName("Client input errors have a single 400 code")
    void singleBadRequestCode() {
        assertThat(Arrays.stream(ErrorCode.values()).filter(c -> c.getHttpStatus() == 400))
                .containsExactly(ErrorCode.VALIDATION_ERROR);
    }
}
