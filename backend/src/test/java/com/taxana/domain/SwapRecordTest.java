package com.taxana.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SwapRecordTest {

    private static final SwapRecord VALID = SwapRecord.builder()
            .signature("5h3k")
            .timestamp(Instant.parse("2025-04-01T09:30:00Z"))
            .fromToken("So11111111111111111111111111111111111111112")
            .fromAmount(new BigDecimal("1.5"))
            .toToken("JUPyiwrYJFskUPiHa7hkeR8VUtAeFoSYbKedZNsDvCN")
            .toAmount(new BigDecimal("310"))
            .build();

    @Test
    @DisplayName("complete record passes; zero amounts are allowed")
    void validRecord() {
        assertThatCode(VALID::validate).doesNotThrowAnyException();
        assertThatCode(() -> VALID.toBuilder().toAmount(BigDecimal.ZERO).build().validate())
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("missing signature")
    void missingSignature() {
        assertThatThrownBy(() -> VALID.toBuilder().signature(" ").build().validate())
                .isInstanceOf(InvalidSwapRecordException.class)
                .hasFieldOrPropertyWithValue("reason", InvalidSwapRecordException.MISSING_SIGNATURE)
                .hasFieldOrPropertyWithValue("signature", null);
    }

    @Test
    @DisplayName("missing timestamp")
    void missingTimestamp() {
        assertThatThrownBy(() -> VALID.toBuilder().timestamp(null).build().validate())
                .hasFieldOrPropertyWithValue("reason", InvalidSwapRecordException.MISSING_TIMESTAMP)
                .hasFieldOrPropertyWithValue("signature", "5h3k");
    }

    @Test
    @DisplayName("missing token on either leg")
    void missingToken() {
        assertThatThrownBy(() -> VALID.toBuilder().toToken(null).build().validate())
                .hasFieldOrPropertyWithValue("reason", InvalidSwapRecordException.MISSING_TOKEN);
        assertThatThrownBy(() -> VALID.toBuilder().fromToken("").build().validate())
                .hasFieldOrPropertyWithValue("reason", InvalidSwapRecordException.MISSING_TOKEN);
    }

    @Test
    @DisplayName("negative or missing amount")
    void invalidAmount() {
        assertThatThrownBy(() -> VALID.toBuilder().fromAmount(new BigDecimal("-0.1")).build().validate())
                .hasFieldOrPropertyWithValue("reason", InvalidSwapRecordException.INVALID_AMOUNT)
                .hasMessageContaining("fromAmount");
        assertThatThrownBy(() -> VALID.toBuilder().toAmount(null).build().validate())
                .hasFieldOrPropertyWithValue("reason", InvalidSwapRecordException.INVALID_AMOUNT)
                .hasMessageContaining("toAmount");
    }
}
