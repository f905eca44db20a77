package com.cred.freestyle.registration.domain.model;

import com.cred.freestyle.registration.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Offering window checks and kind codes.
 */
@DisplayName("Offering Domain Model Tests")
class OfferingTest {

    private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");
    private static final Instant END = Instant.parse("2026-03-31T23:59:59Z");

    @Test
    @DisplayName("Window is inclusive at both ends")
    void windowIsInclusive() {
        Offering offering = TestDataBuilder.offering().window(START, END).build();

        assertThat(offering.isAvailableAt(START)).isTrue();
        assertThat(offering.isAvailableAt(END)).isTrue();
        assertThat(offering.isAvailableAt(START.minusMillis(1))).isFalse();
        assertThat(offering.isAvailableAt(END.plusMillis(1))).isFalse();
    }

    @Test
    @DisplayName("Kind codes resolve case-insensitively and reject unknown kinds")
    void kindCodes() {
        assertThat(OfferingKind.fromCode("TEST")).isEqualTo(OfferingKind.TEST);
        assertThat(OfferingKind.fromCode("course")).isEqualTo(OfferingKind.COURSE);
        assertThatThrownBy(() -> OfferingKind.fromCode("webinar"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Offering references compare by kind and id")
    void refEquality() {
        assertThat(OfferingRef.test(1L)).isEqualTo(OfferingRef.of(OfferingKind.TEST, 1L));
        assertThat(OfferingRef.test(1L)).isNotEqualTo(OfferingRef.course(1L));
        assertThat(OfferingRef.course(9L).toString()).isEqualTo("course:9");
    }
}
