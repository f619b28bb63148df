package com.paxkun.pulldb.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifiersTest {

    @Test
    void acceptsNumericStringsAndIntegers() {
        assertThat(Identifiers.parseId("42")).hasValue(42);
        assertThat(Identifiers.parseId(" 7 ")).hasValue(7);
        assertThat(Identifiers.parseId(12)).hasValue(12);
        assertThat(Identifiers.parseId(12L)).hasValue(12);
    }

    @Test
    void integralDecimalsFromJsonAreIds() {
        assertThat(Identifiers.parseId(12.0)).hasValue(12);
        assertThat(Identifiers.parseId(12.0f)).hasValue(12);
        assertThat(Identifiers.parseId(new BigDecimal("7.00"))).hasValue(7);
        assertThat(Identifiers.parseId(-1.0)).isEmpty();
        assertThat(Identifiers.parseId(1.0e20)).isEmpty();
        assertThat(Identifiers.parseId(Double.NaN)).isEmpty();
    }

    @Test
    void rejectsEverythingElse() {
        assertThat(Identifiers.parseId(null)).isEmpty();
        assertThat(Identifiers.parseId("-3")).isEmpty();
        assertThat(Identifiers.parseId(-3)).isEmpty();
        assertThat(Identifiers.parseId("4.5")).isEmpty();
        assertThat(Identifiers.parseId(4.5)).isEmpty();
        assertThat(Identifiers.parseId("1234567890123456789012")).isEmpty();
    }

    @Test
    void datesMayBeFullTimestamps() {
        assertThat(Identifiers.parseDate("2020-01-02")).contains(LocalDate.parse("2020-01-02"));
        assertThat(Identifiers.parseDate("2020-01-02T23:59:59Z")).contains(LocalDate.parse("2020-01-02"));
        assertThat(Identifiers.parseDate("soon")).isEmpty();
        assertThat(Identifiers.parseDate(null)).isEmpty();
    }

    @Test
    void sanitizeStripsLineBreaks() {
        assertThat(Identifiers.sanitizeForLog("alice\r\n[FAKE] entry")).isEqualTo("aliceFAKE entry");
    }
}
