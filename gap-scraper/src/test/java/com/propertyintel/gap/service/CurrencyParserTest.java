package com.propertyintel.gap.service;

import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CurrencyParserTest {

    private final CurrencyParser parser = new CurrencyParser();

    @Test
    void parseAmount_shouldHandleEokWithMan() {
        assertEquals(380_000_000L, parser.parseAmount("3억 8,000만원").getAsLong());
        assertEquals(380_000_000L, parser.parseAmount("3억8000만").getAsLong());
    }

    @Test
    void parseAmount_shouldTreatBareNumberAsMan() {
        assertEquals(85_000_000L, parser.parseAmount("8,500").getAsLong());
    }

    @Test
    void parseAmount_shouldTreatBareNumberWithWonMarkAsWon() {
        assertEquals(320_000_000L, parser.parseAmount("320000000원").getAsLong());
    }

    @Test
    void parseAmount_shouldRoundFractionalEok() {
        assertEquals(750_000_000L, parser.parseAmount("7.5억").getAsLong());
        assertEquals(125_000_000L, parser.parseAmount("1.25억").getAsLong());
    }

    @Test
    void parseAmount_shouldReadThousandAfterEokAsThousandsOfMan() {
        assertEquals(320_000_000L, parser.parseAmount("3억2천").getAsLong());
    }

    @Test
    void parseAmount_shouldReadBareTrailingNumberAfterEokAsMan() {
        assertEquals(355_000_000L, parser.parseAmount("3억 5,500").getAsLong());
    }

    @Test
    void parseAmount_shouldHandleManAndThousandOnly() {
        assertEquals(95_000_000L, parser.parseAmount("9,500만원").getAsLong());
        assertEquals(50_000_000L, parser.parseAmount("5천만").getAsLong());
        assertEquals(30_000_000L, parser.parseAmount("3천").getAsLong());
    }

    @Test
    void parseAmount_shouldReturnEmptyForUnparsableInput() {
        assertTrue(parser.parseAmount("").isEmpty());
        assertTrue(parser.parseAmount("   ").isEmpty());
        assertTrue(parser.parseAmount(null).isEmpty());
        assertTrue(parser.parseAmount("가격문의").isEmpty());
        assertTrue(parser.parseAmount("원").isEmpty());
    }

    @Test
    void parseAmount_shouldReturnEmptyWhenDigitsOverflow() {
        OptionalLong result = parser.parseAmount("99999999999999999999999");
        assertTrue(result.isEmpty());
    }

    @Test
    void parseAmount_shouldReturnEmptyWhenProductOverflows() {
        assertTrue(parser.parseAmount("922337203685477580").isEmpty());
        assertTrue(parser.parseAmount("9223372036854775만").isEmpty());
        assertTrue(parser.parseAmount("9223372036854775807천").isEmpty());
        assertTrue(parser.parseAmount("1억9223372036854775807만").isEmpty());
    }
}
