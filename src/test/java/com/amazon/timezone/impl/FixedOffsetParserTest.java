// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.timezone.impl;

import com.amazon.timezone.UnrecognizedTimeZoneException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class FixedOffsetParserTest {

    static Arguments[] recognizedForms() {
        return new Arguments[] {
            Arguments.of("Z",          ParsedOffset.Form.ZULU,        '+',  0,  0,  0),
            Arguments.of("UTC",        ParsedOffset.Form.UTC,         '+',  0,  0,  0),
            Arguments.of("UTC+6",      ParsedOffset.Form.UTC_HOUR,    '+',  6,  0,  0),
            Arguments.of("UTC-12",     ParsedOffset.Form.UTC_HOUR,    '-', 12,  0,  0),
            Arguments.of("+05",        ParsedOffset.Form.SIGNED_HOUR, '+',  5,  0,  0),
            Arguments.of("-11",        ParsedOffset.Form.SIGNED_HOUR, '-', 11,  0,  0),
            Arguments.of("15:45:21",   ParsedOffset.Form.EXTENDED,    '+', 15, 45, 21),
            Arguments.of("-05:30",     ParsedOffset.Form.EXTENDED,    '-',  5, 30,  0),
            Arguments.of("UTC+05:30",  ParsedOffset.Form.EXTENDED,    '+',  5, 30,  0),
            Arguments.of("-1330",      ParsedOffset.Form.BASIC,       '-', 13, 30,  0),
            Arguments.of("1330",       ParsedOffset.Form.BASIC,       '+', 13, 30,  0),
            Arguments.of("UTC-0530",   ParsedOffset.Form.BASIC,       '-',  5, 30,  0),
        };
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("recognizedForms")
    public void recognizesFields(String text, ParsedOffset.Form form, char sign, int hour, int minute, int second) {
        ParsedOffset parsed = _Private_FixedOffsetParser.parse(text);
        assertEquals(form, parsed.getForm());
        assertEquals(sign, parsed.getSign());
        assertEquals(hour, parsed.getHour());
        assertEquals(minute, parsed.getMinute());
        assertEquals(second, parsed.getSecond());
    }

    @Test
    public void zuluIsShortCircuited() {
        ParsedOffset parsed = _Private_FixedOffsetParser.parse("Z");
        assertSame(ParsedOffset.ZULU, parsed);
        assertEquals("Z", parsed.getName());
        assertEquals(0, parsed.getTotalSeconds());
    }

    @Test
    public void totalSecondsCarriesTheSign() {
        assertEquals(-(13 * 3600 + 30 * 60), _Private_FixedOffsetParser.parse("-1330").getTotalSeconds());
        assertEquals(15 * 3600 + 45 * 60 + 21, _Private_FixedOffsetParser.parse("15:45:21").getTotalSeconds());
        assertEquals(-6 * 3600, _Private_FixedOffsetParser.parse("UTC-6").getTotalSeconds());
    }

    @Test
    public void negativeZeroIsNamedUtc() {
        ParsedOffset parsed = _Private_FixedOffsetParser.parse("-00:00");
        assertEquals('-', parsed.getSign());
        assertEquals(0, parsed.getTotalSeconds());
        assertEquals("UTC", parsed.getName());
    }

    @Test
    public void nameIsBuiltFromFields() {
        assertEquals("UTC+06:00", _Private_FixedOffsetParser.parse("UTC+6").getName());
        assertEquals("UTC+05:30", _Private_FixedOffsetParser.parse("+0530").getName());
        assertEquals("UTC+05:30", _Private_FixedOffsetParser.parse("+05:30").getName());
        assertEquals("UTC+12:00", _Private_FixedOffsetParser.parse("12:00:00").getName());
        assertEquals("UTC+00:00:01", _Private_FixedOffsetParser.parse("00:00:01").getName());
    }

    @Test
    public void failureExplainsWhatWasExpected() {
        UnrecognizedTimeZoneException e =
            assertThrows(UnrecognizedTimeZoneException.class, () -> _Private_FixedOffsetParser.parse("UTC*05"));
        assertThat(e.getMessage(), containsString("after \"UTC\""));
        assertThat(e.getMessage(), containsString("\"*\""));

        e = assertThrows(UnrecognizedTimeZoneException.class, () -> _Private_FixedOffsetParser.parse("12:3x"));
        assertThat(e.getMessage(), containsString("minutes has non-digit character \"x\""));

        e = assertThrows(UnrecognizedTimeZoneException.class, () -> _Private_FixedOffsetParser.parse("1230:45"));
        assertThat(e.getMessage(), containsString("excess characters after minutes"));
    }
}
