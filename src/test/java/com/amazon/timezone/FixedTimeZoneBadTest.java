// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.timezone;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Text that {@link FixedTimeZone#valueOf(CharSequence)} rejects.
 */
public class FixedTimeZoneBadTest {

    @ParameterizedTest(name = "\"{0}\"")
    @ValueSource(strings = {
        "",
        "z",
        "ZZ",
        "utc",
        "GMT",
        "GMT+05",
        "UTC+",
        "UTC6",
        "UTCZ",
        "UTC+123",
        "UTC+6:30",
        "UTC05:30",
        "UTC0530",
        "+5",
        "+123",
        "++05",
        "+-05",
        "5",
        "05",
        "12:3",
        "12:30:",
        "12:30:4",
        "+05::30",
        "1230:45",
        "123045",
        "+12:30:45:00",
        "UTC+05:30:00:00",
        "+1a:30",
        "ab:cd",
        "+05:3O",
        " +05:30",
        "+05:30 ",
        "+05:30\n",
        "+05.30",
        "٥٠:٠٠",
    })
    public void rejected(String text) {
        UnrecognizedTimeZoneException e =
            assertThrows(UnrecognizedTimeZoneException.class, () -> FixedTimeZone.valueOf(text));
        assertEquals(text, e.getBadText());
        assertThat(e.getMessage(), startsWith("Unrecognized time zone: "));
    }

    @Test
    public void secondWithoutMinuteIsRejected() {
        assertThrows(UnrecognizedTimeZoneException.class, () -> FixedTimeZone.valueOf("+05::21"));
        assertThrows(UnrecognizedTimeZoneException.class, () -> FixedTimeZone.valueOf("UTC+5::21"));
    }

    @Test
    public void nullText() {
        assertThrows(NullPointerException.class, () -> FixedTimeZone.valueOf(null));
    }

    @Test
    public void exceptionIsATimeZoneException() {
        TimeZoneException e = assertThrows(TimeZoneException.class, () -> FixedTimeZone.valueOf("bogus"));
        assertEquals("bogus", ((UnrecognizedTimeZoneException) e).getBadText());
    }

    @Test
    public void badTextIsQuotedInMessage() {
        UnrecognizedTimeZoneException e =
            assertThrows(UnrecognizedTimeZoneException.class, () -> FixedTimeZone.valueOf("+05:30\t"));
        assertThat(e.getMessage(), endsWith(": \"+05:30\\t\""));
    }
}
