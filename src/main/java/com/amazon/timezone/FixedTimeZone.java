// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.timezone;

import static com.amazon.timezone.util.ZoneTextUtils.printString;

import com.amazon.timezone.impl.ParsedOffset;
import com.amazon.timezone.impl._Private_FixedOffsetParser;
import java.time.Duration;

/**
 * An immutable {@link TimeZone} whose offset from UTC is the same for all of
 * time.
 * <p>
 * Values are created from an explicit name and offset, or parsed from text
 * with {@link #valueOf(CharSequence)}. Parsed values are named
 * {@code UTC±HH:MM[:SS]}:
 * <ul>
 *   <li>{@code UTC+6} is named {@code UTC+06:00}</li>
 *   <li>{@code -1330} is named {@code UTC-13:30}</li>
 *   <li>{@code 15:45:21} is named {@code UTC+15:45:21}</li>
 * </ul>
 *
 * <h3>Equality and Comparison</h3>
 *
 * The {@link #equals equals} method compares both name and offset.
 * The {@link #compareTo} method orders zones chronologically and ignores the
 * name, so {@link #UTC_ZERO} ({@code Z}) and the value parsed from
 * {@code "UTC"} compare as {@code 0} but are not {@code equals}.
 * Thus the <em>natural comparison method</em> of this class is <em>not
 * consistent with equals</em>. See the documentation of {@link Comparable} for
 * further discussion.
 *
 * @see #compareTo(FixedTimeZone)
 */
public final class FixedTimeZone
    implements TimeZone, Comparable<FixedTimeZone>
{
    /**
     * The maximum number of characters in a zone name.
     */
    public static final int MAX_NAME_LENGTH = 15;

    /**
     * The zero offset zone, named {@code "Z"} as in ISO 8601.
     */
    public static final FixedTimeZone UTC_ZERO =
        new FixedTimeZone("Z", UtcOffset.ZERO);

    private static final int HASH_SIGNATURE =
        "INTERNAL FIXED TIME ZONE".hashCode();

    private final String    _name;
    private final UtcOffset _offset;


    /**
     * @param name the display name; must be between 1 and
     *          {@link #MAX_NAME_LENGTH} characters.
     * @param offset the offset from UTC; must not be null.
     *
     * @throws IllegalArgumentException if the name is empty or too long.
     */
    public FixedTimeZone(String name, UtcOffset offset)
    {
        checkName(name);
        if (offset == null) {
            throw new NullPointerException("offset must not be null");
        }
        _name = name;
        _offset = offset;
    }

    /**
     * @param standardSeconds the offset from UTC, in seconds.
     */
    public FixedTimeZone(String name, int standardSeconds)
    {
        this(name, new UtcOffset(standardSeconds, 0));
    }

    /**
     * @param standardSeconds the standard offset from UTC, in seconds.
     * @param daylightSeconds the daylight saving shift, in seconds.
     */
    public FixedTimeZone(String name, int standardSeconds, int daylightSeconds)
    {
        this(name, new UtcOffset(standardSeconds, daylightSeconds));
    }

    /**
     * @throws IllegalArgumentException if {@code standard} isn't a whole
     *          number of seconds.
     */
    public FixedTimeZone(String name, Duration standard)
    {
        this(name, UtcOffset.forDuration(standard));
    }

    /**
     * @throws IllegalArgumentException if either duration isn't a whole
     *          number of seconds.
     */
    public FixedTimeZone(String name, Duration standard, Duration daylight)
    {
        this(name, UtcOffset.forDuration(standard, daylight));
    }

    private static void checkName(String name)
    {
        if (name == null) {
            throw new NullPointerException("name must not be null");
        }
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException(
                String.format("name %s exceeds %d characters",
                              printString(name), MAX_NAME_LENGTH));
        }
    }


    /**
     * Returns a zone whose offset is defined by the given text.
     * <p>
     * {@code "Z"} returns {@link #UTC_ZERO}. Any other zero offset, such as
     * {@code "UTC"} or {@code "+00:00"}, is named {@code "UTC"}.
     *
     * @param text
     *          one of {@code Z}; {@code UTC}; {@code UTC±H} or {@code UTC±HH};
     *          {@code ±HH}; or an optional {@code UTC} prefix (only with a
     *          sign), an optional sign and {@code HH:MM}, {@code HH:MM:SS} or
     *          {@code HHMM}.
     *
     * @throws UnrecognizedTimeZoneException
     *          if the text is not one of the accepted forms.
     * @throws NullPointerException if {@code text} is null.
     */
    public static FixedTimeZone valueOf(CharSequence text)
    {
        ParsedOffset parsed = _Private_FixedOffsetParser.parse(text);
        if (parsed.getForm() == ParsedOffset.Form.ZULU) {
            return UTC_ZERO;
        }
        return new FixedTimeZone(parsed.getName(), parsed.getTotalSeconds());
    }


    public String getName()
    {
        return _name;
    }

    public UtcOffset getOffset()
    {
        return _offset;
    }

    /**
     * Returns a zone with the same offset as this one and a different name.
     * This zone is not modified.
     *
     * @throws IllegalArgumentException if the name is empty or too long.
     */
    public FixedTimeZone rename(String name)
    {
        return new FixedTimeZone(name, _offset);
    }


    /**
     * Orders zones chronologically: a zone precedes another when its
     * offset is numerically greater.
     * <p>
     * A given wall clock reading happens earlier in absolute time in a zone
     * further east, so 10:00 in {@code UTC-05:00} is an earlier moment than
     * 10:00 in {@code UTC-08:00}, and {@code UTC+02:00} precedes
     * {@code UTC-01:00}.
     * Zones with the same effective offset compare as {@code 0} whatever
     * their names.
     *
     * @param that the zone to compare this zone to.
     *
     * @return
     *          a negative number, zero, or a positive number if this zone is
     *          chronologically before, the same as, or after {@code that}.
     *
     * @throws NullPointerException if {@code that} is null.
     */
    public int compareTo(FixedTimeZone that)
    {
        // this < that exactly when that's offset < this offset.
        return that._offset.compareTo(this._offset);
    }

    /**
     * Compares this zone to the specified Object.
     * The result is {@code true} if and only if the parameter is a
     * {@link FixedTimeZone} with the same name and offset.
     *
     * @see #compareTo(FixedTimeZone)
     */
    @Override
    public boolean equals(Object other)
    {
        if (this == other) return true;
        if (!(other instanceof FixedTimeZone)) return false;

        FixedTimeZone that = (FixedTimeZone) other;
        return this._name.equals(that._name)
            && this._offset.equals(that._offset);
    }

    @Override
    public int hashCode()
    {
        final int prime = 8191;
        int result = HASH_SIGNATURE;
        result = prime * result + _name.hashCode();
        result = prime * result + _offset.hashCode();
        return result;
    }

    /**
     * Returns the name of this zone.
     */
    @Override
    public String toString()
    {
        return _name;
    }
}
