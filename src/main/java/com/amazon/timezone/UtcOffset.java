// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.timezone;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Locale;

/**
 * An immutable offset from Coordinated Universal Time, made of a standard
 * component and a daylight saving component, both in whole seconds.
 * The effective offset is the sum of the two.
 *
 * <h3>Equality and Comparison</h3>
 *
 * The {@link #equals equals} method observes both components, so
 * {@code 3600/0} and {@code 0/3600} are not equal.
 * The {@link #compareTo} method only looks at the total, so the same pair
 * compares as {@code 0}.
 * Thus the <em>natural comparison method</em> of this class is <em>not
 * consistent with equals</em>. See the documentation of {@link Comparable} for
 * further discussion.
 */
public final class UtcOffset
    implements Comparable<UtcOffset>
{
    /**
     * Zero standard offset and zero daylight offset.
     */
    public static final UtcOffset ZERO = new UtcOffset(0, 0);

    private static final int SECONDS_PER_MINUTE = 60;
    private static final int SECONDS_PER_HOUR   = 3600;

    private static final int HASH_SIGNATURE =
        "INTERNAL UTC OFFSET".hashCode();

    private final int _standardSeconds;
    private final int _daylightSeconds;


    /**
     * Creates an offset with no daylight saving component.
     *
     * @param standardSeconds the standard offset from UTC, in seconds.
     */
    public UtcOffset(int standardSeconds)
    {
        this(standardSeconds, 0);
    }

    /**
     * @param standardSeconds the standard offset from UTC, in seconds.
     * @param daylightSeconds the daylight saving shift applied on top of the
     *          standard offset, in seconds.
     */
    public UtcOffset(int standardSeconds, int daylightSeconds)
    {
        _standardSeconds = standardSeconds;
        _daylightSeconds = daylightSeconds;
    }


    /**
     * Creates an offset with no daylight saving component from a
     * {@link Duration}.
     *
     * @throws IllegalArgumentException if the duration has a fractional
     *          second or doesn't fit in an {@code int} number of seconds.
     */
    public static UtcOffset forDuration(Duration standard)
    {
        return new UtcOffset(toSeconds(standard, "standard offset"), 0);
    }

    /**
     * Creates an offset from a pair of {@link Duration}s.
     *
     * @throws IllegalArgumentException if either duration has a fractional
     *          second or doesn't fit in an {@code int} number of seconds.
     */
    public static UtcOffset forDuration(Duration standard, Duration daylight)
    {
        return new UtcOffset(toSeconds(standard, "standard offset"),
                             toSeconds(daylight, "daylight offset"));
    }

    private static int toSeconds(Duration duration, String field)
    {
        if (duration == null) {
            throw new NullPointerException(field + " must not be null");
        }
        if (duration.getNano() != 0) {
            throw new IllegalArgumentException(
                String.format("%s %s must be a whole number of seconds", field, duration));
        }
        long seconds = duration.getSeconds();
        if (seconds < Integer.MIN_VALUE || seconds > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                String.format("%s %s is out of range.", field, duration));
        }
        return (int) seconds;
    }


    public int getStandardSeconds()
    {
        return _standardSeconds;
    }

    public int getDaylightSeconds()
    {
        return _daylightSeconds;
    }

    /**
     * Gets the effective offset, the sum of the standard and daylight
     * components.
     */
    public long getTotalSeconds()
    {
        return (long) _standardSeconds + _daylightSeconds;
    }

    /**
     * Converts the effective offset of this value into a {@link ZoneOffset}.
     *
     * @throws DateTimeException if the total is outside the range that
     *          {@link ZoneOffset} supports (-18:00 to +18:00).
     */
    public ZoneOffset toZoneOffset()
    {
        long total = getTotalSeconds();
        if (total < Integer.MIN_VALUE || total > Integer.MAX_VALUE) {
            throw new DateTimeException("Zone offset not in valid range: " + this);
        }
        return ZoneOffset.ofTotalSeconds((int) total);
    }


    /**
     * Compares the effective offsets of this value and {@code that},
     * numerically.
     *
     * @return
     *          a negative number, zero, or a positive number if the total of
     *          this offset is less than, equal to, or greater than the total of
     *          {@code that}.
     *
     * @throws NullPointerException if {@code that} is null.
     */
    public int compareTo(UtcOffset that)
    {
        long thisTotal = this.getTotalSeconds();
        long thatTotal = that.getTotalSeconds();
        if (thisTotal != thatTotal) {
            return (thisTotal < thatTotal) ? -1 : 1;
        }
        return 0;
    }

    @Override
    public boolean equals(Object other)
    {
        if (this == other) return true;
        if (!(other instanceof UtcOffset)) return false;

        UtcOffset that = (UtcOffset) other;
        return this._standardSeconds == that._standardSeconds
            && this._daylightSeconds == that._daylightSeconds;
    }

    @Override
    public int hashCode()
    {
        final int prime = 8191;
        int result = HASH_SIGNATURE;
        result = prime * result + _standardSeconds;
        result = prime * result + _daylightSeconds;
        return result;
    }

    /**
     * Renders the standard component as {@code +HH:MM} (or
     * {@code +HH:MM:SS} when seconds are present), followed by
     * {@code /+HH:MM} for the daylight component when it is non-zero.
     */
    @Override
    public String toString()
    {
        StringBuilder buf = new StringBuilder(16);
        printSeconds(buf, _standardSeconds);
        if (_daylightSeconds != 0) {
            buf.append('/');
            printSeconds(buf, _daylightSeconds);
        }
        return buf.toString();
    }

    private static void printSeconds(StringBuilder buf, long seconds)
    {
        buf.append(seconds < 0 ? '-' : '+');
        long magnitude = Math.abs(seconds);
        long hours   = magnitude / SECONDS_PER_HOUR;
        long minutes = (magnitude % SECONDS_PER_HOUR) / SECONDS_PER_MINUTE;
        long secs    = magnitude % SECONDS_PER_MINUTE;
        buf.append(String.format(Locale.ROOT, "%02d:%02d", hours, minutes));
        if (secs != 0) {
            buf.append(String.format(Locale.ROOT, ":%02d", secs));
        }
    }
}
