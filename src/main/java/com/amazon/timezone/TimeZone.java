// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.timezone;

/**
 * A named offset from Coordinated Universal Time.
 * <p>
 * Implementations must be immutable so that instances may be shared freely
 * between threads.
 *
 * @see FixedTimeZone
 */
public interface TimeZone
{
    /**
     * Gets the display name of this zone, for example {@code "UTC+05:30"}.
     *
     * @return the name; never null or empty.
     */
    public String getName();

    /**
     * Gets the offset from UTC observed by this zone.
     *
     * @return the offset; never null.
     */
    public UtcOffset getOffset();
}
