// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.timezone;

import com.amazon.timezone.util.ZoneTextUtils;

/**
 * An error caused by text that is not a recognized fixed-offset time zone
 * designator.
 *
 * @see FixedTimeZone#valueOf(CharSequence)
 */
public class UnrecognizedTimeZoneException
    extends TimeZoneException
{
    private static final long serialVersionUID = 4817320557306124418L;

    private final String myBadText;


    public UnrecognizedTimeZoneException(CharSequence badText)
    {
        super("Unrecognized time zone: " + ZoneTextUtils.printString(badText));
        myBadText = (badText == null ? null : badText.toString());
    }

    /**
     * @param badText the rejected input.
     * @param reason what the parser expected at the point of failure.
     */
    public UnrecognizedTimeZoneException(CharSequence badText, String reason)
    {
        super("Unrecognized time zone: " + reason + ": "
              + ZoneTextUtils.printString(badText));
        myBadText = (badText == null ? null : badText.toString());
    }


    /**
     * Returns the text that failed to parse, exactly as it was supplied.
     */
    public String getBadText()
    {
        return myBadText;
    }
}
