// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0

/**
 * Fixed-offset time zones: the {@link com.amazon.timezone.FixedTimeZone}
 * value, its {@link com.amazon.timezone.UtcOffset} and the text form that
 * {@link com.amazon.timezone.FixedTimeZone#valueOf(CharSequence)} accepts.
 */
package com.amazon.timezone;
