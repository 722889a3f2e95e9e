package io.nosqlbench.bucketize.api;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Pattern;

/// Helpers for cell timestamps.
///
/// `Instant.MIN` stands for negative infinity: the timestamp of a run in which no ordering key
/// carried a valid point in time.
public final class Timestamps {

    /// The timestamp used when no valid point in time is known
    public static final Instant NEGATIVE_INFINITY = Instant.MIN;

    /// The text form of {@link #NEGATIVE_INFINITY}
    public static final String NEGATIVE_INFINITY_TEXT = "-Infinity";

    private static final Pattern LOCAL_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private Timestamps() {
    }

    /// @param timestamp a timestamp
    /// @return true unless the timestamp is negative infinity
    public static boolean isADate(Instant timestamp) {
        return timestamp != null && !NEGATIVE_INFINITY.equals(timestamp);
    }

    /// @param a a timestamp, or null
    /// @param b a timestamp, or null
    /// @return the later of the two, ignoring nulls; negative infinity when both are null
    public static Instant max(Instant a, Instant b) {
        if (a == null) {
            return b == null ? NEGATIVE_INFINITY : b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }

    /// @param timestamp a timestamp
    /// @return ISO-8601 text, or `-Infinity`
    public static String format(Instant timestamp) {
        return isADate(timestamp) ? timestamp.toString() : NEGATIVE_INFINITY_TEXT;
    }

    /// Parse ISO-8601 instant or offset date-time text, or a local date. Local dates are taken at the
    /// start of the day in UTC.
    /// @param text the text to parse
    /// @return the instant, or empty if the text is not a recognized date
    public static Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (NEGATIVE_INFINITY_TEXT.equals(trimmed)) {
            return Optional.of(NEGATIVE_INFINITY);
        }
        try {
            if (LOCAL_DATE.matcher(trimmed).matches()) {
                return Optional.of(LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant());
            }
            return Optional.of(OffsetDateTime.parse(trimmed).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
