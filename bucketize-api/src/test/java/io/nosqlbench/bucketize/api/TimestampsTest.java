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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Timestamps")
class TimestampsTest {

    @ParameterizedTest
    @CsvSource({
        "2024-03-01T12:00:00Z, 2024-03-01T12:00:00Z",
        "2024-03-01T14:00:00+02:00, 2024-03-01T12:00:00Z",
        "2024-03-01, 2024-03-01T00:00:00Z"
    })
    void shouldParseIsoText(String text, String expected) {
        assertThat(Timestamps.parse(text)).contains(Instant.parse(expected));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "yesterday", "2024-13-01", "12"})
    void shouldNotParseOtherText(String text) {
        assertThat(Timestamps.parse(text)).isEmpty();
    }

    @Test
    void negativeInfinityShouldRoundTripThroughText() {
        assertThat(Timestamps.format(Timestamps.NEGATIVE_INFINITY)).isEqualTo("-Infinity");
        assertThat(Timestamps.parse("-Infinity")).contains(Timestamps.NEGATIVE_INFINITY);
        assertThat(Timestamps.isADate(Timestamps.NEGATIVE_INFINITY)).isFalse();
    }

    @Test
    void maxShouldIgnoreNulls() {
        Instant t = Instant.parse("2020-01-01T00:00:00Z");
        assertThat(Timestamps.max(null, null)).isEqualTo(Timestamps.NEGATIVE_INFINITY);
        assertThat(Timestamps.max(t, null)).isEqualTo(t);
        assertThat(Timestamps.max(Timestamps.NEGATIVE_INFINITY, t)).isEqualTo(t);
        assertThat(Timestamps.max(t, t.plusSeconds(1))).isEqualTo(t.plusSeconds(1));
    }
}
