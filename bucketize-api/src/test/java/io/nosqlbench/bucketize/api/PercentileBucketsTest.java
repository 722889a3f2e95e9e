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

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PercentileBuckets")
class PercentileBucketsTest {

    @Test
    @DisplayName("should keep insertion order")
    void shouldKeepInsertionOrder() {
        PercentileBuckets buckets = PercentileBuckets.builder()
            .add("high", 50, 100)
            .add("low", 0, 50)
            .build();

        assertThat(buckets.ranges()).extracting(PercentileRange::label).containsExactly("high", "low");
        assertThat(buckets.size()).isEqualTo(2);
        assertThat(buckets.get("low")).contains(new PercentileRange("low", 0, 50));
        assertThat(buckets.get("missing")).isEmpty();
    }

    @Test
    @DisplayName("should reject a duplicate label naming both ranges")
    void shouldRejectDuplicateLabel() {
        PercentileBuckets.Builder builder = PercentileBuckets.builder().add("a", 0, 10);

        assertThatThrownBy(() -> builder.add("a", 20, 30))
            .isInstanceOf(BucketConfigException.class)
            .hasMessageContaining("duplicate percentile bucket label 'a'")
            .satisfies(e -> assertThat(((BucketConfigException) e).getOffendingRanges())
                .extracting(PercentileRange::start)
                .containsExactly(0.0d, 20.0d));
    }

    @Test
    @DisplayName("should reject a blank label")
    void shouldRejectBlankLabel() {
        assertThatThrownBy(() -> new PercentileRange(" ", 0, 10))
            .isInstanceOf(BucketConfigException.class);
    }

    @Test
    @DisplayName("should build from label to bounds map")
    void shouldBuildFromMap() {
        Map<String, double[]> bounds = new LinkedHashMap<>();
        bounds.put("train", new double[]{0, 80});
        bounds.put("test", new double[]{80, 100});

        PercentileBuckets buckets = PercentileBuckets.of(bounds);

        assertThat(buckets).containsExactly(
            new PercentileRange("train", 0, 80),
            new PercentileRange("test", 80, 100));
    }

    @Test
    @DisplayName("should reject a map entry without two bounds")
    void shouldRejectMalformedMapEntry() {
        assertThatThrownBy(() -> PercentileBuckets.of(Map.of("x", new double[]{1})))
            .isInstanceOf(BucketConfigException.class)
            .hasMessageContaining("exactly two bounds");
    }

    @Test
    @DisplayName("ranges() should return a copy")
    void rangesShouldBeACopy() {
        PercentileBuckets buckets = PercentileBuckets.builder().add("a", 0, 100).build();
        buckets.ranges().clear();
        assertThat(buckets.size()).isEqualTo(1);
    }

    @Test
    void assignmentShouldExposeSharedCell() {
        Cell cell = BucketAssignment.bucketCell("low", Timestamps.NEGATIVE_INFINITY);
        BucketAssignment assignment = new BucketAssignment("row1", cell);

        assertThat(assignment.bucketLabel()).isEqualTo("low");
        assertThat(assignment.cells()).singleElement().isSameAs(cell);
        assertThat(cell.column()).isEqualTo(BucketAssignment.BUCKET_COLUMN);
    }

    @Test
    void cellShouldRejectUnsupportedValueTypes() {
        assertThatThrownBy(() -> new Cell("c", 3, Timestamps.NEGATIVE_INFINITY))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unsupported cell value type");
    }
}
