package io.nosqlbench.bucketize.engine;

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

import io.nosqlbench.bucketize.api.BucketAssignment;
import io.nosqlbench.bucketize.api.BucketConfigException;
import io.nosqlbench.bucketize.api.OrderedRowSource;
import io.nosqlbench.bucketize.api.PercentileBuckets;
import io.nosqlbench.bucketize.api.RankedRow;
import io.nosqlbench.bucketize.api.RowRecord;
import io.nosqlbench.bucketize.api.RowSinkException;
import io.nosqlbench.bucketize.api.Timestamps;
import io.nosqlbench.bucketize.config.BucketizeConfig;
import io.nosqlbench.bucketize.sinks.InMemoryRowSink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BucketizeProcedure")
class BucketizeProcedureTest {

    private static final PercentileBuckets QUARTERS = PercentileBuckets.builder()
        .add("q1", 0, 25)
        .add("q2", 25, 50)
        .add("q3", 50, 75)
        .add("q4", 75, 100)
        .build();

    /// Rows `r0..r<count-1>` in rank order, generated on the fly.
    private static OrderedRowSource untimedRows(long count) {
        return () -> new Iterator<>() {
            private long next = 0;

            @Override
            public boolean hasNext() {
                return next < count;
            }

            @Override
            public RankedRow next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return RankedRow.untimed(RecordingRowSink.rowName(next++));
            }
        };
    }

    private static BucketizeConfig config(PercentileBuckets buckets, int parallelism) {
        return BucketizeConfig.of(buckets).withParallelism(parallelism);
    }

    @Nested
    @DisplayName("coverage")
    class Coverage {

        @ParameterizedTest(name = "{0} rows")
        @ValueSource(longs = {0, 1, 7, 1024, 1_000_000})
        @DisplayName("buckets covering 0..100 should assign every row exactly once")
        void fullCoverageShouldAssignEveryRowOnce(long rowCount) {
            RecordingRowSink sink = new RecordingRowSink();

            BucketizeResult result = new BucketizeProcedure(config(QUARTERS, 4))
                .run(untimedRows(rowCount), sink);

            BitSet all = new BitSet();
            long total = 0;
            for (String label : List.of("q1", "q2", "q3", "q4")) {
                BitSet rows = sink.rows(label);
                assertThat(rows.intersects(all)).as("bucket %s shares rows", label).isFalse();
                all.or(rows);
                total += rows.cardinality();
            }
            assertThat(sink.duplicates()).isZero();
            assertThat(total).isEqualTo(rowCount);
            assertThat(all.cardinality()).isEqualTo((int) rowCount);
            assertThat(result.rowCount()).isEqualTo(rowCount);
            assertThat(result.assignments()).isEqualTo(rowCount);
            assertThat(sink.commits()).isEqualTo(1);
        }

        @Test
        @DisplayName("each bucket should hold its slice of the ranking")
        void bucketsShouldHoldTheirRankSlice() {
            RecordingRowSink sink = new RecordingRowSink();

            BucketizeResult result = new BucketizeProcedure(config(QUARTERS, 2)).run(untimedRows(100), sink);

            assertThat(sink.rows("q1").stream().toArray()).containsExactly(range(0, 25));
            assertThat(sink.rows("q3").stream().toArray()).containsExactly(range(50, 75));
            assertThat(result.buckets()).extracting(BucketSummary::rowCount).containsExactly(25L, 25L, 25L, 25L);
        }

        @Test
        @DisplayName("rows between buckets should stay unassigned")
        void gapsShouldStayUnassigned() {
            PercentileBuckets edges = PercentileBuckets.builder()
                .add("bottom", 0, 10)
                .add("top", 90, 100)
                .build();
            RecordingRowSink sink = new RecordingRowSink();

            new BucketizeProcedure(config(edges, 3)).run(untimedRows(1000), sink);

            assertThat(sink.rows("bottom").cardinality()).isEqualTo(100);
            assertThat(sink.rows("top").cardinality()).isEqualTo(100);
            assertThat(sink.rows("top").nextSetBit(0)).isEqualTo(900);
            assertThat(sink.rowCount()).isEqualTo(200);
        }

        @Test
        @DisplayName("a shared boundary row should go to the upper bucket only")
        void sharedBoundaryShouldGoToOneBucket() {
            PercentileBuckets halves = PercentileBuckets.builder()
                .add("low", 0, 50)
                .add("high", 50, 100)
                .build();
            InMemoryRowSink sink = new InMemoryRowSink();

            new BucketizeProcedure(config(halves, 2)).run(untimedRows(7), sink);

            assertThat(sink.rows()).extracting(row -> ((BucketAssignment) row).bucketLabel() + ":" + row.rowName())
                .containsExactlyInAnyOrder("low:r0", "low:r1", "low:r2",
                    "high:r3", "high:r4", "high:r5", "high:r6");
        }

        private int[] range(int from, int to) {
            int[] values = new int[to - from];
            for (int i = from; i < to; i++) {
                values[i - from] = i;
            }
            return values;
        }
    }

    @Nested
    @DisplayName("batching")
    class Batching {

        @Test
        @DisplayName("2500 rows with the default threshold should arrive as 1024, 1024, 452")
        void shouldBatchAtDefaultThreshold() {
            InMemoryRowSink sink = new InMemoryRowSink();
            PercentileBuckets all = PercentileBuckets.builder().add("all", 0, 100).build();

            BucketizeResult result = new BucketizeProcedure(config(all, 1)).run(untimedRows(2500), sink);

            assertThat(BucketizeConfig.of(all).flushThreshold()).isEqualTo(1024);
            assertThat(sink.batchSizes()).containsExactly(1024, 1024, 452);
            assertThat(result.flushes()).isEqualTo(3);
            assertThat(sink.committed()).isTrue();
        }

        @Test
        void noBatchShouldExceedTheThreshold() {
            RecordingRowSink sink = new RecordingRowSink();

            new BucketizeProcedure(config(QUARTERS, 4).withFlushThreshold(100)).run(untimedRows(20_000), sink);

            assertThat(sink.batchSizes()).allSatisfy(size -> assertThat(size).isBetween(1, 100));
            assertThat(sink.batchSizes().stream().mapToInt(Integer::intValue).sum()).isEqualTo(20_000);
        }
    }

    @Nested
    @DisplayName("timestamps")
    class Timestamping {

        @Test
        @DisplayName("every assignment should carry the latest key timestamp")
        void shouldAttachRepresentativeTimestamp() {
            Instant t1 = Instant.parse("2024-01-01T00:00:00Z");
            Instant t2 = Instant.parse("2024-05-05T00:00:00Z");
            Instant t3 = Instant.parse("2024-03-03T00:00:00Z");
            List<RankedRow> rows = List.of(
                new RankedRow("r0", List.of(t1)),
                new RankedRow("r1", List.of(t2)),
                new RankedRow("r2", List.of(t3)));
            RecordingRowSink sink = new RecordingRowSink();

            BucketizeResult result = new BucketizeProcedure(config(QUARTERS, 2)).run(rows::iterator, sink);

            assertThat(result.representativeTimestamp()).isEqualTo(t2);
            assertThat(sink.timestamps()).containsExactly(t2);
        }

        @Test
        void untimedRowsShouldCarryNegativeInfinity() {
            RecordingRowSink sink = new RecordingRowSink();

            new BucketizeProcedure(config(QUARTERS, 2)).run(untimedRows(10), sink);

            assertThat(sink.timestamps()).containsExactly(Timestamps.NEGATIVE_INFINITY);
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("overlapping buckets should fail before any row is read")
        void shouldRejectOverlapAtConstruction() {
            PercentileBuckets overlapping = PercentileBuckets.builder()
                .add("a", 0, 60)
                .add("b", 50, 100)
                .build();

            assertThatThrownBy(() -> new BucketizeProcedure(config(overlapping, 1)))
                .isInstanceOf(BucketConfigException.class)
                .hasMessageContaining("is overlapping with");
        }

        @Test
        @DisplayName("a sink failure should stop the run without commit")
        void sinkFailureShouldPreventCommit() {
            RecordingRowSink sink = new RecordingRowSink(2);
            BucketizeConfig config = config(QUARTERS, 4).withFlushThreshold(10);

            assertThatThrownBy(() -> new BucketizeProcedure(config).run(untimedRows(10_000), sink))
                .isInstanceOf(RowSinkException.class);
            assertThat(sink.commits()).isZero();
        }

        @Test
        void invalidTuningShouldBeRejected() {
            assertThatThrownBy(() -> BucketizeConfig.of(QUARTERS).withFlushThreshold(0))
                .isInstanceOf(BucketConfigException.class)
                .hasMessageContaining("flushThreshold");
            assertThatThrownBy(() -> BucketizeConfig.of(QUARTERS).withParallelism(0))
                .isInstanceOf(BucketConfigException.class)
                .hasMessageContaining("parallelism");
        }
    }

    @Test
    @DisplayName("progress should be reported after resolution and after each bucket")
    void shouldReportProgress() {
        List<Double> progress = new ArrayList<>();
        InMemoryRowSink sink = new InMemoryRowSink();

        new BucketizeProcedure(config(QUARTERS, 1)).run(untimedRows(8), sink,
            (fraction, message) -> progress.add(fraction));

        assertThat(progress).containsExactly(0.0, 0.25, 0.5, 0.75, 1.0);
        assertThat(sink.rows()).extracting(RowRecord::rowName).hasSize(8);
    }
}
