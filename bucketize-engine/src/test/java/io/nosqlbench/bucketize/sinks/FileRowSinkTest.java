package io.nosqlbench.bucketize.sinks;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nosqlbench.bucketize.api.BucketAssignment;
import io.nosqlbench.bucketize.api.Cell;
import io.nosqlbench.bucketize.api.NamedRow;
import io.nosqlbench.bucketize.api.RowSink;
import io.nosqlbench.bucketize.api.RowSinkException;
import io.nosqlbench.bucketize.api.SinkStatus;
import io.nosqlbench.bucketize.api.Timestamps;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("File row sinks")
class FileRowSinkTest {

    private static final Instant TS = Instant.parse("2024-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("commit and discard")
    class CommitAndDiscard {

        @Test
        @DisplayName("rows should only appear at the target after commit")
        void shouldWriteInProgressThenMove() {
            Path target = tempDir.resolve("out.jsonl");
            JsonLinesRowSink sink = new JsonLinesRowSink(SinkSpec.forPath(target, false));

            sink.recordRows(List.of(new BucketAssignment("r1", BucketAssignment.bucketCell("low", TS))));
            assertThat(target).doesNotExist();
            assertThat(sink.getInProgressPath()).exists();

            SinkStatus status = sink.commit();
            sink.close();

            assertThat(target).exists();
            assertThat(sink.getInProgressPath()).doesNotExist();
            assertThat(status).isEqualTo(new SinkStatus("jsonl", target.toString(), 1, 1));
        }

        @Test
        @DisplayName("closing without commit should discard the rows")
        void closeWithoutCommitShouldDiscard() {
            Path target = tempDir.resolve("out.csv");
            CsvRowSink sink = new CsvRowSink(SinkSpec.forPath(target, false));

            sink.recordRows(List.of(new BucketAssignment("r1", BucketAssignment.bucketCell("low", TS))));
            sink.close();

            assertThat(target).doesNotExist();
            assertThat(sink.getInProgressPath()).doesNotExist();
        }

        @Test
        @DisplayName("an existing target should need overwrite")
        void existingTargetShouldNeedOverwrite() throws IOException {
            Path target = tempDir.resolve("out.jsonl");
            Files.writeString(target, "old\n");

            assertThatThrownBy(() -> new JsonLinesRowSink(SinkSpec.forPath(target, false)))
                .isInstanceOf(RowSinkException.class)
                .hasMessageContaining("already exists");

            try (JsonLinesRowSink sink = new JsonLinesRowSink(SinkSpec.forPath(target, true))) {
                sink.commit();
            }
            assertThat(target).hasContent("");
        }

        @Test
        void shouldRejectRowsAfterCommit() {
            JsonLinesRowSink sink = new JsonLinesRowSink(SinkSpec.forPath(tempDir.resolve("a.jsonl"), false));
            sink.commit();

            assertThatThrownBy(() -> sink.recordRow(new NamedRow("r", List.of())))
                .isInstanceOf(RowSinkException.class)
                .hasMessageContaining("already committed");
        }
    }

    @Test
    @DisplayName("jsonl sink should write one object per row")
    void jsonLinesFormat() throws IOException {
        Path target = tempDir.resolve("rows.jsonl");
        try (RowSink sink = new JsonLinesRowSink(SinkSpec.forPath(target, false))) {
            sink.recordRows(List.of(
                new BucketAssignment("r1", BucketAssignment.bucketCell("low", TS)),
                new NamedRow("r2", List.of(
                    new Cell("n", 3L, Instant.EPOCH),
                    new Cell("f", 1.5d, Instant.EPOCH),
                    new Cell("b", true, Timestamps.NEGATIVE_INFINITY)))));
            sink.commit();
        }

        List<String> lines = Files.readAllLines(target);
        assertThat(lines).hasSize(2);
        ObjectMapper mapper = new ObjectMapper();
        JsonNode first = mapper.readTree(lines.get(0));
        assertThat(first.get("rowName").asText()).isEqualTo("r1");
        assertThat(first.at("/cells/0/column").asText()).isEqualTo("bucket");
        assertThat(first.at("/cells/0/value").asText()).isEqualTo("low");
        assertThat(first.at("/cells/0/ts").asText()).isEqualTo("2024-01-01T00:00:00Z");

        JsonNode second = mapper.readTree(lines.get(1));
        assertThat(second.at("/cells/0/value").isIntegralNumber()).isTrue();
        assertThat(second.at("/cells/1/value").doubleValue()).isEqualTo(1.5d);
        assertThat(second.at("/cells/2/value").booleanValue()).isTrue();
        assertThat(second.at("/cells/2/ts").asText()).isEqualTo("-Infinity");
    }

    @Test
    @DisplayName("csv sink should write one quoted line per cell")
    void csvFormat() throws IOException {
        Path target = tempDir.resolve("rows.csv");
        try (RowSink sink = RowSinks.open(SinkSpec.forPath(target, false))) {
            sink.recordRows(List.of(
                new BucketAssignment("r,1", BucketAssignment.bucketCell("say \"hi\"", TS)),
                new NamedRow("r2", List.of(new Cell("a", 1L, Instant.EPOCH), new Cell("b", "x", Instant.EPOCH)))));
            sink.commit();
        }

        assertThat(Files.readAllLines(target)).containsExactly(
            CsvRowSink.HEADER,
            "\"r,1\",bucket,\"say \"\"hi\"\"\",2024-01-01T00:00:00Z",
            "r2,a,1,1970-01-01T00:00:00Z",
            "r2,b,x,1970-01-01T00:00:00Z");
    }

    @Test
    void registryShouldFindBothFileSinks() {
        assertThat(RowSinks.availableTypes()).containsExactly("csv", "jsonl");
        assertThat(RowSinks.get("JSONL")).isPresent();
        assertThatThrownBy(() -> RowSinks.open(new SinkSpec("parquet", tempDir.resolve("x"), false)))
            .isInstanceOf(RowSinkException.class)
            .hasMessageContaining("No row sink found with type: parquet");
    }

    @Test
    void sinkSpecShouldPickTypeFromExtension() {
        assertThat(SinkSpec.forPath(Path.of("a.CSV"), false).type()).isEqualTo("csv");
        assertThat(SinkSpec.forPath(Path.of("a.json"), false).type()).isEqualTo("jsonl");
        assertThat(new SinkSpec("CSV", Path.of("a"), false).type()).isEqualTo("csv");
    }
}
