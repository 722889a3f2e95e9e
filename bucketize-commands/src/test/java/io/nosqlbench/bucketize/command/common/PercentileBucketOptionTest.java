package io.nosqlbench.bucketize.command.common;

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

import io.nosqlbench.bucketize.api.BucketConfigException;
import io.nosqlbench.bucketize.api.PercentileRange;
import io.nosqlbench.bucketize.sinks.SinkSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import picocli.CommandLine;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PercentileBucketOption")
class PercentileBucketOptionTest {

    @Nested
    @DisplayName("PercentileRangeConverter")
    class ConverterTest {

        private final PercentileBucketOption.PercentileRangeConverter converter =
            new PercentileBucketOption.PercentileRangeConverter();

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', value = {
            "low=[0,50]|low|0|50",
            "high = [ 50 , 100 ]|high|50|100",
            "mid=25..75|mid|25|75",
            "p99=99.5..100|p99|99.5|100"
        })
        void shouldParseBucket(String text, String label, double start, double end) {
            assertThat(converter.convert(text)).isEqualTo(new PercentileRange(label, start, end));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "low", "=[0,1]", "low=0-50", "low=[0,50,75]", "low=[a,b]", " =0..1"})
        void shouldRejectMalformed(String text) {
            assertThatThrownBy(() -> converter.convert(text)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @CommandLine.Command
    static class Holder {
        @CommandLine.Mixin
        PercentileBucketOption buckets = new PercentileBucketOption();

        @CommandLine.Mixin
        OutputSinkOption output = new OutputSinkOption();
    }

    @Test
    @DisplayName("should collect repeated buckets in order")
    void shouldCollectRepeatedBuckets() {
        Holder holder = new Holder();
        new CommandLine(holder).parseArgs("-b", "b=[50,100]", "--bucket", "a=0..50");

        assertThat(holder.buckets.isSpecified()).isTrue();
        assertThat(holder.buckets.getBuckets().ranges()).extracting(PercentileRange::label).containsExactly("b", "a");
    }

    @Test
    void shouldRejectRepeatedLabel() {
        Holder holder = new Holder();
        new CommandLine(holder).parseArgs("-b", "a=[0,10]", "-b", "a=[10,20]");

        assertThatThrownBy(holder.buckets::getBuckets).isInstanceOf(BucketConfigException.class);
    }

    @Test
    @DisplayName("output options should override a configured sink")
    void outputShouldOverrideConfiguredSink() {
        SinkSpec configured = new SinkSpec("csv", Path.of("configured.csv"), false);

        Holder none = new Holder();
        new CommandLine(none).parseArgs();
        assertThat(none.output.applyTo(configured)).isEqualTo(configured);
        assertThat(none.output.applyTo(null)).isNull();

        Holder holder = new Holder();
        new CommandLine(holder).parseArgs("-o", "cli.out", "--format", "jsonl", "-f");
        assertThat(holder.output.applyTo(configured)).isEqualTo(new SinkSpec("jsonl", Path.of("cli.out"), true));

        Holder fresh = new Holder();
        new CommandLine(fresh).parseArgs("-o", "fresh.csv");
        assertThat(fresh.output.applyTo(null)).isEqualTo(new SinkSpec("csv", Path.of("fresh.csv"), false));
    }
}
