package io.nosqlbench.bucketize.sources;

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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OrderByTest {

    @Test
    void shouldParseClauses() {
        OrderBy orderBy = OrderBy.parse(" score DESC , name,age asc ");

        assertThat(orderBy.clauses()).containsExactly(
            new OrderBy.Clause("score", true),
            new OrderBy.Clause("name", false),
            new OrderBy.Clause("age", false));
        assertThat(orderBy.toString()).isEqualTo("score DESC, name ASC, age ASC");
    }

    @Test
    void blankShouldMeanNoOrder() {
        assertThat(OrderBy.parse("  ").isEmpty()).isTrue();
        assertThat(OrderBy.parse(null)).isSameAs(OrderBy.NONE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"score SIDEWAYS", "a b c", "score,,name"})
    void shouldRejectMalformedClauses(String text) {
        assertThatThrownBy(() -> OrderBy.parse(text)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void jsonValuesShouldOrderByKindThenValue() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        List<JsonNode> values = new ArrayList<>();
        for (String json : List.of("\"b\"", "10", "{\"a\":1}", "true", "null", "2.5", "\"a\"", "false", "-3")) {
            values.add(mapper.readTree(json));
        }

        values.sort(JsonValueOrder.INSTANCE);

        assertThat(values).extracting(JsonNode::toString)
            .containsExactly("null", "false", "true", "-3", "2.5", "10", "\"a\"", "\"b\"", "{\"a\":1}");
    }
}
