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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/// The fields rows are ranked by, most significant first.
///
/// Parsed from text of the form `field [ASC|DESC], field [ASC|DESC], ...`. An empty order keeps
/// the rows in file order.
///
/// @param clauses the order-by clauses
public record OrderBy(List<Clause> clauses) {

    /// Keep rows in file order
    public static final OrderBy NONE = new OrderBy(List.of());

    public OrderBy {
        clauses = List.copyOf(clauses);
    }

    /// One order-by field.
    ///
    /// @param field the top level JSON field name
    /// @param descending true for descending order
    public record Clause(String field, boolean descending) {
        public Clause {
            if (field == null || field.isBlank()) {
                throw new IllegalArgumentException("order-by field must not be blank");
            }
        }

        @Override
        public String toString() {
            return field + (descending ? " DESC" : " ASC");
        }
    }

    /// @param text the order-by text, may be null or blank for no ordering
    /// @return the parsed order
    /// @throws IllegalArgumentException if a clause is malformed
    public static OrderBy parse(String text) {
        if (text == null || text.isBlank()) {
            return NONE;
        }
        List<Clause> clauses = new ArrayList<>();
        for (String part : text.split(",")) {
            String[] words = part.trim().split("\\s+");
            if (words.length == 0 || words[0].isEmpty() || words.length > 2) {
                throw new IllegalArgumentException("Invalid order-by clause: '" + part.trim()
                    + "'. Expected: field [ASC|DESC]");
            }
            boolean descending = false;
            if (words.length == 2) {
                switch (words[1].toUpperCase(Locale.ROOT)) {
                    case "ASC" -> descending = false;
                    case "DESC" -> descending = true;
                    default -> throw new IllegalArgumentException("Invalid order-by direction '" + words[1]
                        + "' in clause '" + part.trim() + "'. Expected ASC or DESC");
                }
            }
            clauses.add(new Clause(words[0], descending));
        }
        return new OrderBy(clauses);
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    @Override
    public String toString() {
        return String.join(", ", clauses.stream().map(Clause::toString).toList());
    }
}
