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

import java.time.Instant;

/// The outcome of rank resolution: the ordered row identifiers and the representative timestamp.
///
/// @param rows row identifiers in rank order
/// @param representativeTimestamp the latest order-by key timestamp seen, or negative infinity
public record RankResolution(OrderedRowSequence rows, Instant representativeTimestamp) {

    public long rowCount() {
        return rows.size();
    }
}
