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

import io.nosqlbench.bucketize.api.OrderedRowSource;
import io.nosqlbench.bucketize.api.RankedRow;
import io.nosqlbench.bucketize.api.Timestamps;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/// Reads the rows of an ordered source once, keeping their order and folding every valid
/// order-by key timestamp into a running maximum.
public final class RankResolver {
    private static final Logger logger = LogManager.getLogger(RankResolver.class);

    private RankResolver() {
    }

    /// @param source the rows in their final order
    /// @return the ordered identifiers and the representative timestamp
    public static RankResolution resolve(OrderedRowSource source) {
        List<String> rowNames = new ArrayList<>();
        Instant latest = Timestamps.NEGATIVE_INFINITY;

        for (RankedRow row : source) {
            for (Instant keyTimestamp : row.keyTimestamps()) {
                if (Timestamps.isADate(keyTimestamp)) {
                    latest = Timestamps.max(latest, keyTimestamp);
                }
            }
            rowNames.add(row.rowName());
        }

        logger.debug("Row count: {}", rowNames.size());
        logger.debug("Representative timestamp: {}", Timestamps.format(latest));
        return new RankResolution(OrderedRowSequence.of(rowNames), latest);
    }
}
