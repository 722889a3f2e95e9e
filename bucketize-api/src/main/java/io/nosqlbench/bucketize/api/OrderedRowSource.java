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

/// The already-bound, already-filtered rows of a run, in their final rank order.
///
/// Iteration must yield one consistent total order; rank `i` is the `i`-th row yielded.
public interface OrderedRowSource extends Iterable<RankedRow> {

    /// @return a short description of where the rows come from, for logging
    default String describe() {
        return getClass().getSimpleName();
    }
}
