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

import io.nosqlbench.bucketize.api.RowSink;

/// Opens sinks of one type. Implementations are annotated with {@link SinkType}, have a public
/// no-argument constructor, and are listed in
/// `META-INF/services/io.nosqlbench.bucketize.sinks.RowSinkProvider`.
public interface RowSinkProvider {

    /// @param spec where and how to open the sink
    /// @return an open sink
    /// @throws io.nosqlbench.bucketize.api.RowSinkException if the sink cannot be opened
    RowSink open(SinkSpec spec);
}
