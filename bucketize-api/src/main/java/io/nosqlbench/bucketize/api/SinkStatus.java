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

/// The status a sink reports after commit.
///
/// @param sinkType the registered sink type name
/// @param location where the rows went, or a description for non-file sinks
/// @param rowCount the number of rows recorded
/// @param cellCount the number of cells recorded
public record SinkStatus(String sinkType, String location, long rowCount, long cellCount) {
}
