package io.nosqlbench.bucketize.importer;

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

import io.nosqlbench.bucketize.api.SinkStatus;

/// @param rowCount the number of rows recorded
/// @param numLineErrors the number of lines skipped because they were not JSON objects
/// @param sinkStatus the status reported by the sink at commit
public record ImportResult(long rowCount, long numLineErrors, SinkStatus sinkStatus) {
}
