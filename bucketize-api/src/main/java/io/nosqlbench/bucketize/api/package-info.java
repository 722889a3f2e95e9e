/// Contracts shared by the bucketize modules.
///
/// ## Key Components
///
/// - {@link io.nosqlbench.bucketize.api.PercentileRange} and
///   {@link io.nosqlbench.bucketize.api.PercentileBuckets}: bucket definitions
/// - {@link io.nosqlbench.bucketize.api.OrderedRowSource}: rows in rank order, from the ordering step
/// - {@link io.nosqlbench.bucketize.api.RowRecord}, {@link io.nosqlbench.bucketize.api.Cell}: rows as written
/// - {@link io.nosqlbench.bucketize.api.RowSink}: the output destination
/// - {@link io.nosqlbench.bucketize.api.BucketizeException} and its subtypes: the error taxonomy
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
