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

/// Receives progress updates from a bucketize run.
@FunctionalInterface
public interface ProgressCallback {

    /// A callback that ignores all updates
    ProgressCallback NONE = (progress, message) -> {
    };

    /// @param progress completion from 0.0 to 1.0
    /// @param message a short description of the step just completed
    void onProgress(double progress, String message);
}
