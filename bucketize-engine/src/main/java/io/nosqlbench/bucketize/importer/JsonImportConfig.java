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

import java.nio.file.Path;
import java.util.Objects;

/// Settings for a JSON-lines import.
///
/// @param dataFile the file holding one JSON object per line
/// @param offset the number of leading lines to skip
/// @param limit the maximum number of lines to process, or -1 for all
/// @param ignoreBadLines whether lines that are not JSON objects are counted and skipped
///     instead of failing the import
public record JsonImportConfig(Path dataFile, long offset, long limit, boolean ignoreBadLines) {

    public JsonImportConfig {
        Objects.requireNonNull(dataFile, "dataFile must not be null");
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        if (limit < -1) {
            throw new IllegalArgumentException("limit must be -1 (no limit) or non-negative: " + limit);
        }
    }

    /// @param dataFile the file to import
    /// @return a config importing every line and failing on the first bad one
    public static JsonImportConfig of(Path dataFile) {
        return new JsonImportConfig(dataFile, 0L, -1L, false);
    }
}
