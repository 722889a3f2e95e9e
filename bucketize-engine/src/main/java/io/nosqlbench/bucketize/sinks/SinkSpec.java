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

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/// Where a run writes its rows.
///
/// @param type the registered sink type, e.g. `jsonl` or `csv`
/// @param path the output file
/// @param overwrite whether an existing output file may be replaced
public record SinkSpec(String type, Path path, boolean overwrite) {

    /// The sink type used when none is given and the file extension does not name one
    public static final String DEFAULT_TYPE = "jsonl";

    public SinkSpec {
        Objects.requireNonNull(type, "sink type must not be null");
        Objects.requireNonNull(path, "sink path must not be null");
        type = type.toLowerCase(Locale.ROOT);
    }

    /// Pick the sink type from the file extension: `.csv` selects `csv`, anything else `jsonl`.
    /// @param path the output file
    /// @param overwrite whether an existing output file may be replaced
    /// @return the sink spec
    public static SinkSpec forPath(Path path, boolean overwrite) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return new SinkSpec(name.endsWith(".csv") ? "csv" : DEFAULT_TYPE, path, overwrite);
    }

    public SinkSpec withType(String newType) {
        return new SinkSpec(newType, path, overwrite);
    }

    public SinkSpec withPath(Path newPath) {
        return new SinkSpec(type, newPath, overwrite);
    }

    public SinkSpec withOverwrite(boolean newOverwrite) {
        return new SinkSpec(type, path, newOverwrite);
    }
}
