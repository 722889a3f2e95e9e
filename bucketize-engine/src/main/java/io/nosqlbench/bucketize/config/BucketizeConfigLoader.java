package io.nosqlbench.bucketize.config;

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

import io.nosqlbench.bucketize.api.BucketConfigException;
import io.nosqlbench.bucketize.api.PercentileBuckets;
import io.nosqlbench.bucketize.engine.RangeValidator;
import io.nosqlbench.bucketize.sinks.SinkSpec;
import io.nosqlbench.bucketize.sources.JsonLinesSourceSpec;
import io.nosqlbench.bucketize.sources.OrderBy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Reads a [BucketizeConfig] from YAML or JSON.
///
/// ```yaml
/// percentileBuckets:
///   low: [0, 50]
///   high: [50, 100]
/// flushThreshold: 1024
/// parallelism: 4
/// input:
///   path: rows.jsonl
///   orderBy: score DESC
///   timestampField: ts
/// output:
///   type: csv
///   path: buckets.csv
///   overwrite: true
/// ```
///
/// Relative input and output paths resolve against the directory of the configuration file.
/// The buckets are validated as soon as they are read.
public class BucketizeConfigLoader {
    private static final Logger logger = LogManager.getLogger(BucketizeConfigLoader.class);

    private static final Set<String> TOP_KEYS = Set.of("percentileBuckets", "flushThreshold", "parallelism", "input", "output");
    private static final Set<String> INPUT_KEYS = Set.of("path", "orderBy", "rowNameField", "timestampField", "offset", "limit");
    private static final Set<String> OUTPUT_KEYS = Set.of("type", "path", "overwrite");

    private BucketizeConfigLoader() {
    }

    /// @param file a YAML or JSON configuration file
    /// @return the configuration
    /// @throws BucketConfigException if the file cannot be read or is malformed
    public static BucketizeConfig load(Path file) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BucketConfigException("Unable to read configuration file " + file, e);
        }
        Path parent = file.toAbsolutePath().getParent();
        return parse(text, file.toString(), parent);
    }

    /// @param text YAML or JSON configuration text
    /// @param origin a name for the text in error messages
    /// @return the configuration, with relative paths as given
    public static BucketizeConfig parse(String text, String origin) {
        return parse(text, origin, null);
    }

    private static BucketizeConfig parse(String text, String origin, Path baseDir) {
        LoadSettings loadSettings = LoadSettings.builder().setLabel(origin).build();
        Load yaml = new Load(loadSettings);
        Object loaded;
        try {
            loaded = yaml.loadFromString(text);
        } catch (YamlEngineException e) {
            throw new BucketConfigException("Unable to parse configuration " + origin + ": " + e.getMessage(), e);
        }
        Map<String, Object> cfgmap = asMap(loaded, origin);
        checkKeys(cfgmap, TOP_KEYS, origin);

        BucketizeConfig config = BucketizeConfig.defaults();
        if (cfgmap.containsKey("percentileBuckets")) {
            config = config.withPercentileBuckets(readBuckets(cfgmap.get("percentileBuckets"), origin));
        }
        if (cfgmap.containsKey("flushThreshold")) {
            config = config.withFlushThreshold(toInt(cfgmap.get("flushThreshold"), "flushThreshold", origin));
        }
        if (cfgmap.containsKey("parallelism")) {
            config = config.withParallelism(toInt(cfgmap.get("parallelism"), "parallelism", origin));
        }
        if (cfgmap.get("input") != null) {
            config = config.withInput(readInput(asMap(cfgmap.get("input"), origin + " input"), origin, baseDir));
        }
        if (cfgmap.get("output") != null) {
            config = config.withOutput(readOutput(asMap(cfgmap.get("output"), origin + " output"), origin, baseDir));
        }

        RangeValidator.validate(config.percentileBuckets());
        logger.debug("Loaded {} buckets from {}", config.percentileBuckets().size(), origin);
        return config;
    }

    private static PercentileBuckets readBuckets(Object value, String origin) {
        Map<String, Object> buckets = asMap(value, origin + " percentileBuckets");
        PercentileBuckets.Builder builder = PercentileBuckets.builder();
        for (Map.Entry<String, Object> entry : buckets.entrySet()) {
            if (!(entry.getValue() instanceof List<?> bounds) || bounds.size() != 2) {
                throw new BucketConfigException("Bucket '" + entry.getKey() + "' in " + origin
                    + " must be a two element list [start, end], but was " + entry.getValue());
            }
            double start = toDouble(bounds.get(0), entry.getKey(), origin);
            double end = toDouble(bounds.get(1), entry.getKey(), origin);
            builder.add(entry.getKey(), start, end);
        }
        return builder.build();
    }

    private static JsonLinesSourceSpec readInput(Map<String, Object> input, String origin, Path baseDir) {
        checkKeys(input, INPUT_KEYS, origin + " input");
        Object path = input.get("path");
        if (path == null) {
            throw new BucketConfigException("input in " + origin + " requires a path");
        }
        JsonLinesSourceSpec spec = JsonLinesSourceSpec.of(resolve(path.toString(), baseDir));
        try {
            if (input.get("orderBy") != null) {
                spec = spec.withOrderBy(OrderBy.parse(input.get("orderBy").toString()));
            }
            if (input.get("rowNameField") != null) {
                spec = spec.withRowNameField(input.get("rowNameField").toString());
            }
            if (input.get("timestampField") != null) {
                spec = spec.withTimestampField(input.get("timestampField").toString());
            }
            if (input.containsKey("offset")) {
                spec = spec.withOffset(toLong(input.get("offset"), "offset", origin));
            }
            if (input.containsKey("limit")) {
                spec = spec.withLimit(toLong(input.get("limit"), "limit", origin));
            }
        } catch (IllegalArgumentException e) {
            throw new BucketConfigException("Invalid input in " + origin + ": " + e.getMessage(), e);
        }
        return spec;
    }

    private static SinkSpec readOutput(Map<String, Object> output, String origin, Path baseDir) {
        checkKeys(output, OUTPUT_KEYS, origin + " output");
        Object path = output.get("path");
        if (path == null) {
            throw new BucketConfigException("output in " + origin + " requires a path");
        }
        boolean overwrite = false;
        Object overwriteValue = output.get("overwrite");
        if (overwriteValue != null) {
            if (!(overwriteValue instanceof Boolean flag)) {
                throw new BucketConfigException("output overwrite in " + origin + " must be true or false");
            }
            overwrite = flag;
        }
        SinkSpec spec = SinkSpec.forPath(resolve(path.toString(), baseDir), overwrite);
        if (output.get("type") != null) {
            spec = spec.withType(output.get("type").toString());
        }
        return spec;
    }

    private static Path resolve(String path, Path baseDir) {
        Path p = Path.of(path);
        return baseDir == null || p.isAbsolute() ? p : baseDir.resolve(p);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map)) {
            throw new BucketConfigException("Expected a map for " + what + ", but found "
                + (value == null ? "nothing" : value.getClass().getSimpleName()));
        }
        return (Map<String, Object>) value;
    }

    private static void checkKeys(Map<String, Object> map, Set<String> allowed, String what) {
        for (String key : map.keySet()) {
            if (!allowed.contains(key)) {
                throw new BucketConfigException("Unknown key '" + key + "' in " + what
                    + ". Valid keys are " + allowed.stream().sorted().toList());
            }
        }
    }

    private static double toDouble(Object value, String label, String origin) {
        if (!(value instanceof Number number)) {
            throw new BucketConfigException("Bucket '" + label + "' in " + origin
                + " has a non-numeric bound: " + value);
        }
        return number.doubleValue();
    }

    private static long toLong(Object value, String name, String origin) {
        if (!(value instanceof Integer || value instanceof Long || value instanceof BigInteger)) {
            throw new BucketConfigException(name + " in " + origin + " must be an integer, but was " + value);
        }
        return ((Number) value).longValue();
    }

    private static int toInt(Object value, String name, String origin) {
        long longValue = toLong(value, name, origin);
        if (longValue > Integer.MAX_VALUE || longValue < Integer.MIN_VALUE) {
            throw new BucketConfigException(name + " in " + origin + " is out of range: " + value);
        }
        return (int) longValue;
    }
}
