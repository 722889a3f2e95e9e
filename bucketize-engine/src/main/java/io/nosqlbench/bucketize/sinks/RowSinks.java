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
import io.nosqlbench.bucketize.api.RowSinkException;

import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Finds {@link RowSinkProvider}s through {@link ServiceLoader} by their {@link SinkType} name.
///
/// ```java
/// try (RowSink sink = RowSinks.open(new SinkSpec("csv", Path.of("out.csv"), true))) {
///     sink.recordRows(rows);
///     sink.commit();
/// }
/// ```
public final class RowSinks {

    private static final ServiceLoader<RowSinkProvider> serviceLoader =
        ServiceLoader.load(RowSinkProvider.class);

    private RowSinks() {
    }

    /// @param type a sink type name
    /// @return a new provider instance for the type, if one is registered
    public static Optional<RowSinkProvider> get(String type) {
        synchronized (serviceLoader) {
            return providers()
                .filter(provider -> typeOf(provider.type()).equalsIgnoreCase(type))
                .findFirst()
                .map(ServiceLoader.Provider::get);
        }
    }

    /// Open a sink for the spec.
    /// @param spec the sink type, path and overwrite policy
    /// @return the open sink
    /// @throws RowSinkException if the type is unknown or the sink cannot be opened
    public static RowSink open(SinkSpec spec) {
        RowSinkProvider provider = get(spec.type()).orElseThrow(() -> new RowSinkException(
            "No row sink found with type: " + spec.type() + ". Available: " + availableTypes()));
        return provider.open(spec);
    }

    /// @return the names of all registered sink types
    public static List<String> availableTypes() {
        synchronized (serviceLoader) {
            return providers().map(provider -> typeOf(provider.type())).sorted().collect(Collectors.toList());
        }
    }

    private static Stream<ServiceLoader.Provider<RowSinkProvider>> providers() {
        return serviceLoader.stream();
    }

    private static String typeOf(Class<? extends RowSinkProvider> providerType) {
        SinkType annotation = providerType.getAnnotation(SinkType.class);
        return annotation != null ? annotation.value() : providerType.getSimpleName();
    }
}
