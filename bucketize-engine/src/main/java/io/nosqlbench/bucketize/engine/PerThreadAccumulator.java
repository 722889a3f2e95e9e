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

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;
import java.util.function.Supplier;

/// One lazily created value per thread, with a registry of every value handed out so that all of
/// them can be visited once the threads are done.
///
/// Each value is only touched by the thread that created it until {@link #forEach(Consumer)} is
/// called, which must happen after those threads have finished with it.
///
/// @param <T> the per-thread value type
public final class PerThreadAccumulator<T> {

    private final Queue<T> created = new ConcurrentLinkedQueue<>();
    private final ThreadLocal<T> local;

    /// @param factory creates the value for a thread on first use
    public PerThreadAccumulator(Supplier<T> factory) {
        this.local = ThreadLocal.withInitial(() -> {
            T value = factory.get();
            created.add(value);
            return value;
        });
    }

    /// @return the calling thread's value, created on first call
    public T get() {
        return local.get();
    }

    /// @return the number of values created so far
    public int size() {
        return created.size();
    }

    /// Visit every value created so far, once each.
    /// @param visitor the action for each value
    public void forEach(Consumer<? super T> visitor) {
        created.forEach(visitor);
    }
}
