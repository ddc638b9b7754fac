/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.proxgraph.util;

import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The standard {@link ThreadLocal} appears to be designed to be used with relatively
 * short-lived Threads.  Objects it references cannot be GC'd for the lifetime of the Thread,
 * which makes it a bad fit for the long-lived pool threads that run searches against an index.
 * <p>
 * Because ExplicitThreadLocal doesn't hook into Thread internals, any referenced values
 * can be GC'd as soon as the ETL instance itself is no longer referenced, e.g. when the
 * index that owns the per-thread searchers is closed.
 */
public abstract class ExplicitThreadLocal<U> implements AutoCloseable {
    // thread id -> instance
    private final ConcurrentHashMap<Long, U> map = new ConcurrentHashMap<>();

    // computeIfAbsent wants a callable that takes a parameter, but if we use a lambda
    // it will be a closure and we'll get a new instance for every call.  So we instantiate
    // it just once here as a field instead.
    private final Function<Long, U> initialSupplier = k -> initialValue();

    public U get() {
        return map.computeIfAbsent(Thread.currentThread().getId(), initialSupplier);
    }

    protected abstract U initialValue();

    /**
     * Invoke the close() method on all AutoCloseable values in the map, and then clear the map.
     * <p>
     * Not threadsafe.
     */
    @Override
    public void close() throws Exception {
        for (U value : map.values()) {
            if (value instanceof AutoCloseable) {
                ((AutoCloseable) value).close();
            }
        }
        map.clear();
    }

    public static <U> ExplicitThreadLocal<U> withInitial(Supplier<U> initialValue) {
        return new ExplicitThreadLocal<>() {
            @Override
            protected U initialValue() {
                return initialValue.get();
            }
        };
    }
}
