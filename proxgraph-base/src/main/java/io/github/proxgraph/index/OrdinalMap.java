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

package io.github.proxgraph.index;

import io.github.proxgraph.exceptions.InternalInconsistencyException;
import io.github.proxgraph.util.DenseIntMap;
import io.github.proxgraph.vector.types.VectorFloat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Translates between caller-assigned vector ids and the dense graph ordinals they were given.
 * <p>
 * Every graph node has an id.  Only live nodes are reachable from their id: a tombstoned node keeps its id
 * until it is purged, but the id may meanwhile be reused by a fresh insert under a new ordinal.  When that
 * happens the stored record is overwritten, so the old node's vector is kept here until the purge.
 */
final class OrdinalMap {
    private final DenseIntMap<Long> ordinalToId = new DenseIntMap<>(1024);
    private final ConcurrentHashMap<Long, Integer> liveOrdinals = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Integer, VectorFloat<?>> retired = new ConcurrentHashMap<>();
    private final AtomicInteger nextOrdinal;

    OrdinalMap(int nextOrdinal) {
        this.nextOrdinal = new AtomicInteger(nextOrdinal);
    }

    int allocate() {
        return nextOrdinal.getAndIncrement();
    }

    int nextOrdinal() {
        return nextOrdinal.get();
    }

    void ensureNextOrdinalAbove(int ordinal) {
        nextOrdinal.accumulateAndGet(ordinal + 1, Math::max);
    }

    /**
     * Records that {@code ordinal} holds {@code id}; if {@code live}, the id resolves to it.
     */
    void register(int ordinal, long id, boolean live) {
        if (!ordinalToId.compareAndPut(ordinal, null, id)) {
            throw new IllegalStateException("Ordinal " + ordinal + " is already assigned to " + ordinalToId.get(ordinal));
        }
        if (live) {
            liveOrdinals.put(id, ordinal);
        }
    }

    /**
     * Makes the id resolve to an ordinal it was registered under.
     */
    void link(long id, int ordinal) {
        liveOrdinals.put(id, ordinal);
    }

    /**
     * @throws InternalInconsistencyException if the ordinal was never assigned
     */
    long idOf(int ordinal) {
        Long id = ordinalToId.get(ordinal);
        if (id == null) {
            throw new InternalInconsistencyException("Graph node " + ordinal + " has no vector id");
        }
        return id;
    }

    boolean hasOrdinal(int ordinal) {
        return ordinalToId.containsKey(ordinal);
    }

    /**
     * @return the live ordinal of the id, or -1
     */
    int liveOrdinal(long id) {
        Integer ordinal = liveOrdinals.get(id);
        return ordinal == null ? -1 : ordinal;
    }

    /**
     * Detaches the id from its live ordinal; the ordinal itself stays assigned until {@link #forget}.
     *
     * @return the ordinal, or -1 if the id was not live
     */
    int unlink(long id) {
        Integer ordinal = liveOrdinals.remove(id);
        return ordinal == null ? -1 : ordinal;
    }

    void retire(int ordinal, VectorFloat<?> vector) {
        retired.put(ordinal, vector);
    }

    /**
     * @return the vector kept for a tombstoned ordinal whose record was overwritten, or null
     */
    VectorFloat<?> retiredVector(int ordinal) {
        return retired.get(ordinal);
    }

    /**
     * Removes a purged ordinal.
     *
     * @return the id it held
     */
    long forget(int ordinal) {
        retired.remove(ordinal);
        Long id = ordinalToId.remove(ordinal);
        if (id == null) {
            throw new InternalInconsistencyException("Purged graph node " + ordinal + " had no vector id");
        }
        return id;
    }

    int liveCount() {
        return liveOrdinals.size();
    }

    /**
     * @return a snapshot of the live ordinals, ascending
     */
    List<Integer> liveOrdinals() {
        var ordinals = new ArrayList<>(liveOrdinals.values());
        Collections.sort(ordinals);
        return ordinals;
    }
}
