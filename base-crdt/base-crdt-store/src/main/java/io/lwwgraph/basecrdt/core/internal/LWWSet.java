/*
 * Copyright (c) 2024. The LWWGraph Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *    http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and limitations under the License.
 */

package io.lwwgraph.basecrdt.core.internal;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.Iterators;
import com.google.common.collect.Maps;
import io.lwwgraph.basecrdt.core.api.ILWWSet;
import io.lwwgraph.basecrdt.core.api.LWWStateException;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;

final class LWWSet<E, T extends Comparable<? super T>> implements ILWWSet<E, T> {
    private final Map<E, T> adds = Maps.newLinkedHashMap();
    private final Map<E, T> removes = Maps.newLinkedHashMap();

    @Override
    public void add(E element, T timestamp) {
        join(adds, checkNotNull(element), checkNotNull(timestamp));
    }

    @Override
    public void remove(E element, T timestamp) {
        join(removes, checkNotNull(element), checkNotNull(timestamp));
    }

    @Override
    public boolean contains(E element) {
        T added = adds.get(element);
        if (added == null) {
            return false;
        }
        T removed = removes.get(element);
        if (removed == null) {
            return true;
        }
        return added.compareTo(removed) > 0;
    }

    @Override
    public boolean addExists(E element) {
        return adds.containsKey(element);
    }

    @Override
    public boolean removeExists(E element) {
        return removes.containsKey(element);
    }

    @Override
    public T addTimestamp(E element) {
        T added = adds.get(element);
        if (added == null) {
            throw LWWStateException.addNotFound(element);
        }
        return added;
    }

    @Override
    public T removeTimestamp(E element) {
        T removed = removes.get(element);
        if (removed == null) {
            throw LWWStateException.removeNotFound(element);
        }
        return removed;
    }

    @Override
    public Map<E, T> addTimestamps() {
        return Collections.unmodifiableMap(adds);
    }

    @Override
    public Map<E, T> removeTimestamps() {
        return Collections.unmodifiableMap(removes);
    }

    @Override
    public Iterator<E> elements() {
        return Iterators.unmodifiableIterator(Iterators.filter(adds.keySet().iterator(), this::contains));
    }

    @Override
    public void merge(ILWWSet<E, T> other) {
        other.addTimestamps().forEach(this::add);
        other.removeTimestamps().forEach(this::remove);
    }

    private static <E, T extends Comparable<? super T>> void join(Map<E, T> timestamps, E element, T timestamp) {
        timestamps.merge(element, timestamp, (existing, t) -> existing.compareTo(t) >= 0 ? existing : t);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ILWWSet)) {
            return false;
        }
        ILWWSet<?, ?> that = (ILWWSet<?, ?>) o;
        return adds.equals(that.addTimestamps()) && removes.equals(that.removeTimestamps());
    }

    @Override
    public int hashCode() {
        return 31 * adds.hashCode() + removes.hashCode();
    }

    @Override
    public String toString() {
        return "LWWSet{adds=" + adds + ", removes=" + removes + '}';
    }
}
