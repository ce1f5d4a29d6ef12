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

import io.lwwgraph.basecrdt.core.api.ILWWSet;
import java.util.Iterator;
import java.util.Map;

/**
 * Read-only view over a set owned by a graph. Mutations must go through the owning graph.
 */
final class UnmodifiableLWWSet<E, T extends Comparable<? super T>> implements ILWWSet<E, T> {
    private final ILWWSet<E, T> delegate;

    UnmodifiableLWWSet(ILWWSet<E, T> delegate) {
        this.delegate = delegate;
    }

    @Override
    public void add(E element, T timestamp) {
        throw new UnsupportedOperationException("Read-only view");
    }

    @Override
    public void remove(E element, T timestamp) {
        throw new UnsupportedOperationException("Read-only view");
    }

    @Override
    public boolean contains(E element) {
        return delegate.contains(element);
    }

    @Override
    public boolean addExists(E element) {
        return delegate.addExists(element);
    }

    @Override
    public boolean removeExists(E element) {
        return delegate.removeExists(element);
    }

    @Override
    public T addTimestamp(E element) {
        return delegate.addTimestamp(element);
    }

    @Override
    public T removeTimestamp(E element) {
        return delegate.removeTimestamp(element);
    }

    @Override
    public Map<E, T> addTimestamps() {
        return delegate.addTimestamps();
    }

    @Override
    public Map<E, T> removeTimestamps() {
        return delegate.removeTimestamps();
    }

    @Override
    public Iterator<E> elements() {
        return delegate.elements();
    }

    @Override
    public void merge(ILWWSet<E, T> other) {
        throw new UnsupportedOperationException("Read-only view");
    }

    @Override
    public boolean equals(Object o) {
        return this == o || delegate.equals(o);
    }

    @Override
    public int hashCode() {
        return delegate.hashCode();
    }

    @Override
    public String toString() {
        return delegate.toString();
    }
}
