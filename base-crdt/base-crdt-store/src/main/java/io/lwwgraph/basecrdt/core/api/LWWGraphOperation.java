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

package io.lwwgraph.basecrdt.core.api;

import static com.google.common.base.Preconditions.checkNotNull;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@ToString
@EqualsAndHashCode
public final class LWWGraphOperation<E, T extends Comparable<? super T>> {
    public enum Type {
        AddVertex, RemoveVertex, AddEdge, RemoveEdge
    }

    public final Type type;
    public final E from;
    // null for vertex operations
    public final E to;
    public final T timestamp;

    public static <E, T extends Comparable<? super T>> LWWGraphOperation<E, T> addVertex(E vertex, T timestamp) {
        return new LWWGraphOperation<>(Type.AddVertex, vertex, null, timestamp);
    }

    public static <E, T extends Comparable<? super T>> LWWGraphOperation<E, T> removeVertex(E vertex, T timestamp) {
        return new LWWGraphOperation<>(Type.RemoveVertex, vertex, null, timestamp);
    }

    public static <E, T extends Comparable<? super T>> LWWGraphOperation<E, T> addEdge(E from, E to, T timestamp) {
        return new LWWGraphOperation<>(Type.AddEdge, from, checkNotNull(to), timestamp);
    }

    public static <E, T extends Comparable<? super T>> LWWGraphOperation<E, T> removeEdge(E from, E to, T timestamp) {
        return new LWWGraphOperation<>(Type.RemoveEdge, from, checkNotNull(to), timestamp);
    }

    private LWWGraphOperation(Type type, E from, E to, T timestamp) {
        this.type = type;
        this.from = checkNotNull(from);
        this.to = to;
        this.timestamp = checkNotNull(timestamp);
    }
}
