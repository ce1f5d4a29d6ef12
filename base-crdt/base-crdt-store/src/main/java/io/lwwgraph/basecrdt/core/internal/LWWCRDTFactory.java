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

import io.lwwgraph.basecrdt.core.api.ILWWGraph;
import io.lwwgraph.basecrdt.core.api.ILWWSet;

public final class LWWCRDTFactory {
    private LWWCRDTFactory() {
    }

    public static <E, T extends Comparable<? super T>> ILWWSet<E, T> newSet() {
        return new LWWSet<>();
    }

    public static <E, T extends Comparable<? super T>> ILWWGraph<E, T> newGraph() {
        return new LWWGraph<>();
    }

    /**
     * Create an independent replica carrying the same raw state as the given graph.
     *
     * @param graph the graph to copy
     * @return the copy
     */
    public static <E, T extends Comparable<? super T>> ILWWGraph<E, T> copyOf(ILWWGraph<E, T> graph) {
        ILWWGraph<E, T> copy = new LWWGraph<>();
        copy.merge(graph);
        return copy;
    }
}
