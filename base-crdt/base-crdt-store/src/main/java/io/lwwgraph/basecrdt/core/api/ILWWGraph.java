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

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A last-writer-wins directed graph composed of a vertex {@link ILWWSet} and one edge {@link ILWWSet} per source
 * vertex. An edge is visible only while both endpoints are visible and its add timestamp is neither older than an
 * endpoint's add nor dominated by an endpoint's remove.
 *
 * @param <E> the vertex key type
 * @param <T> the timestamp type
 */
public interface ILWWGraph<E, T extends Comparable<? super T>> {
    void addVertex(E vertex, T timestamp);

    void removeVertex(E vertex, T timestamp);

    boolean containsVertex(E vertex);

    void addEdge(E from, E to, T timestamp);

    void removeEdge(E from, E to, T timestamp);

    /**
     * Check if the directed edge is visible, taking the state of both endpoints into account.
     *
     * @param from the source vertex
     * @param to the destination vertex
     * @return true if the edge is visible
     */
    boolean containsEdge(E from, E to);

    /**
     * Apply an operation to the graph.
     *
     * @param op the operation
     */
    void execute(LWWGraphOperation<E, T> op);

    /**
     * Join the state of another replica into this one.
     *
     * @param other the other replica
     */
    void merge(ILWWGraph<E, T> other);

    /**
     * The vertices connected to the given vertex through a visible edge, in either direction. The whole edge state is
     * scanned, so the cost is linear in the number of edges ever recorded.
     *
     * @param vertex the vertex
     * @return the connected vertices
     */
    Set<E> allConnectedVertices(E vertex);

    /**
     * Find one shortest directed path over visible edges.
     *
     * @param from the source vertex
     * @param to the destination vertex
     * @return an unmodifiable list of the vertices along the path including both ends, or an empty list if no
     *     path exists
     */
    List<E> anyPath(E from, E to);

    /**
     * The vertices currently present.
     *
     * @return an iterator of present vertices
     */
    Iterator<E> vertices();

    /**
     * Read-only view of the raw vertex state.
     *
     * @return the vertex set
     */
    ILWWSet<E, T> vertexSet();

    /**
     * Read-only view of the raw edge state keyed by source vertex.
     *
     * @return the edge sets
     */
    Map<E, ILWWSet<E, T>> edgeSets();
}
