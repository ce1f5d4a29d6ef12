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

import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import io.lwwgraph.basecrdt.core.api.ILWWGraph;
import io.lwwgraph.basecrdt.core.api.ILWWSet;
import io.lwwgraph.basecrdt.core.api.LWWGraphOperation;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

@Slf4j
final class LWWGraph<E, T extends Comparable<? super T>> implements ILWWGraph<E, T> {
    private final LWWSet<E, T> vertices = new LWWSet<>();
    // source vertex -> destination vertices, entries are never dropped
    private final Map<E, LWWSet<E, T>> edges = Maps.newLinkedHashMap();

    @Override
    public void addVertex(E vertex, T timestamp) {
        vertices.add(vertex, timestamp);
    }

    @Override
    public void removeVertex(E vertex, T timestamp) {
        vertices.remove(vertex, timestamp);
    }

    @Override
    public boolean containsVertex(E vertex) {
        return vertices.contains(vertex);
    }

    @Override
    public void addEdge(E from, E to, T timestamp) {
        edgeSet(checkNotNull(from)).add(to, timestamp);
    }

    @Override
    public void removeEdge(E from, E to, T timestamp) {
        edgeSet(checkNotNull(from)).remove(to, timestamp);
    }

    @Override
    public boolean containsEdge(E from, E to) {
        LWWSet<E, T> outgoing = edges.get(from);
        if (outgoing == null || !outgoing.contains(to)) {
            return false;
        }
        if (!containsVertex(from) || !containsVertex(to)) {
            return false;
        }
        T added = outgoing.addTimestamp(to);
        // an endpoint removed at or after the edge was added hides the edge
        if (removedNoEarlierThan(from, added) || removedNoEarlierThan(to, added)) {
            return false;
        }
        // an edge never predates its endpoints
        return added.compareTo(vertices.addTimestamp(from)) >= 0 && added.compareTo(vertices.addTimestamp(to)) >= 0;
    }

    @Override
    public void execute(LWWGraphOperation<E, T> op) {
        switch (op.type) {
            case AddVertex:
                addVertex(op.from, op.timestamp);
                break;
            case RemoveVertex:
                removeVertex(op.from, op.timestamp);
                break;
            case AddEdge:
                addEdge(op.from, op.to, op.timestamp);
                break;
            case RemoveEdge:
                removeEdge(op.from, op.to, op.timestamp);
                break;
            default:
                throw new UnsupportedOperationException("Unknown operation type: " + op.type);
        }
    }

    @Override
    public void merge(ILWWGraph<E, T> other) {
        vertices.merge(other.vertexSet());
        Map<E, ILWWSet<E, T>> otherEdges = other.edgeSets();
        otherEdges.forEach((from, outgoing) -> edgeSet(from).merge(outgoing));
        if (log.isTraceEnabled()) {
            log.trace("Merged graph state: vertices={}, edgeSources={}", other.vertexSet().addTimestamps().size(),
                otherEdges.size());
        }
    }

    @Override
    public Set<E> allConnectedVertices(E vertex) {
        Set<E> connected = Sets.newLinkedHashSet();
        edges.forEach((from, outgoing) -> {
            if (from.equals(vertex)) {
                for (E to : outgoing.addTimestamps().keySet()) {
                    if (containsEdge(from, to)) {
                        connected.add(to);
                    }
                }
            } else if (outgoing.addExists(vertex) && containsEdge(from, vertex)) {
                connected.add(from);
            }
        });
        return connected;
    }

    @Override
    public List<E> anyPath(E from, E to) {
        if (!containsVertex(from) || !containsVertex(to)) {
            return Collections.emptyList();
        }
        Deque<E> queue = new ArrayDeque<>();
        Map<E, E> previous = Maps.newHashMap();
        queue.add(from);
        previous.put(from, from);
        while (!queue.isEmpty()) {
            E current = queue.poll();
            if (current.equals(to)) {
                return backtrack(previous, from, current);
            }
            LWWSet<E, T> outgoing = edges.get(current);
            if (outgoing == null) {
                // never had an outgoing edge
                continue;
            }
            for (E next : outgoing.addTimestamps().keySet()) {
                if (!previous.containsKey(next) && containsEdge(current, next)) {
                    previous.put(next, current);
                    queue.add(next);
                }
            }
        }
        return Collections.emptyList();
    }

    @Override
    public Iterator<E> vertices() {
        return vertices.elements();
    }

    @Override
    public ILWWSet<E, T> vertexSet() {
        return new UnmodifiableLWWSet<>(vertices);
    }

    @Override
    public Map<E, ILWWSet<E, T>> edgeSets() {
        Map<E, ILWWSet<E, T>> view = Maps.transformValues(edges, outgoing -> new UnmodifiableLWWSet<>(outgoing));
        return Collections.unmodifiableMap(view);
    }

    private LWWSet<E, T> edgeSet(E from) {
        return edges.computeIfAbsent(from, k -> new LWWSet<>());
    }

    private boolean removedNoEarlierThan(E vertex, T timestamp) {
        return vertices.removeExists(vertex) && timestamp.compareTo(vertices.removeTimestamp(vertex)) <= 0;
    }

    private static <E> List<E> backtrack(Map<E, E> previous, E from, E to) {
        List<E> path = new ArrayList<>();
        E step = to;
        while (!step.equals(from)) {
            path.add(step);
            step = previous.get(step);
        }
        path.add(from);
        Collections.reverse(path);
        return Collections.unmodifiableList(path);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LWWGraph)) {
            return false;
        }
        LWWGraph<?, ?> that = (LWWGraph<?, ?>) o;
        return vertices.equals(that.vertices) && edges.equals(that.edges);
    }

    @Override
    public int hashCode() {
        return 31 * vertices.hashCode() + edges.hashCode();
    }

    @Override
    public String toString() {
        return "LWWGraph{vertices=" + vertices + ", edges=" + edges + '}';
    }
}
