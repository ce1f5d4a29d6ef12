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

package io.lwwgraph.basecrdt.store;

import static com.google.common.base.Preconditions.checkNotNull;

import io.lwwgraph.basecrdt.codec.LWWStateCodec;
import io.lwwgraph.basecrdt.core.api.ILWWGraph;
import io.lwwgraph.basecrdt.core.api.LWWGraphOperation;
import io.lwwgraph.basecrdt.core.internal.LWWCRDTFactory;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * A replica of an LWW graph that may be shared between threads. Operations and joins are applied one at a time
 * under a write lock while queries run concurrently under a read lock. Replicas exchange state only through
 * encoded snapshots, so merging two replicas never holds both of their locks.
 *
 * @param <E> the vertex key type
 * @param <T> the timestamp type
 */
@Slf4j
public final class LWWGraphReplica<E, T extends Comparable<? super T>> {
    private final String id;
    private final ILWWGraph<E, T> graph = LWWCRDTFactory.newGraph();
    private final LWWStateCodec<E, T> codec;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public LWWGraphReplica(Class<E> elementClass, Class<T> timestampClass) {
        this(elementClass, timestampClass, ReplicaOptions.builder().build());
    }

    public LWWGraphReplica(Class<E> elementClass, Class<T> timestampClass, ReplicaOptions options) {
        this.id = checkNotNull(options.id());
        this.codec = LWWStateCodec.of(elementClass, timestampClass, options.codecOptions());
    }

    public String id() {
        return id;
    }

    public void execute(LWWGraphOperation<E, T> op) {
        checkNotNull(op);
        lock.writeLock().lock();
        try {
            graph.execute(op);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Replica[{}] executed: {}", id, op);
    }

    /**
     * Run a query against the graph under the read lock. The query must not mutate the graph or leak it.
     *
     * @param query the query
     * @return the result of the query
     */
    public <R> R read(Function<ILWWGraph<E, T>, R> query) {
        lock.readLock().lock();
        try {
            return query.apply(graph);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean containsVertex(E vertex) {
        return read(g -> g.containsVertex(vertex));
    }

    public boolean containsEdge(E from, E to) {
        return read(g -> g.containsEdge(from, to));
    }

    public Set<E> allConnectedVertices(E vertex) {
        return read(g -> g.allConnectedVertices(vertex));
    }

    public List<E> anyPath(E from, E to) {
        return read(g -> g.anyPath(from, to));
    }

    /**
     * An independent copy of the current state.
     *
     * @return the copy
     */
    public ILWWGraph<E, T> state() {
        return read(LWWCRDTFactory::copyOf);
    }

    public byte[] snapshot() {
        return read(g -> codec.encode(g));
    }

    /**
     * Join an encoded snapshot received from another replica.
     *
     * @param snapshot the encoded state
     * @throws io.lwwgraph.basecrdt.codec.CodecException if the snapshot cannot be decoded
     */
    public void join(byte[] snapshot) {
        ILWWGraph<E, T> other = codec.decodeGraph(snapshot);
        lock.writeLock().lock();
        try {
            graph.merge(other);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Replica[{}] joined snapshot of {} bytes", id, snapshot.length);
    }

    public void merge(LWWGraphReplica<E, T> other) {
        if (other == this) {
            return;
        }
        log.debug("Replica[{}] merging from replica[{}]", id, other.id);
        join(other.snapshot());
    }
}
