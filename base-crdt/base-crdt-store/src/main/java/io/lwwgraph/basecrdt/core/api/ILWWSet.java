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
import java.util.Map;

/**
 * A last-writer-wins element set. Every element keeps the latest add and the latest remove timestamp ever observed,
 * and is present only when its add timestamp is strictly greater than its remove timestamp.
 *
 * @param <E> the element type, must have consistent equals and hashCode
 * @param <T> the timestamp type
 */
public interface ILWWSet<E, T extends Comparable<? super T>> {
    /**
     * Record an add of the element. The stored add timestamp only moves forward.
     *
     * @param element the element
     * @param timestamp the timestamp of the add
     */
    void add(E element, T timestamp);

    /**
     * Record a remove of the element. The stored remove timestamp only moves forward.
     *
     * @param element the element
     * @param timestamp the timestamp of the remove
     */
    void remove(E element, T timestamp);

    /**
     * Check if the element is present. A remove wins over an add carrying the same timestamp.
     *
     * @param element the element
     * @return true if present
     */
    boolean contains(E element);

    boolean addExists(E element);

    boolean removeExists(E element);

    /**
     * The latest add timestamp of the element.
     *
     * @param element the element
     * @return the timestamp
     * @throws LWWStateException.NotFoundException if the element was never added
     */
    T addTimestamp(E element);

    /**
     * The latest remove timestamp of the element.
     *
     * @param element the element
     * @return the timestamp
     * @throws LWWStateException.NotFoundException if the element was never removed
     */
    T removeTimestamp(E element);

    /**
     * Read-only view of every recorded add.
     *
     * @return the add timestamps keyed by element
     */
    Map<E, T> addTimestamps();

    /**
     * Read-only view of every recorded remove.
     *
     * @return the remove timestamps keyed by element
     */
    Map<E, T> removeTimestamps();

    /**
     * The elements currently present, in the order they were first added.
     *
     * @return an iterator of present elements
     */
    Iterator<E> elements();

    /**
     * Join the state of another set into this one, taking the pointwise maximum of the timestamps.
     *
     * @param other the other set
     */
    void merge(ILWWSet<E, T> other);
}
