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

package io.lwwgraph.basecrdt.codec;

import static com.google.common.base.Preconditions.checkNotNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.lwwgraph.basecrdt.core.api.ILWWGraph;
import io.lwwgraph.basecrdt.core.api.ILWWSet;
import io.lwwgraph.basecrdt.core.internal.LWWCRDTFactory;
import java.io.IOException;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Encodes the raw state of LWW sets and graphs as UTF-8 JSON, so that replicas can exchange full snapshots.
 *
 * <p>A set is encoded as {@code {"adds":[{"e":..,"t":..}],"removes":[..]}}. A graph is encoded as
 * {@code {"vertices":<set>,"edges":[{"from":..,"adds":[..],"removes":[..]}]}}. Elements and timestamps are
 * written with Jackson's default data binding for their types. Decoding a snapshot yields a state equal to
 * the encoded one.
 *
 * @param <E> the element type
 * @param <T> the timestamp type
 */
public final class LWWStateCodec<E, T extends Comparable<? super T>> {
    private static final String ADDS = "adds";
    private static final String REMOVES = "removes";
    private static final String ELEMENT = "e";
    private static final String TIMESTAMP = "t";
    private static final String VERTICES = "vertices";
    private static final String EDGES = "edges";
    private static final String FROM = "from";

    private final ObjectMapper mapper;
    private final JavaType elementType;
    private final JavaType timestampType;
    private final int maxSnapshotBytes;

    private LWWStateCodec(Class<E> elementClass, Class<T> timestampClass, CodecOptions options) {
        this.mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.INDENT_OUTPUT, options.prettyPrint());
        // timestamps decode exactly or not at all
        mapper.configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
        this.elementType = mapper.constructType(checkNotNull(elementClass));
        this.timestampType = mapper.constructType(checkNotNull(timestampClass));
        this.maxSnapshotBytes = options.maxSnapshotBytes();
    }

    public static <E, T extends Comparable<? super T>> LWWStateCodec<E, T> of(Class<E> elementClass,
                                                                              Class<T> timestampClass) {
        return of(elementClass, timestampClass, CodecOptions.builder().build());
    }

    public static <E, T extends Comparable<? super T>> LWWStateCodec<E, T> of(Class<E> elementClass,
                                                                              Class<T> timestampClass,
                                                                              CodecOptions options) {
        return new LWWStateCodec<>(elementClass, timestampClass, checkNotNull(options));
    }

    public byte[] encode(ILWWSet<E, T> set) {
        ObjectNode root = mapper.createObjectNode();
        writeSet(root, set);
        return write(root);
    }

    public byte[] encode(ILWWGraph<E, T> graph) {
        ObjectNode root = mapper.createObjectNode();
        writeSet(root.putObject(VERTICES), graph.vertexSet());
        ArrayNode edges = root.putArray(EDGES);
        for (Map.Entry<E, ILWWSet<E, T>> entry : graph.edgeSets().entrySet()) {
            ObjectNode edgeNode = edges.addObject();
            edgeNode.set(FROM, mapper.valueToTree(entry.getKey()));
            writeSet(edgeNode, entry.getValue());
        }
        return write(root);
    }

    public ILWWSet<E, T> decodeSet(byte[] snapshot) {
        JsonNode root = read(snapshot);
        ILWWSet<E, T> set = LWWCRDTFactory.newSet();
        readSet(root, set::add, set::remove);
        return set;
    }

    public ILWWGraph<E, T> decodeGraph(byte[] snapshot) {
        JsonNode root = read(snapshot);
        ILWWGraph<E, T> graph = LWWCRDTFactory.newGraph();
        readSet(field(root, VERTICES), graph::addVertex, graph::removeVertex);
        JsonNode edges = field(root, EDGES);
        if (!edges.isArray()) {
            throw CodecException.malformed("'" + EDGES + "' is not an array");
        }
        for (JsonNode edgeNode : edges) {
            E from = convert(field(edgeNode, FROM), elementType);
            if (from == null) {
                throw CodecException.malformed("null edge source");
            }
            readSet(edgeNode, (to, t) -> graph.addEdge(from, to, t), (to, t) -> graph.removeEdge(from, to, t));
        }
        return graph;
    }

    private void writeSet(ObjectNode node, ILWWSet<E, T> set) {
        writeTimestamps(node.putArray(ADDS), set.addTimestamps());
        writeTimestamps(node.putArray(REMOVES), set.removeTimestamps());
    }

    private void writeTimestamps(ArrayNode array, Map<E, T> timestamps) {
        timestamps.forEach((e, t) -> {
            ObjectNode pair = array.addObject();
            pair.set(ELEMENT, mapper.valueToTree(e));
            pair.set(TIMESTAMP, mapper.valueToTree(t));
        });
    }

    private void readSet(JsonNode node, BiConsumer<E, T> onAdd, BiConsumer<E, T> onRemove) {
        readTimestamps(field(node, ADDS), onAdd);
        readTimestamps(field(node, REMOVES), onRemove);
    }

    private void readTimestamps(JsonNode array, BiConsumer<E, T> consumer) {
        if (!array.isArray()) {
            throw CodecException.malformed("timestamps are not an array");
        }
        for (JsonNode pair : array) {
            E element = convert(field(pair, ELEMENT), elementType);
            T timestamp = convert(field(pair, TIMESTAMP), timestampType);
            if (element == null || timestamp == null) {
                throw CodecException.malformed("null element or timestamp");
            }
            consumer.accept(element, timestamp);
        }
    }

    private JsonNode field(JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null) {
            throw CodecException.malformed("missing field '" + name + "'");
        }
        return value;
    }

    private <V> V convert(JsonNode node, JavaType type) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw CodecException.malformed("cannot read " + node + " as " + type, e);
        }
    }

    private byte[] write(JsonNode root) {
        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw CodecException.encodeFailed(e);
        }
    }

    private JsonNode read(byte[] snapshot) {
        checkNotNull(snapshot);
        if (snapshot.length > maxSnapshotBytes) {
            throw CodecException.tooLarge(snapshot.length, maxSnapshotBytes);
        }
        JsonNode root;
        try {
            root = mapper.readTree(snapshot);
        } catch (IOException e) {
            throw CodecException.malformed("not a JSON document", e);
        }
        if (root == null || !root.isObject()) {
            throw CodecException.malformed("root is not an object");
        }
        return root;
    }
}
