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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import com.google.common.collect.Lists;
import io.lwwgraph.basecrdt.core.api.ILWWSet;
import io.lwwgraph.basecrdt.core.api.LWWStateException;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class LWWSetTest {
    private LWWSet<String, Integer> set;

    @BeforeMethod
    public void setup() {
        set = new LWWSet<>();
    }

    @Test
    public void testEmpty() {
        assertFalse(set.contains("a"));
        assertFalse(set.addExists("a"));
        assertFalse(set.removeExists("a"));
        assertFalse(set.elements().hasNext());
        assertThrows(LWWStateException.NotFoundException.class, () -> set.addTimestamp("a"));
        assertThrows(LWWStateException.NotFoundException.class, () -> set.removeTimestamp("a"));
    }

    @Test
    public void testAddKeepsLatest() {
        set.add("a", 3);
        set.add("a", 1);
        assertEquals(set.addTimestamp("a"), Integer.valueOf(3));
        set.add("a", 5);
        assertEquals(set.addTimestamp("a"), Integer.valueOf(5));
        assertTrue(set.contains("a"));
        assertFalse(set.removeExists("a"));
    }

    @Test
    public void testRemoveKeepsLatest() {
        set.remove("a", 4);
        set.remove("a", 2);
        assertEquals(set.removeTimestamp("a"), Integer.valueOf(4));
        assertFalse(set.contains("a"));
        assertFalse(set.addExists("a"));
    }

    @Test
    public void testIdempotent() {
        set.add("a", 1);
        LWWSet<String, Integer> once = new LWWSet<>();
        once.add("a", 1);
        set.add("a", 1);
        assertEquals(set, once);

        set.remove("a", 2);
        once.remove("a", 2);
        set.remove("a", 2);
        assertEquals(set, once);
    }

    @Test
    public void testRemoveWinsTie() {
        set.add("a", 5);
        set.remove("a", 5);
        assertFalse(set.contains("a"));

        set.add("a", 6);
        assertTrue(set.contains("a"));

        set.remove("b", 7);
        set.add("b", 7);
        assertFalse(set.contains("b"));
    }

    @Test
    public void testRemoveBeforeAdd() {
        set.remove("a", 1);
        set.add("a", 2);
        assertTrue(set.contains("a"));
        set.remove("a", 3);
        assertFalse(set.contains("a"));
    }

    @Test
    public void testElements() {
        set.add("a", 1);
        set.add("b", 1);
        set.add("c", 1);
        set.remove("b", 2);
        assertEquals(Lists.newArrayList(set.elements()), Lists.newArrayList("a", "c"));
    }

    @Test
    public void testViewsAreReadOnly() {
        set.add("a", 1);
        assertThrows(UnsupportedOperationException.class, () -> set.addTimestamps().put("b", 1));
        assertThrows(UnsupportedOperationException.class, () -> set.removeTimestamps().clear());
    }

    @Test
    public void testRejectNull() {
        assertThrows(NullPointerException.class, () -> set.add(null, 1));
        assertThrows(NullPointerException.class, () -> set.remove("a", null));
    }

    @Test
    public void testMerge() {
        set.add("a", 1);
        set.remove("a", 3);
        set.add("b", 4);

        LWWSet<String, Integer> other = new LWWSet<>();
        other.add("a", 5);
        other.remove("b", 2);
        other.add("c", 1);

        set.merge(other);
        assertEquals(set.addTimestamp("a"), Integer.valueOf(5));
        assertEquals(set.removeTimestamp("a"), Integer.valueOf(3));
        assertTrue(set.contains("a"));
        assertTrue(set.contains("b"));
        assertTrue(set.contains("c"));
        // merge only reads the other side
        assertFalse(other.removeExists("a"));
    }

    @Test
    public void testMergeIdempotent() {
        set.add("a", 1);
        set.remove("b", 2);
        LWWSet<String, Integer> copy = new LWWSet<>();
        copy.merge(set);
        assertEquals(copy, set);

        set.merge(set);
        assertEquals(set, copy);
        set.merge(copy);
        assertEquals(set, copy);
    }

    @Test
    public void testMergeCommutativeAndAssociative() {
        LWWSet<String, Integer> a = new LWWSet<>();
        LWWSet<String, Integer> b = new LWWSet<>();
        LWWSet<String, Integer> c = new LWWSet<>();
        a.add("x", 1);
        a.remove("y", 4);
        b.add("y", 3);
        b.remove("x", 2);
        c.add("x", 2);
        c.add("z", 9);

        ILWWSet<String, Integer> ab = LWWCRDTFactory.newSet();
        ab.merge(a);
        ab.merge(b);
        ILWWSet<String, Integer> ba = LWWCRDTFactory.newSet();
        ba.merge(b);
        ba.merge(a);
        assertEquals(ab, ba);

        // (a + b) + c
        ab.merge(c);
        // a + (b + c)
        ILWWSet<String, Integer> bc = LWWCRDTFactory.newSet();
        bc.merge(b);
        bc.merge(c);
        ILWWSet<String, Integer> abc = LWWCRDTFactory.newSet();
        abc.merge(a);
        abc.merge(bc);
        assertEquals(ab, abc);
        assertEquals(ab.hashCode(), abc.hashCode());
        assertFalse(abc.contains("x"));
        assertFalse(abc.contains("y"));
        assertTrue(abc.contains("z"));
    }

    @Test
    public void testEqualityUsesRawState() {
        LWWSet<String, Integer> a = new LWWSet<>();
        LWWSet<String, Integer> b = new LWWSet<>();
        a.add("x", 1);
        a.remove("x", 2);
        b.add("x", 1);
        b.remove("x", 3);
        // same visibility, different raw state
        assertFalse(a.contains("x"));
        assertFalse(b.contains("x"));
        assertNotEquals(a, b);
    }
}
