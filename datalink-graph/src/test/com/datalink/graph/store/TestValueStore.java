/**

Copyright (C) SYSTAP, LLC 2006-2007.  All rights reserved.

Contact:
     SYSTAP, LLC
     4501 Tower Road
     Greensboro, NC 27410
     licenses@bigdata.com

This program is free software; you can redistribute it and/or modify
it under the terms of the GNU General Public License as published by
the Free Software Foundation; version 2 of the License.

This program is distributed in the hope that it will be useful,
but WITHOUT ANY WARRANTY; without even the implied warranty of
MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
GNU General Public License for more details.

You should have received a copy of the GNU General Public License
along with this program; if not, write to the Free Software
Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA
*/
/*
 * Created on Mar 20, 2024
 */

package com.datalink.graph.store;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.datalink.graph.model.Edge;
import com.datalink.graph.model.ID;
import com.datalink.graph.model.TypedValue;
import com.datalink.graph.model.ValueType;

/**
 * Test suite for the {@link IValueStore} operations of a {@link GraphStore}.
 *
 * @author datalink developers
 * @version $Id$
 */
public class TestValueStore extends AbstractGraphStoreTestCase {

    public TestValueStore() {
    }

    public TestValueStore(String name) {
        super(name);
    }

    /**
     * Every payload type round trips, including the edges of each range.
     */
    public void test_roundTrip() {

        final TypedValue[] values = new TypedValue[] {
                TypedValue.EMPTY,
                TypedValue.bool(true),
                TypedValue.bool(false),
                TypedValue.u8(0),
                TypedValue.u8(255),
                TypedValue.i8(Byte.MIN_VALUE),
                TypedValue.i8(Byte.MAX_VALUE),
                TypedValue.u16(65535),
                TypedValue.i16(Short.MIN_VALUE),
                TypedValue.u32(4294967295L),
                TypedValue.i32(Integer.MIN_VALUE),
                TypedValue.u64(-1L), // 2^64-1
                TypedValue.u64(0L),
                TypedValue.i64(Long.MAX_VALUE),
                TypedValue.f32(-1.25f),
                TypedValue.f32(Float.POSITIVE_INFINITY),
                TypedValue.f64(Math.PI),
                TypedValue.f64(-0.5d),
                TypedValue.str(""),
                TypedValue.str("café 日本"),
        };

        final ID[] ids = new ID[values.length];

        for (int i = 0; i < values.length; i++) {

            ids[i] = store.store(values[i]);

        }

        assertEquals((long) values.length, store.getValueCount());

        for (int i = 0; i < values.length; i++) {

            final TypedValue actual = store.get(ids[i]);

            assertEquals(values[i], actual);

            assertEquals(values[i].getType(), actual.getType());

        }

        assertEquals(ValueType.None, store.get(ids[0]).getType());

    }

    public void test_put_overwrites() {

        final ID id = ID.random();

        assertFalse(store.contains(id));

        store.put(id, TypedValue.u32(42));

        assertEquals(TypedValue.u32(42), store.get(id));

        // the type may change.
        store.put(id, TypedValue.str("forty-two"));

        assertEquals(TypedValue.str("forty-two"), store.get(id));

        store.put(id, TypedValue.EMPTY);

        assertEquals(TypedValue.EMPTY, store.get(id));

        assertEquals(1L, store.getValueCount());

        assertTrue(store.checkIntegrity().isEmpty());

    }

    public void test_insert_duplicate() {

        final ID id = ID.random();

        store.insert(id, TypedValue.i64(1L));

        try {
            store.insert(id, TypedValue.i64(2L));
            fail("Expecting: " + DuplicateIdentifierException.class);
        } catch (DuplicateIdentifierException ex) {
            assertEquals(id, ex.getId());
        }

        // unchanged.
        assertEquals(TypedValue.i64(1L), store.get(id));

        assertEquals(1L, store.getValueCount());

    }

    public void test_store_distinctIds() {

        final ID a = store.store(TypedValue.str("x"));

        final ID b = store.store(TypedValue.str("x"));

        assertFalse(a.equals(b));

        assertFalse(a.isNull());

        assertEquals(2L, store.getValueCount());

    }

    public void test_get_notFound() {

        final ID id = ID.random();

        try {
            store.get(id);
            fail("Expecting: " + NotFoundException.class);
        } catch (NotFoundException ex) {
            assertEquals(id, ex.getId());
        }

    }

    public void test_correctRejection() {

        try {
            store.put(null, TypedValue.EMPTY);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

        try {
            store.put(ID.random(), null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

        try {
            store.get(null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

    }

    /**
     * Deleting a record leaves the links which refer to it in place.
     */
    public void test_delete() {

        final ID a = store.store(TypedValue.str("a"));

        final ID b = store.store(TypedValue.str("b"));

        final Edge e = store.addEdge(a, null, b);

        assertTrue(store.delete(b));

        assertFalse(store.delete(b));

        assertFalse(store.contains(b));

        try {
            store.get(b);
            fail("Expecting: " + NotFoundException.class);
        } catch (NotFoundException ex) {
            // ignore
        }

        final List<Edge> edges = toList(store
                .edgesFrom(a));

        assertEquals(1, edges.size());

        assertEquals(e, edges.get(0));

        assertEquals(b, edges.get(0).getTarget());

        // the dangling target is reported.
        assertEquals(1, store.checkIntegrity().size());

    }

    public void test_findByString() {

        final ID a = store.store(TypedValue.str("apple"));

        final ID b = store.store(TypedValue.str("apple"));

        final ID c = store.store(TypedValue.str("apricot"));

        store.store(TypedValue.i32(1));

        final Set<ID> found = new HashSet<ID>(store.findByString("apple"));

        assertEquals(2, found.size());
        assertTrue(found.contains(a));
        assertTrue(found.contains(b));

        assertTrue(store.findByString("banana").isEmpty());

        final Set<ID> like = new HashSet<ID>(store.findByStringLike("ap%"));

        assertEquals(3, like.size());
        assertTrue(like.contains(c));

        assertEquals(1, store.findByStringLike("%cot").size());

    }

}
