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

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Properties;

import com.datalink.graph.model.Edge;
import com.datalink.graph.model.ID;
import com.datalink.graph.model.TypedValue;
import com.datalink.striterator.ICloseableIterator;

/**
 * Test suite for the {@link ILinkStore} operations of a {@link GraphStore}.
 * The chunk capacity is deliberately small so that the traversals span
 * several chunks.
 *
 * @author datalink developers
 * @version $Id$
 */
public class TestLinkStore extends AbstractGraphStoreTestCase {

    public TestLinkStore() {
    }

    public TestLinkStore(String name) {
        super(name);
    }

    protected Properties getProperties() {

        final Properties properties = super.getProperties();

        properties.setProperty(Options.CHUNK_CAPACITY, "2");

        return properties;

    }

    /**
     * Store a string, an integer and a link between them labeled by the
     * string. The link is found by its source and label, and the target which
     * was never stored does not resolve.
     */
    public void test_labeledEdge() {

        final ID a = fill(0x11);
        final ID b = fill(0x22);
        final ID c = fill(0x33);

        store.put(a, TypedValue.u32(42));

        store.put(b, TypedValue.str("likes"));

        store.addEdge(a, b, c);

        final List<Edge> edges = toList(store.edgesFromWithKey(a, b));

        assertEquals(1, edges.size());

        assertEquals(a, edges.get(0).getSource());
        assertEquals(b, edges.get(0).getKey());
        assertEquals(c, edges.get(0).getTarget());

        assertEquals(TypedValue.u32(42), store.get(a));
        assertEquals(TypedValue.str("likes"), store.get(b));

        try {
            store.get(c);
            fail("Expecting: " + NotFoundException.class);
        } catch (NotFoundException ex) {
            // ignore
        }

    }

    /**
     * Parallel edges are distinct and each is visited.
     */
    public void test_multigraph() {

        final ID a = ID.random();
        final ID k = ID.random();
        final ID b = ID.random();

        final Edge e1 = store.addEdge(a, k, b);
        final Edge e2 = store.addEdge(a, k, b);

        assertFalse(e1.getHandle() == e2.getHandle());
        assertFalse(e1.equals(e2));

        assertEquals(2L, store.getLinkCount());

        final List<Edge> edges = toList(store.edgesFrom(a));

        assertEquals(2, edges.size());
        assertEquals(e1, edges.get(0));
        assertEquals(e2, edges.get(1));

        assertEquals(2, toList(store.edgesTo(b)).size());
        assertEquals(2, toList(store.edgesByKey(k)).size());
        assertEquals(2, toList(store.edgesFromWithKey(a, k)).size());

        assertTrue(store.removeEdge(e1));
        assertFalse(store.removeEdge(e1));

        final List<Edge> after = toList(store.edgesFrom(a));

        assertEquals(1, after.size());
        assertEquals(e2, after.get(0));

        assertEquals(1L, store.getLinkCount());

    }

    /**
     * Removing an edge a second time does not remove the edge which was
     * later given the same rowid.
     */
    public void test_removeEdge_reusedRowid() {

        final ID a = ID.random();
        final ID b = ID.random();
        final ID c = ID.random();

        store.addEdge(a, null, b);

        final Edge e2 = store.addEdge(a, null, b);

        assertTrue(store.removeEdge(e2));

        final Edge e3 = store.addEdge(a, null, c);

        // SQLite hands out the freed rowid again.
        assertEquals(e2.getHandle(), e3.getHandle());

        assertFalse(store.removeEdge(e2));

        assertEquals(2L, store.getLinkCount());

        assertEquals(e3, toList(store.edgesTo(c)).get(0));

        // a visited edge is a valid handle.
        assertTrue(store.removeEdge(toList(store.edgesTo(c)).get(0)));

        assertEquals(1L, store.getLinkCount());

    }

    /**
     * The traversals select on the expected position and visit the edges in
     * the order in which they were added, across chunk boundaries.
     */
    public void test_traversals() {

        final ID a = ID.random();
        final ID b = ID.random();
        final ID k1 = ID.random();
        final ID k2 = ID.random();

        final int n = 7;

        final Edge[] out = new Edge[n];

        for (int i = 0; i < n; i++) {

            out[i] = store.addEdge(a, (i % 2 == 0) ? k1 : k2, ID.random());

        }

        store.addEdge(b, k1, a);
        store.addEdge(b, null, a);
        store.addEdge(b, k2, b);

        final List<Edge> from = toList(store.edgesFrom(a));

        assertEquals(n, from.size());

        for (int i = 0; i < n; i++) {

            assertEquals(out[i], from.get(i));
            assertEquals(a, from.get(i).getSource());

        }

        final List<Edge> withK1 = toList(store.edgesFromWithKey(a, k1));

        assertEquals(4, withK1.size());

        for (Edge e : withK1) {

            assertEquals(a, e.getSource());
            assertEquals(k1, e.getKey());

        }

        assertEquals(5, toList(store.edgesByKey(k1)).size());
        assertEquals(4, toList(store.edgesByKey(k2)).size());

        final List<Edge> to = toList(store.edgesTo(a));

        assertEquals(2, to.size());
        assertEquals(b, to.get(0).getSource());
        assertEquals(b, to.get(1).getSource());

        assertEquals(1, toList(store.edgesTo(b)).size());

        assertTrue(toList(store.edgesFrom(ID.random())).isEmpty());

    }

    /**
     * A <code>null</code> key selects the edges without a label.
     */
    public void test_unlabeled() {

        final ID a = ID.random();
        final ID b = ID.random();
        final ID k = ID.random();

        final Edge e = store.addEdge(a, null, b);

        store.addEdge(a, k, b);

        final List<Edge> unlabeled = toList(store.edgesFromWithKey(a, null));

        assertEquals(1, unlabeled.size());
        assertEquals(e, unlabeled.get(0));
        assertNull(unlabeled.get(0).getKey());

        final List<Edge> byKey = toList(store.edgesByKey(null));

        assertEquals(1, byKey.size());
        assertEquals(e, byKey.get(0));

    }

    /**
     * Edges may refer to identifiers which have no value record.
     */
    public void test_dangling() {

        final ID a = store.store(TypedValue.bool(true));

        final ID ghost = ID.random();

        store.addEdge(a, null, ghost);

        assertEquals(1, toList(store.edgesTo(ghost)).size());

        assertFalse(store.contains(ghost));

        assertEquals(1, store.checkIntegrity().size());

        store.put(ghost, TypedValue.EMPTY);

        assertTrue(store.checkIntegrity().isEmpty());

    }

    public void test_iterator_protocol() {

        final ID a = ID.random();

        for (int i = 0; i < 5; i++)
            store.addEdge(a, null, ID.random());

        final ICloseableIterator<Edge> itr = store.edgesFrom(a);

        try {

            assertTrue(itr.hasNext());

            itr.next();

            try {
                itr.remove();
                fail("Expecting: " + UnsupportedOperationException.class);
            } catch (UnsupportedOperationException ex) {
                // ignore
            }

        } finally {

            itr.close();

        }

        assertFalse(itr.hasNext());

        try {
            itr.next();
            fail("Expecting: " + NoSuchElementException.class);
        } catch (NoSuchElementException ex) {
            // ignore
        }

        // exhausted iterators may be closed again.
        final ICloseableIterator<Edge> itr2 = store.edgesFrom(a);

        assertEquals(5, toList(itr2).size());

        itr2.close();

    }

    public void test_correctRejection() {

        try {
            store.addEdge(null, null, ID.random());
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

        try {
            store.addEdge(ID.random(), null, null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

        try {
            store.removeEdge(null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

        try {
            store.edgesFrom(null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

        try {
            store.edgesTo(null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

    }

}
