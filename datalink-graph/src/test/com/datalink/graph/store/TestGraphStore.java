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
 * Created on Mar 21, 2024
 */

package com.datalink.graph.store;

import java.io.File;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Properties;

import com.datalink.config.ConfigurationException;
import com.datalink.graph.AbstractGraphTestCase;
import com.datalink.graph.model.Edge;
import com.datalink.graph.model.ID;
import com.datalink.graph.model.TypedValue;
import com.datalink.graph.schema.GraphSchema;
import com.datalink.journal.ITask;
import com.datalink.journal.Journal;
import com.datalink.migration.MigrationFailedException;

/**
 * Test suite for opening, reopening and migrating a {@link GraphStore}.
 *
 * @author datalink developers
 * @version $Id$
 */
public class TestGraphStore extends AbstractGraphTestCase {

    public TestGraphStore() {
    }

    public TestGraphStore(String name) {
        super(name);
    }

    public void test_create() {

        final GraphStore store = new GraphStore(getProperties());

        try {

            assertTrue(store.isOpen());

            assertEquals(GraphSchema.CURRENT_VERSION, store.getSchemaVersion());

            assertEquals(0L, store.getValueCount());

            assertEquals(0L, store.getLinkCount());

            assertTrue(hasIndex(store, GraphSchema.LINKS_TARGET));

        } finally {

            store.close();

        }

        assertFalse(store.isOpen());

        // may be closed more than once.
        store.close();

        try {
            store.getValueCount();
            fail("Expecting: " + IllegalStateException.class);
        } catch (IllegalStateException ex) {
            // ignore
        }

    }

    public void test_reopen() throws Exception {

        final File file = newTempFile();

        final Properties properties = getDiskProperties(file);

        final ID a = ID.random();
        final ID b = ID.random();
        final Edge e;

        {

            final GraphStore store = new GraphStore(properties);

            try {

                store.put(a, TypedValue.f64(2.5d));

                store.put(b, TypedValue.str("b"));

                e = store.addEdge(a, b, b);

            } finally {

                store.close();

            }

        }

        assertTrue(file.exists());

        final GraphStore store = new GraphStore(properties);

        try {

            assertEquals(GraphSchema.CURRENT_VERSION, store.getSchemaVersion());

            assertEquals(TypedValue.f64(2.5d), store.get(a));

            assertEquals(TypedValue.str("b"), store.get(b));

            final List<Edge> edges = toList(store.edgesFromWithKey(a, b));

            assertEquals(1, edges.size());

            assertEquals(e, edges.get(0));

        } finally {

            store.closeAndDelete();

        }

        assertFalse(file.exists());

    }

    /**
     * A generation 1 store is migrated when it is opened.
     */
    public void test_open_migrates() throws Exception {

        final File file = newTempFile();

        final Properties properties = getDiskProperties(file);

        {

            final Journal journal = openGeneration1(properties);

            try {

                insertValueV1(journal, "a", "str", "A");

                insertLinkV1(journal, "a", null, "a");

            } finally {

                journal.close();

            }

        }

        final GraphStore store = new GraphStore(properties);

        try {

            assertEquals(2, store.getSchemaVersion());

            final ID a = ID.fromText("a");

            assertEquals(TypedValue.str("A"), store.get(a));

            final List<Edge> edges = toList(store.edgesTo(a));

            assertEquals(1, edges.size());

            assertEquals(a, edges.get(0).getSource());

            assertNull(edges.get(0).getKey());

        } finally {

            store.close();

        }

    }

    /**
     * A store written by a newer version is refused and left unchanged.
     */
    public void test_open_newerGeneration() throws Exception {

        final File file = newTempFile();

        final Properties properties = getDiskProperties(file);

        {

            final Journal journal = new Journal(properties);

            try {

                journal.execute(new ITask<Void>() {
                    public Void call(final Connection conn) throws SQLException {
                        Journal.writeSchemaVersion(conn,
                                GraphSchema.CURRENT_VERSION + 1);
                        return null;
                    }
                });

            } finally {

                journal.close();

            }

        }

        try {
            new GraphStore(properties);
            fail("Expecting: " + MigrationFailedException.class);
        } catch (MigrationFailedException ex) {
            assertEquals(GraphSchema.CURRENT_VERSION + 1, ex.getVersion());
        }

        final Journal journal = new Journal(properties);

        try {

            assertEquals(GraphSchema.CURRENT_VERSION + 1, journal
                    .getSchemaVersion());

        } finally {

            journal.close();

        }

    }

    public void test_badChunkCapacity() {

        final Properties properties = getProperties();

        properties.setProperty(Options.CHUNK_CAPACITY, "0");

        try {
            new GraphStore(properties);
            fail("Expecting: " + ConfigurationException.class);
        } catch (ConfigurationException ex) {
            // ignore
        }

        properties.setProperty(Options.CHUNK_CAPACITY, "many");

        try {
            new GraphStore(properties);
            fail("Expecting: " + ConfigurationException.class);
        } catch (ConfigurationException ex) {
            // ignore
        }

    }

}
