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
 * Created on Mar 9, 2024
 */

package com.datalink.migration;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

import org.apache.log4j.Logger;

import com.datalink.journal.AbstractJournalTestCase;
import com.datalink.journal.ITask;
import com.datalink.journal.Journal;

/**
 * Test suite for the {@link Migrations} runner.
 *
 * @author datalink developers
 * @version $Id$
 */
public class TestMigrations extends AbstractJournalTestCase {

    private static final Logger log = Logger.getLogger(TestMigrations.class);

    public TestMigrations() {
    }

    public TestMigrations(String name) {
        super(name);
    }

    private Journal journal;

    protected void setUp() throws Exception {

        journal = new Journal(getProperties());

    }

    protected void tearDown() throws Exception {

        if (journal != null)
            journal.close();

        journal = null;

    }

    /**
     * Creates a table if it is absent.
     */
    private static class CreateStep extends AbstractMigrationStep {

        CreateStep() {
            super(1);
        }

        public boolean isDestructive() {
            return false;
        }

        public List<IntegrityWarning> apply(final Connection conn)
                throws SQLException {
            execute(conn, "CREATE TABLE IF NOT EXISTS t (x TEXT)");
            return Collections.emptyList();
        }

    }

    /**
     * Rewrites the table, converting <code>x</code> to an integer. Rows that
     * do not convert are reported. Optionally fails after the rows were
     * copied forward.
     */
    private static class RewriteStep extends AbstractRewriteStep {

        private final boolean fail;

        RewriteStep(final boolean fail) {
            super(2);
            this.fail = fail;
        }

        protected void dropIndices(final Connection conn) throws SQLException {
            execute(conn, "DROP INDEX IF EXISTS t_x");
        }

        protected void createStructures(final Connection conn)
                throws SQLException {
            execute(conn, "CREATE TABLE t_new (x INTEGER)");
        }

        protected long copyForward(final Connection conn) throws SQLException {
            final long n = executeUpdate(conn,
                    "INSERT INTO t_new (x) SELECT CAST(x AS INTEGER) FROM t");
            if (fail)
                throw new SQLException("Forced failure");
            return n;
        }

        protected void swapIn(final Connection conn) throws SQLException {
            execute(conn, "DROP TABLE t", "ALTER TABLE t_new RENAME TO t");
        }

        protected void createIndices(final Connection conn)
                throws SQLException {
            execute(conn, "CREATE INDEX t_x ON t (x)");
        }

        protected List<IntegrityWarning> checkIntegrity(final Connection conn)
                throws SQLException {
            final List<IntegrityWarning> warnings = new ArrayList<IntegrityWarning>();
            final Statement stmt = conn.createStatement();
            try {
                final ResultSet rs = stmt
                        .executeQuery("SELECT rowid FROM t WHERE x = 0");
                while (rs.next()) {
                    warnings.add(new IntegrityWarning("t", rs.getLong(1), "x",
                            "not a number"));
                }
            } finally {
                stmt.close();
            }
            return warnings;
        }

    }

    private void insert(final String... values) {

        journal.execute(new ITask<Void>() {
            public Void call(final Connection conn) throws SQLException {
                for (String v : values) {
                    final java.sql.PreparedStatement stmt = conn
                            .prepareStatement("INSERT INTO t (x) VALUES (?)");
                    try {
                        stmt.setString(1, v);
                        stmt.executeUpdate();
                    } finally {
                        stmt.close();
                    }
                }
                return null;
            }
        });

    }

    private String typeofFirst() {

        return journal.execute(new ITask<String>() {
            public String call(final Connection conn) throws SQLException {
                final Statement stmt = conn.createStatement();
                try {
                    final ResultSet rs = stmt
                            .executeQuery("SELECT typeof(x) FROM t ORDER BY rowid LIMIT 1");
                    return rs.next() ? rs.getString(1) : null;
                } finally {
                    stmt.close();
                }
            }
        });

    }

    public void test_ctor_correctRejection() {

        try {
            new Migrations(null, Collections.<IMigrationStep> emptyList());
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

        try {
            new Migrations(journal, null);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

        // not contiguous from one.
        try {
            new Migrations(journal, Arrays.asList(new RewriteStep(false)));
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

        // out of order.
        try {
            new Migrations(journal, Arrays.<IMigrationStep> asList(
                    new RewriteStep(false), new CreateStep()));
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

    }

    public void test_runAll() {

        final Migrations m = new Migrations(journal, Arrays
                .<IMigrationStep> asList(new CreateStep(),
                        new RewriteStep(false)));

        assertEquals(0, m.getVersion());
        assertEquals(2, m.getTargetVersion());
        assertTrue(m.hasNext());

        assertEquals(Integer.valueOf(1), m.next());
        assertEquals(1, journal.getSchemaVersion());

        insert("12", "abc");

        assertEquals(2, m.runAll());
        assertEquals(2, journal.getSchemaVersion());
        assertFalse(m.hasNext());

        assertEquals("integer", typeofFirst());

        // the row which did not convert was reported.
        assertEquals(1, m.getWarnings().size());
        assertEquals("t", m.getWarnings().get(0).getTable());
        assertEquals("x", m.getWarnings().get(0).getColumn());
        assertEquals(2L, m.getWarnings().get(0).getRowId());

        try {
            m.next();
            fail("Expecting: " + NoSuchElementException.class);
        } catch (NoSuchElementException ex) {
            // ignore
        }

        // nothing to do on a second run.
        final Migrations m2 = new Migrations(journal, Arrays
                .<IMigrationStep> asList(new CreateStep(),
                        new RewriteStep(false)));

        assertEquals(2, m2.getVersion());
        assertFalse(m2.hasNext());
        assertEquals(2, m2.runAll());

    }

    public void test_runTo() {

        final Migrations m = new Migrations(journal, Arrays
                .<IMigrationStep> asList(new CreateStep(),
                        new RewriteStep(false)));

        assertEquals(1, m.runTo(1));
        assertEquals(1, journal.getSchemaVersion());

        try {
            m.runTo(0);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

        try {
            m.runTo(3);
            fail("Expecting: " + IllegalArgumentException.class);
        } catch (IllegalArgumentException ex) {
            // ignore
        }

        assertEquals(2, m.runTo(2));

    }

    /**
     * A step which fails part way through leaves the generation and the data
     * of the prior generation untouched.
     */
    public void test_failure_rollsBack() {

        new Migrations(journal, Arrays.<IMigrationStep> asList(new CreateStep()))
                .runAll();

        insert("12", "13");

        final Migrations m = new Migrations(journal, Arrays
                .<IMigrationStep> asList(new CreateStep(),
                        new RewriteStep(true)));

        assertEquals(1, m.getVersion());

        try {
            m.next();
            fail("Expecting: " + MigrationFailedException.class);
        } catch (MigrationFailedException ex) {
            assertEquals(2, ex.getVersion());
            if (log.isInfoEnabled())
                log.info("Ignoring expected exception: " + ex);
        }

        assertEquals(1, m.getVersion());
        assertEquals(1, journal.getSchemaVersion());

        // the old table is intact and the new one is gone.
        assertEquals("text", typeofFirst());
        assertEquals(Integer.valueOf(0), journal.execute(new ITask<Integer>() {
            public Integer call(final Connection conn) throws SQLException {
                final Statement stmt = conn.createStatement();
                try {
                    final ResultSet rs = stmt
                            .executeQuery("SELECT COUNT(*) FROM sqlite_master WHERE name = 't_new'");
                    rs.next();
                    return rs.getInt(1);
                } finally {
                    stmt.close();
                }
            }
        }));

        // the step may be retried once the problem is fixed.
        assertEquals(2, new Migrations(journal, Arrays
                .<IMigrationStep> asList(new CreateStep(),
                        new RewriteStep(false))).runAll());

    }

    /**
     * A store which is newer than the newest known step is refused.
     */
    public void test_newerGeneration_refused() {

        journal.execute(new ITask<Void>() {
            public Void call(final Connection conn) throws SQLException {
                Journal.writeSchemaVersion(conn, 3);
                return null;
            }
        });

        try {
            new Migrations(journal, Arrays.<IMigrationStep> asList(
                    new CreateStep(), new RewriteStep(false)));
            fail("Expecting: " + MigrationFailedException.class);
        } catch (MigrationFailedException ex) {
            assertEquals(3, ex.getVersion());
        }

        assertEquals(3, journal.getSchemaVersion());

    }

    /**
     * The runner re-reads the generation inside the atomic unit and refuses
     * to apply a step to a store which was changed behind its back.
     */
    public void test_generationChanged() {

        final Migrations m = new Migrations(journal, Arrays
                .<IMigrationStep> asList(new CreateStep(),
                        new RewriteStep(false)));

        journal.execute(new ITask<Void>() {
            public Void call(final Connection conn) throws SQLException {
                Journal.writeSchemaVersion(conn, 1);
                return null;
            }
        });

        try {
            m.next();
            fail("Expecting: " + MigrationFailedException.class);
        } catch (MigrationFailedException ex) {
            assertEquals(1, ex.getVersion());
        }

        assertEquals(1, journal.getSchemaVersion());

    }

    public void test_remove_notSupported() {

        try {
            new Migrations(journal, Collections.<IMigrationStep> emptyList())
                    .remove();
            fail("Expecting: " + UnsupportedOperationException.class);
        } catch (UnsupportedOperationException ex) {
            // ignore
        }

    }

    public void test_isDestructive() {

        assertFalse(new CreateStep().isDestructive());

        assertTrue(new RewriteStep(false).isDestructive());

    }

}
