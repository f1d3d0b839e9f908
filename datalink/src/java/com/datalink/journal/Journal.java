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
 * Created on Mar 4, 2024
 */

package com.datalink.journal;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.log4j.Logger;

import com.datalink.config.Configuration;
import com.datalink.config.ConfigurationException;
import com.datalink.config.IntegerValidator;

/**
 * An embedded store backed by a single SQLite database. The journal owns one
 * JDBC {@link Connection} and serializes all access to that connection.
 * <p>
 * Work is submitted as {@link ITask}s. {@link #execute(ITask)} runs a task in
 * auto-commit mode. {@link #executeAtomic(ITask)} runs a task as one atomic
 * unit: either every change made by the task is committed or none is. Atomic
 * units submitted from within an atomic unit join the outer unit.
 * <p>
 * The journal also owns the schema version of the store, which is persisted
 * in the database header (<code>PRAGMA user_version</code>). The version is
 * zero for a newly created store. It is advanced by the migration engine, never
 * by ordinary writes.
 *
 * @see Options
 *
 * @author datalink developers
 * @version $Id$
 */
public class Journal {

    protected static final transient Logger log = Logger.getLogger(Journal.class);

    /**
     * A copy of the properties used to initialize this journal.
     */
    private final Properties properties;

    private final BufferMode bufferMode;

    /**
     * The backing file -or- <code>null</code> for a transient journal.
     */
    private final File file;

    private final boolean deleteOnClose;

    /**
     * Serializes access to {@link #conn}.
     */
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * The #of atomic units currently open on {@link #conn} (nesting depth).
     * Guarded by {@link #lock}.
     */
    private int atomicDepth = 0;

    /**
     * The connection -or- <code>null</code> once the journal is closed.
     */
    private volatile Connection conn;

    /**
     * Open or create a journal.
     *
     * @param properties
     *            The configuration.
     *
     * @throws ConfigurationException
     *             if an option is invalid.
     * @throws JournalException
     *             if the backing store could not be opened.
     *
     * @see Options
     */
    public Journal(final Properties properties) {

        if (properties == null)
            throw new IllegalArgumentException();

        this.properties = (Properties) properties.clone();

        final String bufferModeStr = Configuration.getProperty(
                this.properties, Options.BUFFER_MODE,
                Options.DEFAULT_BUFFER_MODE);

        try {

            bufferMode = BufferMode.valueOf(bufferModeStr);

        } catch (IllegalArgumentException ex) {

            throw new ConfigurationException(Options.BUFFER_MODE,
                    bufferModeStr, "Unknown buffer mode");

        }

        final boolean create = Boolean.parseBoolean(Configuration.getProperty(
                this.properties, Options.CREATE, Options.DEFAULT_CREATE));

        deleteOnClose = Boolean.parseBoolean(Configuration.getProperty(
                this.properties, Options.DELETE_ON_CLOSE,
                Options.DEFAULT_DELETE_ON_CLOSE));

        final int busyTimeout = Configuration.getProperty(this.properties,
                Options.BUSY_TIMEOUT, Options.DEFAULT_BUSY_TIMEOUT,
                IntegerValidator.GTE_ZERO);

        final String journalMode = Configuration.getProperty(this.properties,
                Options.JOURNAL_MODE, Options.DEFAULT_JOURNAL_MODE);

        final String url;

        if (bufferMode.isStable()) {

            final String fileName = Configuration.getProperty(
                    this.properties, Options.FILE, null/* defaultValue */);

            if (fileName == null)
                throw new ConfigurationException(Options.FILE, fileName,
                        "Required for bufferMode=" + bufferMode);

            file = new File(fileName);

            if (!create && !file.exists())
                throw new JournalException("File not found: " + file);

            url = "jdbc:sqlite:" + file.getPath();

        } else {

            file = null;

            url = "jdbc:sqlite::memory:";

        }

        try {

            conn = DriverManager.getConnection(url);

            final Statement stmt = conn.createStatement();

            try {

                stmt.execute("PRAGMA busy_timeout = " + busyTimeout);

                if (bufferMode.isStable()) {

                    if (!journalMode.matches("[A-Za-z]+"))
                        throw new ConfigurationException(Options.JOURNAL_MODE,
                                journalMode, "Not a journal mode");

                    stmt.execute("PRAGMA journal_mode = " + journalMode);

                }

            } finally {

                stmt.close();

            }

        } catch (SQLException ex) {

            closeQuietly();

            throw new JournalException("Could not open: " + url, ex);

        } catch (RuntimeException ex) {

            closeQuietly();

            throw ex;

        }

        if (log.isInfoEnabled())
            log.info("Opened: url=" + url + ", bufferMode=" + bufferMode);

    }

    /**
     * A copy of the properties used to open the journal.
     */
    final public Properties getProperties() {

        return (Properties) properties.clone();

    }

    final public BufferMode getBufferMode() {

        return bufferMode;

    }

    /**
     * The backing file -or- <code>null</code> iff the journal is transient.
     */
    final public File getFile() {

        return file;

    }

    final public boolean isOpen() {

        return conn != null;

    }

    private void assertOpen() {

        if (conn == null)
            throw new IllegalStateException("Closed");

    }

    /**
     * Run a task against the connection in auto-commit mode (unless invoked
     * from within {@link #executeAtomic(ITask)}, in which case the task joins
     * the open unit).
     *
     * @return The value returned by the task.
     *
     * @throws JournalException
     *             if the task throws an {@link SQLException}.
     */
    public <T> T execute(final ITask<T> task) {

        if (task == null)
            throw new IllegalArgumentException();

        lock.lock();

        try {

            assertOpen();

            return task.call(conn);

        } catch (SQLException ex) {

            throw new JournalException(ex);

        } finally {

            lock.unlock();

        }

    }

    /**
     * Run a task as a single atomic unit. Changes made by the task are
     * committed iff the task returns normally. If the task throws anything at
     * all, every change is rolled back and the exception is propagated
     * ({@link SQLException}s are wrapped in a {@link JournalException}).
     *
     * @return The value returned by the task.
     */
    public <T> T executeAtomic(final ITask<T> task) {

        if (task == null)
            throw new IllegalArgumentException();

        lock.lock();

        try {

            assertOpen();

            if (atomicDepth > 0) {

                // join the outer unit.
                atomicDepth++;

                try {

                    return task.call(conn);

                } finally {

                    atomicDepth--;

                }

            }

            conn.setAutoCommit(false);

            atomicDepth++;

            try {

                final T ret = task.call(conn);

                conn.commit();

                return ret;

            } catch (Throwable t) {

                rollback();

                if (t instanceof SQLException)
                    throw new JournalException(t);

                if (t instanceof RuntimeException)
                    throw (RuntimeException) t;

                if (t instanceof Error)
                    throw (Error) t;

                throw new JournalException(t);

            } finally {

                atomicDepth--;

                conn.setAutoCommit(true);

            }

        } catch (SQLException ex) {

            // could not change the auto-commit mode.
            throw new JournalException(ex);

        } finally {

            lock.unlock();

        }

    }

    private void rollback() {

        try {

            conn.rollback();

            if (log.isInfoEnabled())
                log.info("Rolled back");

        } catch (SQLException ex) {

            log.error("Rollback failed: " + ex, ex);

        }

    }

    /**
     * The schema version recorded in the store.
     */
    public int getSchemaVersion() {

        return execute(new ITask<Integer>() {

            public Integer call(final Connection conn) throws SQLException {

                return readSchemaVersion(conn);

            }

        });

    }

    /**
     * Read the schema version using the given connection.
     */
    public static int readSchemaVersion(final Connection conn)
            throws SQLException {

        final Statement stmt = conn.createStatement();

        try {

            final ResultSet rs = stmt.executeQuery("PRAGMA user_version");

            try {

                return rs.next() ? rs.getInt(1) : 0;

            } finally {

                rs.close();

            }

        } finally {

            stmt.close();

        }

    }

    /**
     * Write the schema version using the given connection. When invoked from
     * within an atomic unit the new version becomes visible iff that unit
     * commits.
     */
    public static void writeSchemaVersion(final Connection conn,
            final int version) throws SQLException {

        if (version < 0)
            throw new IllegalArgumentException();

        final Statement stmt = conn.createStatement();

        try {

            stmt.execute("PRAGMA user_version = " + version);

        } finally {

            stmt.close();

        }

    }

    /**
     * Close the journal. The backing file is deleted if
     * {@link Options#DELETE_ON_CLOSE} was specified. This method may be
     * invoked more than once.
     */
    public void close() {

        lock.lock();

        try {

            if (conn == null)
                return;

            closeQuietly();

            if (log.isInfoEnabled())
                log.info("Closed: file=" + file);

            if (deleteOnClose)
                deleteFiles();

        } finally {

            lock.unlock();

        }

    }

    /**
     * Close the journal and delete the backing file (if any).
     */
    public void closeAndDelete() {

        close();

        if (!deleteOnClose)
            deleteFiles();

    }

    private void closeQuietly() {

        final Connection c = conn;

        conn = null;

        if (c == null)
            return;

        try {

            c.close();

        } catch (SQLException ex) {

            log.warn("Problem closing connection: " + ex, ex);

        }

    }

    private void deleteFiles() {

        if (file == null)
            return;

        for (String suffix : new String[] { "", "-journal", "-wal", "-shm" }) {

            final File f = new File(file.getPath() + suffix);

            if (f.exists() && !f.delete())
                log.warn("Could not delete: " + f);

        }

    }

    public String toString() {

        return getClass().getSimpleName() + "{bufferMode=" + bufferMode
                + ", file=" + file + ", open=" + isOpen() + "}";

    }

}
