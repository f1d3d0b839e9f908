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
 * Created on Mar 6, 2024
 */

package com.datalink.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.apache.log4j.Logger;

import com.datalink.journal.ITask;
import com.datalink.journal.Journal;

/**
 * Brings a {@link Journal} forward through an ordered sequence of
 * {@link IMigrationStep}s. The steps must produce the generations
 * <code>1, 2, ..., n</code> in that order.
 * <p>
 * The runner visits the generations that it reaches, one per step. Each step
 * is applied within a single atomic unit which re-reads the generation of the
 * store, refuses to proceed unless the store is exactly one generation behind
 * the step, applies the step, and records the new generation. If anything
 * fails the unit is rolled back, the store keeps its prior generation and a
 * {@link MigrationFailedException} is thrown.
 *
 * <pre>
 * final Migrations m = new Migrations(journal, steps);
 * while (m.hasNext()) {
 *     final int version = m.next();
 *     ...
 * }
 * </pre>
 *
 * @author datalink developers
 * @version $Id$
 */
public class Migrations implements Iterator<Integer> {

    protected static final transient Logger log = Logger.getLogger(Migrations.class);

    private final Journal journal;

    private final List<IMigrationStep> steps;

    /**
     * The generation of the store as last observed by this runner.
     */
    private int version;

    private final List<IntegrityWarning> warnings = new ArrayList<IntegrityWarning>();

    /**
     * @param journal
     *            The store.
     * @param steps
     *            The steps, where the i<sup>th</sup> step produces generation
     *            <code>i+1</code>.
     *
     * @throws IllegalArgumentException
     *             if the steps are not contiguous from generation one.
     * @throws MigrationFailedException
     *             if the store has a generation which is newer than the
     *             newest step.
     */
    public Migrations(final Journal journal,
            final List<? extends IMigrationStep> steps) {

        if (journal == null)
            throw new IllegalArgumentException();

        if (steps == null)
            throw new IllegalArgumentException();

        for (int i = 0; i < steps.size(); i++) {

            final IMigrationStep step = steps.get(i);

            if (step == null)
                throw new IllegalArgumentException("null step @ index=" + i);

            if (step.getVersion() != i + 1)
                throw new IllegalArgumentException("Expecting version="
                        + (i + 1) + ", not " + step);

        }

        this.journal = journal;

        this.steps = Collections
                .unmodifiableList(new ArrayList<IMigrationStep>(steps));

        this.version = journal.getSchemaVersion();

        if (version > getTargetVersion()) {

            throw new MigrationFailedException(version, "Store generation "
                    + version + " is newer than supported generation "
                    + getTargetVersion() + " : " + journal);

        }

    }

    /**
     * The current generation of the store.
     */
    public int getVersion() {

        return version;

    }

    /**
     * The newest generation known to the runner.
     */
    public int getTargetVersion() {

        return steps.size();

    }

    /**
     * The integrity warnings reported by the steps applied so far.
     */
    public List<IntegrityWarning> getWarnings() {

        return Collections.unmodifiableList(warnings);

    }

    public boolean hasNext() {

        return version < getTargetVersion();

    }

    /**
     * Apply the next step.
     *
     * @return The generation reached.
     *
     * @throws NoSuchElementException
     *             if the store is at the newest generation.
     * @throws MigrationFailedException
     *             if the step could not be applied.
     */
    public Integer next() {

        if (!hasNext())
            throw new NoSuchElementException();

        final IMigrationStep step = steps.get(version);

        if (log.isInfoEnabled())
            log.info("Migrating: " + version + " => " + step.getVersion()
                    + " : " + step);

        final List<IntegrityWarning> found;

        try {

            found = journal.executeAtomic(new MigrationTask(step));

        } catch (MigrationFailedException ex) {

            throw ex;

        } catch (RuntimeException ex) {

            log.error("Migration failed: " + step + " : " + ex, ex);

            throw new MigrationFailedException(step.getVersion(),
                    "Could not migrate to generation " + step.getVersion(), ex);

        }

        warnings.addAll(found);

        version = step.getVersion();

        if (log.isInfoEnabled())
            log.info("Migrated to version " + version + " with "
                    + found.size() + " warnings");

        return version;

    }

    /**
     * @throws UnsupportedOperationException
     */
    public void remove() {

        throw new UnsupportedOperationException();

    }

    /**
     * Apply all pending steps.
     *
     * @return The generation reached.
     */
    public int runAll() {

        while (hasNext()) {

            next();

        }

        return version;

    }

    /**
     * Apply the pending steps up to and including the given generation.
     *
     * @param target
     *            The generation to reach.
     *
     * @return The generation reached.
     *
     * @throws IllegalArgumentException
     *             if the target is older than the store or newer than the
     *             newest step.
     */
    public int runTo(final int target) {

        if (target < version)
            throw new IllegalArgumentException("Can not regress: version="
                    + version + ", target=" + target);

        if (target > getTargetVersion())
            throw new IllegalArgumentException("No such generation: "
                    + target);

        while (version < target) {

            next();

        }

        return version;

    }

    /**
     * Applies one step and records the generation which it produces.
     */
    private static class MigrationTask implements
            ITask<List<IntegrityWarning>> {

        private final IMigrationStep step;

        MigrationTask(final IMigrationStep step) {

            this.step = step;

        }

        public List<IntegrityWarning> call(final Connection conn)
                throws SQLException {

            final int expected = step.getVersion() - 1;

            final int actual = Journal.readSchemaVersion(conn);

            if (actual != expected) {

                throw new MigrationFailedException(step.getVersion(),
                        "Expecting generation " + expected + ", not " + actual);

            }

            final List<IntegrityWarning> found = step.apply(conn);

            for (IntegrityWarning w : found) {

                log.warn(w);

            }

            Journal.writeSchemaVersion(conn, step.getVersion());

            return found;

        }

    }

}
