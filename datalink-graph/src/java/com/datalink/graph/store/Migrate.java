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
 * Created on Mar 15, 2024
 */

package com.datalink.graph.store;

import java.io.File;
import java.io.PrintStream;
import java.sql.SQLException;
import java.util.Properties;

import org.apache.log4j.Logger;

import com.datalink.graph.schema.GraphSchema;
import com.datalink.journal.BufferMode;
import com.datalink.journal.Journal;
import com.datalink.journal.JournalException;
import com.datalink.migration.IntegrityWarning;
import com.datalink.migration.MigrationFailedException;
import com.datalink.migration.Migrations;
import com.datalink.util.InnerCause;

/**
 * Utility brings an existing store to the current schema generation,
 * reporting each generation as it is reached.
 *
 * <pre>
 * java com.datalink.graph.store.Migrate &lt;path-to-database&gt;
 * </pre>
 *
 * The exit status is zero on success and otherwise one of the
 * <code>EXIT_*</code> codes.
 *
 * @author datalink developers
 * @version $Id$
 */
public class Migrate {

    protected static final transient Logger log = Logger.getLogger(Migrate.class);

    public static final int EXIT_OK = 0;

    /** Wrong arguments. */
    public static final int EXIT_USAGE = 1;

    /** There is no file at the given path. */
    public static final int EXIT_NO_DB = 2;

    /** The store is already at the current generation. */
    public static final int EXIT_ALREADY_MIGRATED = 3;

    /** The store could not be opened or a step failed. */
    public static final int EXIT_FAILED = 4;

    /** The store is not at the current generation after the run. */
    public static final int EXIT_VERSION_MISMATCH = 5;

    private final PrintStream out;

    private final PrintStream err;

    public Migrate(final PrintStream out, final PrintStream err) {

        if (out == null)
            throw new IllegalArgumentException();

        if (err == null)
            throw new IllegalArgumentException();

        this.out = out;

        this.err = err;

    }

    /**
     * Run the utility.
     *
     * @param args
     *            The command line arguments.
     *
     * @return The exit status.
     */
    public int run(final String[] args) {

        if (args == null || args.length != 1) {

            err.println("Usage: " + Migrate.class.getName()
                    + " <path-to-database>");

            return EXIT_USAGE;

        }

        final File file = new File(args[0]);

        if (!file.exists()) {

            err.println("No database found at " + file);

            return EXIT_NO_DB;

        }

        final Properties properties = new Properties();

        properties.setProperty(Options.BUFFER_MODE, BufferMode.Disk.toString());

        properties.setProperty(Options.FILE, file.toString());

        properties.setProperty(Options.CREATE, "false");

        out.println("Opening database at " + file);

        final Journal journal;

        try {

            journal = new Journal(properties);

        } catch (JournalException ex) {

            err.println("Could not open: " + file + " : " + ex);

            return EXIT_FAILED;

        }

        try {

            return migrate(journal);

        } finally {

            journal.close();

        }

    }

    private int migrate(final Journal journal) {

        final int target = GraphSchema.CURRENT_VERSION;

        final Migrations migrations;

        try {

            migrations = new Migrations(journal, GraphSchema
                    .getMigrationSteps());

            out.println("Current schema version: " + migrations.getVersion());

            out.println("Target schema version: " + target);

            if (!migrations.hasNext()) {

                err.println("Already migrated");

                return EXIT_ALREADY_MIGRATED;

            }

            out.println("Migrating...");

            while (migrations.hasNext()) {

                out.println("Migrated to version " + migrations.next());

            }

        } catch (MigrationFailedException ex) {

            log.error(ex, ex);

            err.println("Migration failed: " + ex.getMessage());

            final Throwable cause = InnerCause.getInnerCause(ex,
                    SQLException.class);

            if (cause != null)
                err.println("Caused by: " + cause.getMessage());

            return EXIT_FAILED;

        } catch (JournalException ex) {

            log.error(ex, ex);

            err.println("Error: " + ex);

            return EXIT_FAILED;

        }

        out.println("Done");

        for (IntegrityWarning w : migrations.getWarnings()) {

            out.println("Warning: " + w);

        }

        out.println("Checking schema version...");

        final int now = journal.getSchemaVersion();

        out.println("Schema version now: " + now);

        if (now != target) {

            err.println("Schema version mismatch: current=" + now
                    + ", target=" + target);

            return EXIT_VERSION_MISMATCH;

        }

        out.println("Migration successful");

        return EXIT_OK;

    }

    /**
     * @param args
     *            <code>&lt;path-to-database&gt;</code>
     */
    public static void main(final String[] args) {

        final int status = new Migrate(System.out, System.err).run(args);

        System.exit(status);

    }

}
