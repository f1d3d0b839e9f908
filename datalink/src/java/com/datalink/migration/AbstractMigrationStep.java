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
import java.sql.Statement;

import org.apache.log4j.Logger;

/**
 * Base class for {@link IMigrationStep}s.
 *
 * @author datalink developers
 * @version $Id$
 */
abstract public class AbstractMigrationStep implements IMigrationStep {

    protected static final transient Logger log = Logger
            .getLogger(AbstractMigrationStep.class);

    private final int version;

    /**
     * @param version
     *            The generation produced by this step.
     */
    protected AbstractMigrationStep(final int version) {

        if (version <= 0)
            throw new IllegalArgumentException();

        this.version = version;

    }

    final public int getVersion() {

        return version;

    }

    /**
     * Execute each statement in turn.
     */
    protected static void execute(final Connection conn, final String... sql)
            throws SQLException {

        final Statement stmt = conn.createStatement();

        try {

            for (String s : sql) {

                if (log.isDebugEnabled())
                    log.debug(s);

                stmt.execute(s);

            }

        } finally {

            stmt.close();

        }

    }

    /**
     * Execute an INSERT, UPDATE or DELETE statement.
     *
     * @return The #of rows changed.
     */
    protected static int executeUpdate(final Connection conn, final String sql)
            throws SQLException {

        if (log.isDebugEnabled())
            log.debug(sql);

        final Statement stmt = conn.createStatement();

        try {

            return stmt.executeUpdate(sql);

        } finally {

            stmt.close();

        }

    }

    public String toString() {

        return getClass().getSimpleName() + "{version=" + version
                + ", destructive=" + isDestructive() + "}";

    }

}
