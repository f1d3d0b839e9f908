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
import java.util.List;

/**
 * A destructive step which rewrites the existing tables into a new layout. The
 * order of the rewrite is fixed:
 * <ol>
 * <li>drop the indices of the old layout;</li>
 * <li>create the new structures under temporary names;</li>
 * <li>copy every row forward, converting as necessary;</li>
 * <li>drop the old tables and rename the new ones into place;</li>
 * <li>create the indices of the new layout;</li>
 * <li>check the integrity of the result.</li>
 * </ol>
 * Recording the new generation is the responsibility of the caller, which
 * runs the whole sequence in one atomic unit.
 *
 * @author datalink developers
 * @version $Id$
 */
abstract public class AbstractRewriteStep extends AbstractMigrationStep {

    protected AbstractRewriteStep(final int version) {

        super(version);

    }

    /**
     * Always <code>true</code>.
     */
    final public boolean isDestructive() {

        return true;

    }

    final public List<IntegrityWarning> apply(final Connection conn)
            throws SQLException {

        dropIndices(conn);

        createStructures(conn);

        final long ncopied = copyForward(conn);

        if (log.isInfoEnabled())
            log.info(this + " : copied " + ncopied + " rows");

        swapIn(conn);

        createIndices(conn);

        return checkIntegrity(conn);

    }

    abstract protected void dropIndices(Connection conn) throws SQLException;

    abstract protected void createStructures(Connection conn)
            throws SQLException;

    /**
     * @return The #of rows copied.
     */
    abstract protected long copyForward(Connection conn) throws SQLException;

    abstract protected void swapIn(Connection conn) throws SQLException;

    abstract protected void createIndices(Connection conn) throws SQLException;

    abstract protected List<IntegrityWarning> checkIntegrity(Connection conn)
            throws SQLException;

}
