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
 * A step which moves a store from one schema generation to the next.
 *
 * @author datalink developers
 * @version $Id$
 */
public interface IMigrationStep {

    /**
     * The generation produced by this step. The step may only be applied to a
     * store whose generation is exactly one less.
     */
    int getVersion();

    /**
     * <code>true</code> iff the step rewrites existing data (vs only creating
     * structures which are absent).
     */
    boolean isDestructive();

    /**
     * Apply the step. The caller is responsible for the atomic unit in which
     * the step runs and for recording the new generation.
     *
     * @param conn
     *            The connection.
     *
     * @return The integrity problems found once the step was applied (never
     *         <code>null</code>). Problems are reported, not fatal.
     */
    List<IntegrityWarning> apply(Connection conn) throws SQLException;

}
