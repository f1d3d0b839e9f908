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

/**
 * Describes a row that is stored but violates some expectation of the schema,
 * e.g., a link endpoint which does not have the expected width or which does
 * not resolve to any record. Warnings are logged and returned to the caller.
 * They never block the store from opening.
 *
 * @author datalink developers
 * @version $Id$
 */
public class IntegrityWarning {

    private final String table;

    private final long rowId;

    private final String column;

    private final String problem;

    /**
     * @param table
     *            The table.
     * @param rowId
     *            The rowid of the offending row.
     * @param column
     *            The offending column.
     * @param problem
     *            A description of the problem.
     */
    public IntegrityWarning(final String table, final long rowId,
            final String column, final String problem) {

        if (table == null)
            throw new IllegalArgumentException();

        if (column == null)
            throw new IllegalArgumentException();

        if (problem == null)
            throw new IllegalArgumentException();

        this.table = table;
        this.rowId = rowId;
        this.column = column;
        this.problem = problem;

    }

    public String getTable() {
        return table;
    }

    public long getRowId() {
        return rowId;
    }

    public String getColumn() {
        return column;
    }

    public String getProblem() {
        return problem;
    }

    public String toString() {

        return table + "[rowid=" + rowId + "]." + column + ": " + problem;

    }

}
