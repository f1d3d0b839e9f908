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
package com.datalink.journal;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A unit of work which is executed against the {@link Connection} of a
 * {@link Journal}.
 * 
 * @param <T>
 *            The type of the value returned by the task.
 * 
 * @see Journal#execute(ITask)
 * @see Journal#executeAtomic(ITask)
 */
public interface ITask<T> {

    /**
     * Run the task.
     * 
     * @param conn
     *            The connection. The task MUST NOT close it or change its
     *            auto-commit mode.
     * 
     * @return The result.
     */
    T call(Connection conn) throws SQLException;

}
