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

import java.util.Properties;

/**
 * Options for the {@link Journal}. Options are specified as property values to
 * the {@link Journal#Journal(Properties)} constructor.
 * 
 * @author datalink developers
 * @version $Id$
 */
public interface Options {

    /**
     * The name of the file. If the file is not found and {@link #CREATE} is
     * true, then a new journal will be created. Required unless the
     * {@link #BUFFER_MODE} is {@link BufferMode#Transient}.
     */
    String FILE = Journal.class.getName() + ".file";

    /**
     * The name of the property whose value controls the nature of the backing
     * store (default {@value #DEFAULT_BUFFER_MODE}).
     * 
     * @see BufferMode
     */
    String BUFFER_MODE = Journal.class.getName() + ".bufferMode";

    String DEFAULT_BUFFER_MODE = BufferMode.Disk.toString();

    /**
     * When <code>false</code> the journal will refuse to open a
     * {@link #FILE} which does not exist (default {@value #DEFAULT_CREATE}).
     */
    String CREATE = Journal.class.getName() + ".create";

    String DEFAULT_CREATE = "true";

    /**
     * When <code>true</code> the {@link #FILE} is deleted when the journal is
     * closed (default {@value #DEFAULT_DELETE_ON_CLOSE}).
     */
    String DELETE_ON_CLOSE = Journal.class.getName() + ".deleteOnClose";

    String DEFAULT_DELETE_ON_CLOSE = "false";

    /**
     * The time in milliseconds that a statement will wait for a lock held by
     * another process on the same file before failing (default
     * {@value #DEFAULT_BUSY_TIMEOUT}).
     */
    String BUSY_TIMEOUT = Journal.class.getName() + ".busyTimeout";

    String DEFAULT_BUSY_TIMEOUT = "5000";

    /**
     * The rollback journal mode for a {@link BufferMode#Disk} journal, e.g.,
     * <code>DELETE</code> or <code>WAL</code> (default
     * {@value #DEFAULT_JOURNAL_MODE}). Ignored for transient journals.
     */
    String JOURNAL_MODE = Journal.class.getName() + ".journalMode";

    String DEFAULT_JOURNAL_MODE = "DELETE";

}
