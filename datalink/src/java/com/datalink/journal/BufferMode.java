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

/**
 * The buffer mode in which the journal is opened.
 * 
 * @author datalink developers
 * @version $Id$
 */
public enum BufferMode {

    /**
     * <p>
     * The journal lives entirely in memory and is not restart-safe. This mode
     * is useful for temporary stores and for unit tests. Each {@link Journal}
     * opened in this mode has its own private database.
     * </p>
     */
    Transient(false/* stable */),

    /**
     * <p>
     * The journal is managed on disk in the file named by
     * {@link Options#FILE}. All changes are durable once the enclosing
     * transaction commits.
     * </p>
     */
    Disk(true/* stable */);

    private final boolean stable;

    private BufferMode(final boolean stable) {

        this.stable = stable;

    }

    /**
     * <code>true</code> iff this {@link BufferMode} uses a stable media
     * (disk) and therefore requires a file.
     */
    public boolean isStable() {

        return stable;

    }

}
