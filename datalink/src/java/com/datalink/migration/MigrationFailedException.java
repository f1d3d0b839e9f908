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
 * Thrown when a store can not be brought to a schema generation. The store is
 * left at the generation it had before the failed step.
 *
 * @author datalink developers
 * @version $Id$
 */
public class MigrationFailedException extends RuntimeException {

    private static final long serialVersionUID = -3874411937406232415L;

    private final int version;

    /**
     * @param version
     *            The generation which could not be reached.
     * @param msg
     *            The message.
     */
    public MigrationFailedException(final int version, final String msg) {

        super(msg);

        this.version = version;

    }

    /**
     * @param version
     *            The generation which could not be reached.
     * @param msg
     *            The message.
     * @param cause
     *            The cause.
     */
    public MigrationFailedException(final int version, final String msg,
            final Throwable cause) {

        super(msg, cause);

        this.version = version;

    }

    /**
     * The generation which could not be reached.
     */
    public int getVersion() {

        return version;

    }

}
