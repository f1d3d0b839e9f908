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
 * Created on Mar 11, 2024
 */

package com.datalink.graph.model;

/**
 * A link record as read from the link store. Two insertions of the same
 * (source, key, target) are distinct edges with distinct handles. An edge is
 * also the handle by which that insertion is removed.
 *
 * @author datalink developers
 * @version $Id$
 */
public final class Edge {

    private final long handle;

    private final ID source;

    private final ID key;

    private final ID target;

    /**
     * @param handle
     *            The handle which identifies this insertion.
     * @param source
     *            The source identifier.
     * @param key
     *            The key identifier -or- <code>null</code> if the edge is not
     *            labeled.
     * @param target
     *            The target identifier.
     */
    public Edge(final long handle, final ID source, final ID key,
            final ID target) {

        if (source == null)
            throw new IllegalArgumentException();

        if (target == null)
            throw new IllegalArgumentException();

        this.handle = handle;
        this.source = source;
        this.key = key;
        this.target = target;

    }

    /**
     * The handle which identifies this insertion. Handles are only meaningful
     * for the schema generation in which they were obtained.
     */
    public long getHandle() {
        return handle;
    }

    public ID getSource() {
        return source;
    }

    /**
     * The key -or- <code>null</code> if the edge is not labeled.
     */
    public ID getKey() {
        return key;
    }

    public ID getTarget() {
        return target;
    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof Edge))
            return false;

        final Edge e = (Edge) o;

        return handle == e.handle && source.equals(e.source)
                && (key == null ? e.key == null : key.equals(e.key))
                && target.equals(e.target);

    }

    public int hashCode() {

        return (int) (handle ^ (handle >>> 32));

    }

    public String toString() {

        return "Edge{#" + handle + ", " + source + " -[" + key + "]-> "
                + target + "}";

    }

}
