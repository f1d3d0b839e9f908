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
 * Created on Mar 14, 2024
 */

package com.datalink.graph.store;

import com.datalink.graph.model.Edge;
import com.datalink.graph.model.ID;
import com.datalink.striterator.ICloseableIterator;

/**
 * A store of directed, optionally labeled edges between identifiers. The
 * same edge may be added any number of times and each insertion is visited
 * separately by the traversals. Endpoints are not required to exist.
 * <p>
 * The traversals are lazy. Callers which stop early should
 * {@link ICloseableIterator#close()} the iterator.
 *
 * @author datalink developers
 * @version $Id$
 */
public interface ILinkStore {

    /**
     * @param key
     *            The label -or- <code>null</code>.
     *
     * @return The new edge. It is the handle for {@link #removeEdge(Edge)}.
     */
    Edge addEdge(ID source, ID key, ID target);

    /**
     * Remove one insertion of an edge. Removing an edge a second time has
     * no effect.
     *
     * @return <code>true</code> iff an edge was removed.
     */
    boolean removeEdge(Edge edge);

    /**
     * All edges whose source is given.
     */
    ICloseableIterator<Edge> edgesFrom(ID source);

    /**
     * The edges whose source and key are given. A <code>null</code> key
     * visits the edges of the source which have no label.
     */
    ICloseableIterator<Edge> edgesFromWithKey(ID source, ID key);

    /**
     * All edges having the given key. A <code>null</code> key visits the
     * edges which have no label.
     */
    ICloseableIterator<Edge> edgesByKey(ID key);

    /**
     * All edges whose target is given.
     */
    ICloseableIterator<Edge> edgesTo(ID target);

    long getLinkCount();

}
