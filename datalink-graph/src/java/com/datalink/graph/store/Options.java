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

/**
 * Options understood by the {@link GraphStore}.
 *
 * @author datalink developers
 * @version $Id$
 */
public interface Options extends com.datalink.journal.Options {

    /**
     * The #of edges read per query by the edge iterators (default
     * {@value #DEFAULT_CHUNK_CAPACITY}). Larger chunks mean fewer queries but
     * longer periods during which the store is locked by an iterator.
     */
    String CHUNK_CAPACITY = GraphStore.class.getName() + ".chunkCapacity";

    String DEFAULT_CHUNK_CAPACITY = "1000";

}
