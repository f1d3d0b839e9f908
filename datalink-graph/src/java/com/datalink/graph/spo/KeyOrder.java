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
 * Created on Mar 13, 2024
 */

package com.datalink.graph.spo;

import static com.datalink.graph.schema.GraphSchema.*;

/**
 * The access paths for the link table. Each access path is served by one
 * index and binds one or more link columns.
 *
 * @author datalink developers
 * @version $Id$
 */
public enum KeyOrder {

    /** Outgoing edges. */
    SOURCE(LINKS_SOURCE, V2_SOURCE),
    /** Edges having some key. */
    KEY(LINKS_KEY, V2_KEY),
    /** Outgoing edges having some key. */
    SOURCE_KEY(LINKS_KEYED, V2_SOURCE, V2_KEY),
    /** Incoming edges. */
    TARGET(LINKS_TARGET, V2_TARGET);

    private final String indexName;

    private final String[] columns;

    private KeyOrder(final String indexName, final String... columns) {

        this.indexName = indexName;

        this.columns = columns;

    }

    /**
     * The name of the index which serves this access path.
     */
    public String getIndexName() {

        return indexName;

    }

    /**
     * The #of columns bound by this access path.
     */
    public int getKeyArity() {

        return columns.length;

    }

    /**
     * The column at the given position in the key.
     */
    public String getColumn(final int keyPos) {

        return columns[keyPos];

    }

}
