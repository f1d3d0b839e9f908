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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import com.datalink.graph.lexicon.ValueIndex;
import com.datalink.graph.model.Edge;
import com.datalink.graph.model.ID;
import com.datalink.journal.ITask;
import com.datalink.journal.Journal;
import com.datalink.striterator.AbstractChunkedIterator;

/**
 * Visits the edges on one {@link KeyOrder} access path in handle order. Each
 * chunk is a separate query which resumes after the last handle visited, so
 * the journal is only locked while a chunk is read and edges written between
 * chunks may or may not be visited.
 *
 * @author datalink developers
 * @version $Id$
 */
public class EdgeIterator extends AbstractChunkedIterator<Edge> {

    private final Journal journal;

    private final KeyOrder keyOrder;

    private final ID[] bindings;

    private final String sql;

    /**
     * @param journal
     *            The store.
     * @param keyOrder
     *            The access path.
     * @param bindings
     *            One value per column of the access path. A <code>null</code>
     *            binding matches only edges for which that column is
     *            <code>NULL</code>.
     * @param chunkCapacity
     *            The maximum #of edges read per query.
     */
    public EdgeIterator(final Journal journal, final KeyOrder keyOrder,
            final ID[] bindings, final int chunkCapacity) {

        super(chunkCapacity);

        if (journal == null)
            throw new IllegalArgumentException();

        if (keyOrder == null)
            throw new IllegalArgumentException();

        if (bindings == null || bindings.length != keyOrder.getKeyArity())
            throw new IllegalArgumentException();

        this.journal = journal;

        this.keyOrder = keyOrder;

        this.bindings = bindings.clone();

        this.sql = getSQL(keyOrder, this.bindings);

    }

    static String getSQL(final KeyOrder keyOrder, final ID[] bindings) {

        final StringBuilder sb = new StringBuilder();

        sb.append("SELECT rowid, ").append(q(V2_SOURCE)).append(", ").append(
                q(V2_KEY)).append(", ").append(q(V2_TARGET));

        sb.append(" FROM ").append(q(LINKS));

        sb.append(" INDEXED BY ").append(q(keyOrder.getIndexName()));

        sb.append(" WHERE ");

        for (int i = 0; i < keyOrder.getKeyArity(); i++) {

            sb.append(q(keyOrder.getColumn(i)));

            sb.append(bindings[i] == null ? " IS NULL" : " = ?");

            sb.append(" AND ");

        }

        sb.append("rowid > ? ORDER BY rowid LIMIT ?");

        return sb.toString();

    }

    public KeyOrder getKeyOrder() {

        return keyOrder;

    }

    protected List<Edge> readChunk(final long fromPosition, final int capacity) {

        return journal.execute(new ITask<List<Edge>>() {

            public List<Edge> call(final Connection conn) throws SQLException {

                final List<Edge> chunk = new ArrayList<Edge>(capacity);

                final PreparedStatement stmt = conn.prepareStatement(sql);

                try {

                    int index = 1;

                    for (ID id : bindings) {

                        if (id != null)
                            ValueIndex.bindID(stmt, index++, id);

                    }

                    stmt.setLong(index++, fromPosition);

                    stmt.setInt(index++, capacity);

                    final ResultSet rs = stmt.executeQuery();

                    try {

                        while (rs.next()) {

                            chunk.add(new Edge(rs.getLong(1), ValueIndex
                                    .readID(rs, 2), ValueIndex.readID(rs, 3),
                                    ValueIndex.readID(rs, 4)));

                        }

                    } finally {

                        rs.close();

                    }

                } finally {

                    stmt.close();

                }

                if (log.isDebugEnabled())
                    log.debug(keyOrder + " : from=" + fromPosition + ", read="
                            + chunk.size());

                return chunk;

            }

        });

    }

    protected long getPosition(final Edge e) {

        return e.getHandle();

    }

}
