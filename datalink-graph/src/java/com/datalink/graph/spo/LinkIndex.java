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
import java.sql.Statement;

import org.apache.log4j.Logger;

import com.datalink.graph.lexicon.ValueIndex;
import com.datalink.graph.model.Edge;
import com.datalink.graph.model.ID;
import com.datalink.journal.ITask;
import com.datalink.journal.Journal;
import com.datalink.striterator.ICloseableIterator;

/**
 * The link table of a generation 2 store. Links are not unique: each
 * {@link #addEdge(ID, ID, ID)} creates a new edge with its own handle. The
 * endpoints are never checked against the value table.
 *
 * @author datalink developers
 * @version $Id$
 */
public class LinkIndex {

    protected static final transient Logger log = Logger.getLogger(LinkIndex.class);

    static final String INSERT = "INSERT INTO " + q(LINKS) + " ("
            + q(V2_SOURCE) + ", " + q(V2_KEY) + ", " + q(V2_TARGET)
            + ") VALUES (?, ?, ?)";

    /**
     * A rowid may be reused once its row is deleted, so the endpoints are
     * matched as well as the rowid.
     */
    static final String DELETE = "DELETE FROM " + q(LINKS)
            + " WHERE rowid = ? AND " + q(V2_SOURCE) + " = ? AND "
            + q(V2_KEY) + " IS ? AND " + q(V2_TARGET) + " = ?";

    static final String COUNT = "SELECT COUNT(*) FROM " + q(LINKS);

    private final Journal journal;

    private final int chunkCapacity;

    /**
     * @param journal
     *            The store.
     * @param chunkCapacity
     *            The #of edges read per query by the iterators.
     */
    public LinkIndex(final Journal journal, final int chunkCapacity) {

        if (journal == null)
            throw new IllegalArgumentException();

        if (chunkCapacity <= 0)
            throw new IllegalArgumentException();

        this.journal = journal;

        this.chunkCapacity = chunkCapacity;

    }

    /**
     * Add an edge.
     *
     * @param source
     *            The source.
     * @param key
     *            The key -or- <code>null</code> for an edge without a label.
     * @param target
     *            The target.
     *
     * @return The new edge, which is also its handle.
     */
    public Edge addEdge(final ID source, final ID key, final ID target) {

        if (source == null)
            throw new IllegalArgumentException();

        if (target == null)
            throw new IllegalArgumentException();

        final long handle = journal.execute(new ITask<Long>() {

            public Long call(final Connection conn) throws SQLException {

                final PreparedStatement stmt = conn.prepareStatement(INSERT);

                try {

                    ValueIndex.bindID(stmt, 1, source);

                    ValueIndex.bindID(stmt, 2, key);

                    ValueIndex.bindID(stmt, 3, target);

                    stmt.executeUpdate();

                } finally {

                    stmt.close();

                }

                final Statement s = conn.createStatement();

                try {

                    final ResultSet rs = s
                            .executeQuery("SELECT last_insert_rowid()");

                    try {

                        rs.next();

                        return rs.getLong(1);

                    } finally {

                        rs.close();

                    }

                } finally {

                    s.close();

                }

            }

        });

        final Edge edge = new Edge(handle, source, key, target);

        if (log.isDebugEnabled())
            log.debug("added: " + edge);

        return edge;

    }

    /**
     * Remove an edge. An edge which was already removed is not removed
     * again, even if its rowid has since been assigned to another edge.
     *
     * @param edge
     *            The edge as returned by {@link #addEdge(ID, ID, ID)} or
     *            visited by {@link #rangeQuery(KeyOrder, ID...)}.
     *
     * @return <code>true</code> iff an edge was removed.
     */
    public boolean removeEdge(final Edge edge) {

        if (edge == null)
            throw new IllegalArgumentException();

        return journal.execute(new ITask<Boolean>() {

            public Boolean call(final Connection conn) throws SQLException {

                final PreparedStatement stmt = conn.prepareStatement(DELETE);

                try {

                    stmt.setLong(1, edge.getHandle());

                    ValueIndex.bindID(stmt, 2, edge.getSource());

                    ValueIndex.bindID(stmt, 3, edge.getKey());

                    ValueIndex.bindID(stmt, 4, edge.getTarget());

                    return stmt.executeUpdate() > 0;

                } finally {

                    stmt.close();

                }

            }

        });

    }

    /**
     * Visit the edges on an access path.
     *
     * @param keyOrder
     *            The access path.
     * @param bindings
     *            One value per column of the access path. A <code>null</code>
     *            binding matches <code>NULL</code>.
     */
    public ICloseableIterator<Edge> rangeQuery(final KeyOrder keyOrder,
            final ID... bindings) {

        return new EdgeIterator(journal, keyOrder, bindings, chunkCapacity);

    }

    public long getLinkCount() {

        return journal.execute(new ITask<Long>() {

            public Long call(final Connection conn) throws SQLException {

                final Statement stmt = conn.createStatement();

                try {

                    final ResultSet rs = stmt.executeQuery(COUNT);

                    try {

                        rs.next();

                        return rs.getLong(1);

                    } finally {

                        rs.close();

                    }

                } finally {

                    stmt.close();

                }

            }

        });

    }

}
