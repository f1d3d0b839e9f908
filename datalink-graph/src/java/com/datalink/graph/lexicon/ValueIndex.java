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

package com.datalink.graph.lexicon;

import static com.datalink.graph.schema.GraphSchema.*;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.LinkedList;
import java.util.List;

import org.apache.log4j.Logger;

import com.datalink.graph.model.ID;
import com.datalink.graph.model.TypedValue;
import com.datalink.graph.model.ValueType;
import com.datalink.journal.ITask;
import com.datalink.journal.Journal;

/**
 * The value table of a generation 2 store. Each record is keyed by its
 * {@link ID} and carries at most one payload column, selected by the
 * {@link ValueType} of the record's {@link TypedValue}.
 *
 * @author datalink developers
 * @version $Id$
 */
public class ValueIndex {

    protected static final transient Logger log = Logger.getLogger(ValueIndex.class);

    private static final ValueType[] PAYLOAD = ValueType.payloadTypes();

    static final String INSERT = "INSERT INTO " + q(VALUES) + " (" + q(V2_ID)
            + ", " + payloadColumns(null) + ") VALUES (?"
            + repeat(", ?", PAYLOAD.length) + ")";

    static final String UPSERT = INSERT + " ON CONFLICT(" + q(V2_ID)
            + ") DO UPDATE SET " + assignExcluded();

    static final String SELECT = "SELECT " + payloadColumns(null) + " FROM "
            + q(VALUES) + " INDEXED BY " + q(DATA_ID) + " WHERE " + q(V2_ID)
            + " = ?";

    static final String CONTAINS = "SELECT 1 FROM " + q(VALUES)
            + " INDEXED BY " + q(DATA_ID) + " WHERE " + q(V2_ID) + " = ?";

    static final String DELETE = "DELETE FROM " + q(VALUES) + " WHERE "
            + q(V2_ID) + " = ?";

    static final String FIND_STR = "SELECT " + q(V2_ID) + " FROM " + q(VALUES)
            + " INDEXED BY " + q(DATA_STRS) + " WHERE " + q("str") + " = ?";

    static final String FIND_STR_LIKE = "SELECT " + q(V2_ID) + " FROM "
            + q(VALUES) + " WHERE " + q("str") + " LIKE ? ORDER BY rowid";

    static final String COUNT = "SELECT COUNT(*) FROM " + q(VALUES);

    private static String repeat(final String s, final int n) {

        final StringBuilder sb = new StringBuilder();

        for (int i = 0; i < n; i++)
            sb.append(s);

        return sb.toString();

    }

    private static String assignExcluded() {

        final StringBuilder sb = new StringBuilder();

        for (ValueType t : PAYLOAD) {

            if (sb.length() > 0)
                sb.append(", ");

            sb.append(q(t.getColumn())).append(" = excluded.").append(
                    q(t.getColumn()));

        }

        return sb.toString();

    }

    private final Journal journal;

    public ValueIndex(final Journal journal) {

        if (journal == null)
            throw new IllegalArgumentException();

        this.journal = journal;

    }

    /**
     * Bind an identifier.
     */
    public static void bindID(final PreparedStatement stmt, final int index,
            final ID id) throws SQLException {

        if (id == null) {

            stmt.setNull(index, Types.BLOB);

        } else {

            stmt.setBytes(index, id.toByteArray());

        }

    }

    /**
     * Read an identifier.
     *
     * @return The identifier -or- <code>null</code> if the column is SQL
     *         <code>NULL</code>.
     *
     * @throws com.datalink.graph.model.MalformedIdentifierException
     *             if the column is not a valid identifier.
     */
    public static ID readID(final ResultSet rs, final int index)
            throws SQLException {

        final byte[] b = rs.getBytes(index);

        if (b == null)
            return null;

        return ID.valueOf(b);

    }

    /**
     * Bind the identifier and every payload column (all but one of which are
     * <code>NULL</code>).
     */
    private static void bindRecord(final PreparedStatement stmt, final ID id,
            final TypedValue value) throws SQLException {

        bindID(stmt, 1, id);

        for (int i = 0; i < PAYLOAD.length; i++) {

            final ValueType t = PAYLOAD[i];

            t.bind(stmt, i + 2, t == value.getType() ? value.getValue() : null);

        }

    }

    private static void assertArgs(final ID id, final TypedValue value) {

        if (id == null)
            throw new IllegalArgumentException();

        if (value == null)
            throw new IllegalArgumentException();

    }

    /**
     * Insert the record or replace the payload of an existing record.
     */
    public void put(final ID id, final TypedValue value) {

        assertArgs(id, value);

        journal.execute(new ITask<Void>() {

            public Void call(final Connection conn) throws SQLException {

                final PreparedStatement stmt = conn.prepareStatement(UPSERT);

                try {

                    bindRecord(stmt, id, value);

                    stmt.executeUpdate();

                } finally {

                    stmt.close();

                }

                return null;

            }

        });

        if (log.isDebugEnabled())
            log.debug("put: " + id + " := " + value);

    }

    /**
     * Insert the record.
     *
     * @return <code>false</code> iff a record with that identifier exists, in
     *         which case the store is unchanged.
     */
    public boolean insert(final ID id, final TypedValue value) {

        assertArgs(id, value);

        final boolean inserted = journal.executeAtomic(new ITask<Boolean>() {

            public Boolean call(final Connection conn) throws SQLException {

                if (contains(conn, id))
                    return Boolean.FALSE;

                final PreparedStatement stmt = conn.prepareStatement(INSERT);

                try {

                    bindRecord(stmt, id, value);

                    stmt.executeUpdate();

                } finally {

                    stmt.close();

                }

                return Boolean.TRUE;

            }

        });

        if (log.isDebugEnabled())
            log.debug("insert: " + id + " := " + value + " : " + inserted);

        return inserted;

    }

    /**
     * @return The payload -or- <code>null</code> if there is no such record.
     */
    public TypedValue get(final ID id) {

        if (id == null)
            throw new IllegalArgumentException();

        return journal.execute(new ITask<TypedValue>() {

            public TypedValue call(final Connection conn) throws SQLException {

                final PreparedStatement stmt = conn.prepareStatement(SELECT);

                try {

                    bindID(stmt, 1, id);

                    final ResultSet rs = stmt.executeQuery();

                    try {

                        if (!rs.next())
                            return null;

                        return readPayload(id, rs);

                    } finally {

                        rs.close();

                    }

                } finally {

                    stmt.close();

                }

            }

        });

    }

    /**
     * Decode the payload of the current row. If more than one column is set
     * the first one in declaration order wins and the others are not
     * decoded.
     */
    private static TypedValue readPayload(final ID id, final ResultSet rs)
            throws SQLException {

        TypedValue ret = null;

        StringBuilder ignored = null;

        for (int i = 0; i < PAYLOAD.length; i++) {

            if (rs.getObject(i + 1) == null)
                continue;

            if (ret == null) {

                ret = PAYLOAD[i].read(rs, i + 1);

            } else {

                if (ignored == null)
                    ignored = new StringBuilder();
                else
                    ignored.append(", ");

                ignored.append(PAYLOAD[i].getColumn());

            }

        }

        if (ignored != null)
            log.warn("Multiple payloads: id=" + id + ", using " + ret
                    + ", ignoring " + ignored);

        return ret == null ? TypedValue.EMPTY : ret;

    }

    public boolean contains(final ID id) {

        if (id == null)
            throw new IllegalArgumentException();

        return journal.execute(new ITask<Boolean>() {

            public Boolean call(final Connection conn) throws SQLException {

                return contains(conn, id);

            }

        });

    }

    private static boolean contains(final Connection conn, final ID id)
            throws SQLException {

        final PreparedStatement stmt = conn.prepareStatement(CONTAINS);

        try {

            bindID(stmt, 1, id);

            final ResultSet rs = stmt.executeQuery();

            try {

                return rs.next();

            } finally {

                rs.close();

            }

        } finally {

            stmt.close();

        }

    }

    /**
     * @return <code>true</code> iff a record was removed.
     */
    public boolean delete(final ID id) {

        if (id == null)
            throw new IllegalArgumentException();

        return journal.execute(new ITask<Boolean>() {

            public Boolean call(final Connection conn) throws SQLException {

                final PreparedStatement stmt = conn.prepareStatement(DELETE);

                try {

                    bindID(stmt, 1, id);

                    return stmt.executeUpdate() > 0;

                } finally {

                    stmt.close();

                }

            }

        });

    }

    /**
     * The identifiers of the records whose payload is exactly the given
     * string.
     */
    public List<ID> findByString(final String text) {

        if (text == null)
            throw new IllegalArgumentException();

        return findIds(FIND_STR, text);

    }

    /**
     * The identifiers of the records whose string payload matches the SQL
     * <code>LIKE</code> pattern.
     */
    public List<ID> findByStringLike(final String pattern) {

        if (pattern == null)
            throw new IllegalArgumentException();

        return findIds(FIND_STR_LIKE, pattern);

    }

    private List<ID> findIds(final String sql, final String arg) {

        return journal.execute(new ITask<List<ID>>() {

            public List<ID> call(final Connection conn) throws SQLException {

                final List<ID> ids = new LinkedList<ID>();

                final PreparedStatement stmt = conn.prepareStatement(sql);

                try {

                    stmt.setString(1, arg);

                    final ResultSet rs = stmt.executeQuery();

                    try {

                        while (rs.next()) {

                            ids.add(readID(rs, 1));

                        }

                    } finally {

                        rs.close();

                    }

                } finally {

                    stmt.close();

                }

                return ids;

            }

        });

    }

    public long getValueCount() {

        return journal.execute(new ITask<Long>() {

            public Long call(final Connection conn) throws SQLException {

                final PreparedStatement stmt = conn.prepareStatement(COUNT);

                try {

                    final ResultSet rs = stmt.executeQuery();

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
