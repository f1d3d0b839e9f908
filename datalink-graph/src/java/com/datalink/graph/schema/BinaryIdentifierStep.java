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
 * Created on Mar 12, 2024
 */

package com.datalink.graph.schema;

import static com.datalink.graph.schema.GraphSchema.*;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import com.datalink.graph.model.ID;
import com.datalink.migration.AbstractRewriteStep;
import com.datalink.migration.IntegrityWarning;
import com.datalink.util.Bytes;

/**
 * Rewrites a generation 1 store into generation 2. Every text identifier is
 * replaced by {@link ID#fromText(String)}, which is applied consistently to
 * the value records and to all three link positions, so a link which
 * resolved before the rewrite still resolves afterwards. Payload columns are
 * copied by name without conversion. Link handles (rowids) are preserved.
 * <p>
 * The step fails if two value records map onto the same identifier or if a
 * row would be lost.
 *
 * @author datalink developers
 * @version $Id$
 */
public class BinaryIdentifierStep extends AbstractRewriteStep {

    static final String VALUES_NEW = "values_new";

    static final String LINKS_NEW = "links_new";

    /**
     * A temporary table mapping the text identifiers onto binary identifiers.
     */
    static final String ID_MAP = "id_map";

    /**
     * The #of identifier mappings written per batch.
     */
    static final int BATCH_SIZE = 1000;

    static final String CREATE_VALUES_NEW = "CREATE TABLE " + q(VALUES_NEW)
            + " (\n" //
            + q(V2_ID) + " BLOB NOT NULL UNIQUE CHECK(length(" + V2_ID + ") = "
            + Bytes.SIZEOF_UUID + "),\n" //
            + PAYLOAD_DECLS + ",\n" //
            + "PRIMARY KEY (" + q(V2_ID) + ")\n" //
            + ")";

    static final String CREATE_LINKS_NEW = "CREATE TABLE " + q(LINKS_NEW)
            + " (\n" //
            + q(V2_SOURCE) + " BLOB NOT NULL " + check(V2_SOURCE) + ",\n" //
            + q(V2_KEY) + " BLOB " + check(V2_KEY) + ",\n" //
            + q(V2_TARGET) + " BLOB NOT NULL " + check(V2_TARGET) + "\n" //
            + ")";

    static final String[] CREATE_INDICES = new String[] {
            "CREATE UNIQUE INDEX " + q(DATA_ID) + " ON " + q(VALUES) + " ("
                    + q(V2_ID) + ")",
            "CREATE INDEX " + q(DATA_STRS) + " ON " + q(VALUES) + " ("
                    + q("str") + ")",
            "CREATE INDEX " + q(LINKS_SOURCE) + " ON " + q(LINKS) + " ("
                    + q(V2_SOURCE) + ")",
            "CREATE INDEX " + q(LINKS_KEY) + " ON " + q(LINKS) + " ("
                    + q(V2_KEY) + ")",
            "CREATE INDEX " + q(LINKS_TARGET) + " ON " + q(LINKS) + " ("
                    + q(V2_TARGET) + ")",
            "CREATE INDEX " + q(LINKS_KEYED) + " ON " + q(LINKS) + " ("
                    + q(V2_SOURCE) + ", " + q(V2_KEY) + ")" };

    private static String check(final String col) {

        return "CHECK(length(" + col + ") = " + Bytes.SIZEOF_UUID + ")";

    }

    /**
     * The text of an identifier column of the old layout.
     */
    private static String text(final String alias, final String col) {

        return "CAST(" + alias + "." + q(col) + " AS TEXT)";

    }

    public BinaryIdentifierStep() {

        super(2);

    }

    protected void dropIndices(final Connection conn) throws SQLException {

        execute(conn, //
                "DROP INDEX IF EXISTS " + q(DATA_ID),//
                "DROP INDEX IF EXISTS " + q(LINKS_SOURCE_ID),//
                "DROP INDEX IF EXISTS " + q(LINKS_KEY_ID),//
                "DROP INDEX IF EXISTS " + q(LINKS_KEYED)//
        );

    }

    protected void createStructures(final Connection conn) throws SQLException {

        execute(conn, CREATE_VALUES_NEW, CREATE_LINKS_NEW,
                "CREATE TEMP TABLE " + q(ID_MAP)
                        + " (`text` TEXT NOT NULL PRIMARY KEY, " + q(V2_ID)
                        + " BLOB NOT NULL)");

    }

    protected long copyForward(final Connection conn) throws SQLException {

        final int nids = populateIdMap(conn);

        if (log.isInfoEnabled())
            log.info("Mapped " + nids + " identifiers");

        assertNoCollisions(conn);

        final int nvalues = executeUpdate(conn, "INSERT INTO " + q(VALUES_NEW)
                + " (" + q(V2_ID) + ", " + payloadColumns(null) + ")"
                + " SELECT m." + q(V2_ID) + ", " + payloadColumns("v")
                + " FROM " + q(VALUES) + " AS v" //
                + " JOIN temp." + q(ID_MAP) + " AS m ON m.`text` = "
                + text("v", V1_ID) //
                + " ORDER BY v.rowid");

        assertCount(conn, VALUES, nvalues);

        final int nlinks = executeUpdate(conn, "INSERT INTO " + q(LINKS_NEW)
                + " (rowid, " + q(V2_SOURCE) + ", " + q(V2_KEY) + ", "
                + q(V2_TARGET) + ")" //
                + " SELECT l.rowid, s." + q(V2_ID) + ", k." + q(V2_ID)
                + ", t." + q(V2_ID) //
                + " FROM " + q(LINKS) + " AS l" //
                + " JOIN temp." + q(ID_MAP) + " AS s ON s.`text` = "
                + text("l", V1_SOURCE) //
                + " LEFT JOIN temp." + q(ID_MAP) + " AS k ON k.`text` = "
                + text("l", V1_KEY) //
                + " JOIN temp." + q(ID_MAP) + " AS t ON t.`text` = "
                + text("l", V1_TARGET) //
                + " ORDER BY l.rowid");

        assertCount(conn, LINKS, nlinks);

        execute(conn, "DROP TABLE temp." + q(ID_MAP));

        return nvalues + nlinks;

    }

    /**
     * Map every distinct text identifier used by either table. The
     * identifiers are streamed into the map in batches of
     * {@link #BATCH_SIZE}.
     *
     * @return The #of distinct identifiers.
     */
    private int populateIdMap(final Connection conn) throws SQLException {

        int n = 0;

        final Statement stmt = conn.createStatement();

        try {

            final PreparedStatement insert = conn
                    .prepareStatement("INSERT INTO temp." + q(ID_MAP)
                            + " (`text`, " + q(V2_ID) + ") VALUES (?, ?)");

            try {

                final ResultSet rs = stmt.executeQuery("SELECT "
                        + text("v", V1_ID) + " FROM " + q(VALUES) + " AS v" //
                        + " UNION SELECT " + text("l", V1_SOURCE) + " FROM "
                        + q(LINKS) + " AS l" //
                        + " UNION SELECT " + text("l", V1_TARGET) + " FROM "
                        + q(LINKS) + " AS l" //
                        + " UNION SELECT " + text("l", V1_KEY) + " FROM "
                        + q(LINKS) + " AS l WHERE l." + q(V1_KEY)
                        + " IS NOT NULL");

                try {

                    while (rs.next()) {

                        final String s = rs.getString(1);

                        insert.setString(1, s);

                        insert.setBytes(2, ID.fromText(s).toByteArray());

                        insert.addBatch();

                        if (++n % BATCH_SIZE == 0)
                            insert.executeBatch();

                    }

                } finally {

                    rs.close();

                }

                insert.executeBatch();

            } finally {

                insert.close();

            }

        } finally {

            stmt.close();

        }

        return n;

    }

    /**
     * Two value records must not map onto the same identifier.
     */
    private void assertNoCollisions(final Connection conn) throws SQLException {

        final Statement stmt = conn.createStatement();

        try {

            final ResultSet rs = stmt.executeQuery("SELECT group_concat("
                    + text("v", V1_ID) + ", ', ') FROM " + q(VALUES)
                    + " AS v JOIN temp." + q(ID_MAP) + " AS m ON m.`text` = "
                    + text("v", V1_ID) + " GROUP BY m." + q(V2_ID)
                    + " HAVING COUNT(*) > 1 LIMIT 1");

            try {

                if (rs.next())
                    throw new SQLException(
                            "Identifiers map onto the same record: "
                                    + rs.getString(1));

            } finally {

                rs.close();

            }

        } finally {

            stmt.close();

        }

    }

    private void assertCount(final Connection conn, final String table,
            final int ncopied) throws SQLException {

        final Statement stmt = conn.createStatement();

        try {

            final ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM "
                    + q(table));

            try {

                rs.next();

                final long n = rs.getLong(1);

                if (n != ncopied)
                    throw new SQLException("Copied " + ncopied + " of " + n
                            + " rows from " + table);

            } finally {

                rs.close();

            }

        } finally {

            stmt.close();

        }

    }

    protected void swapIn(final Connection conn) throws SQLException {

        execute(conn, //
                "DROP TABLE " + q(VALUES), //
                "ALTER TABLE " + q(VALUES_NEW) + " RENAME TO " + q(VALUES), //
                "DROP TABLE " + q(LINKS), //
                "ALTER TABLE " + q(LINKS_NEW) + " RENAME TO " + q(LINKS) //
        );

    }

    protected void createIndices(final Connection conn) throws SQLException {

        execute(conn, CREATE_INDICES);

    }

    protected List<IntegrityWarning> checkIntegrity(final Connection conn)
            throws SQLException {

        return IntegrityCheck.check(conn);

    }

}
