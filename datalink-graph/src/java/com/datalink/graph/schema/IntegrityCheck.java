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
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import com.datalink.graph.model.ValueType;
import com.datalink.migration.IntegrityWarning;
import com.datalink.util.Bytes;
import com.datalink.util.BytesUtil;

/**
 * Reports rows of a generation 2 store which are stored but which violate an
 * expectation of the schema:
 * <ul>
 * <li>a value record whose identifier is not 16 bytes;</li>
 * <li>a value record with more than one payload column;</li>
 * <li>a link endpoint which is not 16 bytes;</li>
 * <li>a link endpoint which does not resolve to a value record.</li>
 * </ul>
 * Dangling link endpoints are legal, so every problem is reported as an
 * {@link IntegrityWarning} rather than an error.
 *
 * @author datalink developers
 * @version $Id$
 */
public class IntegrityCheck {

    static final String MALFORMED = "malformed identifier";

    static final String MULTIPLE_PAYLOADS = "multiple payload columns";

    static final String DANGLING = "dangling reference";

    private IntegrityCheck() {
    }

    /**
     * Run all checks.
     *
     * @return The warnings (never <code>null</code>).
     */
    public static List<IntegrityWarning> check(final Connection conn)
            throws SQLException {

        final List<IntegrityWarning> warnings = new ArrayList<IntegrityWarning>();

        final Statement stmt = conn.createStatement();

        try {

            collect(stmt, warnings, VALUES, V2_ID, MALFORMED, "SELECT rowid, "
                    + q(V2_ID) + " FROM " + q(VALUES) + " WHERE "
                    + malformed(q(V2_ID)));

            collect(stmt, warnings, VALUES, "*", MULTIPLE_PAYLOADS,
                    "SELECT rowid, " + q(V2_ID) + " FROM " + q(VALUES)
                            + " WHERE (" + payloadCount() + ") > 1");

            for (String col : new String[] { V2_SOURCE, V2_KEY, V2_TARGET }) {

                final String c = "l." + q(col);

                collect(stmt, warnings, LINKS, col, MALFORMED,
                        "SELECT l.rowid, " + c + " FROM " + q(LINKS)
                                + " AS l WHERE " + c + " IS NOT NULL AND "
                                + malformed(c));

                collect(stmt, warnings, LINKS, col, DANGLING,
                        "SELECT l.rowid, " + c + " FROM " + q(LINKS)
                                + " AS l WHERE " + c + " IS NOT NULL AND "
                                + "NOT EXISTS (SELECT 1 FROM " + q(VALUES)
                                + " AS v WHERE v." + q(V2_ID) + " = " + c
                                + ")");

            }

        } finally {

            stmt.close();

        }

        return warnings;

    }

    private static String malformed(final String col) {

        return "(typeof(" + col + ") != 'blob' OR length(" + col + ") != "
                + Bytes.SIZEOF_UUID + ")";

    }

    private static String payloadCount() {

        final StringBuilder sb = new StringBuilder();

        for (ValueType t : ValueType.payloadTypes()) {

            if (sb.length() > 0)
                sb.append(" + ");

            sb.append("(").append(q(t.getColumn())).append(" IS NOT NULL)");

        }

        return sb.toString();

    }

    private static void collect(final Statement stmt,
            final List<IntegrityWarning> warnings, final String table,
            final String column, final String problem, final String sql)
            throws SQLException {

        final ResultSet rs = stmt.executeQuery(sql);

        try {

            while (rs.next()) {

                final Object v = rs.getObject(2);

                final String s = v instanceof byte[] ? BytesUtil
                        .toHexString((byte[]) v) : String.valueOf(v);

                warnings.add(new IntegrityWarning(table, rs.getLong(1),
                        column, problem + " : " + s));

            }

        } finally {

            rs.close();

        }

    }

}
