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
import java.sql.SQLException;
import java.util.Collections;
import java.util.List;

import com.datalink.migration.AbstractMigrationStep;
import com.datalink.migration.IntegrityWarning;

/**
 * Creates the generation 1 tables and indices. Every statement is
 * conditional on the absence of the structure, so the step may be applied to
 * a store which already has them.
 *
 * @author datalink developers
 * @version $Id$
 */
public class CreateSchemaStep extends AbstractMigrationStep {

    static final String CREATE_VALUES = "CREATE TABLE IF NOT EXISTS "
            + q(VALUES) + " (\n" //
            + q(V1_ID) + " TEXT NOT NULL,\n" //
            + PAYLOAD_DECLS + ",\n" //
            + "PRIMARY KEY (" + q(V1_ID) + ")\n" //
            + ")";

    static final String CREATE_LINKS = "CREATE TABLE IF NOT EXISTS "
            + q(LINKS) + " (\n" //
            + q(V1_SOURCE) + " TEXT NOT NULL,\n" //
            + q(V1_KEY) + " TEXT,\n" //
            + q(V1_TARGET) + " TEXT NOT NULL\n" //
            + ")";

    static final String[] CREATE_INDICES = new String[] {
            "CREATE UNIQUE INDEX IF NOT EXISTS " + q(DATA_ID) + " ON "
                    + q(VALUES) + " (" + q(V1_ID) + ")",
            "CREATE INDEX IF NOT EXISTS " + q(LINKS_SOURCE_ID) + " ON "
                    + q(LINKS) + " (" + q(V1_SOURCE) + ")",
            "CREATE INDEX IF NOT EXISTS " + q(LINKS_KEY_ID) + " ON "
                    + q(LINKS) + " (" + q(V1_KEY) + ")",
            "CREATE INDEX IF NOT EXISTS " + q(LINKS_KEYED) + " ON "
                    + q(LINKS) + " (" + q(V1_SOURCE) + ", " + q(V1_KEY) + ")" };

    public CreateSchemaStep() {

        super(1);

    }

    /**
     * Always <code>false</code>.
     */
    public boolean isDestructive() {

        return false;

    }

    public List<IntegrityWarning> apply(final Connection conn)
            throws SQLException {

        execute(conn, CREATE_VALUES, CREATE_LINKS);

        execute(conn, CREATE_INDICES);

        return Collections.emptyList();

    }

}
