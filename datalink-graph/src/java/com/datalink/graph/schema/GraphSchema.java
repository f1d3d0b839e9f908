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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.datalink.graph.model.ValueType;
import com.datalink.migration.IMigrationStep;

/**
 * The persistent layout of the graph: table, column and index names for each
 * schema generation and the ordered list of steps which produce them.
 * <p>
 * Generation 1 keys records by opaque text. Generation 2 keys records by 16
 * byte binary identifiers and adds the string and target indices.
 *
 * @author datalink developers
 * @version $Id$
 */
public class GraphSchema {

    /**
     * The newest generation.
     */
    public static final int CURRENT_VERSION = 2;

    /*
     * Tables.
     */

    public static final String VALUES = "values";

    public static final String LINKS = "links";

    /*
     * Generation 1 columns.
     */

    public static final String V1_ID = "id";

    public static final String V1_SOURCE = "source_id";

    public static final String V1_KEY = "key_id";

    public static final String V1_TARGET = "target_id";

    /*
     * Generation 2 columns.
     */

    public static final String V2_ID = "uuid";

    public static final String V2_SOURCE = "source_uuid";

    public static final String V2_KEY = "key_uuid";

    public static final String V2_TARGET = "target_uuid";

    /*
     * Indices.
     */

    /** Unique index on the record identifier (both generations). */
    public static final String DATA_ID = "data_id";

    public static final String DATA_STRS = "data_strs";

    public static final String LINKS_SOURCE_ID = "links_source_id";

    public static final String LINKS_KEY_ID = "links_key_id";

    public static final String LINKS_SOURCE = "links_source";

    public static final String LINKS_KEY = "links_key";

    public static final String LINKS_TARGET = "links_target";

    /** Index on (source, key) (both generations). */
    public static final String LINKS_KEYED = "links_keyed";

    /**
     * The declarations of the payload columns, in declaration order.
     */
    static final String PAYLOAD_DECLS = "" //
            + "`bool` BOOLEAN,\n" //
            + "`u8` UNSIGNED INT(1),\n" //
            + "`i8` INT(1),\n" //
            + "`u16` UNSIGNED INT(2),\n" //
            + "`i16` INT(2),\n" //
            + "`u32` UNSIGNED INT(4),\n" //
            + "`i32` INT(4),\n" //
            + "`u64` UNSIGNED INT(8),\n" //
            + "`i64` INT(8),\n" //
            + "`f32` FLOAT(4),\n" //
            + "`f64` FLOAT(8),\n" //
            + "`str` TEXT";

    private GraphSchema() {
    }

    /**
     * Quote an SQL identifier.
     */
    public static String q(final String name) {

        return "`" + name + "`";

    }

    /**
     * The payload columns, quoted, comma delimited and qualified by the given
     * table alias (optional).
     */
    public static String payloadColumns(final String alias) {

        final StringBuilder sb = new StringBuilder();

        for (ValueType t : ValueType.payloadTypes()) {

            if (sb.length() > 0)
                sb.append(", ");

            if (alias != null)
                sb.append(alias).append('.');

            sb.append(q(t.getColumn()));

        }

        return sb.toString();

    }

    /**
     * The steps which produce generations <code>1..CURRENT_VERSION</code>.
     */
    public static List<IMigrationStep> getMigrationSteps() {

        final List<IMigrationStep> steps = new ArrayList<IMigrationStep>();

        steps.add(new CreateSchemaStep());

        steps.add(new BinaryIdentifierStep());

        return Collections.unmodifiableList(steps);

    }

}
