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
 * Created on Mar 21, 2024
 */

package com.datalink.graph;

import junit.framework.Test;
import junit.framework.TestCase;
import junit.framework.TestSuite;

/**
 * Aggregates test suites in increasing dependency order.
 *
 * @author datalink developers
 * @version $Id$
 */
public class TestAll extends TestCase {

    public TestAll() {
    }

    public TestAll(String arg0) {
        super(arg0);
    }

    public static Test suite() {

        final TestSuite suite = new TestSuite("graph");

        suite.addTest(com.datalink.graph.model.TestAll.suite());

        suite.addTest(com.datalink.graph.schema.TestAll.suite());

        suite.addTest(com.datalink.graph.lexicon.TestAll.suite());

        suite.addTest(com.datalink.graph.spo.TestAll.suite());

        suite.addTest(com.datalink.graph.store.TestAll.suite());

        return suite;

    }

}
