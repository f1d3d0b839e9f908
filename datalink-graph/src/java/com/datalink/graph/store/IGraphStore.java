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

import java.util.List;

import com.datalink.migration.IntegrityWarning;

/**
 * A value store and a link store sharing one backing store.
 *
 * @author datalink developers
 * @version $Id$
 */
public interface IGraphStore extends IValueStore, ILinkStore {

    /**
     * The schema generation of the backing store.
     */
    int getSchemaVersion();

    /**
     * Report rows which are stored but which violate an expectation of the
     * schema.
     */
    List<IntegrityWarning> checkIntegrity();

    boolean isOpen();

    void close();

}
