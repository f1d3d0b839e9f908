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

import com.datalink.graph.model.ID;
import com.datalink.graph.model.TypedValue;

/**
 * A store of typed value records keyed by {@link ID}. Deleting a record never
 * removes the links which refer to it.
 *
 * @author datalink developers
 * @version $Id$
 */
public interface IValueStore {

    /**
     * Insert the record or replace the payload of an existing record.
     */
    void put(ID id, TypedValue value);

    /**
     * Insert the record.
     *
     * @throws DuplicateIdentifierException
     *             if there is already a record with that identifier.
     */
    void insert(ID id, TypedValue value);

    /**
     * Insert the record under a new random identifier.
     *
     * @return The identifier.
     */
    ID store(TypedValue value);

    /**
     * @throws NotFoundException
     *             if there is no such record.
     */
    TypedValue get(ID id);

    boolean contains(ID id);

    /**
     * @return <code>true</code> iff a record was removed.
     */
    boolean delete(ID id);

    /**
     * The records whose payload is exactly the given string.
     */
    List<ID> findByString(String text);

    /**
     * The records whose string payload matches an SQL <code>LIKE</code>
     * pattern.
     */
    List<ID> findByStringLike(String pattern);

    long getValueCount();

}
