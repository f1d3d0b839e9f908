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
 * Created on Feb 27, 2008
 */

package com.datalink.util;

/**
 * Utility class declaring methods for examining a stack trace for an instance
 * of some class of exception.
 * 
 * @author datalink developers
 * @version $Id$
 */
public class InnerCause {

    /**
     * Examines a stack trace for an instance of the specified cause nested to
     * any level within that stack trace.
     * 
     * @param t
     *            The stack trace.
     * @param cls
     *            The class of exception that you are looking for in the stack
     *            trace.
     * 
     * @return An exception that is an instance of that class iff one exists in
     *         the stack trace and <code>null</code> otherwise.
     * 
     * @throws IllegalArgumentException
     *             if any parameter is null.
     */
    static public Throwable getInnerCause(Throwable t,
            final Class<? extends Throwable> cls) {

        if (t == null)
            throw new IllegalArgumentException();

        if (cls == null)
            throw new IllegalArgumentException();

        while (t != null) {

            if (cls.isInstance(t))
                return t;

            t = t.getCause();

        }

        return null;

    }

    /**
     * Return <code>true</code> iff an instance of the class appears anywhere
     * in the causal chain of <i>t</i>.
     * 
     * @see #getInnerCause(Throwable, Class)
     */
    static public boolean isInnerCause(final Throwable t,
            final Class<? extends Throwable> cls) {

        return getInnerCause(t, cls) != null;

    }

}
