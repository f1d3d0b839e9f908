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
 * Created on Mar 3, 2024
 */

package com.datalink.util;

/**
 * Static utility methods for unsigned byte[]s.
 * 
 * @author datalink developers
 * @version $Id$
 */
public class BytesUtil {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private static transient String NULL = "null";

    /**
     * Byte-wise comparison of byte[]s (the arrays are treated as arrays of
     * unsigned bytes).
     * 
     * @param a
     *            A byte[].
     * @param b
     *            Another byte[].
     * 
     * @return a negative integer, zero, or a positive integer as the first
     *         argument is less than, equal to, or greater than the second.
     */
    final public static int compareBytes(final byte[] a, final byte[] b) {

        if (a == b)
            return 0;

        final int alen = a.length;

        final int blen = b.length;

        for (int i = 0; i < alen && i < blen; i++) {

            // promotes to signed integers in [0:255] for comparison.
            final int ret = (a[i] & 0xff) - (b[i] & 0xff);

            if (ret != 0)
                return ret;

        }

        return alen - blen;

    }

    /**
     * Return <code>true</code> iff every byte in the array is zero.
     */
    final public static boolean isZero(final byte[] a) {

        for (int i = 0; i < a.length; i++) {

            if (a[i] != 0)
                return false;

        }

        return true;

    }

    /**
     * Formats the bytes as lower case hexadecimal digits without any
     * delimiters.
     * 
     * @param key
     *            The bytes.
     * 
     * @return The hex string -or- <code>"null"</code> if <i>key</i> is
     *         <code>null</code>.
     */
    final public static String toHexString(final byte[] key) {

        if (key == null)
            return NULL;

        final StringBuilder sb = new StringBuilder(key.length * 2);

        for (int i = 0; i < key.length; i++) {

            sb.append(HEX[(key[i] >> 4) & 0x0f]);

            sb.append(HEX[key[i] & 0x0f]);

        }

        return sb.toString();

    }

    /**
     * Formats a key as a series of comma delimited unsigned bytes.
     * 
     * @param key
     *            The key.
     * 
     * @return The string representation of the array as unsigned bytes.
     */
    final public static String toString(final byte[] key) {

        if (key == null)
            return NULL;

        final StringBuilder sb = new StringBuilder(key.length * 4 + 2);

        sb.append("[");

        for (int i = 0; i < key.length; i++) {

            if (i > 0)
                sb.append(", ");

            // as an unsigned integer.
            sb.append(Integer.toString(key[i] & 0xff));

        }

        sb.append("]");

        return sb.toString();

    }

}
