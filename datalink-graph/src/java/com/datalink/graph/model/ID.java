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
 * Created on Mar 11, 2024
 */

package com.datalink.graph.model;

import java.io.Serializable;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.UUID;
import java.util.regex.Pattern;

import com.datalink.util.Bytes;
import com.datalink.util.BytesUtil;

/**
 * A 16 byte identifier for a value record. Identifiers are compared as
 * unsigned byte strings, which is also the order of the persistent indices.
 * <p>
 * The all-zero identifier is reserved ({@link #NULL}) and is never assigned
 * to a record. {@link #valueOf(byte[])} rejects it.
 *
 * @author datalink developers
 * @version $Id$
 */
public final class ID implements Comparable<ID>, Serializable {

    private static final long serialVersionUID = -1462087466117322598L;

    /**
     * The reserved all-zero identifier.
     */
    public static final ID NULL = new ID(new byte[Bytes.SIZEOF_UUID]);

    private static final Pattern CANONICAL = Pattern
            .compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]{32}");

    private final byte[] bytes;

    private transient int hash = 0;

    private ID(final byte[] bytes) {

        this.bytes = bytes;

    }

    /**
     * Return the identifier having the given bytes.
     *
     * @param bytes
     *            The bytes (copied).
     *
     * @throws MalformedIdentifierException
     *             unless there are exactly 16 bytes, not all of which are
     *             zero.
     */
    public static ID valueOf(final byte[] bytes) {

        if (bytes == null)
            throw new MalformedIdentifierException("null");

        if (bytes.length != Bytes.SIZEOF_UUID)
            throw new MalformedIdentifierException("Expecting "
                    + Bytes.SIZEOF_UUID + " bytes, not " + bytes.length);

        if (BytesUtil.isZero(bytes))
            throw new MalformedIdentifierException("Reserved identifier");

        return new ID(bytes.clone());

    }

    /**
     * Return the identifier having the bytes of the given {@link UUID} (most
     * significant bits first).
     *
     * @throws MalformedIdentifierException
     *             if the {@link UUID} is zero.
     */
    public static ID fromUUID(final UUID uuid) {

        if (uuid == null)
            throw new IllegalArgumentException();

        final ByteBuffer b = ByteBuffer.allocate(Bytes.SIZEOF_UUID);

        b.putLong(uuid.getMostSignificantBits());

        b.putLong(uuid.getLeastSignificantBits());

        return valueOf(b.array());

    }

    /**
     * A new random (type 4) identifier.
     */
    public static ID random() {

        return fromUUID(UUID.randomUUID());

    }

    /**
     * Map an opaque text identifier onto an {@link ID}. A canonical UUID
     * string or 32 hexadecimal digits denote those bytes (unless they are all
     * zero). Any other text, including the empty string, maps to the name
     * based (type 3) UUID of its UTF-8 bytes. The same text always maps to
     * the same identifier.
     */
    public static ID fromText(final String text) {

        if (text == null)
            throw new IllegalArgumentException();

        final byte[] parsed;

        if (CANONICAL.matcher(text).matches()) {

            parsed = parseHex(text.replace("-", ""));

        } else if (HEX.matcher(text).matches()) {

            parsed = parseHex(text);

        } else {

            parsed = null;

        }

        if (parsed != null && !BytesUtil.isZero(parsed))
            return new ID(parsed);

        return fromUUID(UUID.nameUUIDFromBytes(text
                .getBytes(StandardCharsets.UTF_8)));

    }

    private static byte[] parseHex(final String s) {

        final byte[] a = new byte[s.length() / 2];

        for (int i = 0; i < a.length; i++) {

            a[i] = (byte) Integer.parseInt(s.substring(i * 2, i * 2 + 2), 16);

        }

        return a;

    }

    /**
     * <code>true</code> iff this is {@link #NULL}.
     */
    public boolean isNull() {

        return this == NULL || BytesUtil.isZero(bytes);

    }

    /**
     * A copy of the bytes.
     */
    public byte[] toByteArray() {

        return bytes.clone();

    }

    public UUID toUUID() {

        final ByteBuffer b = ByteBuffer.wrap(bytes);

        return new UUID(b.getLong(), b.getLong());

    }

    public int compareTo(final ID o) {

        return BytesUtil.compareBytes(bytes, o.bytes);

    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof ID))
            return false;

        return Arrays.equals(bytes, ((ID) o).bytes);

    }

    public int hashCode() {

        if (hash == 0)
            hash = Arrays.hashCode(bytes);

        return hash;

    }

    /**
     * The canonical UUID form.
     */
    public String toString() {

        return toUUID().toString();

    }

}
