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

/**
 * The payload of a value record: a {@link ValueType} together with a value of
 * that type. Exactly one type is active per instance, so a record can never
 * carry two payloads.
 * <p>
 * Values are held as the following Java types:
 * <dl>
 * <dt>{@link ValueType#Bool}</dt>
 * <dd>{@link Boolean}</dd>
 * <dt>{@link ValueType#U8}, {@link ValueType#I16}</dt>
 * <dd>{@link Short}</dd>
 * <dt>{@link ValueType#I8}</dt>
 * <dd>{@link Byte}</dd>
 * <dt>{@link ValueType#U16}, {@link ValueType#I32}</dt>
 * <dd>{@link Integer}</dd>
 * <dt>{@link ValueType#U32}, {@link ValueType#I64}, {@link ValueType#U64}</dt>
 * <dd>{@link Long} ({@link ValueType#U64} as the bits of the unsigned value)</dd>
 * <dt>{@link ValueType#F32}</dt>
 * <dd>{@link Float}</dd>
 * <dt>{@link ValueType#F64}</dt>
 * <dd>{@link Double}</dd>
 * <dt>{@link ValueType#Str}</dt>
 * <dd>{@link String}</dd>
 * </dl>
 *
 * @author datalink developers
 * @version $Id$
 */
public final class TypedValue implements Serializable {

    private static final long serialVersionUID = 2590434419640669103L;

    /**
     * A record without a payload.
     */
    public static final TypedValue EMPTY = new TypedValue(ValueType.None, null);

    private final ValueType type;

    private final Object value;

    private TypedValue(final ValueType type, final Object value) {

        this.type = type;

        this.value = value;

    }

    public static TypedValue bool(final boolean v) {

        return new TypedValue(ValueType.Bool, Boolean.valueOf(v));

    }

    /**
     * @throws IllegalArgumentException
     *             unless <code>0 &lt;= v &lt;= 255</code>.
     */
    public static TypedValue u8(final int v) {

        if (v < 0 || v > 0xff)
            throw new IllegalArgumentException("u8: " + v);

        return new TypedValue(ValueType.U8, Short.valueOf((short) v));

    }

    public static TypedValue i8(final byte v) {

        return new TypedValue(ValueType.I8, Byte.valueOf(v));

    }

    /**
     * @throws IllegalArgumentException
     *             unless <code>0 &lt;= v &lt;= 65535</code>.
     */
    public static TypedValue u16(final int v) {

        if (v < 0 || v > 0xffff)
            throw new IllegalArgumentException("u16: " + v);

        return new TypedValue(ValueType.U16, Integer.valueOf(v));

    }

    public static TypedValue i16(final short v) {

        return new TypedValue(ValueType.I16, Short.valueOf(v));

    }

    /**
     * @throws IllegalArgumentException
     *             unless <code>0 &lt;= v &lt;= 2^32-1</code>.
     */
    public static TypedValue u32(final long v) {

        if (v < 0 || v > 0xffffffffL)
            throw new IllegalArgumentException("u32: " + v);

        return new TypedValue(ValueType.U32, Long.valueOf(v));

    }

    public static TypedValue i32(final int v) {

        return new TypedValue(ValueType.I32, Integer.valueOf(v));

    }

    /**
     * @param bits
     *            The bits of the unsigned value, e.g., <code>-1L</code> for
     *            <code>2^64-1</code>.
     */
    public static TypedValue u64(final long bits) {

        return new TypedValue(ValueType.U64, Long.valueOf(bits));

    }

    public static TypedValue i64(final long v) {

        return new TypedValue(ValueType.I64, Long.valueOf(v));

    }

    public static TypedValue f32(final float v) {

        return new TypedValue(ValueType.F32, Float.valueOf(v));

    }

    public static TypedValue f64(final double v) {

        return new TypedValue(ValueType.F64, Double.valueOf(v));

    }

    public static TypedValue str(final String v) {

        if (v == null)
            throw new IllegalArgumentException();

        return new TypedValue(ValueType.Str, v);

    }

    public ValueType getType() {

        return type;

    }

    /**
     * The value -or- <code>null</code> iff this is {@link #EMPTY}.
     */
    public Object getValue() {

        return value;

    }

    public boolean isEmpty() {

        return type == ValueType.None;

    }

    /**
     * @throws IllegalStateException
     *             unless the type is {@link ValueType#Bool}.
     */
    public boolean booleanValue() {

        assertType(type == ValueType.Bool);

        return ((Boolean) value).booleanValue();

    }

    /**
     * The value of an integer type. For {@link ValueType#U64} these are the
     * bits of the unsigned value.
     *
     * @throws IllegalStateException
     *             unless the type is an integer type.
     */
    public long longValue() {

        assertType(type.isInteger());

        return ((Number) value).longValue();

    }

    /**
     * The value of a floating point type.
     *
     * @throws IllegalStateException
     *             unless the type is {@link ValueType#F32} or
     *             {@link ValueType#F64}.
     */
    public double doubleValue() {

        assertType(type == ValueType.F32 || type == ValueType.F64);

        return ((Number) value).doubleValue();

    }

    /**
     * @throws IllegalStateException
     *             unless the type is {@link ValueType#Str}.
     */
    public String stringValue() {

        assertType(type == ValueType.Str);

        return (String) value;

    }

    private void assertType(final boolean ok) {

        if (!ok)
            throw new IllegalStateException("type=" + type);

    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof TypedValue))
            return false;

        final TypedValue t = (TypedValue) o;

        if (type != t.type)
            return false;

        return value == null ? t.value == null : value.equals(t.value);

    }

    public int hashCode() {

        return type.hashCode() * 31 + (value == null ? 0 : value.hashCode());

    }

    public String toString() {

        if (type == ValueType.U64)
            return type + "(" + Long.toUnsignedString((Long) value) + ")";

        return type + "(" + value + ")";

    }

    /**
     * Preserve the singleton.
     */
    private Object readResolve() {

        return type == ValueType.None ? EMPTY : this;

    }

}
