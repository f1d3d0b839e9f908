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

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

/**
 * A type safe enumeration of the scalar types which may be stored in a value
 * record. Each type other than {@link #None} has its own nullable column in
 * the value table, named by {@link #getColumn()}. This class also binds and
 * reads column values.
 */
public enum ValueType {

    /**
     * A record without a payload.
     */
    None(null, 0),
    /**
     * A boolean.
     */
    Bool("bool", 1),
    /**
     * An unsigned 8-bit integer.
     */
    U8("u8", 1),
    /**
     * A signed 8-bit integer.
     */
    I8("i8", 1),
    /**
     * An unsigned 16-bit integer.
     */
    U16("u16", 2),
    /**
     * A signed 16-bit integer.
     */
    I16("i16", 2),
    /**
     * An unsigned 32-bit integer.
     */
    U32("u32", 4),
    /**
     * A signed 32-bit integer.
     */
    I32("i32", 4),
    /**
     * An unsigned 64-bit integer. It is stored as the signed 64-bit integer
     * having the same bits.
     */
    U64("u64", 8),
    /**
     * A signed 64-bit integer.
     */
    I64("i64", 8),
    /**
     * A single precision floating point value.
     */
    F32("f32", 4),
    /**
     * A double precision floating point value.
     */
    F64("f64", 8),
    /**
     * A Unicode string.
     */
    Str("str", -1);

    private final String column;

    private final int width;

    ValueType(final String column, final int width) {

        this.column = column;

        this.width = width;

    }

    /**
     * The column which stores values of this type -or- <code>null</code> for
     * {@link #None}.
     */
    public String getColumn() {

        return column;

    }

    /**
     * The width of the type in bytes, <code>-1</code> if the type has a
     * variable width, and zero for {@link #None}.
     */
    public int getWidth() {

        return width;

    }

    /**
     * <code>true</code> for the integer types.
     */
    public boolean isInteger() {

        switch (this) {
        case U8:
        case I8:
        case U16:
        case I16:
        case U32:
        case I32:
        case U64:
        case I64:
            return true;
        default:
            return false;
        }

    }

    /**
     * <code>true</code> for the unsigned integer types.
     */
    public boolean isUnsigned() {

        return this == U8 || this == U16 || this == U32 || this == U64;

    }

    /**
     * The types which have a column, in the order in which the columns are
     * declared.
     */
    public static ValueType[] payloadTypes() {

        final ValueType[] a = values();

        final ValueType[] b = new ValueType[a.length - 1];

        System.arraycopy(a, 1, b, 0, b.length);

        return b;

    }

    /**
     * Return the type stored in the named column.
     *
     * @throws IllegalArgumentException
     *             if no type is stored in that column.
     */
    public static ValueType valueOfColumn(final String column) {

        for (ValueType t : values()) {

            if (t.column != null && t.column.equals(column))
                return t;

        }

        throw new IllegalArgumentException("Unknown column: " + column);

    }

    /**
     * Bind the column value for this type. A <code>null</code> value binds an
     * SQL <code>NULL</code>.
     *
     * @param stmt
     *            The statement.
     * @param index
     *            The parameter index (origin one).
     * @param value
     *            The value -or- <code>null</code>.
     */
    public void bind(final PreparedStatement stmt, final int index,
            final Object value) throws SQLException {

        if (value == null) {

            stmt.setNull(index, sqlType());

            return;

        }

        switch (this) {
        case Bool:
            stmt.setBoolean(index, ((Boolean) value).booleanValue());
            break;
        case U8:
        case I8:
        case U16:
        case I16:
        case U32:
        case I32:
        case U64:
        case I64:
            stmt.setLong(index, ((Number) value).longValue());
            break;
        case F32:
            stmt.setFloat(index, ((Float) value).floatValue());
            break;
        case F64:
            stmt.setDouble(index, ((Double) value).doubleValue());
            break;
        case Str:
            stmt.setString(index, (String) value);
            break;
        default:
            throw new UnsupportedOperationException(toString());
        }

    }

    /**
     * Read the column value for this type.
     *
     * @param rs
     *            The result set, positioned on a row.
     * @param index
     *            The column index (origin one).
     *
     * @return The value -or- <code>null</code> if the column is SQL
     *         <code>NULL</code>.
     *
     * @throws IllegalArgumentException
     *             if the stored value is out of range for this type.
     */
    public TypedValue read(final ResultSet rs, final int index)
            throws SQLException {

        if (rs.getObject(index) == null)
            return null;

        final TypedValue v;

        switch (this) {
        case Bool:
            v = TypedValue.bool(rs.getBoolean(index));
            break;
        case U8:
            v = TypedValue.u8(rs.getInt(index));
            break;
        case I8: {
            final long x = rs.getLong(index);
            if (x < Byte.MIN_VALUE || x > Byte.MAX_VALUE)
                throw new IllegalArgumentException(this + " : " + x);
            v = TypedValue.i8((byte) x);
            break;
        }
        case U16:
            v = TypedValue.u16(rs.getInt(index));
            break;
        case I16: {
            final long x = rs.getLong(index);
            if (x < Short.MIN_VALUE || x > Short.MAX_VALUE)
                throw new IllegalArgumentException(this + " : " + x);
            v = TypedValue.i16((short) x);
            break;
        }
        case U32:
            v = TypedValue.u32(rs.getLong(index));
            break;
        case I32: {
            final long x = rs.getLong(index);
            if (x < Integer.MIN_VALUE || x > Integer.MAX_VALUE)
                throw new IllegalArgumentException(this + " : " + x);
            v = TypedValue.i32((int) x);
            break;
        }
        case U64:
            v = TypedValue.u64(rs.getLong(index));
            break;
        case I64:
            v = TypedValue.i64(rs.getLong(index));
            break;
        case F32:
            v = TypedValue.f32(rs.getFloat(index));
            break;
        case F64:
            v = TypedValue.f64(rs.getDouble(index));
            break;
        case Str:
            v = TypedValue.str(rs.getString(index));
            break;
        default:
            throw new UnsupportedOperationException(toString());
        }

        return v;

    }

    private int sqlType() {

        switch (this) {
        case Bool:
            return Types.BOOLEAN;
        case F32:
            return Types.FLOAT;
        case F64:
            return Types.DOUBLE;
        case Str:
            return Types.VARCHAR;
        default:
            return Types.BIGINT;
        }

    }

}
