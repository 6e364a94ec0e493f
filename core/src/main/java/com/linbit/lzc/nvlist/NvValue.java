package com.linbit.lzc.nvlist;

import javax.annotation.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * A value that can be stored in an {@link NvMap}
 *
 * The set of subclasses is closed: {@link NvPresence}, {@link NvBoolean}, {@link NvNumber},
 * {@link NvString}, {@link NvNested} and {@link NvArray}. Code that needs to handle every
 * variant switches over {@link #getKind()}.
 */
public abstract class NvValue
{
    public enum Kind
    {
        PRESENCE,
        BOOLEAN,
        NUMBER,
        STRING,
        NESTED,
        ARRAY
    }

    NvValue()
    {
    }

    public abstract Kind getKind();

    /**
     * Returns the libnvpair tag this value is written with, or null if the tag cannot be
     * determined without looking at the elements (non-empty arrays) or the key (host integers)
     */
    public abstract @Nullable NvDataType getType();

    public static NvPresence presence()
    {
        return NvPresence.INSTANCE;
    }

    public static NvBoolean of(boolean value)
    {
        return value ? NvBoolean.TRUE : NvBoolean.FALSE;
    }

    public static NvString of(String value)
    {
        return new NvString(value);
    }

    public static NvNested of(NvMap value)
    {
        return new NvNested(value);
    }

    /**
     * Creates a host integer without a declared width. It is written as uint64 unless the
     * key it is stored under requires a different width.
     */
    public static NvNumber integer(long value)
    {
        return new NvNumber(NvDataType.UINT64, value, false);
    }

    public static NvNumber byteValue(int value)
    {
        return new NvNumber(NvDataType.BYTE, value, true);
    }

    public static NvNumber int8(int value)
    {
        return new NvNumber(NvDataType.INT8, value, true);
    }

    public static NvNumber uint8(int value)
    {
        return new NvNumber(NvDataType.UINT8, value, true);
    }

    public static NvNumber int16(int value)
    {
        return new NvNumber(NvDataType.INT16, value, true);
    }

    public static NvNumber uint16(int value)
    {
        return new NvNumber(NvDataType.UINT16, value, true);
    }

    public static NvNumber int32(int value)
    {
        return new NvNumber(NvDataType.INT32, value, true);
    }

    public static NvNumber uint32(long value)
    {
        return new NvNumber(NvDataType.UINT32, value, true);
    }

    public static NvNumber int64(long value)
    {
        return new NvNumber(NvDataType.INT64, value, true);
    }

    /**
     * @param value The unsigned 64 bit value; values above {@link Long#MAX_VALUE} are passed as
     *     their two's complement bit pattern
     */
    public static NvNumber uint64(long value)
    {
        return new NvNumber(NvDataType.UINT64, value, true);
    }

    public static NvNumber number(NvDataType type, long value)
    {
        return new NvNumber(type, value, true);
    }

    public static NvArray array(NvValue... elements)
    {
        return new NvArray(Arrays.asList(elements), null);
    }

    public static NvArray array(List<? extends NvValue> elements)
    {
        return new NvArray(elements, null);
    }

    /**
     * Creates an empty array. The element type is needed because an empty array does not have
     * a specimen element the libnvpair tag could be derived from.
     */
    public static NvArray emptyArray(NvDataType elementType)
    {
        return new NvArray(Arrays.<NvValue>asList(), elementType);
    }

    public static NvArray stringArray(String... values)
    {
        NvValue[] elements = new NvValue[values.length];
        for (int idx = 0; idx < values.length; ++idx)
        {
            elements[idx] = of(values[idx]);
        }
        return values.length == 0 ? emptyArray(NvDataType.STRING) : array(elements);
    }

    public static NvArray mapArray(NvMap... values)
    {
        NvValue[] elements = new NvValue[values.length];
        for (int idx = 0; idx < values.length; ++idx)
        {
            elements[idx] = of(values[idx]);
        }
        return values.length == 0 ? emptyArray(NvDataType.NVLIST) : array(elements);
    }
}
