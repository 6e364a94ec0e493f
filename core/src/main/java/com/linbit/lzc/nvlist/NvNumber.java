package com.linbit.lzc.nvlist;

import java.math.BigInteger;

/**
 * An integer of one of the explicitly sized libnvpair integer types
 *
 * Unsigned 64 bit values are stored as their two's complement bit pattern. A number created
 * by {@link NvValue#integer(long)} is a host integer without a declared width: it is written as
 * uint64 unless the key it is stored under is one of the keys that libzfs_core expects with a
 * different width. Equality ignores whether the width was declared.
 */
public final class NvNumber extends NvValue
{
    private final NvDataType type;
    private final long value;
    private final boolean widthDeclared;

    NvNumber(NvDataType typeRef, long valueRef, boolean widthDeclaredRef)
    {
        if (!typeRef.isInteger())
        {
            throw new IllegalArgumentException(typeRef + " is not an integer type");
        }
        if (!isInRange(typeRef, valueRef))
        {
            throw new IllegalArgumentException(
                String.format("Value %d is out of range for type %s", valueRef, typeRef)
            );
        }
        type = typeRef;
        value = valueRef;
        widthDeclared = widthDeclaredRef;
    }

    /**
     * Checks whether the value fits into the given integer type. Every long is a valid uint64
     * bit pattern.
     */
    public static boolean isInRange(NvDataType type, long value)
    {
        boolean inRange;
        switch (type)
        {
            case INT8:
                inRange = value >= Byte.MIN_VALUE && value <= Byte.MAX_VALUE;
                break;
            case BYTE:
            case UINT8:
                inRange = value >= 0 && value <= 0xFFL;
                break;
            case INT16:
                inRange = value >= Short.MIN_VALUE && value <= Short.MAX_VALUE;
                break;
            case UINT16:
                inRange = value >= 0 && value <= 0xFFFFL;
                break;
            case INT32:
                inRange = value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
                break;
            case UINT32:
                inRange = value >= 0 && value <= 0xFFFFFFFFL;
                break;
            case INT64:
            case UINT64:
                inRange = true;
                break;
            default:
                inRange = false;
                break;
        }
        return inRange;
    }

    @Override
    public Kind getKind()
    {
        return Kind.NUMBER;
    }

    @Override
    public NvDataType getType()
    {
        return type;
    }

    public boolean isWidthDeclared()
    {
        return widthDeclared;
    }

    public long longValue()
    {
        return value;
    }

    /**
     * Returns the value as an int
     *
     * @throws ArithmeticException if the value does not fit into an int
     */
    public int intValue()
    {
        return Math.toIntExact(value);
    }

    public BigInteger toBigInteger()
    {
        BigInteger result = BigInteger.valueOf(value);
        if (type == NvDataType.UINT64 && value < 0)
        {
            result = result.add(BigInteger.ONE.shiftLeft(Long.SIZE));
        }
        return result;
    }

    @Override
    public int hashCode()
    {
        return 31 * type.hashCode() + Long.hashCode(value);
    }

    @Override
    public boolean equals(Object obj)
    {
        boolean eq = this == obj;
        if (!eq && obj instanceof NvNumber)
        {
            NvNumber other = (NvNumber) obj;
            eq = type == other.type && value == other.value;
        }
        return eq;
    }

    @Override
    public String toString()
    {
        String text = type == NvDataType.UINT64 ? Long.toUnsignedString(value) : Long.toString(value);
        return widthDeclared ? type.getSuffix() + ":" + text : text;
    }
}
