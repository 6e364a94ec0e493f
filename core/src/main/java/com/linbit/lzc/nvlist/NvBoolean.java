package com.linbit.lzc.nvlist;

public final class NvBoolean extends NvValue
{
    static final NvBoolean TRUE = new NvBoolean(true);
    static final NvBoolean FALSE = new NvBoolean(false);

    private final boolean value;

    private NvBoolean(boolean valueRef)
    {
        value = valueRef;
    }

    public boolean booleanValue()
    {
        return value;
    }

    @Override
    public Kind getKind()
    {
        return Kind.BOOLEAN;
    }

    @Override
    public NvDataType getType()
    {
        return NvDataType.BOOLEAN_VALUE;
    }

    @Override
    public String toString()
    {
        return Boolean.toString(value);
    }
}
