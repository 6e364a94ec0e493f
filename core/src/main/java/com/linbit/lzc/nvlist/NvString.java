package com.linbit.lzc.nvlist;

import java.util.Objects;

public final class NvString extends NvValue
{
    private final String value;

    NvString(String valueRef)
    {
        value = Objects.requireNonNull(valueRef);
    }

    public String stringValue()
    {
        return value;
    }

    @Override
    public Kind getKind()
    {
        return Kind.STRING;
    }

    @Override
    public NvDataType getType()
    {
        return NvDataType.STRING;
    }

    @Override
    public int hashCode()
    {
        return value.hashCode();
    }

    @Override
    public boolean equals(Object obj)
    {
        return obj instanceof NvString && value.equals(((NvString) obj).value);
    }

    @Override
    public String toString()
    {
        return "\"" + value + "\"";
    }
}
