package com.linbit.lzc.nvlist;

import java.util.Objects;

/**
 * A nested {@link NvMap} ({@code DATA_TYPE_NVLIST})
 */
public final class NvNested extends NvValue
{
    private final NvMap value;

    NvNested(NvMap valueRef)
    {
        value = Objects.requireNonNull(valueRef);
    }

    public NvMap mapValue()
    {
        return value;
    }

    @Override
    public Kind getKind()
    {
        return Kind.NESTED;
    }

    @Override
    public NvDataType getType()
    {
        return NvDataType.NVLIST;
    }

    @Override
    public int hashCode()
    {
        return value.hashCode();
    }

    @Override
    public boolean equals(Object obj)
    {
        return obj instanceof NvNested && value.equals(((NvNested) obj).value);
    }

    @Override
    public String toString()
    {
        return value.toString();
    }
}
