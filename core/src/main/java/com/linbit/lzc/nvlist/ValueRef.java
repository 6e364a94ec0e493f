package com.linbit.lzc.nvlist;

import javax.annotation.Nullable;

/**
 * Output parameter of a wire accessor call
 */
public final class ValueRef<T>
{
    private @Nullable T value;

    public @Nullable T get()
    {
        return value;
    }

    public void set(@Nullable T valueRef)
    {
        value = valueRef;
    }
}
