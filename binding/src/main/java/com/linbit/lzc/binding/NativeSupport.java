package com.linbit.lzc.binding;

import javax.annotation.Nullable;

import java.nio.charset.StandardCharsets;

import jnr.ffi.Pointer;
import jnr.ffi.Runtime;

/**
 * Conversions between the address based core interfaces and jnr-ffi types
 */
final class NativeSupport
{
    static final long NULL_ADDRESS = 0L;

    private NativeSupport()
    {
    }

    static @Nullable Pointer toPointer(Runtime runtime, long address)
    {
        return address == NULL_ADDRESS ? null : Pointer.wrap(runtime, address);
    }

    static long toAddress(@Nullable Pointer pointer)
    {
        return pointer == null ? NULL_ADDRESS : pointer.address();
    }

    static int toBooleanT(boolean value)
    {
        return value ? 1 : 0;
    }

    /**
     * Returns the content of a NUL-terminated string buffer; a buffer without NUL byte is
     * taken completely
     */
    static String fromCString(byte[] buffer)
    {
        int length = 0;
        while (length < buffer.length && buffer[length] != 0)
        {
            ++length;
        }
        return new String(buffer, 0, length, StandardCharsets.UTF_8);
    }
}
