package com.linbit.lzc.core;

import java.util.Set;

/**
 * Flags of {@code lzc_send} ({@code enum lzc_send_flags})
 */
public enum SendFlag
{
    /** Send WRITE_EMBEDDED records */
    EMBED_DATA(1 << 0),
    /** Send blocks larger than 128 KiB */
    LARGE_BLOCK(1 << 1),
    /** Send compressed blocks as they are stored on disk */
    COMPRESS(1 << 2),
    /** Send encrypted blocks without decrypting them */
    RAW(1 << 3);

    private final int mask;

    SendFlag(int maskRef)
    {
        mask = maskRef;
    }

    public int getMask()
    {
        return mask;
    }

    public static int toMask(Set<SendFlag> flags)
    {
        int result = 0;
        for (SendFlag flag : flags)
        {
            result |= flag.mask;
        }
        return result;
    }
}
