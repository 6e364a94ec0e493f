package com.linbit.lzc.nvlist;

import com.linbit.lzc.LzcException;

import javax.annotation.Nullable;

/**
 * Thrown if a property map cannot be converted to an nvlist or vice versa
 */
public class NvListException extends LzcException
{
    private static final long serialVersionUID = -2617358290147153871L;

    public enum Reason
    {
        TYPE_MISMATCH,
        UNSUPPORTED_TYPE,
        INVALID_VALUE,
        ALLOCATION_FAILED,
        ADD_FAILED,
        DECODE_FAILED
    }

    private final Reason reason;
    private final @Nullable String key;

    public NvListException(Reason reasonRef, @Nullable String keyRef, String message)
    {
        this(reasonRef, keyRef, message, null);
    }

    public NvListException(
        Reason reasonRef,
        @Nullable String keyRef,
        String message,
        @Nullable Throwable cause
    )
    {
        super(
            keyRef == null ? message : message + " (key '" + keyRef + "')",
            message,
            null,
            null,
            null,
            cause
        );
        reason = reasonRef;
        key = keyRef;
    }

    public Reason getReason()
    {
        return reason;
    }

    /**
     * Returns the key of the entry that could not be converted, or null if the failure is not
     * related to a single entry
     */
    public @Nullable String getKey()
    {
        return key;
    }
}
