package com.linbit.lzc;

import javax.annotation.Nullable;

/**
 * Signals a broken internal contract, e.g. classifying a successful status code or an
 * nvlist handed back by libzfs_core that does not have the documented layout.
 *
 * Never caught by the bindings themselves.
 */
public class ImplementationError extends Error
{
    private static final long serialVersionUID = -3620425513364907871L;

    public ImplementationError(String message)
    {
        super(message);
    }

    public ImplementationError(String message, @Nullable Throwable cause)
    {
        super(message, cause);
    }
}
