package com.linbit.lzc.errors;

import com.linbit.lzc.ImplementationError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Failure of a batch operation, e.g. creating several snapshots at once
 *
 * libzfs_core reports the failures of the individual items, but only up to a limit; the number
 * of failures that were not reported is available as {@link #getSuppressedCount()}.
 */
public class ZfsMultipleErrorsException extends ZfsErrorException
{
    private static final long serialVersionUID = -1472893412358412981L;

    private final List<ZfsErrorException> errors;
    private final int suppressedCount;

    public ZfsMultipleErrorsException(ZfsErrorKind kindRef, List<ZfsErrorException> errorsRef, int suppressedCountRef)
    {
        super(kindRef, firstErrno(errorsRef), null, describe(kindRef, errorsRef, suppressedCountRef));
        if (!kindRef.isBatch())
        {
            throw new ImplementationError(kindRef + " is not a batch failure kind");
        }
        errors = Collections.unmodifiableList(new ArrayList<>(errorsRef));
        suppressedCount = suppressedCountRef;
        for (ZfsErrorException error : errors)
        {
            addSuppressed(error);
        }
    }

    private static int firstErrno(List<ZfsErrorException> errorsRef)
    {
        if (errorsRef.isEmpty())
        {
            throw new ImplementationError("A batch failure requires at least one item failure");
        }
        return errorsRef.get(0).getErrno();
    }

    private static String describe(ZfsErrorKind kindRef, List<ZfsErrorException> errorsRef, int suppressedCountRef)
    {
        StringBuilder text = new StringBuilder(kindRef.getDescription());
        text.append(" (").append(errorsRef.size()).append(errorsRef.size() == 1 ? " error" : " errors");
        if (suppressedCountRef > 0)
        {
            text.append(", ").append(suppressedCountRef).append(" more suppressed");
        }
        text.append(')');
        return text.toString();
    }

    /**
     * Returns the failures of the individual items, in the order reported by libzfs_core
     */
    public List<ZfsErrorException> getErrors()
    {
        return errors;
    }

    public int getSuppressedCount()
    {
        return suppressedCount;
    }
}
