package com.linbit.lzc.errors;

import com.linbit.lzc.Errno;
import com.linbit.lzc.LzcException;

import javax.annotation.Nullable;

/**
 * A classified libzfs_core failure
 *
 * The numeric code of the exception is the errno value that libzfs_core returned.
 */
public class ZfsErrorException extends LzcException
{
    private static final long serialVersionUID = 3961270419861425560L;

    private final ZfsErrorKind kind;
    private final int errno;
    private final @Nullable String name;

    public ZfsErrorException(ZfsErrorKind kindRef, int errnoRef, @Nullable String nameRef)
    {
        this(kindRef, errnoRef, nameRef, kindRef.getDescription());
    }

    /**
     * @param description Describes the problem, used instead of the kind's description
     */
    public ZfsErrorException(
        ZfsErrorKind kindRef,
        int errnoRef,
        @Nullable String nameRef,
        String description
    )
    {
        super(
            nameRef == null ? description : description + ": " + nameRef,
            description,
            Errno.name(errnoRef) + ": " + Errno.describe(errnoRef),
            null,
            null
        );
        kind = kindRef;
        errno = errnoRef;
        name = nameRef;
        setNumericCode((long) errnoRef);
    }

    public ZfsErrorKind getKind()
    {
        return kind;
    }

    public int getErrno()
    {
        return errno;
    }

    /**
     * Returns the name of the dataset, snapshot, bookmark or hold tag the failure refers to, or
     * null if the failure cannot be attributed to a single name
     */
    public @Nullable String getName()
    {
        return name;
    }
}
