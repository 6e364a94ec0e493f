package com.linbit.lzc;

import java.util.HashMap;
import java.util.Map;

/**
 * errno values returned by libzfs_core (Linux numbering)
 */
public final class Errno
{
    public static final int EPERM = 1;
    public static final int ENOENT = 2;
    public static final int EIO = 5;
    public static final int ENXIO = 6;
    public static final int E2BIG = 7;
    public static final int EBADF = 9;
    public static final int EAGAIN = 11;
    public static final int ENOMEM = 12;
    public static final int EACCES = 13;
    public static final int EBUSY = 16;
    public static final int EEXIST = 17;
    public static final int EXDEV = 18;
    public static final int ENODEV = 19;
    public static final int EINVAL = 22;
    public static final int ETXTBSY = 26;
    public static final int EFBIG = 27;
    public static final int ENOSPC = 28;
    public static final int ESPIPE = 29;
    public static final int EROFS = 30;
    public static final int EPIPE = 32;
    public static final int ERANGE = 34;
    public static final int ENAMETOOLONG = 36;
    public static final int ENOTSUP = 95;
    public static final int EDQUOT = 122;

    private static final Map<Integer, String> NAMES = new HashMap<>();
    private static final Map<Integer, String> DESCRIPTIONS = new HashMap<>();

    static
    {
        register(EPERM, "EPERM", "Operation not permitted");
        register(ENOENT, "ENOENT", "No such file or directory");
        register(EIO, "EIO", "Input/output error");
        register(ENXIO, "ENXIO", "No such device or address");
        register(E2BIG, "E2BIG", "Argument list too long");
        register(EBADF, "EBADF", "Bad file descriptor");
        register(EAGAIN, "EAGAIN", "Resource temporarily unavailable");
        register(ENOMEM, "ENOMEM", "Cannot allocate memory");
        register(EACCES, "EACCES", "Permission denied");
        register(EBUSY, "EBUSY", "Device or resource busy");
        register(EEXIST, "EEXIST", "File exists");
        register(EXDEV, "EXDEV", "Invalid cross-device link");
        register(ENODEV, "ENODEV", "No such device");
        register(EINVAL, "EINVAL", "Invalid argument");
        register(ETXTBSY, "ETXTBSY", "Text file busy");
        register(EFBIG, "EFBIG", "File too large");
        register(ENOSPC, "ENOSPC", "No space left on device");
        register(ESPIPE, "ESPIPE", "Illegal seek");
        register(EROFS, "EROFS", "Read-only file system");
        register(EPIPE, "EPIPE", "Broken pipe");
        register(ERANGE, "ERANGE", "Numerical result out of range");
        register(ENAMETOOLONG, "ENAMETOOLONG", "File name too long");
        register(ENOTSUP, "ENOTSUP", "Operation not supported");
        register(EDQUOT, "EDQUOT", "Disk quota exceeded");
    }

    private Errno()
    {
    }

    private static void register(int errno, String name, String description)
    {
        NAMES.put(errno, name);
        DESCRIPTIONS.put(errno, description);
    }

    /**
     * Returns the symbolic name of the errno value, e.g. "EINVAL", or "errno 123" for values
     * that are not known to this class
     */
    public static String name(int errno)
    {
        String name = NAMES.get(errno);
        if (name == null)
        {
            name = "errno " + errno;
        }
        return name;
    }

    /**
     * Returns the strerror(3) text of the errno value
     */
    public static String describe(int errno)
    {
        String description = DESCRIPTIONS.get(errno);
        if (description == null)
        {
            description = "Unknown error " + errno;
        }
        return description;
    }
}
