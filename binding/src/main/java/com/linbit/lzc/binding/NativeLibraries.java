package com.linbit.lzc.binding;

import com.linbit.lzc.LzcException;

import jnr.ffi.LibraryLoader;

/**
 * Loads libnvpair and libzfs_core through jnr-ffi
 */
public final class NativeLibraries
{
    private NativeLibraries()
    {
    }

    public static NativeNvPairLibrary loadNvPair(String libraryName) throws LzcException
    {
        NativeNvPairLibrary nvPairLib;
        try
        {
            nvPairLib = new NativeNvPairLibrary(
                LibraryLoader.create(LibNvpairNative.class).failImmediately().load(libraryName)
            );
        }
        catch (LinkageError | RuntimeException exc)
        {
            throw loadFailed(libraryName, exc);
        }
        return nvPairLib;
    }

    /**
     * Loads libzfs_core and initializes it by calling {@code libzfs_core_init()}
     */
    public static NativeZfsCoreLibrary loadZfsCore(String libraryName) throws LzcException
    {
        NativeZfsCoreLibrary zfsCoreLib;
        int initStatus;
        try
        {
            LibZfsCoreNative lib = LibraryLoader.create(LibZfsCoreNative.class)
                .failImmediately()
                .load(libraryName);
            initStatus = lib.libzfs_core_init();
            zfsCoreLib = new NativeZfsCoreLibrary(lib);
        }
        catch (LinkageError | RuntimeException exc)
        {
            throw loadFailed(libraryName, exc);
        }
        if (initStatus != 0)
        {
            throw new LzcException(
                "Initialization of libzfs_core failed",
                "libzfs_core_init() failed",
                String.format("libzfs_core_init() returned %d", initStatus),
                "Check that the ZFS kernel module is loaded and that /dev/zfs is accessible",
                null
            );
        }
        return zfsCoreLib;
    }

    private static LzcException loadFailed(String libraryName, Throwable cause)
    {
        return new LzcException(
            "Loading the native library '" + libraryName + "' failed",
            "Loading the native library '" + libraryName + "' failed",
            cause.getMessage(),
            "Install the ZFS userland libraries or configure the library name in the [library] section " +
                "of the configuration file",
            null,
            cause
        );
    }
}
