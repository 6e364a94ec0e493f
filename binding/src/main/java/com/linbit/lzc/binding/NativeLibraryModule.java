package com.linbit.lzc.binding;

import com.linbit.lzc.LzcException;
import com.linbit.lzc.cfg.LzcConfig;
import com.linbit.lzc.core.ZfsCoreLibrary;
import com.linbit.lzc.logging.ErrorReporter;
import com.linbit.lzc.nvlist.NvPairLibrary;

import com.google.inject.AbstractModule;

/**
 * Binds the native libnvpair and libzfs_core implementations
 */
public class NativeLibraryModule extends AbstractModule
{
    private final NvPairLibrary nvPairLib;
    private final ZfsCoreLibrary zfsCoreLib;

    public NativeLibraryModule(NvPairLibrary nvPairLibRef, ZfsCoreLibrary zfsCoreLibRef)
    {
        nvPairLib = nvPairLibRef;
        zfsCoreLib = zfsCoreLibRef;
    }

    /**
     * Loads the libraries named by the configuration
     */
    public static NativeLibraryModule load(LzcConfig lzcCfg, ErrorReporter errorReporter)
        throws LzcException
    {
        NvPairLibrary nvPairLib = NativeLibraries.loadNvPair(lzcCfg.getNvPairLibrary());
        errorReporter.logDebug("Loaded native library '%s'", lzcCfg.getNvPairLibrary());
        ZfsCoreLibrary zfsCoreLib = NativeLibraries.loadZfsCore(lzcCfg.getZfsCoreLibrary());
        errorReporter.logDebug("Loaded and initialized native library '%s'", lzcCfg.getZfsCoreLibrary());
        return new NativeLibraryModule(nvPairLib, zfsCoreLib);
    }

    @Override
    protected void configure()
    {
        bind(NvPairLibrary.class).toInstance(nvPairLib);
        bind(ZfsCoreLibrary.class).toInstance(zfsCoreLib);
    }
}
