package com.linbit.lzc.core;

import com.linbit.lzc.errors.ZfsErrorTranslator;
import com.linbit.lzc.nvlist.NvListCodec;

import com.google.inject.AbstractModule;

/**
 * Binds the codec, the error translator and the facade. The native libraries
 * ({@link com.linbit.lzc.nvlist.NvPairLibrary}, {@link ZfsCoreLibrary}) and the
 * {@link com.linbit.lzc.logging.ErrorReporter} are bound by other modules.
 */
public class LzcModule extends AbstractModule
{
    @Override
    protected void configure()
    {
        bind(NvListCodec.class);
        bind(ZfsErrorTranslator.class);
        bind(LibZfsCore.class);
    }
}
