package com.linbit.lzc.cfg;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;

public class LzcConfigModule extends AbstractModule
{
    private final LzcConfig lzcConfig;

    public LzcConfigModule(LzcConfig lzcConfigRef)
    {
        lzcConfig = lzcConfigRef;
    }

    @Provides
    LzcConfig getLzcConfig()
    {
        return lzcConfig;
    }
}
