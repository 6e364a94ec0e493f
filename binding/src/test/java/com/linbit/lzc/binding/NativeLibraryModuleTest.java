package com.linbit.lzc.binding;

import com.linbit.lzc.LzcException;
import com.linbit.lzc.cfg.LzcConfig;
import com.linbit.lzc.cfg.LzcEnvParser;
import com.linbit.lzc.core.ZfsCoreLibrary;
import com.linbit.lzc.logging.ErrorReporter;
import com.linbit.lzc.nvlist.NvPairLibrary;

import java.util.HashMap;
import java.util.Map;

import com.google.inject.Guice;
import com.google.inject.Injector;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

public class NativeLibraryModuleTest
{
    @Test
    public void bindsGivenLibraries()
    {
        NvPairLibrary nvPairLib = mock(NvPairLibrary.class);
        ZfsCoreLibrary zfsCoreLib = mock(ZfsCoreLibrary.class);

        Injector injector = Guice.createInjector(new NativeLibraryModule(nvPairLib, zfsCoreLib));

        assertThat(injector.getInstance(NvPairLibrary.class)).isSameAs(nvPairLib);
        assertThat(injector.getInstance(ZfsCoreLibrary.class)).isSameAs(zfsCoreLib);
        verifyNoInteractions(nvPairLib, zfsCoreLib);
    }

    @Test
    public void loadFailsForConfiguredMissingLibrary() throws Exception
    {
        Map<String, String> env = new HashMap<>();
        env.put(LzcEnvParser.LZC_NVPAIR_LIBRARY, "lzc-test-nvpair-that-does-not-exist");
        LzcConfig lzcCfg = LzcConfig.load(null, env::get);
        ErrorReporter errorReporter = mock(ErrorReporter.class);

        LzcException exc = catchThrowableOfType(
            () -> NativeLibraryModule.load(lzcCfg, errorReporter),
            LzcException.class
        );

        assertThat(exc).isNotNull();
        assertThat(exc.getMessage()).contains("lzc-test-nvpair-that-does-not-exist");
        verifyNoInteractions(errorReporter);
    }
}
