package com.linbit.lzc.binding;

import com.linbit.lzc.LzcException;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

public class NativeLibrariesTest
{
    private static final String MISSING_LIBRARY = "lzc-test-library-that-does-not-exist";

    @Test
    public void missingZfsCoreLibraryIsReported()
    {
        LzcException exc = catchThrowableOfType(
            () -> NativeLibraries.loadZfsCore(MISSING_LIBRARY),
            LzcException.class
        );

        assertThat(exc).isNotNull();
        assertThat(exc.getMessage()).contains(MISSING_LIBRARY);
        assertThat(exc.getCorrectionText()).contains("[library]");
    }

    @Test(expected = LzcException.class)
    public void missingNvPairLibraryIsReported() throws Exception
    {
        NativeLibraries.loadNvPair(MISSING_LIBRARY);
    }
}
