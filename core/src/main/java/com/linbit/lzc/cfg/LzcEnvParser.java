package com.linbit.lzc.cfg;

import javax.annotation.Nullable;

import java.util.function.Function;

public class LzcEnvParser
{
    public static final String LZC_CONFIG_FILE = "LZC_CONFIG_FILE";
    public static final String LZC_NVPAIR_LIBRARY = "LZC_NVPAIR_LIBRARY";
    public static final String LZC_ZFS_CORE_LIBRARY = "LZC_ZFS_CORE_LIBRARY";
    public static final String LZC_LOG_LEVEL = "LZC_LOG_LEVEL";
    public static final String LZC_LOG_LEVEL_LZC = "LZC_LOG_LEVEL_LZC";

    private LzcEnvParser()
    {
    }

    static void applyTo(LzcConfig cfg, Function<String, String> env)
    {
        cfg.setNvPairLibrary(getEnv(env, LZC_NVPAIR_LIBRARY));
        cfg.setZfsCoreLibrary(getEnv(env, LZC_ZFS_CORE_LIBRARY));
        cfg.setLogLevel(getEnv(env, LZC_LOG_LEVEL));
        cfg.setLogLevelLzc(getEnv(env, LZC_LOG_LEVEL_LZC));
    }

    /**
     * Returns the value of the variable, treating empty values as unset
     */
    private static @Nullable String getEnv(Function<String, String> env, String name)
    {
        String value = env.apply(name);
        if (value != null && value.trim().isEmpty())
        {
            value = null;
        }
        return value;
    }
}
