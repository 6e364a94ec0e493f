package com.linbit.lzc.cfg;

import com.linbit.lzc.LzcException;

import javax.annotation.Nullable;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Function;

import com.moandjiezana.toml.Toml;

/**
 * Configuration of the libzfs_core bindings
 *
 * The values are taken from the built-in defaults, overridden by the TOML configuration file,
 * if it exists, which are in turn overridden by environment variables.
 */
public class LzcConfig
{
    public static final String DEFAULT_CONFIG_FILE = "/etc/lzc/lzc.toml";
    public static final String DEFAULT_NVPAIR_LIBRARY = "nvpair";
    public static final String DEFAULT_ZFS_CORE_LIBRARY = "zfs_core";
    public static final String DEFAULT_LOG_LEVEL = "INFO";

    /*
     * Native libraries
     */
    private String nvPairLibrary;
    private String zfsCoreLibrary;

    /*
     * Logging
     */
    private String logLevel;
    private @Nullable String logLevelLzc;

    public LzcConfig()
    {
        applyDefaultValues();
    }

    /**
     * Loads the configuration from the file named by {@link LzcEnvParser#LZC_CONFIG_FILE} (or
     * {@link #DEFAULT_CONFIG_FILE}) and the process environment
     */
    public static LzcConfig load() throws LzcException
    {
        String configFile = System.getenv(LzcEnvParser.LZC_CONFIG_FILE);
        return load(Paths.get(configFile == null ? DEFAULT_CONFIG_FILE : configFile), System::getenv);
    }

    /**
     * @param tomlFile The configuration file; ignored if it does not exist
     * @param env Looks up environment variables, returns null for unset variables
     */
    public static LzcConfig load(@Nullable Path tomlFile, Function<String, String> env) throws LzcException
    {
        LzcConfig cfg = new LzcConfig();
        if (tomlFile != null)
        {
            cfg.applyTomlArgs(tomlFile);
        }
        cfg.applyEnvVars(env);
        return cfg;
    }

    protected void applyDefaultValues()
    {
        setNvPairLibrary(DEFAULT_NVPAIR_LIBRARY);
        setZfsCoreLibrary(DEFAULT_ZFS_CORE_LIBRARY);
        setLogLevel(DEFAULT_LOG_LEVEL);
    }

    protected void applyTomlArgs(Path tomlFile) throws LzcException
    {
        Path configPath = tomlFile.normalize();
        if (Files.exists(configPath))
        {
            try
            {
                LzcTomlConfig lzcToml = new Toml().read(configPath.toFile()).to(LzcTomlConfig.class);
                lzcToml.applyTo(this);
            }
            catch (RuntimeException tomlExc)
            {
                throw new LzcException(
                    String.format("Error parsing '%s': %s", configPath, tomlExc.getMessage()),
                    "The configuration file could not be parsed",
                    tomlExc.getMessage(),
                    "Check the syntax of the configuration file " + configPath,
                    null,
                    tomlExc
                );
            }
        }
    }

    protected void applyEnvVars(Function<String, String> env)
    {
        LzcEnvParser.applyTo(this, env);
    }

    public void setNvPairLibrary(@Nullable String nvPairLibraryRef)
    {
        if (nvPairLibraryRef != null)
        {
            nvPairLibrary = nvPairLibraryRef;
        }
    }

    public void setZfsCoreLibrary(@Nullable String zfsCoreLibraryRef)
    {
        if (zfsCoreLibraryRef != null)
        {
            zfsCoreLibrary = zfsCoreLibraryRef;
        }
    }

    public void setLogLevel(@Nullable String logLevelRef)
    {
        if (logLevelRef != null)
        {
            logLevel = logLevelRef;
        }
    }

    public void setLogLevelLzc(@Nullable String logLevelLzcRef)
    {
        if (logLevelLzcRef != null)
        {
            logLevelLzc = logLevelLzcRef;
        }
    }

    /**
     * Name or path of libnvpair, as accepted by the native library loader
     */
    public String getNvPairLibrary()
    {
        return nvPairLibrary;
    }

    public String getZfsCoreLibrary()
    {
        return zfsCoreLibrary;
    }

    public String getLogLevel()
    {
        return logLevel;
    }

    /**
     * Returns the log level of the lzc logger, or null if it is the same as {@link #getLogLevel()}
     */
    public @Nullable String getLogLevelLzc()
    {
        return logLevelLzc;
    }
}
