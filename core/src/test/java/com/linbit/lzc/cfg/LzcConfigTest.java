package com.linbit.lzc.cfg;

import com.linbit.lzc.LzcException;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class LzcConfigTest
{
    @Rule
    public TemporaryFolder tmpFolder = new TemporaryFolder();

    private final Map<String, String> env = new HashMap<>();

    private Path fixture() throws Exception
    {
        return Paths.get(LzcConfigTest.class.getResource("/lzc-test.toml").toURI());
    }

    @Test
    public void testDefaults() throws Exception
    {
        LzcConfig cfg = LzcConfig.load(null, env::get);

        assertEquals(LzcConfig.DEFAULT_NVPAIR_LIBRARY, cfg.getNvPairLibrary());
        assertEquals(LzcConfig.DEFAULT_ZFS_CORE_LIBRARY, cfg.getZfsCoreLibrary());
        assertEquals(LzcConfig.DEFAULT_LOG_LEVEL, cfg.getLogLevel());
        assertNull(cfg.getLogLevelLzc());
    }

    @Test
    public void testMissingFileIsIgnored() throws Exception
    {
        LzcConfig cfg = LzcConfig.load(tmpFolder.getRoot().toPath().resolve("absent.toml"), env::get);

        assertEquals(LzcConfig.DEFAULT_NVPAIR_LIBRARY, cfg.getNvPairLibrary());
    }

    @Test
    public void testTomlOverridesDefaults() throws Exception
    {
        LzcConfig cfg = LzcConfig.load(fixture(), env::get);

        assertEquals("libnvpair.so.3", cfg.getNvPairLibrary());
        assertEquals("libzfs_core.so.3", cfg.getZfsCoreLibrary());
        assertEquals("DEBUG", cfg.getLogLevel());
        assertNull(cfg.getLogLevelLzc());
    }

    @Test
    public void testPartialTomlKeepsDefaults() throws Exception
    {
        File toml = tmpFolder.newFile("partial.toml");
        Files.write(toml.toPath(), "[logging]\n  lzc_level = \"TRACE\"\n".getBytes(StandardCharsets.UTF_8));

        LzcConfig cfg = LzcConfig.load(toml.toPath(), env::get);

        assertEquals(LzcConfig.DEFAULT_NVPAIR_LIBRARY, cfg.getNvPairLibrary());
        assertEquals(LzcConfig.DEFAULT_LOG_LEVEL, cfg.getLogLevel());
        assertEquals("TRACE", cfg.getLogLevelLzc());
    }

    @Test
    public void testEnvironmentOverridesToml() throws Exception
    {
        env.put(LzcEnvParser.LZC_NVPAIR_LIBRARY, "/opt/zfs/lib/libnvpair.so");
        env.put(LzcEnvParser.LZC_LOG_LEVEL_LZC, "TRACE");
        env.put(LzcEnvParser.LZC_ZFS_CORE_LIBRARY, "  ");

        LzcConfig cfg = LzcConfig.load(fixture(), env::get);

        assertEquals("/opt/zfs/lib/libnvpair.so", cfg.getNvPairLibrary());
        assertEquals("libzfs_core.so.3", cfg.getZfsCoreLibrary());
        assertEquals("DEBUG", cfg.getLogLevel());
        assertEquals("TRACE", cfg.getLogLevelLzc());
    }

    @Test(expected = LzcException.class)
    public void testMalformedToml() throws Exception
    {
        File toml = tmpFolder.newFile("broken.toml");
        Files.write(toml.toPath(), "[library\nnvpair = ".getBytes(StandardCharsets.UTF_8));

        LzcConfig.load(toml.toPath(), env::get);
    }
}
