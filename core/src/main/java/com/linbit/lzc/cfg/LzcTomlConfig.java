package com.linbit.lzc.cfg;

import javax.annotation.Nullable;

@SuppressWarnings("checkstyle:MemberName")
public class LzcTomlConfig
{
    static class Library
    {
        private @Nullable String nvpair;
        private @Nullable String zfs_core;

        public void applyTo(LzcConfig cfg)
        {
            cfg.setNvPairLibrary(nvpair);
            cfg.setZfsCoreLibrary(zfs_core);
        }
    }

    static class Logging
    {
        private @Nullable String level;
        private @Nullable String lzc_level;

        public void applyTo(LzcConfig cfg)
        {
            cfg.setLogLevel(level);
            cfg.setLogLevelLzc(lzc_level);
        }
    }

    private Library library = new Library();
    private Logging logging = new Logging();

    public void applyTo(LzcConfig cfg)
    {
        library.applyTo(cfg);
        logging.applyTo(cfg);
    }
}
