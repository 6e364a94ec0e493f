package com.linbit.lzc.nvlist;

/**
 * Presence-only boolean ({@code DATA_TYPE_BOOLEAN}); the entry has no payload, its mere
 * existence means "true"
 */
public final class NvPresence extends NvValue
{
    static final NvPresence INSTANCE = new NvPresence();

    private NvPresence()
    {
    }

    @Override
    public Kind getKind()
    {
        return Kind.PRESENCE;
    }

    @Override
    public NvDataType getType()
    {
        return NvDataType.BOOLEAN;
    }

    @Override
    public String toString()
    {
        return "<present>";
    }
}
