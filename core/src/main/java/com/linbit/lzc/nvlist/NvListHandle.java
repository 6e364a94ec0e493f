package com.linbit.lzc.nvlist;

/**
 * Owning reference to an nvlist allocated through {@link NvPairLibrary}
 *
 * Closing the handle frees the nvlist. Closing it again has no effect.
 */
public final class NvListHandle implements AutoCloseable
{
    private final NvPairLibrary nvPairLib;
    private long address;

    NvListHandle(NvPairLibrary nvPairLibRef, long addressRef)
    {
        nvPairLib = nvPairLibRef;
        address = addressRef;
    }

    /**
     * Allocates an empty nvlist with unique names
     *
     * @throws NvListException if libnvpair cannot allocate the nvlist
     */
    static NvListHandle allocate(NvPairLibrary nvPairLib) throws NvListException
    {
        long nvl = nvPairLib.nvlistAlloc(NvPairLibrary.NV_UNIQUE_NAME);
        if (nvl == NvListSlot.NULL_ADDRESS)
        {
            throw new NvListException(
                NvListException.Reason.ALLOCATION_FAILED,
                null,
                "nvlist_alloc failed"
            );
        }
        return new NvListHandle(nvPairLib, nvl);
    }

    public long getAddress()
    {
        if (address == NvListSlot.NULL_ADDRESS)
        {
            throw new IllegalStateException("The nvlist has already been freed");
        }
        return address;
    }

    public boolean isClosed()
    {
        return address == NvListSlot.NULL_ADDRESS;
    }

    @Override
    public void close()
    {
        if (address != NvListSlot.NULL_ADDRESS)
        {
            long nvl = address;
            address = NvListSlot.NULL_ADDRESS;
            nvPairLib.nvlistFree(nvl);
        }
    }
}
