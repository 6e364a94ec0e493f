package com.linbit.lzc.nvlist;

import java.util.Arrays;

/**
 * A fixed number of sibling nvlists that are allocated and freed together, as needed for
 * adding an nvlist array
 */
final class NvListHandleGroup implements AutoCloseable
{
    private final NvPairLibrary nvPairLib;
    private final long[] addresses;
    private boolean closed = false;

    private NvListHandleGroup(NvPairLibrary nvPairLibRef, long[] addressesRef)
    {
        nvPairLib = nvPairLibRef;
        addresses = addressesRef;
    }

    /**
     * Allocates {@code count} empty nvlists. If any allocation fails, the nvlists that were
     * already allocated are freed before the exception is thrown.
     */
    static NvListHandleGroup allocate(NvPairLibrary nvPairLib, int count) throws NvListException
    {
        long[] addresses = new long[count];
        NvListHandleGroup group = new NvListHandleGroup(nvPairLib, addresses);
        for (int idx = 0; idx < count; ++idx)
        {
            long nvl = nvPairLib.nvlistAlloc(NvPairLibrary.NV_UNIQUE_NAME);
            if (nvl == NvListSlot.NULL_ADDRESS)
            {
                group.close();
                throw new NvListException(
                    NvListException.Reason.ALLOCATION_FAILED,
                    null,
                    String.format("nvlist_alloc failed for array element %d of %d", idx, count)
                );
            }
            addresses[idx] = nvl;
        }
        return group;
    }

    int size()
    {
        return addresses.length;
    }

    long getAddress(int idx)
    {
        return addresses[idx];
    }

    long[] getAddresses()
    {
        return Arrays.copyOf(addresses, addresses.length);
    }

    @Override
    public void close()
    {
        if (!closed)
        {
            closed = true;
            for (int idx = 0; idx < addresses.length; ++idx)
            {
                if (addresses[idx] != NvListSlot.NULL_ADDRESS)
                {
                    nvPairLib.nvlistFree(addresses[idx]);
                    addresses[idx] = NvListSlot.NULL_ADDRESS;
                }
            }
        }
    }
}
