package com.linbit.lzc.nvlist;

/**
 * Output slot for an nvlist that is allocated by the called library function
 *
 * The slot is handed to the function empty. If the function stores an nvlist into it, the
 * caller owns that nvlist and must free it.
 */
public final class NvListSlot
{
    public static final long NULL_ADDRESS = 0L;

    private long address = NULL_ADDRESS;

    public long getAddress()
    {
        return address;
    }

    public void setAddress(long addressRef)
    {
        address = addressRef;
    }

    public boolean isSet()
    {
        return address != NULL_ADDRESS;
    }
}
