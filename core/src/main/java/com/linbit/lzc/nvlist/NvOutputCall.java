package com.linbit.lzc.nvlist;

import com.linbit.lzc.LzcException;

/**
 * A library call that returns an nvlist through an output slot
 */
public interface NvOutputCall
{
    /**
     * @param slot The empty output slot
     * @return The status code returned by the library
     */
    int invoke(NvListSlot slot) throws LzcException;
}
