package com.linbit.lzc.nvlist;

/**
 * The subset of libnvpair that is needed for converting property maps
 *
 * nvlists and nvpairs are referenced by their addresses; 0 is the null address. Except for
 * {@link #nvlistAlloc(int)}, every method returns the status code of the underlying libnvpair
 * function (0 on success) or the requested value directly.
 *
 * Unsigned integer types are passed as the Java type of the same width holding the same bit
 * pattern, e.g. an uint32_t is passed as an int.
 */
public interface NvPairLibrary
{
    /** nvlist_alloc flag: the nvlist does not contain duplicate names */
    int NV_UNIQUE_NAME = 1;

    /**
     * @return The address of the new nvlist, or 0 if the allocation failed
     */
    long nvlistAlloc(int nvflag);

    void nvlistFree(long nvl);

    int nvlistAddBoolean(long nvl, String name);

    int nvlistAddBooleanValue(long nvl, String name, boolean value);

    int nvlistAddByte(long nvl, String name, byte value);

    int nvlistAddInt8(long nvl, String name, byte value);

    int nvlistAddUint8(long nvl, String name, byte value);

    int nvlistAddInt16(long nvl, String name, short value);

    int nvlistAddUint16(long nvl, String name, short value);

    int nvlistAddInt32(long nvl, String name, int value);

    int nvlistAddUint32(long nvl, String name, int value);

    int nvlistAddInt64(long nvl, String name, long value);

    int nvlistAddUint64(long nvl, String name, long value);

    int nvlistAddString(long nvl, String name, String value);

    /**
     * Adds a copy of the nvlist {@code value}; the caller keeps ownership of {@code value}
     */
    int nvlistAddNvlist(long nvl, String name, long value);

    int nvlistAddBooleanArray(long nvl, String name, boolean[] values);

    int nvlistAddByteArray(long nvl, String name, byte[] values);

    int nvlistAddInt8Array(long nvl, String name, byte[] values);

    int nvlistAddUint8Array(long nvl, String name, byte[] values);

    int nvlistAddInt16Array(long nvl, String name, short[] values);

    int nvlistAddUint16Array(long nvl, String name, short[] values);

    int nvlistAddInt32Array(long nvl, String name, int[] values);

    int nvlistAddUint32Array(long nvl, String name, int[] values);

    int nvlistAddInt64Array(long nvl, String name, long[] values);

    int nvlistAddUint64Array(long nvl, String name, long[] values);

    int nvlistAddStringArray(long nvl, String name, String[] values);

    /**
     * Adds copies of the given nvlists; the caller keeps ownership of the nvlists
     */
    int nvlistAddNvlistArray(long nvl, String name, long[] values);

    /**
     * @param nvp The current nvpair, or 0 to start the iteration
     * @return The next nvpair, or 0 if there is none
     */
    long nvlistNextNvpair(long nvl, long nvp);

    String nvpairName(long nvp);

    /**
     * @return The {@code data_type_t} id of the nvpair, see {@link NvDataType#fromWireId(int)}
     */
    int nvpairType(long nvp);

    int nvpairValueBooleanValue(long nvp, ValueRef<Boolean> value);

    int nvpairValueByte(long nvp, ValueRef<Byte> value);

    int nvpairValueInt8(long nvp, ValueRef<Byte> value);

    int nvpairValueUint8(long nvp, ValueRef<Byte> value);

    int nvpairValueInt16(long nvp, ValueRef<Short> value);

    int nvpairValueUint16(long nvp, ValueRef<Short> value);

    int nvpairValueInt32(long nvp, ValueRef<Integer> value);

    int nvpairValueUint32(long nvp, ValueRef<Integer> value);

    int nvpairValueInt64(long nvp, ValueRef<Long> value);

    int nvpairValueUint64(long nvp, ValueRef<Long> value);

    int nvpairValueString(long nvp, ValueRef<String> value);

    /**
     * Retrieves the address of an embedded nvlist. The nvlist is owned by the containing nvlist
     * and must not be freed.
     */
    int nvpairValueNvlist(long nvp, ValueRef<Long> value);

    int nvpairValueBooleanArray(long nvp, ValueRef<boolean[]> values);

    int nvpairValueByteArray(long nvp, ValueRef<byte[]> values);

    int nvpairValueInt8Array(long nvp, ValueRef<byte[]> values);

    int nvpairValueUint8Array(long nvp, ValueRef<byte[]> values);

    int nvpairValueInt16Array(long nvp, ValueRef<short[]> values);

    int nvpairValueUint16Array(long nvp, ValueRef<short[]> values);

    int nvpairValueInt32Array(long nvp, ValueRef<int[]> values);

    int nvpairValueUint32Array(long nvp, ValueRef<int[]> values);

    int nvpairValueInt64Array(long nvp, ValueRef<long[]> values);

    int nvpairValueUint64Array(long nvp, ValueRef<long[]> values);

    int nvpairValueStringArray(long nvp, ValueRef<String[]> values);

    /**
     * Retrieves the addresses of embedded nvlists, which are owned by the containing nvlist
     */
    int nvpairValueNvlistArray(long nvp, ValueRef<long[]> values);
}
