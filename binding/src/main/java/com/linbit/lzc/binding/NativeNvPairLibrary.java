package com.linbit.lzc.binding;

import com.linbit.lzc.nvlist.NvPairLibrary;
import com.linbit.lzc.nvlist.ValueRef;

import javax.annotation.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import jnr.ffi.Memory;
import jnr.ffi.Pointer;
import jnr.ffi.Runtime;
import jnr.ffi.byref.ByteByReference;
import jnr.ffi.byref.IntByReference;
import jnr.ffi.byref.LongLongByReference;
import jnr.ffi.byref.PointerByReference;
import jnr.ffi.byref.ShortByReference;

import static com.linbit.lzc.binding.NativeSupport.toAddress;
import static com.linbit.lzc.binding.NativeSupport.toBooleanT;

/**
 * {@link NvPairLibrary} backed by the native libnvpair
 */
public final class NativeNvPairLibrary implements NvPairLibrary
{
    private final LibNvpairNative lib;
    private final Runtime runtime;

    NativeNvPairLibrary(LibNvpairNative libRef)
    {
        lib = libRef;
        runtime = Runtime.getRuntime(libRef);
    }

    private @Nullable Pointer ptr(long address)
    {
        return NativeSupport.toPointer(runtime, address);
    }

    @Override
    public long nvlistAlloc(int nvflag)
    {
        PointerByReference nvlp = new PointerByReference();
        int status = lib.nvlist_alloc(nvlp, nvflag, 0);
        return status == 0 ? toAddress(nvlp.getValue()) : NativeSupport.NULL_ADDRESS;
    }

    @Override
    public void nvlistFree(long nvl)
    {
        lib.nvlist_free(ptr(nvl));
    }

    @Override
    public int nvlistAddBoolean(long nvl, String name)
    {
        return lib.nvlist_add_boolean(ptr(nvl), name);
    }

    @Override
    public int nvlistAddBooleanValue(long nvl, String name, boolean value)
    {
        return lib.nvlist_add_boolean_value(ptr(nvl), name, toBooleanT(value));
    }

    @Override
    public int nvlistAddByte(long nvl, String name, byte value)
    {
        return lib.nvlist_add_byte(ptr(nvl), name, value);
    }

    @Override
    public int nvlistAddInt8(long nvl, String name, byte value)
    {
        return lib.nvlist_add_int8(ptr(nvl), name, value);
    }

    @Override
    public int nvlistAddUint8(long nvl, String name, byte value)
    {
        return lib.nvlist_add_uint8(ptr(nvl), name, value);
    }

    @Override
    public int nvlistAddInt16(long nvl, String name, short value)
    {
        return lib.nvlist_add_int16(ptr(nvl), name, value);
    }

    @Override
    public int nvlistAddUint16(long nvl, String name, short value)
    {
        return lib.nvlist_add_uint16(ptr(nvl), name, value);
    }

    @Override
    public int nvlistAddInt32(long nvl, String name, int value)
    {
        return lib.nvlist_add_int32(ptr(nvl), name, value);
    }

    @Override
    public int nvlistAddUint32(long nvl, String name, int value)
    {
        return lib.nvlist_add_uint32(ptr(nvl), name, value);
    }

    @Override
    public int nvlistAddInt64(long nvl, String name, long value)
    {
        return lib.nvlist_add_int64(ptr(nvl), name, value);
    }

    @Override
    public int nvlistAddUint64(long nvl, String name, long value)
    {
        return lib.nvlist_add_uint64(ptr(nvl), name, value);
    }

    @Override
    public int nvlistAddString(long nvl, String name, String value)
    {
        return lib.nvlist_add_string(ptr(nvl), name, value);
    }

    @Override
    public int nvlistAddNvlist(long nvl, String name, long value)
    {
        return lib.nvlist_add_nvlist(ptr(nvl), name, ptr(value));
    }

    @Override
    public int nvlistAddBooleanArray(long nvl, String name, boolean[] values)
    {
        int[] nativeValues = new int[values.length];
        for (int idx = 0; idx < values.length; ++idx)
        {
            nativeValues[idx] = toBooleanT(values[idx]);
        }
        return lib.nvlist_add_boolean_array(ptr(nvl), name, nativeValues, nativeValues.length);
    }

    @Override
    public int nvlistAddByteArray(long nvl, String name, byte[] values)
    {
        return lib.nvlist_add_byte_array(ptr(nvl), name, values, values.length);
    }

    @Override
    public int nvlistAddInt8Array(long nvl, String name, byte[] values)
    {
        return lib.nvlist_add_int8_array(ptr(nvl), name, values, values.length);
    }

    @Override
    public int nvlistAddUint8Array(long nvl, String name, byte[] values)
    {
        return lib.nvlist_add_uint8_array(ptr(nvl), name, values, values.length);
    }

    @Override
    public int nvlistAddInt16Array(long nvl, String name, short[] values)
    {
        return lib.nvlist_add_int16_array(ptr(nvl), name, values, values.length);
    }

    @Override
    public int nvlistAddUint16Array(long nvl, String name, short[] values)
    {
        return lib.nvlist_add_uint16_array(ptr(nvl), name, values, values.length);
    }

    @Override
    public int nvlistAddInt32Array(long nvl, String name, int[] values)
    {
        return lib.nvlist_add_int32_array(ptr(nvl), name, values, values.length);
    }

    @Override
    public int nvlistAddUint32Array(long nvl, String name, int[] values)
    {
        return lib.nvlist_add_uint32_array(ptr(nvl), name, values, values.length);
    }

    @Override
    public int nvlistAddInt64Array(long nvl, String name, long[] values)
    {
        return lib.nvlist_add_int64_array(ptr(nvl), name, values, values.length);
    }

    @Override
    public int nvlistAddUint64Array(long nvl, String name, long[] values)
    {
        return lib.nvlist_add_uint64_array(ptr(nvl), name, values, values.length);
    }

    @Override
    public int nvlistAddStringArray(long nvl, String name, String[] values)
    {
        int addressSize = runtime.addressSize();
        Pointer table = Memory.allocateDirect(runtime, Math.max(1, values.length) * addressSize);
        // keeps the string buffers reachable until libnvpair has copied them
        List<Pointer> buffers = new ArrayList<>(values.length);
        for (int idx = 0; idx < values.length; ++idx)
        {
            byte[] bytes = values[idx].getBytes(StandardCharsets.UTF_8);
            Pointer buffer = Memory.allocateDirect(runtime, bytes.length + 1);
            buffer.put(0, bytes, 0, bytes.length);
            buffer.putByte(bytes.length, (byte) 0);
            buffers.add(buffer);
            table.putPointer((long) idx * addressSize, buffer);
        }
        int status = lib.nvlist_add_string_array(ptr(nvl), name, table, values.length);
        buffers.clear();
        return status;
    }

    @Override
    public int nvlistAddNvlistArray(long nvl, String name, long[] values)
    {
        int addressSize = runtime.addressSize();
        Pointer table = Memory.allocateDirect(runtime, Math.max(1, values.length) * addressSize);
        for (int idx = 0; idx < values.length; ++idx)
        {
            table.putAddress((long) idx * addressSize, values[idx]);
        }
        return lib.nvlist_add_nvlist_array(ptr(nvl), name, table, values.length);
    }

    @Override
    public long nvlistNextNvpair(long nvl, long nvp)
    {
        return toAddress(lib.nvlist_next_nvpair(ptr(nvl), ptr(nvp)));
    }

    @Override
    public String nvpairName(long nvp)
    {
        return lib.nvpair_name(ptr(nvp));
    }

    @Override
    public int nvpairType(long nvp)
    {
        return lib.nvpair_type(ptr(nvp));
    }

    @Override
    public int nvpairValueBooleanValue(long nvp, ValueRef<Boolean> value)
    {
        IntByReference ref = new IntByReference();
        int status = lib.nvpair_value_boolean_value(ptr(nvp), ref);
        if (status == 0)
        {
            value.set(ref.getValue() != 0);
        }
        return status;
    }

    @Override
    public int nvpairValueByte(long nvp, ValueRef<Byte> value)
    {
        ByteByReference ref = new ByteByReference();
        return setIfOk(lib.nvpair_value_byte(ptr(nvp), ref), value, ref.getValue());
    }

    @Override
    public int nvpairValueInt8(long nvp, ValueRef<Byte> value)
    {
        ByteByReference ref = new ByteByReference();
        return setIfOk(lib.nvpair_value_int8(ptr(nvp), ref), value, ref.getValue());
    }

    @Override
    public int nvpairValueUint8(long nvp, ValueRef<Byte> value)
    {
        ByteByReference ref = new ByteByReference();
        return setIfOk(lib.nvpair_value_uint8(ptr(nvp), ref), value, ref.getValue());
    }

    @Override
    public int nvpairValueInt16(long nvp, ValueRef<Short> value)
    {
        ShortByReference ref = new ShortByReference();
        return setIfOk(lib.nvpair_value_int16(ptr(nvp), ref), value, ref.getValue());
    }

    @Override
    public int nvpairValueUint16(long nvp, ValueRef<Short> value)
    {
        ShortByReference ref = new ShortByReference();
        return setIfOk(lib.nvpair_value_uint16(ptr(nvp), ref), value, ref.getValue());
    }

    @Override
    public int nvpairValueInt32(long nvp, ValueRef<Integer> value)
    {
        IntByReference ref = new IntByReference();
        return setIfOk(lib.nvpair_value_int32(ptr(nvp), ref), value, ref.getValue());
    }

    @Override
    public int nvpairValueUint32(long nvp, ValueRef<Integer> value)
    {
        IntByReference ref = new IntByReference();
        return setIfOk(lib.nvpair_value_uint32(ptr(nvp), ref), value, ref.getValue());
    }

    @Override
    public int nvpairValueInt64(long nvp, ValueRef<Long> value)
    {
        LongLongByReference ref = new LongLongByReference();
        return setIfOk(lib.nvpair_value_int64(ptr(nvp), ref), value, ref.getValue());
    }

    @Override
    public int nvpairValueUint64(long nvp, ValueRef<Long> value)
    {
        LongLongByReference ref = new LongLongByReference();
        return setIfOk(lib.nvpair_value_uint64(ptr(nvp), ref), value, ref.getValue());
    }

    @Override
    public int nvpairValueString(long nvp, ValueRef<String> value)
    {
        PointerByReference ref = new PointerByReference();
        int status = lib.nvpair_value_string(ptr(nvp), ref);
        if (status == 0)
        {
            Pointer str = ref.getValue();
            value.set(str == null ? "" : str.getString(0, Integer.MAX_VALUE, StandardCharsets.UTF_8));
        }
        return status;
    }

    @Override
    public int nvpairValueNvlist(long nvp, ValueRef<Long> value)
    {
        PointerByReference ref = new PointerByReference();
        int status = lib.nvpair_value_nvlist(ptr(nvp), ref);
        if (status == 0)
        {
            value.set(toAddress(ref.getValue()));
        }
        return status;
    }

    @Override
    public int nvpairValueBooleanArray(long nvp, ValueRef<boolean[]> values)
    {
        PointerByReference data = new PointerByReference();
        IntByReference count = new IntByReference();
        int status = lib.nvpair_value_boolean_array(ptr(nvp), data, count);
        if (status == 0)
        {
            int[] nativeValues = new int[count.getValue()];
            if (nativeValues.length > 0)
            {
                data.getValue().get(0, nativeValues, 0, nativeValues.length);
            }
            boolean[] result = new boolean[nativeValues.length];
            for (int idx = 0; idx < result.length; ++idx)
            {
                result[idx] = nativeValues[idx] != 0;
            }
            values.set(result);
        }
        return status;
    }

    @Override
    public int nvpairValueByteArray(long nvp, ValueRef<byte[]> values)
    {
        PointerByReference data = new PointerByReference();
        IntByReference count = new IntByReference();
        int status = lib.nvpair_value_byte_array(ptr(nvp), data, count);
        return setIfOk(status, values, status == 0 ? readBytes(data, count) : null);
    }

    @Override
    public int nvpairValueInt8Array(long nvp, ValueRef<byte[]> values)
    {
        PointerByReference data = new PointerByReference();
        IntByReference count = new IntByReference();
        int status = lib.nvpair_value_int8_array(ptr(nvp), data, count);
        return setIfOk(status, values, status == 0 ? readBytes(data, count) : null);
    }

    @Override
    public int nvpairValueUint8Array(long nvp, ValueRef<byte[]> values)
    {
        PointerByReference data = new PointerByReference();
        IntByReference count = new IntByReference();
        int status = lib.nvpair_value_uint8_array(ptr(nvp), data, count);
        return setIfOk(status, values, status == 0 ? readBytes(data, count) : null);
    }

    @Override
    public int nvpairValueInt16Array(long nvp, ValueRef<short[]> values)
    {
        PointerByReference data = new PointerByReference();
        IntByReference count = new IntByReference();
        int status = lib.nvpair_value_int16_array(ptr(nvp), data, count);
        return setIfOk(status, values, status == 0 ? readShorts(data, count) : null);
    }

    @Override
    public int nvpairValueUint16Array(long nvp, ValueRef<short[]> values)
    {
        PointerByReference data = new PointerByReference();
        IntByReference count = new IntByReference();
        int status = lib.nvpair_value_uint16_array(ptr(nvp), data, count);
        return setIfOk(status, values, status == 0 ? readShorts(data, count) : null);
    }

    @Override
    public int nvpairValueInt32Array(long nvp, ValueRef<int[]> values)
    {
        PointerByReference data = new PointerByReference();
        IntByReference count = new IntByReference();
        int status = lib.nvpair_value_int32_array(ptr(nvp), data, count);
        return setIfOk(status, values, status == 0 ? readInts(data, count) : null);
    }

    @Override
    public int nvpairValueUint32Array(long nvp, ValueRef<int[]> values)
    {
        PointerByReference data = new PointerByReference();
        IntByReference count = new IntByReference();
        int status = lib.nvpair_value_uint32_array(ptr(nvp), data, count);
        return setIfOk(status, values, status == 0 ? readInts(data, count) : null);
    }

    @Override
    public int nvpairValueInt64Array(long nvp, ValueRef<long[]> values)
    {
        PointerByReference data = new PointerByReference();
        IntByReference count = new IntByReference();
        int status = lib.nvpair_value_int64_array(ptr(nvp), data, count);
        return setIfOk(status, values, status == 0 ? readLongs(data, count) : null);
    }

    @Override
    public int nvpairValueUint64Array(long nvp, ValueRef<long[]> values)
    {
        PointerByReference data = new PointerByReference();
        IntByReference count = new IntByReference();
        int status = lib.nvpair_value_uint64_array(ptr(nvp), data, count);
        return setIfOk(status, values, status == 0 ? readLongs(data, count) : null);
    }

    @Override
    public int nvpairValueStringArray(long nvp, ValueRef<String[]> values)
    {
        PointerByReference data = new PointerByReference();
        IntByReference count = new IntByReference();
        int status = lib.nvpair_value_string_array(ptr(nvp), data, count);
        if (status == 0)
        {
            long[] addresses = readAddresses(data, count);
            String[] result = new String[addresses.length];
            for (int idx = 0; idx < result.length; ++idx)
            {
                Pointer str = ptr(addresses[idx]);
                result[idx] = str == null ? "" : str.getString(0, Integer.MAX_VALUE, StandardCharsets.UTF_8);
            }
            values.set(result);
        }
        return status;
    }

    @Override
    public int nvpairValueNvlistArray(long nvp, ValueRef<long[]> values)
    {
        PointerByReference data = new PointerByReference();
        IntByReference count = new IntByReference();
        int status = lib.nvpair_value_nvlist_array(ptr(nvp), data, count);
        return setIfOk(status, values, status == 0 ? readAddresses(data, count) : null);
    }

    private static <T> int setIfOk(int status, ValueRef<T> target, @Nullable T value)
    {
        if (status == 0)
        {
            target.set(value);
        }
        return status;
    }

    private static byte[] readBytes(PointerByReference data, IntByReference count)
    {
        byte[] result = new byte[count.getValue()];
        if (result.length > 0)
        {
            data.getValue().get(0, result, 0, result.length);
        }
        return result;
    }

    private static short[] readShorts(PointerByReference data, IntByReference count)
    {
        short[] result = new short[count.getValue()];
        if (result.length > 0)
        {
            data.getValue().get(0, result, 0, result.length);
        }
        return result;
    }

    private static int[] readInts(PointerByReference data, IntByReference count)
    {
        int[] result = new int[count.getValue()];
        if (result.length > 0)
        {
            data.getValue().get(0, result, 0, result.length);
        }
        return result;
    }

    private static long[] readLongs(PointerByReference data, IntByReference count)
    {
        long[] result = new long[count.getValue()];
        if (result.length > 0)
        {
            data.getValue().get(0, result, 0, result.length);
        }
        return result;
    }

    private long[] readAddresses(PointerByReference data, IntByReference count)
    {
        long[] result = new long[count.getValue()];
        int addressSize = runtime.addressSize();
        Pointer table = data.getValue();
        for (int idx = 0; idx < result.length; ++idx)
        {
            result[idx] = table.getAddress((long) idx * addressSize);
        }
        return result;
    }
}
