package com.linbit.lzc.binding;

import jnr.ffi.Pointer;
import jnr.ffi.annotations.In;
import jnr.ffi.annotations.Out;
import jnr.ffi.byref.ByteByReference;
import jnr.ffi.byref.IntByReference;
import jnr.ffi.byref.LongLongByReference;
import jnr.ffi.byref.PointerByReference;
import jnr.ffi.byref.ShortByReference;
import jnr.ffi.types.u_int32_t;

/**
 * Low-level libnvpair interface
 *
 * See {@code sys/nvpair.h}. {@code boolean_t} is an int, {@code uint_t} array lengths are
 * passed as int.
 */
public interface LibNvpairNative
{
    int nvlist_alloc(@Out PointerByReference nvlp, @u_int32_t int nvflag, int kmflag);

    void nvlist_free(Pointer nvl);

    int nvlist_add_boolean(Pointer nvl, String name);

    int nvlist_add_boolean_value(Pointer nvl, String name, int value);

    int nvlist_add_byte(Pointer nvl, String name, byte value);

    int nvlist_add_int8(Pointer nvl, String name, byte value);

    int nvlist_add_uint8(Pointer nvl, String name, byte value);

    int nvlist_add_int16(Pointer nvl, String name, short value);

    int nvlist_add_uint16(Pointer nvl, String name, short value);

    int nvlist_add_int32(Pointer nvl, String name, int value);

    int nvlist_add_uint32(Pointer nvl, String name, int value);

    int nvlist_add_int64(Pointer nvl, String name, long value);

    int nvlist_add_uint64(Pointer nvl, String name, long value);

    int nvlist_add_string(Pointer nvl, String name, String value);

    int nvlist_add_nvlist(Pointer nvl, String name, Pointer value);

    int nvlist_add_boolean_array(Pointer nvl, String name, @In int[] values, @u_int32_t int count);

    int nvlist_add_byte_array(Pointer nvl, String name, @In byte[] values, @u_int32_t int count);

    int nvlist_add_int8_array(Pointer nvl, String name, @In byte[] values, @u_int32_t int count);

    int nvlist_add_uint8_array(Pointer nvl, String name, @In byte[] values, @u_int32_t int count);

    int nvlist_add_int16_array(Pointer nvl, String name, @In short[] values, @u_int32_t int count);

    int nvlist_add_uint16_array(Pointer nvl, String name, @In short[] values, @u_int32_t int count);

    int nvlist_add_int32_array(Pointer nvl, String name, @In int[] values, @u_int32_t int count);

    int nvlist_add_uint32_array(Pointer nvl, String name, @In int[] values, @u_int32_t int count);

    int nvlist_add_int64_array(Pointer nvl, String name, @In long[] values, @u_int32_t int count);

    int nvlist_add_uint64_array(Pointer nvl, String name, @In long[] values, @u_int32_t int count);

    /**
     * @param values Array of {@code char *}
     */
    int nvlist_add_string_array(Pointer nvl, String name, Pointer values, @u_int32_t int count);

    /**
     * @param values Array of {@code nvlist_t *}
     */
    int nvlist_add_nvlist_array(Pointer nvl, String name, Pointer values, @u_int32_t int count);

    Pointer nvlist_next_nvpair(Pointer nvl, Pointer nvp);

    String nvpair_name(Pointer nvp);

    int nvpair_type(Pointer nvp);

    int nvpair_value_boolean_value(Pointer nvp, @Out IntByReference value);

    int nvpair_value_byte(Pointer nvp, @Out ByteByReference value);

    int nvpair_value_int8(Pointer nvp, @Out ByteByReference value);

    int nvpair_value_uint8(Pointer nvp, @Out ByteByReference value);

    int nvpair_value_int16(Pointer nvp, @Out ShortByReference value);

    int nvpair_value_uint16(Pointer nvp, @Out ShortByReference value);

    int nvpair_value_int32(Pointer nvp, @Out IntByReference value);

    int nvpair_value_uint32(Pointer nvp, @Out IntByReference value);

    int nvpair_value_int64(Pointer nvp, @Out LongLongByReference value);

    int nvpair_value_uint64(Pointer nvp, @Out LongLongByReference value);

    int nvpair_value_string(Pointer nvp, @Out PointerByReference value);

    int nvpair_value_nvlist(Pointer nvp, @Out PointerByReference value);

    int nvpair_value_boolean_array(Pointer nvp, @Out PointerByReference values, @Out IntByReference count);

    int nvpair_value_byte_array(Pointer nvp, @Out PointerByReference values, @Out IntByReference count);

    int nvpair_value_int8_array(Pointer nvp, @Out PointerByReference values, @Out IntByReference count);

    int nvpair_value_uint8_array(Pointer nvp, @Out PointerByReference values, @Out IntByReference count);

    int nvpair_value_int16_array(Pointer nvp, @Out PointerByReference values, @Out IntByReference count);

    int nvpair_value_uint16_array(Pointer nvp, @Out PointerByReference values, @Out IntByReference count);

    int nvpair_value_int32_array(Pointer nvp, @Out PointerByReference values, @Out IntByReference count);

    int nvpair_value_uint32_array(Pointer nvp, @Out PointerByReference values, @Out IntByReference count);

    int nvpair_value_int64_array(Pointer nvp, @Out PointerByReference values, @Out IntByReference count);

    int nvpair_value_uint64_array(Pointer nvp, @Out PointerByReference values, @Out IntByReference count);

    int nvpair_value_string_array(Pointer nvp, @Out PointerByReference values, @Out IntByReference count);

    int nvpair_value_nvlist_array(Pointer nvp, @Out PointerByReference values, @Out IntByReference count);
}
