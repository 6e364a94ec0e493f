package com.linbit.lzc.nvlist;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.LongFunction;

/**
 * Maps each libnvpair type tag to the accessors that add or retrieve values of that type and to
 * the conversion between the libnvpair representation and {@link NvValue}
 *
 * Adding nested nvlists and nvlist arrays requires allocating nvlists, which is done by
 * {@link NvListCodec} itself, so there are no adders for {@link NvDataType#NVLIST} and
 * {@link NvDataType#NVLIST_ARRAY}. {@link NvDataType#BOOLEAN} has no payload and therefore
 * neither an adder nor a reader.
 */
final class NvTypeRegistry
{
    interface Adder
    {
        int add(long nvl, String name, NvValue value);
    }

    interface Reader
    {
        int read(long nvp, NestedDecoder nestedDecoder, ValueRef<NvValue> value) throws NvListException;
    }

    interface NestedDecoder
    {
        NvMap decode(long nvl) throws NvListException;
    }

    private interface Accessor<T>
    {
        int get(long nvp, ValueRef<T> value);
    }

    private final Map<NvDataType, Adder> adders = new EnumMap<>(NvDataType.class);
    private final Map<NvDataType, Reader> readers = new EnumMap<>(NvDataType.class);

    NvTypeRegistry(NvPairLibrary lib)
    {
        adders.put(
            NvDataType.BOOLEAN_VALUE,
            (nvl, name, val) -> lib.nvlistAddBooleanValue(nvl, name, ((NvBoolean) val).booleanValue())
        );
        adders.put(NvDataType.BYTE, (nvl, name, val) -> lib.nvlistAddByte(nvl, name, (byte) number(val)));
        adders.put(NvDataType.INT8, (nvl, name, val) -> lib.nvlistAddInt8(nvl, name, (byte) number(val)));
        adders.put(NvDataType.UINT8, (nvl, name, val) -> lib.nvlistAddUint8(nvl, name, (byte) number(val)));
        adders.put(NvDataType.INT16, (nvl, name, val) -> lib.nvlistAddInt16(nvl, name, (short) number(val)));
        adders.put(NvDataType.UINT16, (nvl, name, val) -> lib.nvlistAddUint16(nvl, name, (short) number(val)));
        adders.put(NvDataType.INT32, (nvl, name, val) -> lib.nvlistAddInt32(nvl, name, (int) number(val)));
        adders.put(NvDataType.UINT32, (nvl, name, val) -> lib.nvlistAddUint32(nvl, name, (int) number(val)));
        adders.put(NvDataType.INT64, (nvl, name, val) -> lib.nvlistAddInt64(nvl, name, number(val)));
        adders.put(NvDataType.UINT64, (nvl, name, val) -> lib.nvlistAddUint64(nvl, name, number(val)));
        adders.put(
            NvDataType.STRING,
            (nvl, name, val) -> lib.nvlistAddString(nvl, name, ((NvString) val).stringValue())
        );

        adders.put(
            NvDataType.BOOLEAN_ARRAY,
            (nvl, name, val) -> lib.nvlistAddBooleanArray(nvl, name, toBooleans(val))
        );
        adders.put(NvDataType.BYTE_ARRAY, (nvl, name, val) -> lib.nvlistAddByteArray(nvl, name, toBytes(val)));
        adders.put(NvDataType.INT8_ARRAY, (nvl, name, val) -> lib.nvlistAddInt8Array(nvl, name, toBytes(val)));
        adders.put(NvDataType.UINT8_ARRAY, (nvl, name, val) -> lib.nvlistAddUint8Array(nvl, name, toBytes(val)));
        adders.put(NvDataType.INT16_ARRAY, (nvl, name, val) -> lib.nvlistAddInt16Array(nvl, name, toShorts(val)));
        adders.put(
            NvDataType.UINT16_ARRAY,
            (nvl, name, val) -> lib.nvlistAddUint16Array(nvl, name, toShorts(val))
        );
        adders.put(NvDataType.INT32_ARRAY, (nvl, name, val) -> lib.nvlistAddInt32Array(nvl, name, toInts(val)));
        adders.put(NvDataType.UINT32_ARRAY, (nvl, name, val) -> lib.nvlistAddUint32Array(nvl, name, toInts(val)));
        adders.put(NvDataType.INT64_ARRAY, (nvl, name, val) -> lib.nvlistAddInt64Array(nvl, name, toLongs(val)));
        adders.put(
            NvDataType.UINT64_ARRAY,
            (nvl, name, val) -> lib.nvlistAddUint64Array(nvl, name, toLongs(val))
        );
        adders.put(
            NvDataType.STRING_ARRAY,
            (nvl, name, val) -> lib.nvlistAddStringArray(nvl, name, toStrings(val))
        );

        readers.put(
            NvDataType.BOOLEAN_VALUE,
            scalar(lib::nvpairValueBooleanValue, raw -> NvValue.of(raw.booleanValue()))
        );
        readers.put(NvDataType.BYTE, scalar(lib::nvpairValueByte, raw -> NvValue.byteValue(raw & 0xFF)));
        readers.put(NvDataType.INT8, scalar(lib::nvpairValueInt8, raw -> NvValue.int8(raw)));
        readers.put(NvDataType.UINT8, scalar(lib::nvpairValueUint8, raw -> NvValue.uint8(raw & 0xFF)));
        readers.put(NvDataType.INT16, scalar(lib::nvpairValueInt16, raw -> NvValue.int16(raw)));
        readers.put(NvDataType.UINT16, scalar(lib::nvpairValueUint16, raw -> NvValue.uint16(raw & 0xFFFF)));
        readers.put(NvDataType.INT32, scalar(lib::nvpairValueInt32, raw -> NvValue.int32(raw)));
        readers.put(
            NvDataType.UINT32,
            scalar(lib::nvpairValueUint32, raw -> NvValue.uint32(raw & 0xFFFFFFFFL))
        );
        readers.put(NvDataType.INT64, scalar(lib::nvpairValueInt64, raw -> NvValue.int64(raw)));
        readers.put(NvDataType.UINT64, scalar(lib::nvpairValueUint64, raw -> NvValue.uint64(raw)));
        readers.put(NvDataType.STRING, scalar(lib::nvpairValueString, raw -> NvValue.of(raw)));
        readers.put(
            NvDataType.NVLIST,
            (nvp, nestedDecoder, value) ->
            {
                ValueRef<Long> ref = new ValueRef<>();
                int status = lib.nvpairValueNvlist(nvp, ref);
                Long nested = ref.get();
                if (status == 0 && nested != null)
                {
                    value.set(NvValue.of(nestedDecoder.decode(nested)));
                }
                return status;
            }
        );

        readers.put(
            NvDataType.BOOLEAN_ARRAY,
            array(
                lib::nvpairValueBooleanArray,
                NvDataType.BOOLEAN_VALUE,
                raw ->
                {
                    List<NvValue> list = new ArrayList<>(raw.length);
                    for (boolean elem : raw)
                    {
                        list.add(NvValue.of(elem));
                    }
                    return list;
                }
            )
        );
        readers.put(
            NvDataType.BYTE_ARRAY,
            array(lib::nvpairValueByteArray, NvDataType.BYTE, raw -> fromBytes(raw, b -> NvValue.byteValue(b & 0xFF)))
        );
        readers.put(
            NvDataType.INT8_ARRAY,
            array(lib::nvpairValueInt8Array, NvDataType.INT8, raw -> fromBytes(raw, b -> NvValue.int8(b)))
        );
        readers.put(
            NvDataType.UINT8_ARRAY,
            array(lib::nvpairValueUint8Array, NvDataType.UINT8, raw -> fromBytes(raw, b -> NvValue.uint8(b & 0xFF)))
        );
        readers.put(
            NvDataType.INT16_ARRAY,
            array(lib::nvpairValueInt16Array, NvDataType.INT16, raw -> fromShorts(raw, s -> NvValue.int16(s)))
        );
        readers.put(
            NvDataType.UINT16_ARRAY,
            array(
                lib::nvpairValueUint16Array,
                NvDataType.UINT16,
                raw -> fromShorts(raw, s -> NvValue.uint16(s & 0xFFFF))
            )
        );
        readers.put(
            NvDataType.INT32_ARRAY,
            array(lib::nvpairValueInt32Array, NvDataType.INT32, raw -> fromInts(raw, i -> NvValue.int32(i)))
        );
        readers.put(
            NvDataType.UINT32_ARRAY,
            array(
                lib::nvpairValueUint32Array,
                NvDataType.UINT32,
                raw -> fromInts(raw, i -> NvValue.uint32(i & 0xFFFFFFFFL))
            )
        );
        readers.put(
            NvDataType.INT64_ARRAY,
            array(lib::nvpairValueInt64Array, NvDataType.INT64, raw -> fromLongs(raw, l -> NvValue.int64(l)))
        );
        readers.put(
            NvDataType.UINT64_ARRAY,
            array(lib::nvpairValueUint64Array, NvDataType.UINT64, raw -> fromLongs(raw, l -> NvValue.uint64(l)))
        );
        readers.put(
            NvDataType.STRING_ARRAY,
            array(
                lib::nvpairValueStringArray,
                NvDataType.STRING,
                raw ->
                {
                    List<NvValue> list = new ArrayList<>(raw.length);
                    for (String elem : raw)
                    {
                        list.add(NvValue.of(elem));
                    }
                    return list;
                }
            )
        );
        readers.put(
            NvDataType.NVLIST_ARRAY,
            (nvp, nestedDecoder, value) ->
            {
                ValueRef<long[]> ref = new ValueRef<>();
                int status = lib.nvpairValueNvlistArray(nvp, ref);
                long[] nested = ref.get();
                if (status == 0 && nested != null)
                {
                    List<NvValue> list = new ArrayList<>(nested.length);
                    for (long nvl : nested)
                    {
                        list.add(NvValue.of(nestedDecoder.decode(nvl)));
                    }
                    value.set(toArray(list, NvDataType.NVLIST));
                }
                return status;
            }
        );
    }

    /**
     * Returns the adder for the given type, or null if values of that type are not added through
     * a plain accessor call
     */
    @Nullable Adder getAdder(NvDataType type)
    {
        return adders.get(type);
    }

    /**
     * Returns the reader for the given type, or null if values of that type cannot be decoded
     */
    @Nullable Reader getReader(NvDataType type)
    {
        return readers.get(type);
    }

    private static <T> Reader scalar(Accessor<T> accessor, Function<T, NvValue> convert)
    {
        return (nvp, nestedDecoder, value) ->
        {
            ValueRef<T> ref = new ValueRef<>();
            int status = accessor.get(nvp, ref);
            T raw = ref.get();
            if (status == 0 && raw != null)
            {
                value.set(convert.apply(raw));
            }
            return status;
        };
    }

    private static <T> Reader array(
        Accessor<T> accessor,
        NvDataType elementType,
        Function<T, List<NvValue>> convert
    )
    {
        return (nvp, nestedDecoder, value) ->
        {
            ValueRef<T> ref = new ValueRef<>();
            int status = accessor.get(nvp, ref);
            T raw = ref.get();
            if (status == 0 && raw != null)
            {
                value.set(toArray(convert.apply(raw), elementType));
            }
            return status;
        };
    }

    private static NvArray toArray(List<NvValue> elements, NvDataType elementType)
    {
        return elements.isEmpty() ? NvValue.emptyArray(elementType) : NvValue.array(elements);
    }

    private static long number(NvValue value)
    {
        return ((NvNumber) value).longValue();
    }

    private static List<NvValue> elements(NvValue value)
    {
        return value instanceof NvArray ? ((NvArray) value).getElements() : Collections.<NvValue>emptyList();
    }

    private static boolean[] toBooleans(NvValue value)
    {
        List<NvValue> list = elements(value);
        boolean[] arr = new boolean[list.size()];
        for (int idx = 0; idx < arr.length; ++idx)
        {
            arr[idx] = ((NvBoolean) list.get(idx)).booleanValue();
        }
        return arr;
    }

    private static byte[] toBytes(NvValue value)
    {
        List<NvValue> list = elements(value);
        byte[] arr = new byte[list.size()];
        for (int idx = 0; idx < arr.length; ++idx)
        {
            arr[idx] = (byte) number(list.get(idx));
        }
        return arr;
    }

    private static short[] toShorts(NvValue value)
    {
        List<NvValue> list = elements(value);
        short[] arr = new short[list.size()];
        for (int idx = 0; idx < arr.length; ++idx)
        {
            arr[idx] = (short) number(list.get(idx));
        }
        return arr;
    }

    private static int[] toInts(NvValue value)
    {
        List<NvValue> list = elements(value);
        int[] arr = new int[list.size()];
        for (int idx = 0; idx < arr.length; ++idx)
        {
            arr[idx] = (int) number(list.get(idx));
        }
        return arr;
    }

    private static long[] toLongs(NvValue value)
    {
        List<NvValue> list = elements(value);
        long[] arr = new long[list.size()];
        for (int idx = 0; idx < arr.length; ++idx)
        {
            arr[idx] = number(list.get(idx));
        }
        return arr;
    }

    private static String[] toStrings(NvValue value)
    {
        List<NvValue> list = elements(value);
        String[] arr = new String[list.size()];
        for (int idx = 0; idx < arr.length; ++idx)
        {
            arr[idx] = ((NvString) list.get(idx)).stringValue();
        }
        return arr;
    }

    private static List<NvValue> fromBytes(byte[] raw, IntFunction<NvValue> convert)
    {
        List<NvValue> list = new ArrayList<>(raw.length);
        for (byte elem : raw)
        {
            list.add(convert.apply(elem));
        }
        return list;
    }

    private static List<NvValue> fromShorts(short[] raw, IntFunction<NvValue> convert)
    {
        List<NvValue> list = new ArrayList<>(raw.length);
        for (short elem : raw)
        {
            list.add(convert.apply(elem));
        }
        return list;
    }

    private static List<NvValue> fromInts(int[] raw, IntFunction<NvValue> convert)
    {
        List<NvValue> list = new ArrayList<>(raw.length);
        for (int elem : raw)
        {
            list.add(convert.apply(elem));
        }
        return list;
    }

    private static List<NvValue> fromLongs(long[] raw, LongFunction<NvValue> convert)
    {
        List<NvValue> list = new ArrayList<>(raw.length);
        for (long elem : raw)
        {
            list.add(convert.apply(elem));
        }
        return list;
    }
}
