package com.linbit.lzc.nvlist;

import com.linbit.lzc.LzcException;
import com.linbit.lzc.logging.ErrorReporter;

import java.util.Arrays;

import org.junit.Before;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.junit.Assert.assertEquals;
import static org.mockito.Mockito.mock;

public class NvListCodecTest
{
    private HeapNvPairLibrary heap;
    private NvListCodec codec;

    @Before
    public void setUp()
    {
        heap = new HeapNvPairLibrary();
        codec = new NvListCodec(heap, mock(ErrorReporter.class));
    }

    private NvMap roundTrip(NvMap map) throws Exception
    {
        NvMap decoded;
        try (NvListHandle handle = codec.encode(map))
        {
            decoded = codec.decode(handle);
        }
        return decoded;
    }

    private NvListException encodeFailure(NvMap map)
    {
        return catchThrowableOfType(
            () ->
            {
                try (NvListHandle handle = codec.encode(map))
                {
                    handle.getAddress();
                }
            },
            NvListException.class
        );
    }

    @Test
    public void testRoundTripKeepsEntriesAndOrder() throws Exception
    {
        NvMap nested = new NvMap()
            .putString("mountpoint", "/mnt/data")
            .putInteger("quota", 1L << 40);
        NvMap map = new NvMap()
            .putPresence("pool/fs@snap")
            .putBoolean("readonly", true)
            .putString("compression", "lz4")
            .putInteger("used", 4096)
            .put("count", NvValue.int32(-7))
            .putMap("props", nested)
            .put("names", NvValue.stringArray("a", "b"))
            .put("bytes", NvValue.array(NvValue.uint8(1), NvValue.uint8(255)))
            .put("flags", NvValue.array(NvValue.of(true), NvValue.of(false)))
            .put("maps", NvValue.mapArray(new NvMap().putString("k", "v"), new NvMap()));

        NvMap decoded = roundTrip(map);

        assertEquals(map, decoded);
        assertThat(decoded.keySet()).containsExactly(
            "pool/fs@snap", "readonly", "compression", "used", "count", "props", "names", "bytes", "flags", "maps"
        );
        assertThat(heap.getLiveCount()).isZero();
    }

    @Test
    public void testPresenceDecodesAsPresence() throws Exception
    {
        NvMap decoded = roundTrip(NvMap.presenceOf(Arrays.asList("p/a@1", "p/a@2")));

        assertThat(decoded.get("p/a@1")).isSameAs(NvValue.presence());
        assertThat(decoded.get("p/a@2")).isSameAs(NvValue.presence());
    }

    @Test
    public void testEmptyArraysKeepTheirElementType() throws Exception
    {
        NvMap map = new NvMap()
            .put("none", NvValue.emptyArray(NvDataType.UINT64))
            .put("nomaps", NvValue.mapArray());

        NvMap decoded = roundTrip(map);

        assertEquals(map, decoded);
        assertThat(((NvArray) decoded.get("none")).getDeclaredElementType()).isEqualTo(NvDataType.UINT64);
    }

    @Test
    public void testHostIntegerWidthDependsOnKey() throws Exception
    {
        NvMap map = new NvMap()
            .putInteger("type", 2)
            .putInteger("rewind-request", 1)
            .putInteger("pool_context", 3)
            .putInteger("N_MORE_ERRORS", 4)
            .putInteger("used", 5)
            .put("declared", NvValue.int16(6));

        try (NvListHandle handle = codec.encode(map))
        {
            long nvl = handle.getAddress();
            assertEquals(NvDataType.UINT32.getWireId(), heap.typeOf(nvl, "type"));
            assertEquals(NvDataType.UINT32.getWireId(), heap.typeOf(nvl, "rewind-request"));
            assertEquals(NvDataType.INT32.getWireId(), heap.typeOf(nvl, "pool_context"));
            assertEquals(NvDataType.INT32.getWireId(), heap.typeOf(nvl, "N_MORE_ERRORS"));
            assertEquals(NvDataType.UINT64.getWireId(), heap.typeOf(nvl, "used"));
            assertEquals(NvDataType.INT16.getWireId(), heap.typeOf(nvl, "declared"));

            NvMap decoded = codec.decode(handle);
            assertEquals(map, decoded);
            assertEquals(map.hashCode(), decoded.hashCode());
            assertThat(decoded.getNumber("type")).isEqualTo(NvValue.uint32(2));
            assertThat(decoded.getNumber("type").isWidthDeclared()).isTrue();
            assertThat(decoded.getNumber("used").longValue()).isEqualTo(5L);
        }
    }

    @Test
    public void testSpecialKeyIntegersRoundTrip() throws Exception
    {
        NvMap map = new NvMap()
            .putInteger("type", 2)
            .putInteger("used", 5)
            .putInteger("pool_context", -1)
            .put("rewind-request", NvValue.array(NvValue.integer(1), NvValue.integer(4)))
            .putMap("nested", new NvMap().putInteger("N_MORE_ERRORS", 3));

        try (NvListHandle handle = codec.encode(map))
        {
            NvMap decoded = codec.decode(handle);
            assertEquals(map, decoded);
            assertEquals(decoded, map);
            assertEquals(map.hashCode(), decoded.hashCode());
        }
    }

    @Test
    public void testHostIntegerDiffersFromOtherWidthUnderPlainKey()
    {
        NvMap host = new NvMap().putInteger("used", 2);
        NvMap narrow = new NvMap().put("used", NvValue.uint32(2));
        NvMap special = new NvMap().put("type", NvValue.uint64(2));

        assertThat(host).isNotEqualTo(narrow);
        assertThat(new NvMap().putInteger("type", 2)).isNotEqualTo(special);
    }

    @Test
    public void testHostIntegerArrayWidthDependsOnKey() throws Exception
    {
        NvMap map = new NvMap().put("type", NvValue.array(NvValue.integer(1), NvValue.integer(2)));

        try (NvListHandle handle = codec.encode(map))
        {
            assertEquals(NvDataType.UINT32_ARRAY.getWireId(), heap.typeOf(handle.getAddress(), "type"));
        }
    }

    @Test
    public void testUnsignedValuesAreDecodedWithoutSign() throws Exception
    {
        NvMap map = new NvMap()
            .put("u32", NvValue.uint32(0xFFFFFFFFL))
            .put("u8", NvValue.uint8(0xFE))
            .put("u64", NvValue.uint64(-1L));

        NvMap decoded = roundTrip(map);

        assertThat(decoded.getNumber("u32").longValue()).isEqualTo(0xFFFFFFFFL);
        assertThat(decoded.getNumber("u8").longValue()).isEqualTo(0xFEL);
        assertThat(decoded.getNumber("u64").toBigInteger().toString()).isEqualTo("18446744073709551615");
    }

    @Test
    public void testMixedArrayReportsFirstMismatchIndex()
    {
        NvMap map = new NvMap().put(
            "mixed",
            NvValue.array(NvValue.of("a"), NvValue.of("b"), NvValue.integer(3), NvValue.of(true))
        );

        NvListException exc = encodeFailure(map);

        assertThat(exc).isNotNull();
        assertThat(exc.getReason()).isEqualTo(NvListException.Reason.TYPE_MISMATCH);
        assertThat(exc.getKey()).isEqualTo("mixed");
        assertThat(exc.getMessage()).contains("index 2");
        assertThat(heap.getLiveCount()).isZero();
    }

    @Test
    public void testArrayOfDifferentWidthsIsRejected()
    {
        NvMap map = new NvMap().put("nrs", NvValue.array(NvValue.int32(1), NvValue.int64(2)));

        NvListException exc = encodeFailure(map);

        assertThat(exc.getReason()).isEqualTo(NvListException.Reason.TYPE_MISMATCH);
        assertThat(exc.getMessage()).contains("index 1");
    }

    @Test
    public void testArrayOfPresenceIsUnsupported()
    {
        NvMap map = new NvMap().put("marks", NvValue.array(NvValue.presence(), NvValue.presence()));

        NvListException exc = encodeFailure(map);

        assertThat(exc.getReason()).isEqualTo(NvListException.Reason.UNSUPPORTED_TYPE);
        assertThat(heap.getLiveCount()).isZero();
    }

    @Test
    public void testNestedArrayIsUnsupported()
    {
        NvMap map = new NvMap().put("deep", NvValue.array(NvValue.stringArray("x")));

        assertThat(encodeFailure(map).getReason()).isEqualTo(NvListException.Reason.UNSUPPORTED_TYPE);
    }

    @Test
    public void testOutOfRangeValueIsRejected()
    {
        NvMap map = new NvMap()
            .putString("first", "ok")
            .putInteger("type", 1L << 33);

        NvListException exc = encodeFailure(map);

        assertThat(exc.getReason()).isEqualTo(NvListException.Reason.INVALID_VALUE);
        assertThat(exc.getKey()).isEqualTo("type");
        assertThat(heap.getLiveCount()).isZero();
    }

    @Test
    public void testOutOfRangeArrayElementIsRejected()
    {
        NvMap map = new NvMap().put("type", NvValue.array(NvValue.integer(1), NvValue.integer(-1)));

        NvListException exc = encodeFailure(map);

        assertThat(exc.getReason()).isEqualTo(NvListException.Reason.INVALID_VALUE);
        assertThat(exc.getMessage()).contains("index 1");
    }

    @Test
    public void testAllocationFailureInsideMapArrayFreesEverything()
    {
        heap.failAllocationsAfter(3);
        NvMap map = new NvMap().put(
            "maps",
            NvValue.mapArray(new NvMap(), new NvMap(), new NvMap(), new NvMap())
        );

        NvListException exc = encodeFailure(map);

        assertThat(exc.getReason()).isEqualTo(NvListException.Reason.ALLOCATION_FAILED);
        assertThat(heap.getAllocCount()).isEqualTo(3);
        assertThat(heap.getFreeCount()).isEqualTo(3);
        assertThat(heap.getLiveCount()).isZero();
    }

    @Test
    public void testAllocationFailureOfTopLevelList()
    {
        heap.failAllocationsAfter(0);

        NvListException exc = encodeFailure(new NvMap().putString("a", "b"));

        assertThat(exc.getReason()).isEqualTo(NvListException.Reason.ALLOCATION_FAILED);
        assertThat(heap.getFreeCount()).isZero();
    }

    @Test
    public void testAddFailureInNestedMapFreesEverything()
    {
        heap.failAdding("broken", 12);
        NvMap map = new NvMap()
            .putString("a", "b")
            .putMap("outer", new NvMap().putMap("inner", new NvMap().putString("broken", "x")));

        NvListException exc = encodeFailure(map);

        assertThat(exc.getReason()).isEqualTo(NvListException.Reason.ADD_FAILED);
        assertThat(exc.getKey()).isEqualTo("broken");
        assertThat(exc.getMessage()).contains("12");
        assertThat(heap.getAllocCount()).isEqualTo(3);
        assertThat(heap.getLiveCount()).isZero();
    }

    @Test
    public void testUnsupportedDecodedTypeIsReported() throws Exception
    {
        long nvl = heap.nvlistAlloc(NvPairLibrary.NV_UNIQUE_NAME);
        heap.addRaw(nvl, "when", NvDataType.HRTIME.getWireId(), 1234L);

        try (NvListHandle handle = new NvListHandle(heap, nvl))
        {
            NvListException exc = catchThrowableOfType(() -> codec.decode(handle), NvListException.class);

            assertThat(exc.getReason()).isEqualTo(NvListException.Reason.DECODE_FAILED);
            assertThat(exc.getKey()).isEqualTo("when");
            assertThat(exc.getMessage()).contains("Unsupported nvpair type 18");
        }
        assertThat(heap.getLiveCount()).isZero();
    }

    @Test
    public void testUnknownDecodedTypeIsReported() throws Exception
    {
        long nvl = heap.nvlistAlloc(NvPairLibrary.NV_UNIQUE_NAME);
        heap.addRaw(nvl, "odd", 99, "x");

        try (NvListHandle handle = new NvListHandle(heap, nvl))
        {
            NvListException exc = catchThrowableOfType(() -> codec.decode(handle), NvListException.class);

            assertThat(exc.getMessage()).contains("Unsupported nvpair type 99");
        }
    }

    @Test
    public void testDecodeIntoReplacesContent() throws Exception
    {
        NvMap dst = new NvMap().putString("stale", "x");

        try (NvListHandle handle = codec.encode(new NvMap().putString("fresh", "y")))
        {
            codec.decodeInto(handle, dst);
        }

        assertThat(dst.keySet()).containsExactly("fresh");
    }

    @Test
    public void testInvokeWithOutputDecodesAndFrees() throws Exception
    {
        NvMap dst = new NvMap().putString("stale", "x");

        int status = codec.invokeWithOutput(
            dst,
            slot ->
            {
                long nvl = heap.nvlistAlloc(NvPairLibrary.NV_UNIQUE_NAME);
                heap.nvlistAddInt32(nvl, "pool/fs@snap", 17);
                slot.setAddress(nvl);
                return 17;
            }
        );

        assertEquals(17, status);
        assertThat(dst.keySet()).containsExactly("pool/fs@snap");
        assertThat(dst.getNumber("pool/fs@snap").intValue()).isEqualTo(17);
        assertThat(heap.getLiveCount()).isZero();
    }

    @Test
    public void testInvokeWithoutOutputLeavesMapEmpty() throws Exception
    {
        NvMap dst = new NvMap().putString("stale", "x");

        int status = codec.invokeWithOutput(dst, slot -> 0);

        assertEquals(0, status);
        assertThat(dst.isEmpty()).isTrue();
    }

    @Test
    public void testInvokeWithOutputFreesWhenCallThrows()
    {
        LzcException failure = new LzcException("call failed");

        Throwable exc = catchThrowableOfType(
            () -> codec.invokeWithOutput(
                new NvMap(),
                slot ->
                {
                    slot.setAddress(heap.nvlistAlloc(NvPairLibrary.NV_UNIQUE_NAME));
                    throw failure;
                }
            ),
            LzcException.class
        );

        assertThat(exc).isSameAs(failure);
        assertThat(heap.getAllocCount()).isEqualTo(1);
        assertThat(heap.getLiveCount()).isZero();
    }

    @Test
    public void testInvokeWithOutputFreesWhenDecodeFails()
    {
        NvListException exc = catchThrowableOfType(
            () -> codec.invokeWithOutput(
                new NvMap(),
                slot ->
                {
                    long nvl = heap.nvlistAlloc(NvPairLibrary.NV_UNIQUE_NAME);
                    heap.addRaw(nvl, "d", NvDataType.DOUBLE.getWireId(), 1.5d);
                    slot.setAddress(nvl);
                    return 0;
                }
            ),
            NvListException.class
        );

        assertThat(exc.getReason()).isEqualTo(NvListException.Reason.DECODE_FAILED);
        assertThat(heap.getLiveCount()).isZero();
    }

    @Test
    public void testClosedHandleCannotBeUsed() throws Exception
    {
        NvListHandle handle = codec.encode(new NvMap());
        handle.close();
        handle.close();

        assertThat(handle.isClosed()).isTrue();
        assertThat(heap.getFreeCount()).isEqualTo(1);
        assertThat(catchThrowableOfType(handle::getAddress, IllegalStateException.class)).isNotNull();
    }
}
