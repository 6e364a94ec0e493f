package com.linbit.lzc.core;

import com.linbit.lzc.Errno;
import com.linbit.lzc.errors.ZfsErrorException;
import com.linbit.lzc.errors.ZfsErrorKind;
import com.linbit.lzc.errors.ZfsErrorTranslator;
import com.linbit.lzc.errors.ZfsMultipleErrorsException;
import com.linbit.lzc.logging.ErrorReporter;
import com.linbit.lzc.nvlist.HeapNvPairLibrary;
import com.linbit.lzc.nvlist.NvDataType;
import com.linbit.lzc.nvlist.NvListCodec;
import com.linbit.lzc.nvlist.NvListSlot;
import com.linbit.lzc.nvlist.NvMap;
import com.linbit.lzc.nvlist.NvNumber;
import com.linbit.lzc.nvlist.NvPairLibrary;
import com.linbit.lzc.nvlist.NvValue;
import com.linbit.lzc.nvlist.ValueRef;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.event.Level;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.entry;
import static org.junit.Assert.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class LibZfsCoreTest
{
    private HeapNvPairLibrary heap;
    private ZfsCoreLibrary zfsCoreLib;
    private ErrorReporter errorReporter;
    private LibZfsCore lzc;

    @Before
    public void setUp()
    {
        heap = new HeapNvPairLibrary();
        zfsCoreLib = mock(ZfsCoreLibrary.class);
        errorReporter = mock(ErrorReporter.class);
        lzc = new LibZfsCore(
            zfsCoreLib,
            new NvListCodec(heap, errorReporter),
            new ZfsErrorTranslator(),
            errorReporter
        );
    }

    @After
    public void tearDown()
    {
        assertEquals("nvlists leaked", 0, heap.getLiveCount());
    }

    /**
     * Allocates an nvlist as libzfs_core would return it through an output parameter
     */
    private long returnedList(NvMap content)
    {
        long nvl = heap.nvlistAlloc(NvPairLibrary.NV_UNIQUE_NAME);
        for (Map.Entry<String, NvValue> entry : content)
        {
            heap.nvlistAddInt32(nvl, entry.getKey(), ((NvNumber) entry.getValue()).intValue());
        }
        return nvl;
    }

    @Test
    public void testCreatePassesTypeAndProperties() throws Exception
    {
        when(zfsCoreLib.lzcCreate(eq("pool/vol"), anyInt(), anyLong())).thenAnswer(
            inv ->
            {
                long props = inv.getArgument(2);
                assertEquals(NvDataType.UINT64.getWireId(), heap.typeOf(props, "volsize"));
                assertEquals(1L << 30, heap.valueOf(props, "volsize"));
                return 0;
            }
        );

        lzc.create("pool/vol", DatasetType.VOLUME, new NvMap().putInteger("volsize", 1L << 30));

        verify(zfsCoreLib).lzcCreate(eq("pool/vol"), eq(3), anyLong());
    }

    @Test
    public void testCreateFailureIsClassifiedAndReported()
    {
        when(zfsCoreLib.lzcCreate(anyString(), anyInt(), anyLong())).thenReturn(Errno.EEXIST);

        ZfsErrorException exc = catchThrowableOfType(
            () -> lzc.create("pool/fs", DatasetType.FILESYSTEM, new NvMap()),
            ZfsErrorException.class
        );

        assertEquals(ZfsErrorKind.FILESYSTEM_EXISTS, exc.getKind());
        verify(errorReporter).reportProblem(eq(Level.DEBUG), eq(exc), any());
    }

    @Test
    public void testRollbackReturnsSnapshot() throws Exception
    {
        when(zfsCoreLib.lzcRollback(eq("pool/fs"), any())).thenAnswer(
            inv ->
            {
                ValueRef<String> snapName = inv.getArgument(1);
                snapName.set("pool/fs@latest");
                return 0;
            }
        );

        assertEquals("pool/fs@latest", lzc.rollback("pool/fs"));
    }

    @Test
    public void testSnapshotSendsPresenceList() throws Exception
    {
        when(zfsCoreLib.lzcSnapshot(anyLong(), anyLong(), any(NvListSlot.class))).thenAnswer(
            inv ->
            {
                long snaps = inv.getArgument(0);
                assertEquals(NvDataType.BOOLEAN.getWireId(), heap.typeOf(snaps, "pool/a@s"));
                assertEquals(NvDataType.BOOLEAN.getWireId(), heap.typeOf(snaps, "pool/b@s"));
                return 0;
            }
        );

        lzc.snapshot(Arrays.asList("pool/a@s", "pool/b@s"), new NvMap());
    }

    @Test
    public void testSnapshotItemFailures()
    {
        when(zfsCoreLib.lzcSnapshot(anyLong(), anyLong(), any(NvListSlot.class))).thenAnswer(
            inv ->
            {
                NvListSlot slot = inv.getArgument(2);
                slot.setAddress(
                    returnedList(
                        new NvMap()
                            .put("pool/a@s", NvValue.int32(Errno.EEXIST))
                            .put("N_MORE_ERRORS", NvValue.int32(2))
                    )
                );
                return Errno.EEXIST;
            }
        );

        ZfsMultipleErrorsException exc = catchThrowableOfType(
            () -> lzc.snapshot(Arrays.asList("pool/a@s", "pool/b@s"), new NvMap()),
            ZfsMultipleErrorsException.class
        );

        assertEquals(ZfsErrorKind.SNAPSHOT_FAILURE, exc.getKind());
        assertEquals(2, exc.getSuppressedCount());
        assertEquals(1, exc.getErrors().size());
        assertEquals(ZfsErrorKind.SNAPSHOT_EXISTS, exc.getErrors().get(0).getKind());
    }

    @Test
    public void testDestroySnapsPassesDefer() throws Exception
    {
        when(zfsCoreLib.lzcDestroySnaps(anyLong(), anyBoolean(), any(NvListSlot.class))).thenReturn(0);

        lzc.destroySnaps(Collections.singletonList("pool/a@s"), true);

        verify(zfsCoreLib).lzcDestroySnaps(anyLong(), eq(true), any(NvListSlot.class));
    }

    @Test
    public void testGetBookmarksUnwrapsValues() throws Exception
    {
        when(zfsCoreLib.lzcGetBookmarks(eq("pool/fs"), anyLong(), any(NvListSlot.class))).thenAnswer(
            inv ->
            {
                long props = inv.getArgument(1);
                assertEquals(NvDataType.BOOLEAN.getWireId(), heap.typeOf(props, "guid"));

                long guid = heap.nvlistAlloc(NvPairLibrary.NV_UNIQUE_NAME);
                heap.nvlistAddUint64(guid, "value", 42L);
                long bookmarkProps = heap.nvlistAlloc(NvPairLibrary.NV_UNIQUE_NAME);
                heap.nvlistAddNvlist(bookmarkProps, "guid", guid);
                long bookmarks = heap.nvlistAlloc(NvPairLibrary.NV_UNIQUE_NAME);
                heap.nvlistAddNvlist(bookmarks, "mark", bookmarkProps);
                heap.nvlistFree(guid);
                heap.nvlistFree(bookmarkProps);

                NvListSlot slot = inv.getArgument(2);
                slot.setAddress(bookmarks);
                return 0;
            }
        );

        Map<String, NvMap> bookmarks = lzc.getBookmarks("pool/fs", Collections.singletonList("guid"));

        assertThat(bookmarks).containsOnlyKeys("mark");
        assertEquals(NvValue.uint64(42L), bookmarks.get("mark").get("guid"));
    }

    @Test
    public void testSnaprangeSpace() throws Exception
    {
        when(zfsCoreLib.lzcSnaprangeSpace(eq("pool/a@1"), eq("pool/a@3"), any())).thenAnswer(
            inv ->
            {
                ValueRef<Long> used = inv.getArgument(2);
                used.set(8192L);
                return 0;
            }
        );

        assertEquals(8192L, lzc.snaprangeSpace("pool/a@1", "pool/a@3"));
    }

    @Test
    public void testHoldReturnsMissingSnapshots() throws Exception
    {
        when(zfsCoreLib.lzcHold(anyLong(), anyInt(), any(NvListSlot.class))).thenAnswer(
            inv ->
            {
                long holds = inv.getArgument(0);
                assertEquals("backup", heap.valueOf(holds, "pool/a@s"));
                NvListSlot slot = inv.getArgument(2);
                slot.setAddress(returnedList(new NvMap().put("pool/b@s", NvValue.int32(Errno.ENOENT))));
                return 0;
            }
        );
        Map<String, String> holds = new LinkedHashMap<>();
        holds.put("pool/a@s", "backup");
        holds.put("pool/b@s", "backup");

        List<String> missing = lzc.hold(holds);

        assertThat(missing).containsExactly("pool/b@s");
        verify(zfsCoreLib).lzcHold(anyLong(), eq(LibZfsCore.NO_CLEANUP_FD), any(NvListSlot.class));
    }

    @Test
    public void testHoldWithBadCleanupFd()
    {
        when(zfsCoreLib.lzcHold(anyLong(), anyInt(), any(NvListSlot.class))).thenReturn(Errno.EBADF);

        ZfsErrorException exc = catchThrowableOfType(
            () -> lzc.hold(Collections.singletonMap("pool/a@s", "tag"), 99),
            ZfsErrorException.class
        );

        assertEquals(ZfsErrorKind.BAD_HOLD_CLEANUP_FD, exc.getKind());
    }

    @Test
    public void testReleaseSendsNestedTags() throws Exception
    {
        when(zfsCoreLib.lzcRelease(anyLong(), any(NvListSlot.class))).thenAnswer(
            inv ->
            {
                long holds = inv.getArgument(0);
                assertEquals(NvDataType.NVLIST.getWireId(), heap.typeOf(holds, "pool/a@s"));
                long tags = (Long) heap.valueOf(holds, "pool/a@s");
                assertEquals(NvDataType.BOOLEAN.getWireId(), heap.typeOf(tags, "t1"));
                assertEquals(NvDataType.BOOLEAN.getWireId(), heap.typeOf(tags, "t2"));
                return 0;
            }
        );

        List<String> missing = lzc.release(Collections.singletonMap("pool/a@s", Arrays.asList("t1", "t2")));

        assertThat(missing).isEmpty();
    }

    @Test
    public void testGetHolds() throws Exception
    {
        when(zfsCoreLib.lzcGetHolds(eq("pool/a@s"), any(NvListSlot.class))).thenAnswer(
            inv ->
            {
                long holds = heap.nvlistAlloc(NvPairLibrary.NV_UNIQUE_NAME);
                heap.nvlistAddUint64(holds, "backup", 1700000000L);
                NvListSlot slot = inv.getArgument(1);
                slot.setAddress(holds);
                return 0;
            }
        );

        assertThat(lzc.getHolds("pool/a@s")).containsExactly(entry("backup", 1700000000L));
    }

    @Test
    public void testSendFlags() throws Exception
    {
        when(zfsCoreLib.lzcSend(anyString(), any(), anyInt(), anyInt())).thenReturn(0);

        lzc.send("pool/a@2", "pool/a@1", 5, EnumSet.of(SendFlag.EMBED_DATA, SendFlag.COMPRESS));
        lzc.send("pool/a@2", null, 6);

        verify(zfsCoreLib).lzcSend("pool/a@2", "pool/a@1", 5, 5);
        verify(zfsCoreLib).lzcSend(eq("pool/a@2"), isNull(), eq(6), eq(0));
    }

    @Test
    public void testSendFailure()
    {
        when(zfsCoreLib.lzcSend(anyString(), any(), anyInt(), anyInt())).thenReturn(Errno.EXDEV);

        ZfsErrorException exc = catchThrowableOfType(
            () -> lzc.send("pool/a@2", "tank/a@1", 5),
            ZfsErrorException.class
        );

        assertEquals(ZfsErrorKind.POOLS_DIFFER, exc.getKind());
    }

    @Test
    public void testSendSpace() throws Exception
    {
        when(zfsCoreLib.lzcSendSpace(eq("pool/a@2"), isNull(), eq(0), any())).thenAnswer(
            inv ->
            {
                ValueRef<Long> space = inv.getArgument(3);
                space.set(1024L);
                return 0;
            }
        );

        assertEquals(1024L, lzc.sendSpace("pool/a@2", null));
    }

    @Test
    public void testReceiveFailure()
    {
        when(zfsCoreLib.lzcReceive(anyString(), anyLong(), any(), anyBoolean(), anyInt())).thenReturn(Errno.ENOSPC);

        ZfsErrorException exc = catchThrowableOfType(
            () -> lzc.receive("pool/a@s", 7),
            ZfsErrorException.class
        );

        assertEquals(ZfsErrorKind.NO_SPACE, exc.getKind());
        assertEquals("pool/a", exc.getName());
        ArgumentCaptor<Boolean> force = ArgumentCaptor.forClass(Boolean.class);
        verify(zfsCoreLib).lzcReceive(eq("pool/a@s"), anyLong(), isNull(), force.capture(), eq(7));
        assertThat(force.getValue()).isFalse();
    }

    @Test
    public void testExists()
    {
        when(zfsCoreLib.lzcExists("pool/a")).thenReturn(true);

        assertThat(lzc.exists("pool/a")).isTrue();
        assertThat(lzc.exists("pool/b")).isFalse();
    }
}
