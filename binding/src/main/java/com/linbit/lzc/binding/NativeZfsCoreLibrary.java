package com.linbit.lzc.binding;

import com.linbit.lzc.core.ZfsCoreLibrary;
import com.linbit.lzc.nvlist.NvListSlot;
import com.linbit.lzc.nvlist.ValueRef;

import javax.annotation.Nullable;

import jnr.ffi.Pointer;
import jnr.ffi.Runtime;
import jnr.ffi.byref.LongLongByReference;
import jnr.ffi.byref.PointerByReference;

import static com.linbit.lzc.binding.NativeSupport.toAddress;
import static com.linbit.lzc.binding.NativeSupport.toBooleanT;

/**
 * {@link ZfsCoreLibrary} backed by the native libzfs_core
 *
 * libzfs_core must have been initialized by {@code libzfs_core_init()} before any of the methods
 * are called, see {@link NativeLibraries#loadZfsCore(String)}.
 */
public final class NativeZfsCoreLibrary implements ZfsCoreLibrary
{
    private final LibZfsCoreNative lib;
    private final Runtime runtime;

    NativeZfsCoreLibrary(LibZfsCoreNative libRef)
    {
        lib = libRef;
        runtime = Runtime.getRuntime(libRef);
    }

    private @Nullable Pointer ptr(long address)
    {
        return NativeSupport.toPointer(runtime, address);
    }

    private static int withErrList(NvListSlot slot, PointerByReference ref, int status)
    {
        slot.setAddress(toAddress(ref.getValue()));
        return status;
    }

    @Override
    public int lzcCreate(String fsName, int objsetType, long props)
    {
        return lib.lzc_create(fsName, objsetType, ptr(props), null, 0);
    }

    @Override
    public int lzcClone(String fsName, String origin, long props)
    {
        return lib.lzc_clone(fsName, origin, ptr(props));
    }

    @Override
    public int lzcRollback(String fsName, ValueRef<String> snapName)
    {
        byte[] buffer = new byte[LibZfsCoreNative.MAX_DATASET_NAME_LEN];
        int status = lib.lzc_rollback(fsName, buffer, buffer.length);
        if (status == 0)
        {
            snapName.set(NativeSupport.fromCString(buffer));
        }
        return status;
    }

    @Override
    public int lzcSnapshot(long snaps, long props, NvListSlot errList)
    {
        PointerByReference ref = new PointerByReference();
        return withErrList(errList, ref, lib.lzc_snapshot(ptr(snaps), ptr(props), ref));
    }

    @Override
    public int lzcDestroySnaps(long snaps, boolean defer, NvListSlot errList)
    {
        PointerByReference ref = new PointerByReference();
        return withErrList(errList, ref, lib.lzc_destroy_snaps(ptr(snaps), toBooleanT(defer), ref));
    }

    @Override
    public int lzcBookmark(long bookmarks, NvListSlot errList)
    {
        PointerByReference ref = new PointerByReference();
        return withErrList(errList, ref, lib.lzc_bookmark(ptr(bookmarks), ref));
    }

    @Override
    public int lzcGetBookmarks(String fsName, long props, NvListSlot bookmarks)
    {
        PointerByReference ref = new PointerByReference();
        return withErrList(bookmarks, ref, lib.lzc_get_bookmarks(fsName, ptr(props), ref));
    }

    @Override
    public int lzcDestroyBookmarks(long bookmarks, NvListSlot errList)
    {
        PointerByReference ref = new PointerByReference();
        return withErrList(errList, ref, lib.lzc_destroy_bookmarks(ptr(bookmarks), ref));
    }

    @Override
    public int lzcSnaprangeSpace(String firstSnap, String lastSnap, ValueRef<Long> used)
    {
        LongLongByReference ref = new LongLongByReference();
        int status = lib.lzc_snaprange_space(firstSnap, lastSnap, ref);
        if (status == 0)
        {
            used.set(ref.getValue());
        }
        return status;
    }

    @Override
    public int lzcHold(long holds, int cleanupFd, NvListSlot errList)
    {
        PointerByReference ref = new PointerByReference();
        return withErrList(errList, ref, lib.lzc_hold(ptr(holds), cleanupFd, ref));
    }

    @Override
    public int lzcRelease(long holds, NvListSlot errList)
    {
        PointerByReference ref = new PointerByReference();
        return withErrList(errList, ref, lib.lzc_release(ptr(holds), ref));
    }

    @Override
    public int lzcGetHolds(String snapName, NvListSlot holds)
    {
        PointerByReference ref = new PointerByReference();
        return withErrList(holds, ref, lib.lzc_get_holds(snapName, ref));
    }

    @Override
    public int lzcSend(String snapName, @Nullable String fromSnap, int fd, int flags)
    {
        return lib.lzc_send(snapName, fromSnap, fd, flags);
    }

    @Override
    public int lzcSendSpace(String snapName, @Nullable String fromSnap, int flags, ValueRef<Long> space)
    {
        LongLongByReference ref = new LongLongByReference();
        int status = lib.lzc_send_space(snapName, fromSnap, flags, ref);
        if (status == 0)
        {
            space.set(ref.getValue());
        }
        return status;
    }

    @Override
    public int lzcReceive(String snapName, long props, @Nullable String origin, boolean force, int fd)
    {
        return lib.lzc_receive(snapName, ptr(props), origin, toBooleanT(force), toBooleanT(false), fd);
    }

    @Override
    public boolean lzcExists(String dataset)
    {
        return lib.lzc_exists(dataset) != 0;
    }
}
