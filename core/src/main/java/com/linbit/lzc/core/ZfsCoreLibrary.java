package com.linbit.lzc.core;

import com.linbit.lzc.nvlist.NvListSlot;
import com.linbit.lzc.nvlist.ValueRef;

import javax.annotation.Nullable;

/**
 * The libzfs_core functions used by {@link LibZfsCore}
 *
 * nvlist arguments are passed as nvlist addresses, 0 being the null address. nvlists returned by
 * the library are stored into an {@link NvListSlot} and are owned by the caller. All methods
 * except {@link #lzcExists(String)} return the status code of the library function, 0 on success
 * or an errno value.
 */
public interface ZfsCoreLibrary
{
    int lzcCreate(String fsName, int objsetType, long props);

    int lzcClone(String fsName, String origin, long props);

    /**
     * @param snapName Receives the name of the snapshot the file system was rolled back to
     */
    int lzcRollback(String fsName, ValueRef<String> snapName);

    int lzcSnapshot(long snaps, long props, NvListSlot errList);

    int lzcDestroySnaps(long snaps, boolean defer, NvListSlot errList);

    int lzcBookmark(long bookmarks, NvListSlot errList);

    int lzcGetBookmarks(String fsName, long props, NvListSlot bookmarks);

    int lzcDestroyBookmarks(long bookmarks, NvListSlot errList);

    int lzcSnaprangeSpace(String firstSnap, String lastSnap, ValueRef<Long> used);

    int lzcHold(long holds, int cleanupFd, NvListSlot errList);

    int lzcRelease(long holds, NvListSlot errList);

    int lzcGetHolds(String snapName, NvListSlot holds);

    int lzcSend(String snapName, @Nullable String fromSnap, int fd, int flags);

    int lzcSendSpace(String snapName, @Nullable String fromSnap, int flags, ValueRef<Long> space);

    int lzcReceive(String snapName, long props, @Nullable String origin, boolean force, int fd);

    boolean lzcExists(String dataset);
}
