package com.linbit.lzc.binding;

import jnr.ffi.Pointer;
import jnr.ffi.annotations.Out;
import jnr.ffi.byref.LongLongByReference;
import jnr.ffi.byref.PointerByReference;
import jnr.ffi.types.u_int32_t;

/**
 * Low-level libzfs_core interface
 *
 * See {@code libzfs_core.h}; the signatures are those of ZFS on Linux 0.8 and later.
 * {@code boolean_t} and enums are passed as int.
 */
public interface LibZfsCoreNative
{
    /** {@code ZFS_MAX_DATASET_NAME_LEN} */
    int MAX_DATASET_NAME_LEN = 256;

    int libzfs_core_init();

    void libzfs_core_fini();

    int lzc_create(String fsname, int type, Pointer props, Pointer wkeydata, @u_int32_t int wkeylen);

    int lzc_clone(String fsname, String origin, Pointer props);

    int lzc_rollback(String fsname, @Out byte[] snapnamebuf, int snapnamelen);

    int lzc_snapshot(Pointer snaps, Pointer props, @Out PointerByReference errlist);

    int lzc_destroy_snaps(Pointer snaps, int defer, @Out PointerByReference errlist);

    int lzc_bookmark(Pointer bookmarks, @Out PointerByReference errlist);

    int lzc_get_bookmarks(String fsname, Pointer props, @Out PointerByReference bmarks);

    int lzc_destroy_bookmarks(Pointer bmarks, @Out PointerByReference errlist);

    int lzc_snaprange_space(String firstsnap, String lastsnap, @Out LongLongByReference usedp);

    int lzc_hold(Pointer holds, int cleanupFd, @Out PointerByReference errlist);

    int lzc_release(Pointer holds, @Out PointerByReference errlist);

    int lzc_get_holds(String snapname, @Out PointerByReference holdsp);

    int lzc_send(String snapname, String from, int fd, int flags);

    int lzc_send_space(String snapname, String from, int flags, @Out LongLongByReference result);

    int lzc_receive(String snapname, Pointer props, String origin, int force, int raw, int fd);

    int lzc_exists(String dataset);
}
