package com.linbit.lzc.core;

import com.linbit.lzc.LzcException;
import com.linbit.lzc.errors.ZfsErrorException;
import com.linbit.lzc.errors.ZfsErrorTranslator;
import com.linbit.lzc.errors.ZfsItemErrors;
import com.linbit.lzc.logging.ErrorReporter;
import com.linbit.lzc.nvlist.NvListCodec;
import com.linbit.lzc.nvlist.NvListHandle;
import com.linbit.lzc.nvlist.NvMap;
import com.linbit.lzc.nvlist.NvNested;
import com.linbit.lzc.nvlist.NvNumber;
import com.linbit.lzc.nvlist.NvValue;
import com.linbit.lzc.nvlist.ValueRef;

import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.event.Level;

/**
 * Java interface to the libzfs_core operations
 *
 * Each method converts its arguments into the nvlists expected by libzfs_core, calls the library
 * and converts the results back. If the library reports a failure, the status code is classified
 * by the {@link ZfsErrorTranslator} and thrown as a {@link ZfsErrorException}; failures of batch
 * operations are thrown as a {@link com.linbit.lzc.errors.ZfsMultipleErrorsException}.
 *
 * The methods do not validate names themselves, libzfs_core is the authority on what is valid.
 */
@Singleton
public class LibZfsCore
{
    /** Passed as cleanup file descriptor to place holds that are not released automatically */
    public static final int NO_CLEANUP_FD = -1;

    private final ZfsCoreLibrary zfsCoreLib;
    private final NvListCodec codec;
    private final ZfsErrorTranslator translator;
    private final ErrorReporter errorReporter;

    @Inject
    public LibZfsCore(
        ZfsCoreLibrary zfsCoreLibRef,
        NvListCodec codecRef,
        ZfsErrorTranslator translatorRef,
        ErrorReporter errorReporterRef
    )
    {
        zfsCoreLib = zfsCoreLibRef;
        codec = codecRef;
        translator = translatorRef;
        errorReporter = errorReporterRef;
    }

    /**
     * Creates a file system or a volume
     *
     * @param props Properties of the new dataset, e.g. "volsize" for volumes
     */
    public void create(String name, DatasetType type, NvMap props) throws LzcException
    {
        errorReporter.logDebug("Creating %s '%s'", type.name().toLowerCase(), name);
        int status;
        try (NvListHandle propsNvl = codec.encode(props))
        {
            status = zfsCoreLib.lzcCreate(name, type.getObjsetType(), propsNvl.getAddress());
        }
        if (status != 0)
        {
            throw report(translator.create(status, name), "create " + name);
        }
    }

    public void clone(String name, String origin, NvMap props) throws LzcException
    {
        errorReporter.logDebug("Cloning '%s' to '%s'", origin, name);
        int status;
        try (NvListHandle propsNvl = codec.encode(props))
        {
            status = zfsCoreLib.lzcClone(name, origin, propsNvl.getAddress());
        }
        if (status != 0)
        {
            throw report(translator.clone(status, name, origin), "clone " + origin + " to " + name);
        }
    }

    /**
     * Rolls the file system back to its most recent snapshot
     *
     * @return The name of the snapshot the file system was rolled back to
     */
    public String rollback(String name) throws LzcException
    {
        errorReporter.logDebug("Rolling back '%s'", name);
        ValueRef<String> snapName = new ValueRef<>();
        int status = zfsCoreLib.lzcRollback(name, snapName);
        if (status != 0)
        {
            throw report(translator.rollback(status, name), "rollback " + name);
        }
        String rolledBackTo = snapName.get();
        return rolledBackTo == null ? "" : rolledBackTo;
    }

    /**
     * Atomically creates the given snapshots. At most one snapshot per file system may be given.
     */
    public void snapshot(List<String> snaps, NvMap props) throws LzcException
    {
        errorReporter.logDebug("Creating snapshots %s", snaps);
        NvMap errList = new NvMap();
        int status;
        try (
            NvListHandle snapsNvl = codec.encode(NvMap.presenceOf(snaps));
            NvListHandle propsNvl = codec.encode(props)
        )
        {
            status = codec.invokeWithOutput(
                errList,
                slot -> zfsCoreLib.lzcSnapshot(snapsNvl.getAddress(), propsNvl.getAddress(), slot)
            );
        }
        if (status != 0)
        {
            throw report(
                translator.snapshot(status, ZfsItemErrors.fromNvMap(errList), snaps),
                "snapshot " + snaps
            );
        }
    }

    /**
     * Destroys the given snapshots
     *
     * @param defer If true, snapshots that are held or cloned are marked for deferred destruction
     *     instead of failing the operation
     */
    public void destroySnaps(List<String> snaps, boolean defer) throws LzcException
    {
        errorReporter.logDebug("Destroying snapshots %s (defer: %b)", snaps, defer);
        NvMap errList = new NvMap();
        int status;
        try (NvListHandle snapsNvl = codec.encode(NvMap.presenceOf(snaps)))
        {
            status = codec.invokeWithOutput(
                errList,
                slot -> zfsCoreLib.lzcDestroySnaps(snapsNvl.getAddress(), defer, slot)
            );
        }
        if (status != 0)
        {
            throw report(
                translator.destroySnaps(status, ZfsItemErrors.fromNvMap(errList), snaps),
                "destroy snapshots " + snaps
            );
        }
    }

    /**
     * @param bookmarks Maps the name of each new bookmark to the snapshot it is created from
     */
    public void bookmark(Map<String, String> bookmarks) throws LzcException
    {
        errorReporter.logDebug("Creating bookmarks %s", bookmarks);
        NvMap request = new NvMap();
        for (Map.Entry<String, String> entry : bookmarks.entrySet())
        {
            request.putString(entry.getKey(), entry.getValue());
        }
        NvMap errList = new NvMap();
        int status;
        try (NvListHandle bookmarksNvl = codec.encode(request))
        {
            status = codec.invokeWithOutput(
                errList,
                slot -> zfsCoreLib.lzcBookmark(bookmarksNvl.getAddress(), slot)
            );
        }
        if (status != 0)
        {
            throw report(
                translator.bookmark(status, ZfsItemErrors.fromNvMap(errList), bookmarks),
                "bookmark " + bookmarks.keySet()
            );
        }
    }

    /**
     * Lists the bookmarks of a file system
     *
     * @param props The bookmark properties to retrieve, e.g. "guid", "createtxg", "creation"
     * @return Maps the name of each bookmark to its properties
     */
    public Map<String, NvMap> getBookmarks(String fsName, List<String> props) throws LzcException
    {
        errorReporter.logTrace("Listing bookmarks of '%s'", fsName);
        NvMap bookmarks = new NvMap();
        int status;
        try (NvListHandle propsNvl = codec.encode(NvMap.presenceOf(props)))
        {
            status = codec.invokeWithOutput(
                bookmarks,
                slot -> zfsCoreLib.lzcGetBookmarks(fsName, propsNvl.getAddress(), slot)
            );
        }
        if (status != 0)
        {
            throw report(translator.getBookmarks(status, fsName), "get bookmarks of " + fsName);
        }

        Map<String, NvMap> result = new LinkedHashMap<>();
        for (Map.Entry<String, NvValue> bookmark : bookmarks)
        {
            NvMap bookmarkProps = new NvMap();
            NvValue value = bookmark.getValue();
            if (value instanceof NvNested)
            {
                // properties are reported as {"value": <value>}
                for (Map.Entry<String, NvValue> prop : ((NvNested) value).mapValue())
                {
                    NvValue propValue = prop.getValue();
                    if (propValue instanceof NvNested)
                    {
                        NvValue unwrapped = ((NvNested) propValue).mapValue().get("value");
                        if (unwrapped != null)
                        {
                            propValue = unwrapped;
                        }
                    }
                    bookmarkProps.put(prop.getKey(), propValue);
                }
            }
            result.put(bookmark.getKey(), bookmarkProps);
        }
        return result;
    }

    public void destroyBookmarks(List<String> bookmarks) throws LzcException
    {
        errorReporter.logDebug("Destroying bookmarks %s", bookmarks);
        NvMap errList = new NvMap();
        int status;
        try (NvListHandle bookmarksNvl = codec.encode(NvMap.presenceOf(bookmarks)))
        {
            status = codec.invokeWithOutput(
                errList,
                slot -> zfsCoreLib.lzcDestroyBookmarks(bookmarksNvl.getAddress(), slot)
            );
        }
        if (status != 0)
        {
            throw report(
                translator.destroyBookmarks(status, ZfsItemErrors.fromNvMap(errList), bookmarks),
                "destroy bookmarks " + bookmarks
            );
        }
    }

    /**
     * Calculates the space that would be freed by destroying the snapshots from {@code firstSnap}
     * to {@code lastSnap}, both inclusive
     */
    public long snaprangeSpace(String firstSnap, String lastSnap) throws LzcException
    {
        ValueRef<Long> used = new ValueRef<>();
        int status = zfsCoreLib.lzcSnaprangeSpace(firstSnap, lastSnap, used);
        if (status != 0)
        {
            throw report(
                translator.snaprangeSpace(status, firstSnap, lastSnap),
                "snaprange space " + firstSnap + " - " + lastSnap
            );
        }
        return valueOrZero(used);
    }

    public List<String> hold(Map<String, String> holds) throws LzcException
    {
        return hold(holds, NO_CLEANUP_FD);
    }

    /**
     * Places user holds on snapshots
     *
     * @param holds Maps each snapshot to the tag of the hold to place on it
     * @param cleanupFd If not {@link #NO_CLEANUP_FD}, a file descriptor of /dev/zfs; the holds
     *     are released when the file descriptor is closed
     * @return The snapshots that did not exist and therefore were not held
     */
    public List<String> hold(Map<String, String> holds, int cleanupFd) throws LzcException
    {
        errorReporter.logDebug("Placing holds %s", holds);
        NvMap request = new NvMap();
        for (Map.Entry<String, String> entry : holds.entrySet())
        {
            request.putString(entry.getKey(), entry.getValue());
        }
        NvMap errList = new NvMap();
        int status;
        try (NvListHandle holdsNvl = codec.encode(request))
        {
            status = codec.invokeWithOutput(
                errList,
                slot -> zfsCoreLib.lzcHold(holdsNvl.getAddress(), cleanupFd, slot)
            );
        }
        ZfsItemErrors errors = ZfsItemErrors.fromNvMap(errList);
        if (status != 0)
        {
            throw report(translator.hold(status, errors, holds), "hold " + holds.keySet());
        }
        return missingItems(errors);
    }

    /**
     * Releases user holds
     *
     * @param holds Maps each snapshot to the tags of the holds to release
     * @return The snapshots or holds that did not exist
     */
    public List<String> release(Map<String, List<String>> holds) throws LzcException
    {
        errorReporter.logDebug("Releasing holds %s", holds);
        NvMap request = new NvMap();
        for (Map.Entry<String, List<String>> entry : holds.entrySet())
        {
            request.putMap(entry.getKey(), NvMap.presenceOf(entry.getValue()));
        }
        NvMap errList = new NvMap();
        int status;
        try (NvListHandle holdsNvl = codec.encode(request))
        {
            status = codec.invokeWithOutput(
                errList,
                slot -> zfsCoreLib.lzcRelease(holdsNvl.getAddress(), slot)
            );
        }
        ZfsItemErrors errors = ZfsItemErrors.fromNvMap(errList);
        if (status != 0)
        {
            throw report(translator.release(status, errors, holds), "release " + holds.keySet());
        }
        return missingItems(errors);
    }

    /**
     * @return Maps the tag of each hold on the snapshot to the time the hold was placed, in
     *     seconds since the epoch
     */
    public Map<String, Long> getHolds(String snapName) throws LzcException
    {
        errorReporter.logTrace("Listing holds of '%s'", snapName);
        NvMap holds = new NvMap();
        int status = codec.invokeWithOutput(holds, slot -> zfsCoreLib.lzcGetHolds(snapName, slot));
        if (status != 0)
        {
            throw report(translator.getHolds(status, snapName), "get holds of " + snapName);
        }
        Map<String, Long> result = new LinkedHashMap<>();
        for (Map.Entry<String, NvValue> hold : holds)
        {
            NvValue value = hold.getValue();
            result.put(hold.getKey(), value instanceof NvNumber ? ((NvNumber) value).longValue() : 0L);
        }
        return result;
    }

    public void send(String snapName, @Nullable String fromSnap, int fd) throws LzcException
    {
        send(snapName, fromSnap, fd, EnumSet.noneOf(SendFlag.class));
    }

    /**
     * Writes a send stream of the snapshot or file system to the file descriptor
     *
     * @param fromSnap The snapshot or bookmark to generate an incremental stream from, or null
     *     for a full stream
     */
    public void send(String snapName, @Nullable String fromSnap, int fd, Set<SendFlag> flags) throws LzcException
    {
        errorReporter.logDebug("Sending '%s' (incremental from: %s, flags: %s)", snapName, fromSnap, flags);
        int status = zfsCoreLib.lzcSend(snapName, fromSnap, fd, SendFlag.toMask(flags));
        if (status != 0)
        {
            throw report(translator.send(status, snapName, fromSnap), "send " + snapName);
        }
    }

    /**
     * Estimates the size of the send stream of the snapshot
     */
    public long sendSpace(String snapName, @Nullable String fromSnap) throws LzcException
    {
        ValueRef<Long> space = new ValueRef<>();
        int status = zfsCoreLib.lzcSendSpace(snapName, fromSnap, 0, space);
        if (status != 0)
        {
            throw report(translator.sendSpace(status, snapName, fromSnap), "send space " + snapName);
        }
        return valueOrZero(space);
    }

    public void receive(String snapName, int fd) throws LzcException
    {
        receive(snapName, fd, false, null, new NvMap());
    }

    /**
     * Receives a send stream from the file descriptor into the snapshot
     *
     * @param force Roll the destination file system back to its most recent snapshot first
     * @param origin For clone streams, the snapshot the received file system is cloned from
     * @param props Properties to set on the received file system
     */
    public void receive(String snapName, int fd, boolean force, @Nullable String origin, NvMap props)
        throws LzcException
    {
        errorReporter.logDebug("Receiving '%s' (origin: %s, force: %b)", snapName, origin, force);
        int status;
        try (NvListHandle propsNvl = codec.encode(props))
        {
            status = zfsCoreLib.lzcReceive(snapName, propsNvl.getAddress(), origin, force, fd);
        }
        if (status != 0)
        {
            throw report(translator.receive(status, snapName, origin), "receive " + snapName);
        }
    }

    /**
     * Checks whether the dataset, snapshot or bookmark exists
     */
    public boolean exists(String name)
    {
        boolean exists = zfsCoreLib.lzcExists(name);
        errorReporter.logTrace("'%s' %s", name, exists ? "exists" : "does not exist");
        return exists;
    }

    private ZfsErrorException report(ZfsErrorException exc, String contextInfo)
    {
        errorReporter.reportProblem(Level.DEBUG, exc, "lzc " + contextInfo);
        return exc;
    }

    private static List<String> missingItems(ZfsItemErrors errors)
    {
        List<String> missing = errors.isEmpty() ?
            Collections.<String>emptyList() :
            new ArrayList<>(errors.getItemErrors().keySet());
        return missing;
    }

    private static long valueOrZero(ValueRef<Long> ref)
    {
        Long value = ref.get();
        return value == null ? 0L : value;
    }
}
