package com.linbit.lzc.errors;

import com.linbit.lzc.Errno;
import com.linbit.lzc.ImplementationError;
import com.linbit.lzc.ZfsNames;

import javax.annotation.Nullable;
import javax.inject.Singleton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static com.linbit.lzc.ZfsNames.fsName;
import static com.linbit.lzc.ZfsNames.isTooLong;
import static com.linbit.lzc.ZfsNames.isValidBookmarkName;
import static com.linbit.lzc.ZfsNames.isValidFsName;
import static com.linbit.lzc.ZfsNames.isValidSnapName;
import static com.linbit.lzc.ZfsNames.poolName;

/**
 * Translates the status codes returned by libzfs_core into classified failures
 *
 * libzfs_core reports most problems with a small set of errno values, EINVAL in particular
 * covers a number of different problems. Where the status code is ambiguous, the names passed to
 * the operation are checked to find the most likely cause.
 *
 * All methods are pure functions of their arguments. They must only be called with a non-zero
 * status code.
 */
@Singleton
public class ZfsErrorTranslator
{
    private interface ItemClassifier
    {
        ZfsErrorException classify(int status, @Nullable String name);
    }

    public ZfsErrorException create(int status, String name)
    {
        checkFailed(status);
        return new ErrorRuleChain("Failed to create filesystem", name)
            .when(Errno.EINVAL, () -> !isValidFsName(name), ZfsErrorKind.NAME_INVALID, name)
            .when(Errno.EINVAL, () -> isTooLong(name), ZfsErrorKind.NAME_TOO_LONG, name)
            .on(Errno.EINVAL, ZfsErrorKind.PROPERTY_INVALID, name)
            .on(Errno.EEXIST, ZfsErrorKind.FILESYSTEM_EXISTS, name)
            .on(Errno.ENOENT, ZfsErrorKind.PARENT_NOT_FOUND, name)
            .classify(status);
    }

    public ZfsErrorException clone(int status, String name, String origin)
    {
        checkFailed(status);
        return new ErrorRuleChain("Failed to create clone", name)
            .when(Errno.EINVAL, () -> !isValidFsName(name), ZfsErrorKind.NAME_INVALID, name)
            .when(Errno.EINVAL, () -> !isValidSnapName(origin), ZfsErrorKind.NAME_INVALID, origin)
            .when(Errno.EINVAL, () -> isTooLong(name), ZfsErrorKind.NAME_TOO_LONG, name)
            .when(Errno.EINVAL, () -> isTooLong(origin), ZfsErrorKind.NAME_TOO_LONG, origin)
            .when(Errno.EINVAL, () -> !isSamePool(name, origin), ZfsErrorKind.POOLS_DIFFER, name)
            .on(Errno.EINVAL, ZfsErrorKind.PROPERTY_INVALID, name)
            .on(Errno.EEXIST, ZfsErrorKind.FILESYSTEM_EXISTS, name)
            .on(Errno.ENOENT, ZfsErrorKind.DATASET_NOT_FOUND, name)
            .classify(status);
    }

    /**
     * @param name The file system that was to be rolled back
     */
    public ZfsErrorException rollback(int status, String name)
    {
        checkFailed(status);
        return new ErrorRuleChain("Failed to rollback", name)
            .when(Errno.EINVAL, () -> !isValidFsName(name), ZfsErrorKind.NAME_INVALID, name)
            .when(Errno.EINVAL, () -> isTooLong(name), ZfsErrorKind.NAME_TOO_LONG, name)
            .on(Errno.EINVAL, ZfsErrorKind.SNAPSHOT_NOT_FOUND, name)
            .when(Errno.ENOENT, () -> !isValidFsName(name), ZfsErrorKind.NAME_INVALID, name)
            .on(Errno.ENOENT, ZfsErrorKind.FILESYSTEM_NOT_FOUND, name)
            .classify(status);
    }

    public ZfsMultipleErrorsException snapshot(int status, ZfsItemErrors errors, List<String> snaps)
    {
        checkFailed(status);
        ItemClassifier classifier = (itemStatus, name) ->
        {
            String invalidSnap = firstMatch(snaps, snap -> !isValidSnapName(snap));
            String tooLongSnap = firstMatch(snaps, ZfsNames::isTooLong);
            return new ErrorRuleChain("Failed to create snapshot", name)
                .when(
                    Errno.EXDEV,
                    () -> ZfsNames.isSamePool(snaps),
                    ZfsErrorKind.DUPLICATE_SNAPSHOTS,
                    name
                )
                .on(Errno.EXDEV, ZfsErrorKind.POOLS_DIFFER, name)
                .when(Errno.EINVAL, () -> invalidSnap != null, ZfsErrorKind.NAME_INVALID, orElse(name, invalidSnap))
                .when(Errno.EINVAL, () -> tooLongSnap != null, ZfsErrorKind.NAME_TOO_LONG, orElse(name, tooLongSnap))
                .on(Errno.EINVAL, ZfsErrorKind.PROPERTY_INVALID, name)
                .on(Errno.EEXIST, ZfsErrorKind.SNAPSHOT_EXISTS, name)
                .on(Errno.ENOENT, ZfsErrorKind.FILESYSTEM_NOT_FOUND, name)
                .classify(itemStatus);
        };
        return batch(status, errors, snaps, ZfsErrorKind.SNAPSHOT_FAILURE, classifier);
    }

    public ZfsMultipleErrorsException destroySnaps(int status, ZfsItemErrors errors, List<String> snaps)
    {
        checkFailed(status);
        ItemClassifier classifier = (itemStatus, name) -> new ErrorRuleChain("Failed to destroy snapshot", name)
            .on(Errno.EEXIST, ZfsErrorKind.SNAPSHOT_IS_CLONED, name)
            .on(Errno.ENOENT, ZfsErrorKind.POOL_NOT_FOUND, name)
            .on(Errno.EBUSY, ZfsErrorKind.SNAPSHOT_IS_HELD, name)
            .classify(itemStatus);
        return batch(status, errors, snaps, ZfsErrorKind.SNAPSHOT_DESTRUCTION_FAILURE, classifier);
    }

    /**
     * @param bookmarks Maps the name of each bookmark to the snapshot it was to be created from
     */
    public ZfsMultipleErrorsException bookmark(int status, ZfsItemErrors errors, Map<String, String> bookmarks)
    {
        checkFailed(status);
        List<String> names = new ArrayList<>(bookmarks.keySet());
        ItemClassifier classifier = (itemStatus, name) ->
        {
            ErrorRuleChain chain = new ErrorRuleChain("Failed to create bookmark", name);
            if (name != null)
            {
                String snap = bookmarks.get(name);
                chain.when(Errno.EINVAL, () -> !isValidBookmarkName(name), ZfsErrorKind.NAME_INVALID, name);
                if (snap != null)
                {
                    chain
                        .when(Errno.EINVAL, () -> !isValidSnapName(snap), ZfsErrorKind.NAME_INVALID, snap)
                        .when(
                            Errno.EINVAL,
                            () -> !fsName(name).equals(fsName(snap)),
                            ZfsErrorKind.BOOKMARK_MISMATCH,
                            name
                        );
                }
                chain.when(
                    Errno.EINVAL,
                    () -> !allInPoolOf(names, name),
                    ZfsErrorKind.POOLS_DIFFER,
                    name
                );
            }
            else
            {
                String invalidName = firstMatch(names, bmark -> !isValidBookmarkName(bmark));
                chain.when(Errno.EINVAL, () -> invalidName != null, ZfsErrorKind.NAME_INVALID, invalidName);
            }
            return chain
                .on(Errno.EEXIST, ZfsErrorKind.BOOKMARK_EXISTS, name)
                .on(Errno.ENOENT, ZfsErrorKind.SNAPSHOT_NOT_FOUND, name)
                .on(Errno.ENOTSUP, ZfsErrorKind.BOOKMARK_NOT_SUPPORTED, name)
                .classify(itemStatus);
        };
        return batch(status, errors, names, ZfsErrorKind.BOOKMARK_FAILURE, classifier);
    }

    public ZfsErrorException getBookmarks(int status, String fsName)
    {
        checkFailed(status);
        return new ErrorRuleChain("Failed to list bookmarks", fsName)
            .on(Errno.ENOENT, ZfsErrorKind.FILESYSTEM_NOT_FOUND, fsName)
            .classify(status);
    }

    public ZfsMultipleErrorsException destroyBookmarks(int status, ZfsItemErrors errors, List<String> bookmarks)
    {
        checkFailed(status);
        ItemClassifier classifier = (itemStatus, name) -> new ErrorRuleChain("Failed to destroy bookmark", name)
            .on(Errno.EINVAL, ZfsErrorKind.NAME_INVALID, name)
            .classify(itemStatus);
        return batch(status, errors, bookmarks, ZfsErrorKind.BOOKMARK_DESTRUCTION_FAILURE, classifier);
    }

    public ZfsErrorException snaprangeSpace(int status, String firstSnap, String lastSnap)
    {
        checkFailed(status);
        return new ErrorRuleChain("Failed to calculate space used by range of snapshots", lastSnap)
            .when(Errno.EINVAL, () -> !isValidSnapName(firstSnap), ZfsErrorKind.NAME_INVALID, firstSnap)
            .when(Errno.EINVAL, () -> !isValidSnapName(lastSnap), ZfsErrorKind.NAME_INVALID, lastSnap)
            .when(Errno.EINVAL, () -> isTooLong(firstSnap), ZfsErrorKind.NAME_TOO_LONG, firstSnap)
            .when(Errno.EINVAL, () -> isTooLong(lastSnap), ZfsErrorKind.NAME_TOO_LONG, lastSnap)
            .when(Errno.EINVAL, () -> !isSamePool(firstSnap, lastSnap), ZfsErrorKind.POOLS_DIFFER, lastSnap)
            .on(Errno.EINVAL, ZfsErrorKind.SNAPSHOT_MISMATCH, lastSnap)
            .on(Errno.ENOENT, ZfsErrorKind.SNAPSHOT_NOT_FOUND, lastSnap)
            .classify(status);
    }

    /**
     * Returns a {@link ZfsMultipleErrorsException} for failures of individual holds, or a plain
     * {@link ZfsErrorException} of kind {@link ZfsErrorKind#BAD_HOLD_CLEANUP_FD} if the cleanup
     * file descriptor was rejected
     *
     * @param holds Maps each snapshot to the tag of the hold to place on it
     */
    public ZfsErrorException hold(int status, ZfsItemErrors errors, Map<String, String> holds)
    {
        checkFailed(status);
        ZfsErrorException failure;
        if (status == Errno.EBADF)
        {
            failure = new ZfsErrorException(ZfsErrorKind.BAD_HOLD_CLEANUP_FD, status, null);
        }
        else
        {
            List<String> snaps = new ArrayList<>(holds.keySet());
            ItemClassifier classifier = (itemStatus, name) ->
            {
                ErrorRuleChain chain = new ErrorRuleChain("Failed to hold snapshot", name)
                    .on(Errno.EXDEV, ZfsErrorKind.POOLS_DIFFER, name);
                String tag;
                if (name != null)
                {
                    tag = holds.get(name);
                    addItemNameRules(chain, name);
                    if (tag != null)
                    {
                        chain.when(Errno.EINVAL, () -> isTooLong(tag), ZfsErrorKind.NAME_TOO_LONG, tag);
                    }
                    chain.when(Errno.EINVAL, () -> !allInPoolOf(snaps, name), ZfsErrorKind.POOLS_DIFFER, name);
                }
                else
                {
                    tag = firstMatch(holds.values(), ZfsNames::isTooLong);
                    addFirstInvalidSnapRule(chain, snaps);
                }
                return chain
                    .on(Errno.ENOENT, ZfsErrorKind.FILESYSTEM_NOT_FOUND, ZfsNames.fsNameOrNull(name))
                    .on(Errno.EEXIST, ZfsErrorKind.HOLD_EXISTS, name)
                    .on(Errno.E2BIG, ZfsErrorKind.NAME_TOO_LONG, tag)
                    .on(Errno.ENOTSUP, ZfsErrorKind.FEATURE_NOT_SUPPORTED, ZfsNames.poolNameOrNull(name))
                    .classify(itemStatus);
            };
            failure = batch(status, errors, snaps, ZfsErrorKind.HOLD_FAILURE, classifier);
        }
        return failure;
    }

    /**
     * @param holds Maps each snapshot to the tags of the holds to release
     */
    public ZfsMultipleErrorsException release(int status, ZfsItemErrors errors, Map<String, List<String>> holds)
    {
        checkFailed(status);
        List<String> snaps = new ArrayList<>(holds.keySet());
        ItemClassifier classifier = (itemStatus, name) ->
        {
            ErrorRuleChain chain = new ErrorRuleChain("Failed to release snapshot hold", name)
                .on(Errno.EXDEV, ZfsErrorKind.POOLS_DIFFER, name);
            List<String> tags;
            if (name != null)
            {
                List<String> snapTags = holds.get(name);
                tags = snapTags == null ? Collections.<String>emptyList() : snapTags;
                addItemNameRules(chain, name);
                chain.when(Errno.EINVAL, () -> !allInPoolOf(snaps, name), ZfsErrorKind.POOLS_DIFFER, name);
            }
            else
            {
                tags = new ArrayList<>();
                for (List<String> snapTags : holds.values())
                {
                    tags.addAll(snapTags);
                }
                addFirstInvalidSnapRule(chain, snaps);
            }
            String tooLongTag = firstMatch(tags, ZfsNames::isTooLong);
            return chain
                .on(Errno.ENOENT, ZfsErrorKind.HOLD_NOT_FOUND, name)
                .on(Errno.E2BIG, ZfsErrorKind.NAME_TOO_LONG, orElse(tooLongTag, name))
                .on(Errno.ENOTSUP, ZfsErrorKind.FEATURE_NOT_SUPPORTED, ZfsNames.poolNameOrNull(name))
                .classify(itemStatus);
        };
        return batch(status, errors, snaps, ZfsErrorKind.HOLD_RELEASE_FAILURE, classifier);
    }

    public ZfsErrorException getHolds(int status, String snapName)
    {
        checkFailed(status);
        return new ErrorRuleChain("Failed to get holds on snapshot", snapName)
            .when(Errno.EINVAL, () -> !isValidSnapName(snapName), ZfsErrorKind.NAME_INVALID, snapName)
            .when(Errno.EINVAL, () -> isTooLong(snapName), ZfsErrorKind.NAME_TOO_LONG, snapName)
            .on(Errno.ENOENT, ZfsErrorKind.SNAPSHOT_NOT_FOUND, snapName)
            .on(Errno.ENOTSUP, ZfsErrorKind.FEATURE_NOT_SUPPORTED, poolName(snapName))
            .classify(status);
    }

    /**
     * @param snapName The snapshot or file system to send
     * @param fromSnap The snapshot or bookmark an incremental stream is based on, or null for a
     *     full stream
     */
    public ZfsErrorException send(int status, String snapName, @Nullable String fromSnap)
    {
        checkFailed(status);
        ErrorRuleChain chain = new ErrorRuleChain("Failed to send", snapName);
        if (fromSnap != null)
        {
            boolean invalidFrom = !isValidSnapName(fromSnap) && !isValidBookmarkName(fromSnap);
            chain
                .when(Errno.EXDEV, () -> !isSamePool(fromSnap, snapName), ZfsErrorKind.POOLS_DIFFER, snapName)
                .on(Errno.EXDEV, ZfsErrorKind.SNAPSHOT_MISMATCH, snapName)
                .when(Errno.EINVAL, () -> invalidFrom, ZfsErrorKind.NAME_INVALID, fromSnap)
                .when(Errno.ENOENT, () -> invalidFrom, ZfsErrorKind.NAME_INVALID, fromSnap);
        }
        chain.when(
            Errno.EINVAL,
            () -> !isValidSnapName(snapName) && !isValidFsName(snapName),
            ZfsErrorKind.NAME_INVALID,
            snapName
        );
        addSendLengthRules(chain, snapName, fromSnap);
        return chain
            .on(Errno.ENOENT, ZfsErrorKind.SNAPSHOT_NOT_FOUND, snapName)
            .when(
                Errno.ENAMETOOLONG,
                () -> fromSnap != null && isTooLong(fromSnap),
                ZfsErrorKind.NAME_TOO_LONG,
                fromSnap
            )
            .on(Errno.ENAMETOOLONG, ZfsErrorKind.NAME_TOO_LONG, snapName)
            .classify(status);
    }

    public ZfsErrorException sendSpace(int status, String snapName, @Nullable String fromSnap)
    {
        checkFailed(status);
        ErrorRuleChain chain = new ErrorRuleChain("Failed to estimate backup stream size", snapName);
        if (fromSnap != null)
        {
            chain
                .when(Errno.EXDEV, () -> !isSamePool(fromSnap, snapName), ZfsErrorKind.POOLS_DIFFER, snapName)
                .on(Errno.EXDEV, ZfsErrorKind.SNAPSHOT_MISMATCH, snapName)
                .when(Errno.EINVAL, () -> !isValidSnapName(fromSnap), ZfsErrorKind.NAME_INVALID, fromSnap)
                .when(Errno.ENOENT, () -> !isValidSnapName(fromSnap), ZfsErrorKind.NAME_INVALID, fromSnap);
        }
        chain.when(Errno.EINVAL, () -> !isValidSnapName(snapName), ZfsErrorKind.NAME_INVALID, snapName);
        addSendLengthRules(chain, snapName, fromSnap);
        return chain
            .on(Errno.ENOENT, ZfsErrorKind.SNAPSHOT_NOT_FOUND, snapName)
            .classify(status);
    }

    /**
     * @param snapName The snapshot to create from the received stream
     * @param origin The clone origin for a received clone stream, or null
     */
    public ZfsErrorException receive(int status, String snapName, @Nullable String origin)
    {
        checkFailed(status);
        String fs = fsName(snapName);
        String pool = poolName(snapName);
        return new ErrorRuleChain("Failed to receive", snapName)
            .when(Errno.EINVAL, () -> !isValidSnapName(snapName), ZfsErrorKind.NAME_INVALID, snapName)
            .when(Errno.EINVAL, () -> isTooLong(snapName), ZfsErrorKind.NAME_TOO_LONG, snapName)
            .when(
                Errno.EINVAL,
                () -> origin != null && !isValidSnapName(origin),
                ZfsErrorKind.NAME_INVALID,
                origin
            )
            .on(Errno.EINVAL, ZfsErrorKind.BAD_STREAM, null)
            .when(Errno.ENOENT, () -> !isValidSnapName(snapName), ZfsErrorKind.NAME_INVALID, snapName)
            .on(Errno.ENOENT, ZfsErrorKind.DATASET_NOT_FOUND, snapName)
            .on(Errno.EEXIST, ZfsErrorKind.DATASET_EXISTS, snapName)
            .on(Errno.ENOTSUP, ZfsErrorKind.STREAM_FEATURE_NOT_SUPPORTED, null)
            .on(Errno.ENODEV, ZfsErrorKind.STREAM_MISMATCH, fs)
            .on(Errno.ETXTBSY, ZfsErrorKind.DESTINATION_MODIFIED, fs)
            .on(Errno.EBUSY, ZfsErrorKind.DATASET_BUSY, fs)
            .on(Errno.ENOSPC, ZfsErrorKind.NO_SPACE, fs)
            .on(Errno.EDQUOT, ZfsErrorKind.QUOTA_EXCEEDED, fs)
            .on(Errno.ENAMETOOLONG, ZfsErrorKind.NAME_TOO_LONG, snapName)
            .on(Errno.EROFS, ZfsErrorKind.READ_ONLY_POOL, pool)
            .on(Errno.EAGAIN, ZfsErrorKind.SUSPENDED_POOL, pool)
            .classify(status);
    }

    private static void addSendLengthRules(ErrorRuleChain chain, String snapName, @Nullable String fromSnap)
    {
        chain
            .when(
                Errno.EINVAL,
                () -> fromSnap != null && isTooLong(fromSnap),
                ZfsErrorKind.NAME_TOO_LONG,
                fromSnap
            )
            .when(Errno.EINVAL, () -> isTooLong(snapName), ZfsErrorKind.NAME_TOO_LONG, snapName)
            .when(
                Errno.EINVAL,
                () -> fromSnap != null && !isSamePool(fromSnap, snapName),
                ZfsErrorKind.POOLS_DIFFER,
                snapName
            );
    }

    /**
     * EINVAL rules of hold and release for a failure attributed to a single snapshot
     */
    private static void addItemNameRules(ErrorRuleChain chain, String name)
    {
        chain
            .when(Errno.EINVAL, () -> !isValidSnapName(name), ZfsErrorKind.NAME_INVALID, name)
            .when(Errno.EINVAL, () -> isTooLong(name), ZfsErrorKind.NAME_TOO_LONG, name);
    }

    /**
     * EINVAL rule of hold and release for a failure that is not attributed to a snapshot
     */
    private static void addFirstInvalidSnapRule(ErrorRuleChain chain, List<String> snaps)
    {
        String invalidSnap = firstMatch(snaps, snap -> !isValidSnapName(snap));
        chain.when(Errno.EINVAL, () -> invalidSnap != null, ZfsErrorKind.NAME_INVALID, invalidSnap);
    }

    /**
     * Classifies the failure of a batch operation
     *
     * If libzfs_core did not report any item failures, the overall status is classified; the
     * failure is attributed to the only requested item if there was exactly one.
     */
    private static ZfsMultipleErrorsException batch(
        int status,
        ZfsItemErrors errors,
        List<String> names,
        ZfsErrorKind batchKind,
        ItemClassifier classifier
    )
    {
        List<ZfsErrorException> failures = new ArrayList<>();
        if (errors.isEmpty())
        {
            String name = names.size() == 1 ? names.get(0) : null;
            failures.add(classifier.classify(status, name));
        }
        else
        {
            for (Map.Entry<String, Integer> item : errors.getItemErrors().entrySet())
            {
                failures.add(classifier.classify(item.getValue(), item.getKey()));
            }
        }
        return new ZfsMultipleErrorsException(batchKind, failures, errors.getSuppressedCount());
    }

    private static void checkFailed(int status)
    {
        if (status == 0)
        {
            throw new ImplementationError("Status code 0 indicates success and cannot be classified");
        }
    }

    private static boolean isSamePool(String name, String otherName)
    {
        return poolName(name).equals(poolName(otherName));
    }

    private static boolean allInPoolOf(List<String> names, String name)
    {
        String pool = poolName(name);
        boolean samePool = true;
        for (String other : names)
        {
            if (!pool.equals(poolName(other)))
            {
                samePool = false;
                break;
            }
        }
        return samePool;
    }

    private static @Nullable String firstMatch(Iterable<String> names, Predicate<String> predicate)
    {
        String match = null;
        for (String name : names)
        {
            if (predicate.test(name))
            {
                match = name;
                break;
            }
        }
        return match;
    }

    private static @Nullable String orElse(@Nullable String name, @Nullable String fallback)
    {
        return name == null ? fallback : name;
    }
}
