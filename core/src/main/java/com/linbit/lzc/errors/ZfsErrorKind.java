package com.linbit.lzc.errors;

/**
 * Classification of libzfs_core failures
 */
public enum ZfsErrorKind
{
    NAME_INVALID("Invalid name"),
    NAME_TOO_LONG("Name is too long"),
    PROPERTY_INVALID("Invalid property or property value"),
    POOLS_DIFFER("Operation is not supported across pools"),
    FILESYSTEM_EXISTS("File system already exists"),
    SNAPSHOT_EXISTS("Snapshot already exists"),
    HOLD_EXISTS("User hold already exists"),
    BOOKMARK_EXISTS("Bookmark already exists"),
    DATASET_EXISTS("Dataset already exists"),
    FILESYSTEM_NOT_FOUND("File system not found"),
    DATASET_NOT_FOUND("Dataset not found"),
    SNAPSHOT_NOT_FOUND("Snapshot not found"),
    POOL_NOT_FOUND("Pool not found"),
    PARENT_NOT_FOUND("Parent not found"),
    HOLD_NOT_FOUND("User hold not found"),
    DUPLICATE_SNAPSHOTS("Requested multiple snapshots of the same file system"),
    SNAPSHOT_IS_CLONED("Snapshot is cloned"),
    SNAPSHOT_IS_HELD("Snapshot is held"),
    DATASET_BUSY("Dataset is busy"),
    SNAPSHOT_MISMATCH("Snapshot is not descendant of source snapshot"),
    BOOKMARK_MISMATCH("Bookmark is not in snapshot's file system"),
    FEATURE_NOT_SUPPORTED("Feature is not supported in this version"),
    BOOKMARK_NOT_SUPPORTED("Bookmark feature is not supported"),
    BAD_HOLD_CLEANUP_FD("Bad file descriptor as cleanup file descriptor"),
    QUOTA_EXCEEDED("Quota exceeded"),
    NO_SPACE("No space left"),
    READ_ONLY_POOL("Pool is read-only"),
    SUSPENDED_POOL("Pool is suspended"),
    STREAM_MISMATCH("Stream is not applicable to destination dataset"),
    STREAM_FEATURE_NOT_SUPPORTED("Stream contains unsupported feature"),
    BAD_STREAM("Bad backup stream"),
    DESTINATION_MODIFIED("Destination dataset has modifications that can not be undone"),
    GENERIC("Operation failed"),

    SNAPSHOT_FAILURE("Creation of snapshot(s) failed for one or more reasons", true),
    SNAPSHOT_DESTRUCTION_FAILURE("Destruction of snapshot(s) failed for one or more reasons", true),
    HOLD_FAILURE("Placement of hold(s) failed for one or more reasons", true),
    HOLD_RELEASE_FAILURE("Release of hold(s) failed for one or more reasons", true),
    BOOKMARK_FAILURE("Creation of bookmark(s) failed for one or more reasons", true),
    BOOKMARK_DESTRUCTION_FAILURE("Destruction of bookmark(s) failed for one or more reasons", true);

    private final String description;
    private final boolean batch;

    ZfsErrorKind(String descriptionRef)
    {
        this(descriptionRef, false);
    }

    ZfsErrorKind(String descriptionRef, boolean batchRef)
    {
        description = descriptionRef;
        batch = batchRef;
    }

    public String getDescription()
    {
        return description;
    }

    /**
     * Indicates whether this kind aggregates the failures of the items of a batch operation
     */
    public boolean isBatch()
    {
        return batch;
    }
}
