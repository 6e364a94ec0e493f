package com.linbit.lzc;

import javax.annotation.Nullable;

/**
 * Validity checks and decomposition of ZFS dataset, snapshot and bookmark names
 *
 * A file system name consists of one or more '/'-separated components, a snapshot name is
 * {@code filesystem@component}, a bookmark name is {@code filesystem#component}. Components
 * must not be empty and may only contain letters, digits and the characters "-_.: "
 * (including the space character).
 */
public final class ZfsNames
{
    public static final int MAX_NAME_LENGTH = 255;

    public static final char PATH_SEPARATOR = '/';
    public static final char SNAPSHOT_SEPARATOR = '@';
    public static final char BOOKMARK_SEPARATOR = '#';

    private static final byte[] VALID_COMPONENT_CHARS = {'-', '_', '.', ':', ' '};

    private ZfsNames()
    {
    }

    /**
     * Checks a single name component, e.g. one path element of a file system name or the part
     * of a snapshot name following the '@'
     *
     * @param component The component to check
     * @return true if the component is not empty and contains only valid characters
     */
    public static boolean isValidNameComponent(String component)
    {
        boolean valid = !component.isEmpty();
        for (int idx = 0; valid && idx < component.length(); ++idx)
        {
            char letter = component.charAt(idx);
            if (!((letter >= 'a' && letter <= 'z') ||
                (letter >= 'A' && letter <= 'Z') ||
                (letter >= '0' && letter <= '9')))
            {
                int vIdx = 0;
                while (vIdx < VALID_COMPONENT_CHARS.length && letter != VALID_COMPONENT_CHARS[vIdx])
                {
                    ++vIdx;
                }
                valid = vIdx < VALID_COMPONENT_CHARS.length;
            }
        }
        return valid;
    }

    public static boolean isValidFsName(String name)
    {
        boolean valid = !name.isEmpty();
        if (valid)
        {
            // limit -1 keeps trailing empty components, "pool/" must not pass
            for (String component : name.split("/", -1))
            {
                if (!isValidNameComponent(component))
                {
                    valid = false;
                    break;
                }
            }
        }
        return valid;
    }

    public static boolean isValidSnapName(String name)
    {
        return isValidSuffixedName(name, SNAPSHOT_SEPARATOR);
    }

    public static boolean isValidBookmarkName(String name)
    {
        return isValidSuffixedName(name, BOOKMARK_SEPARATOR);
    }

    private static boolean isValidSuffixedName(String name, char separator)
    {
        boolean valid = false;
        int sepIdx = name.indexOf(separator);
        if (sepIdx >= 0 && name.indexOf(separator, sepIdx + 1) < 0)
        {
            valid = isValidFsName(name.substring(0, sepIdx)) &&
                isValidNameComponent(name.substring(sepIdx + 1));
        }
        return valid;
    }

    public static boolean isTooLong(String name)
    {
        return name.length() > MAX_NAME_LENGTH;
    }

    /**
     * Returns the pool part of a dataset, snapshot or bookmark name, which is everything up to
     * the first '/', '@' or '#'
     */
    public static String poolName(String name)
    {
        int endIdx = name.length();
        for (int idx = 0; idx < name.length(); ++idx)
        {
            char letter = name.charAt(idx);
            if (letter == PATH_SEPARATOR || letter == SNAPSHOT_SEPARATOR || letter == BOOKMARK_SEPARATOR)
            {
                endIdx = idx;
                break;
            }
        }
        return name.substring(0, endIdx);
    }

    /**
     * Returns the file system part of a snapshot or bookmark name, which is everything up to
     * the first '@' or '#'
     */
    public static String fsName(String name)
    {
        int endIdx = name.length();
        for (int idx = 0; idx < name.length(); ++idx)
        {
            char letter = name.charAt(idx);
            if (letter == SNAPSHOT_SEPARATOR || letter == BOOKMARK_SEPARATOR)
            {
                endIdx = idx;
                break;
            }
        }
        return name.substring(0, endIdx);
    }

    /**
     * Null-tolerant variant of {@link #poolName(String)}
     */
    public static @Nullable String poolNameOrNull(@Nullable String name)
    {
        return name == null ? null : poolName(name);
    }

    /**
     * Null-tolerant variant of {@link #fsName(String)}
     */
    public static @Nullable String fsNameOrNull(@Nullable String name)
    {
        return name == null ? null : fsName(name);
    }

    /**
     * Checks whether all of the given names belong to the same pool
     */
    public static boolean isSamePool(Iterable<String> names)
    {
        boolean samePool = true;
        String firstPool = null;
        for (String name : names)
        {
            String pool = poolName(name);
            if (firstPool == null)
            {
                firstPool = pool;
            }
            else
            if (!firstPool.equals(pool))
            {
                samePool = false;
                break;
            }
        }
        return samePool;
    }
}
