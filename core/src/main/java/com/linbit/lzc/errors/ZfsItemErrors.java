package com.linbit.lzc.errors;

import com.linbit.lzc.nvlist.NvMap;
import com.linbit.lzc.nvlist.NvNumber;
import com.linbit.lzc.nvlist.NvValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-item status codes reported by a libzfs_core batch operation
 *
 * libzfs_core reports the status of each failed item under the item's name. If there were more
 * failures than it reports, the number of unreported failures is stored under
 * {@value #MORE_ERRORS_KEY}.
 */
public final class ZfsItemErrors
{
    public static final String MORE_ERRORS_KEY = "N_MORE_ERRORS";

    private static final ZfsItemErrors EMPTY = new ZfsItemErrors(Collections.<String, Integer>emptyMap(), 0);

    private final Map<String, Integer> itemErrors;
    private final int suppressedCount;

    public ZfsItemErrors(Map<String, Integer> itemErrorsRef, int suppressedCountRef)
    {
        itemErrors = Collections.unmodifiableMap(new LinkedHashMap<>(itemErrorsRef));
        suppressedCount = suppressedCountRef;
    }

    public static ZfsItemErrors empty()
    {
        return EMPTY;
    }

    /**
     * Parses the error list returned by libzfs_core
     *
     * @throws IllegalArgumentException if an entry is not an integer status code
     */
    public static ZfsItemErrors fromNvMap(NvMap errList)
    {
        Map<String, Integer> items = new LinkedHashMap<>();
        int suppressed = 0;
        for (Map.Entry<String, NvValue> entry : errList)
        {
            String key = entry.getKey();
            NvValue value = entry.getValue();
            if (!(value instanceof NvNumber))
            {
                throw new IllegalArgumentException(
                    String.format("Error list entry '%s' is not a status code: %s", key, value)
                );
            }
            int status = (int) ((NvNumber) value).longValue();
            if (MORE_ERRORS_KEY.equals(key))
            {
                suppressed = status;
            }
            else
            {
                items.put(key, status);
            }
        }
        return new ZfsItemErrors(items, suppressed);
    }

    public boolean isEmpty()
    {
        return itemErrors.isEmpty();
    }

    /**
     * Returns the status code of each failed item, in the order reported by libzfs_core
     */
    public Map<String, Integer> getItemErrors()
    {
        return itemErrors;
    }

    public int getSuppressedCount()
    {
        return suppressedCount;
    }

    @Override
    public String toString()
    {
        return "ZfsItemErrors{" + itemErrors + ", suppressed=" + suppressedCount + "}";
    }
}
