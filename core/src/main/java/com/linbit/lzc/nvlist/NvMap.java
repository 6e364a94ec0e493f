package com.linbit.lzc.nvlist;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered property map that is converted to and from a libnvpair nvlist
 *
 * Keys are unique and the insertion order is preserved, which is also the order in which the
 * entries are written into an nvlist. Two maps are equal if they contain the same keys mapped to
 * equal values, regardless of the order. Host integers are compared with the width they are
 * written as under their key, so a map equals the result of decoding its encoded nvlist.
 */
public final class NvMap implements Iterable<Map.Entry<String, NvValue>>
{
    private final Map<String, NvValue> entries = new LinkedHashMap<>();

    public NvMap()
    {
    }

    public NvMap(NvMap other)
    {
        entries.putAll(other.entries);
    }

    /**
     * Creates a map of presence-only entries, one for each name, as used by libzfs_core for
     * lists of snapshots or bookmarks
     */
    public static NvMap presenceOf(Iterable<String> names)
    {
        NvMap map = new NvMap();
        for (String name : names)
        {
            map.putPresence(name);
        }
        return map;
    }

    public NvMap put(String key, NvValue value)
    {
        entries.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
        return this;
    }

    public NvMap putPresence(String key)
    {
        return put(key, NvValue.presence());
    }

    public NvMap putBoolean(String key, boolean value)
    {
        return put(key, NvValue.of(value));
    }

    public NvMap putString(String key, String value)
    {
        return put(key, NvValue.of(value));
    }

    /**
     * Stores a host integer, see {@link NvValue#integer(long)}
     */
    public NvMap putInteger(String key, long value)
    {
        return put(key, NvValue.integer(value));
    }

    public NvMap putMap(String key, NvMap value)
    {
        return put(key, NvValue.of(value));
    }

    public @Nullable NvValue get(String key)
    {
        return entries.get(key);
    }

    public boolean containsKey(String key)
    {
        return entries.containsKey(key);
    }

    public @Nullable NvValue remove(String key)
    {
        return entries.remove(key);
    }

    public void clear()
    {
        entries.clear();
    }

    public int size()
    {
        return entries.size();
    }

    public boolean isEmpty()
    {
        return entries.isEmpty();
    }

    public Set<String> keySet()
    {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Set<Map.Entry<String, NvValue>> entrySet()
    {
        return Collections.unmodifiableMap(entries).entrySet();
    }

    @Override
    public Iterator<Map.Entry<String, NvValue>> iterator()
    {
        return entrySet().iterator();
    }

    /**
     * Returns the number stored under the key, or null if there is no entry for the key or the
     * entry is not a number
     */
    public @Nullable NvNumber getNumber(String key)
    {
        NvValue value = entries.get(key);
        return value instanceof NvNumber ? (NvNumber) value : null;
    }

    public @Nullable String getString(String key)
    {
        NvValue value = entries.get(key);
        return value instanceof NvString ? ((NvString) value).stringValue() : null;
    }

    public @Nullable NvMap getMap(String key)
    {
        NvValue value = entries.get(key);
        return value instanceof NvNested ? ((NvNested) value).mapValue() : null;
    }

    @Override
    public int hashCode()
    {
        int hash = 0;
        for (Map.Entry<String, NvValue> entry : entries.entrySet())
        {
            String key = entry.getKey();
            hash += key.hashCode() ^ asWritten(key, entry.getValue()).hashCode();
        }
        return hash;
    }

    @Override
    public boolean equals(Object obj)
    {
        boolean eq = this == obj;
        if (!eq && obj instanceof NvMap)
        {
            Map<String, NvValue> otherEntries = ((NvMap) obj).entries;
            eq = entries.size() == otherEntries.size();
            Iterator<Map.Entry<String, NvValue>> entryIter = entries.entrySet().iterator();
            while (eq && entryIter.hasNext())
            {
                Map.Entry<String, NvValue> entry = entryIter.next();
                String key = entry.getKey();
                NvValue otherValue = otherEntries.get(key);
                eq = otherValue != null &&
                    asWritten(key, entry.getValue()).equals(asWritten(key, otherValue));
            }
        }
        return eq;
    }

    /**
     * Returns the value with host integers replaced by numbers of the width they are encoded with
     * under the given key
     */
    private static NvValue asWritten(String key, NvValue value)
    {
        NvValue result = value;
        if (value instanceof NvNumber)
        {
            NvNumber nr = (NvNumber) value;
            if (!nr.isWidthDeclared())
            {
                NvDataType type = NvListCodec.hostIntegerType(key);
                if (type != nr.getType() && NvNumber.isInRange(type, nr.longValue()))
                {
                    result = NvValue.number(type, nr.longValue());
                }
            }
        }
        else
        if (value instanceof NvArray)
        {
            NvArray arr = (NvArray) value;
            if (!arr.isEmpty())
            {
                List<NvValue> written = new ArrayList<>(arr.size());
                for (NvValue elem : arr.getElements())
                {
                    written.add(asWritten(key, elem));
                }
                result = new NvArray(written, arr.getDeclaredElementType());
            }
        }
        return result;
    }

    @Override
    public String toString()
    {
        return entries.toString();
    }
}
