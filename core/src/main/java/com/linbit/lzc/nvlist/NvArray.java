package com.linbit.lzc.nvlist;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of values
 *
 * The elements of an array are not checked when the array is created. libnvpair only supports
 * homogeneous arrays, which is verified when the array is encoded.
 */
public final class NvArray extends NvValue
{
    private final List<NvValue> elements;
    private final @Nullable NvDataType declaredElementType;

    NvArray(List<? extends NvValue> elementsRef, @Nullable NvDataType declaredElementTypeRef)
    {
        List<NvValue> copy = new ArrayList<>(elementsRef.size());
        for (NvValue element : elementsRef)
        {
            copy.add(Objects.requireNonNull(element, "Array elements must not be null"));
        }
        if (copy.isEmpty())
        {
            if (declaredElementTypeRef == null)
            {
                throw new IllegalArgumentException("Empty arrays require an element type");
            }
            if (declaredElementTypeRef.getArrayType() == null)
            {
                throw new IllegalArgumentException("libnvpair has no array type for " + declaredElementTypeRef);
            }
        }
        elements = Collections.unmodifiableList(copy);
        declaredElementType = declaredElementTypeRef;
    }

    public List<NvValue> getElements()
    {
        return elements;
    }

    public int size()
    {
        return elements.size();
    }

    public boolean isEmpty()
    {
        return elements.isEmpty();
    }

    public NvValue get(int idx)
    {
        return elements.get(idx);
    }

    /**
     * Returns the element type given when the array was created, which is only mandatory for
     * empty arrays
     */
    public @Nullable NvDataType getDeclaredElementType()
    {
        return declaredElementType;
    }

    @Override
    public Kind getKind()
    {
        return Kind.ARRAY;
    }

    /**
     * Returns the array tag derived from the declared element type or the first element, or null
     * if the first element has no array counterpart in libnvpair
     */
    @Override
    public @Nullable NvDataType getType()
    {
        NvDataType elemType = elements.isEmpty() ? declaredElementType : elements.get(0).getType();
        return elemType == null ? null : elemType.getArrayType();
    }

    @Override
    public int hashCode()
    {
        return elements.hashCode();
    }

    @Override
    public boolean equals(Object obj)
    {
        boolean eq = this == obj;
        if (!eq && obj instanceof NvArray)
        {
            NvArray other = (NvArray) obj;
            eq = elements.equals(other.elements);
            if (eq && elements.isEmpty())
            {
                eq = declaredElementType == other.declaredElementType;
            }
        }
        return eq;
    }

    @Override
    public String toString()
    {
        return elements.toString();
    }
}
