package com.linbit.lzc.nvlist;

import com.linbit.lzc.LzcException;
import com.linbit.lzc.logging.ErrorReporter;

import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts {@link NvMap}s to libnvpair nvlists and back
 *
 * Every nvlist allocated by the codec is owned by exactly one handle and is freed exactly once,
 * including the paths where a conversion fails part way through. The codec holds no mutable
 * state and can be shared.
 */
@Singleton
public class NvListCodec
{
    /**
     * Integer properties that libzfs_core expects with a width other than uint64. Host integers
     * stored under these keys are written with the listed width.
     */
    private static final Map<String, NvDataType> KEY_WIDTHS;

    static
    {
        Map<String, NvDataType> widths = new HashMap<>();
        widths.put("rewind-request", NvDataType.UINT32);
        widths.put("type", NvDataType.UINT32);
        widths.put("N_MORE_ERRORS", NvDataType.INT32);
        widths.put("pool_context", NvDataType.INT32);
        KEY_WIDTHS = Collections.unmodifiableMap(widths);
    }

    private final NvPairLibrary nvPairLib;
    private final ErrorReporter errorReporter;
    private final NvTypeRegistry registry;

    @Inject
    public NvListCodec(NvPairLibrary nvPairLibRef, ErrorReporter errorReporterRef)
    {
        nvPairLib = nvPairLibRef;
        errorReporter = errorReporterRef;
        registry = new NvTypeRegistry(nvPairLibRef);
    }

    /**
     * Returns the type that a host integer stored under the given key is written as
     */
    public static NvDataType hostIntegerType(String key)
    {
        NvDataType type = KEY_WIDTHS.get(key);
        return type == null ? NvDataType.UINT64 : type;
    }

    /**
     * Creates a new nvlist containing the entries of the given map
     *
     * The returned handle must be closed by the caller.
     *
     * @throws NvListException if the map cannot be represented as an nvlist or libnvpair fails to
     *     allocate or populate the nvlist; no nvlist remains allocated in this case
     */
    public NvListHandle encode(NvMap map) throws NvListException
    {
        NvListHandle handle = NvListHandle.allocate(nvPairLib);
        boolean populated = false;
        try
        {
            populate(handle.getAddress(), map);
            populated = true;
        }
        finally
        {
            if (!populated)
            {
                handle.close();
            }
        }
        errorReporter.logTrace("Encoded nvlist with %d entries", map.size());
        return handle;
    }

    public NvMap decode(NvListHandle handle) throws NvListException
    {
        NvMap map = new NvMap();
        decodeAddress(handle.getAddress(), map);
        return map;
    }

    /**
     * Replaces the content of {@code dst} with the entries of the nvlist
     */
    public void decodeInto(NvListHandle handle, NvMap dst) throws NvListException
    {
        decodeAddress(handle.getAddress(), dst);
    }

    /**
     * Invokes a library call that returns an nvlist through an output slot
     *
     * If the call returns normally, the content of {@code dst} is replaced with the entries of the
     * returned nvlist, regardless of the returned status code. If the call does not store an
     * nvlist into the slot, {@code dst} is left empty. The returned nvlist is freed in any case.
     *
     * @return The status code returned by the call
     */
    public int invokeWithOutput(NvMap dst, NvOutputCall call) throws LzcException
    {
        NvListSlot slot = new NvListSlot();
        int status;
        try
        {
            status = call.invoke(slot);
            dst.clear();
            if (slot.isSet())
            {
                decodeAddress(slot.getAddress(), dst);
            }
        }
        finally
        {
            if (slot.isSet())
            {
                nvPairLib.nvlistFree(slot.getAddress());
                slot.setAddress(NvListSlot.NULL_ADDRESS);
            }
        }
        return status;
    }

    private void populate(long nvl, NvMap map) throws NvListException
    {
        for (Map.Entry<String, NvValue> entry : map)
        {
            addEntry(nvl, entry.getKey(), entry.getValue());
        }
    }

    private void addEntry(long nvl, String key, NvValue value) throws NvListException
    {
        int status;
        switch (value.getKind())
        {
            case PRESENCE:
                status = nvPairLib.nvlistAddBoolean(nvl, key);
                break;
            case BOOLEAN:
            case NUMBER:
            case STRING:
                {
                    NvDataType type = scalarType(key, value);
                    checkRange(key, type, value, -1);
                    status = requireAdder(key, type).add(nvl, key, value);
                }
                break;
            case NESTED:
                try (NvListHandle nested = encode(((NvNested) value).mapValue()))
                {
                    status = nvPairLib.nvlistAddNvlist(nvl, key, nested.getAddress());
                }
                break;
            case ARRAY:
                status = addArray(nvl, key, (NvArray) value);
                break;
            default:
                throw new NvListException(
                    NvListException.Reason.UNSUPPORTED_TYPE,
                    key,
                    "Unsupported value type " + value.getKind()
                );
        }
        if (status != 0)
        {
            throw new NvListException(
                NvListException.Reason.ADD_FAILED,
                key,
                String.format("nvlist_add failed with status %d", status)
            );
        }
    }

    private int addArray(long nvl, String key, NvArray array) throws NvListException
    {
        NvDataType elementType = checkArray(key, array);
        int status;
        if (elementType == NvDataType.NVLIST)
        {
            try (NvListHandleGroup group = NvListHandleGroup.allocate(nvPairLib, array.size()))
            {
                for (int idx = 0; idx < group.size(); ++idx)
                {
                    populate(group.getAddress(idx), ((NvNested) array.get(idx)).mapValue());
                }
                status = nvPairLib.nvlistAddNvlistArray(nvl, key, group.getAddresses());
            }
        }
        else
        {
            for (int idx = 0; idx < array.size(); ++idx)
            {
                checkRange(key, elementType, array.get(idx), idx);
            }
            NvDataType arrayType = elementType.getArrayType();
            if (arrayType == null)
            {
                throw new NvListException(
                    NvListException.Reason.UNSUPPORTED_TYPE,
                    key,
                    "libnvpair has no array type for elements of type " + elementType
                );
            }
            status = requireAdder(key, arrayType).add(nvl, key, array);
        }
        return status;
    }

    /**
     * Verifies that all elements of the array are of the same variant and, for numbers, of the
     * same width
     *
     * @return The type of the elements as written to the nvlist
     */
    private NvDataType checkArray(String key, NvArray array) throws NvListException
    {
        NvDataType elementType;
        if (array.isEmpty())
        {
            NvDataType declaredType = array.getDeclaredElementType();
            if (declaredType == null)
            {
                throw new NvListException(
                    NvListException.Reason.UNSUPPORTED_TYPE,
                    key,
                    "Empty array without element type"
                );
            }
            elementType = declaredType;
        }
        else
        {
            List<NvValue> elements = array.getElements();
            NvValue specimen = elements.get(0);
            for (int idx = 1; idx < elements.size(); ++idx)
            {
                NvValue elem = elements.get(idx);
                if (!isSameVariant(specimen, elem))
                {
                    throw new NvListException(
                        NvListException.Reason.TYPE_MISMATCH,
                        key,
                        String.format(
                            "Array has elements of different types: %s and %s at index %d",
                            describe(specimen),
                            describe(elem),
                            idx
                        )
                    );
                }
            }
            if (specimen.getKind() == NvValue.Kind.PRESENCE || specimen.getKind() == NvValue.Kind.ARRAY)
            {
                throw new NvListException(
                    NvListException.Reason.UNSUPPORTED_TYPE,
                    key,
                    "Unsupported array element type " + describe(specimen)
                );
            }
            elementType = scalarType(key, specimen);
        }
        return elementType;
    }

    private static boolean isSameVariant(NvValue specimen, NvValue elem)
    {
        boolean same = specimen.getKind() == elem.getKind();
        if (same && specimen.getKind() == NvValue.Kind.NUMBER)
        {
            NvNumber specimenNr = (NvNumber) specimen;
            NvNumber elemNr = (NvNumber) elem;
            same = specimenNr.getType() == elemNr.getType() &&
                specimenNr.isWidthDeclared() == elemNr.isWidthDeclared();
        }
        return same;
    }

    private static String describe(NvValue value)
    {
        String text;
        if (value.getKind() == NvValue.Kind.NUMBER && !((NvNumber) value).isWidthDeclared())
        {
            text = "integer";
        }
        else
        {
            NvDataType type = value.getType();
            text = type == null ? value.getKind().name() : type.name();
        }
        return text;
    }

    /**
     * Returns the type a scalar value is written as, taking the key specific width of host
     * integers into account
     */
    private static NvDataType scalarType(String key, NvValue value)
    {
        NvDataType type;
        if (value.getKind() == NvValue.Kind.NUMBER && !((NvNumber) value).isWidthDeclared())
        {
            type = hostIntegerType(key);
        }
        else
        {
            type = value.getType();
            if (type == null)
            {
                throw new IllegalStateException("Value without type: " + value);
            }
        }
        return type;
    }

    private static void checkRange(String key, NvDataType type, NvValue value, int idx)
        throws NvListException
    {
        if (value.getKind() == NvValue.Kind.NUMBER)
        {
            long nr = ((NvNumber) value).longValue();
            if (!NvNumber.isInRange(type, nr))
            {
                throw new NvListException(
                    NvListException.Reason.INVALID_VALUE,
                    key,
                    idx < 0 ?
                        String.format("Value %d is out of range for type %s", nr, type) :
                        String.format("Value %d at index %d is out of range for type %s", nr, idx, type)
                );
            }
        }
    }

    private NvTypeRegistry.Adder requireAdder(String key, NvDataType type) throws NvListException
    {
        NvTypeRegistry.Adder adder = registry.getAdder(type);
        if (adder == null)
        {
            throw new NvListException(
                NvListException.Reason.UNSUPPORTED_TYPE,
                key,
                "Unsupported value type " + type
            );
        }
        return adder;
    }

    private NvMap decodeNested(long nvl) throws NvListException
    {
        NvMap map = new NvMap();
        decodeAddress(nvl, map);
        return map;
    }

    private void decodeAddress(long nvl, NvMap dst) throws NvListException
    {
        dst.clear();
        long nvp = nvPairLib.nvlistNextNvpair(nvl, NvListSlot.NULL_ADDRESS);
        while (nvp != NvListSlot.NULL_ADDRESS)
        {
            String name = nvPairLib.nvpairName(nvp);
            int typeId = nvPairLib.nvpairType(nvp);
            NvDataType type = NvDataType.fromWireId(typeId);
            NvValue value;
            if (type == NvDataType.BOOLEAN)
            {
                value = NvValue.presence();
            }
            else
            {
                value = readValue(name, typeId, type, nvp);
            }
            dst.put(name, value);
            nvp = nvPairLib.nvlistNextNvpair(nvl, nvp);
        }
        errorReporter.logTrace("Decoded nvlist with %d entries", dst.size());
    }

    private NvValue readValue(String name, int typeId, @Nullable NvDataType type, long nvp)
        throws NvListException
    {
        NvTypeRegistry.Reader reader = type == null ? null : registry.getReader(type);
        if (reader == null)
        {
            throw new NvListException(
                NvListException.Reason.DECODE_FAILED,
                name,
                String.format("Unsupported nvpair type %d", typeId)
            );
        }
        ValueRef<NvValue> ref = new ValueRef<>();
        int status = reader.read(nvp, this::decodeNested, ref);
        NvValue value = ref.get();
        if (status != 0 || value == null)
        {
            throw new NvListException(
                NvListException.Reason.DECODE_FAILED,
                name,
                String.format("%s failed with status %d", type.getValueFunctionName(), status)
            );
        }
        return value;
    }
}
