package com.linbit.lzc.nvlist;

import javax.annotation.Nullable;

/**
 * The libnvpair {@code data_type_t} tags
 *
 * The numeric ids and the accessor suffixes ({@code nvlist_add_<suffix>},
 * {@code nvpair_value_<suffix>}) are defined by libnvpair and must not be changed.
 */
public enum NvDataType
{
    UNKNOWN(0, null),
    BOOLEAN(1, null),
    BYTE(2, "byte"),
    INT16(3, "int16"),
    UINT16(4, "uint16"),
    INT32(5, "int32"),
    UINT32(6, "uint32"),
    INT64(7, "int64"),
    UINT64(8, "uint64"),
    STRING(9, "string"),
    BYTE_ARRAY(10, "byte_array"),
    INT16_ARRAY(11, "int16_array"),
    UINT16_ARRAY(12, "uint16_array"),
    INT32_ARRAY(13, "int32_array"),
    UINT32_ARRAY(14, "uint32_array"),
    INT64_ARRAY(15, "int64_array"),
    UINT64_ARRAY(16, "uint64_array"),
    STRING_ARRAY(17, "string_array"),
    HRTIME(18, "hrtime"),
    NVLIST(19, "nvlist"),
    NVLIST_ARRAY(20, "nvlist_array"),
    BOOLEAN_VALUE(21, "boolean_value"),
    INT8(22, "int8"),
    UINT8(23, "uint8"),
    BOOLEAN_ARRAY(24, "boolean_array"),
    INT8_ARRAY(25, "int8_array"),
    UINT8_ARRAY(26, "uint8_array"),
    DOUBLE(27, "double");

    private static final NvDataType[] BY_WIRE_ID;

    static
    {
        NvDataType[] values = values();
        BY_WIRE_ID = new NvDataType[values.length];
        for (NvDataType type : values)
        {
            BY_WIRE_ID[type.wireId] = type;
        }

        pair(BYTE, BYTE_ARRAY);
        pair(INT8, INT8_ARRAY);
        pair(UINT8, UINT8_ARRAY);
        pair(INT16, INT16_ARRAY);
        pair(UINT16, UINT16_ARRAY);
        pair(INT32, INT32_ARRAY);
        pair(UINT32, UINT32_ARRAY);
        pair(INT64, INT64_ARRAY);
        pair(UINT64, UINT64_ARRAY);
        pair(STRING, STRING_ARRAY);
        pair(NVLIST, NVLIST_ARRAY);
        pair(BOOLEAN_VALUE, BOOLEAN_ARRAY);
    }

    private final int wireId;
    private final @Nullable String suffix;

    private @Nullable NvDataType arrayType;
    private @Nullable NvDataType elementType;

    NvDataType(int wireIdRef, @Nullable String suffixRef)
    {
        wireId = wireIdRef;
        suffix = suffixRef;
    }

    private static void pair(NvDataType scalar, NvDataType array)
    {
        scalar.arrayType = array;
        array.elementType = scalar;
    }

    public int getWireId()
    {
        return wireId;
    }

    /**
     * Returns the accessor suffix, or null for tags that have no value accessor
     * ({@link #UNKNOWN}, {@link #BOOLEAN})
     */
    public @Nullable String getSuffix()
    {
        return suffix;
    }

    public boolean isArray()
    {
        return elementType != null;
    }

    /**
     * Returns the array tag whose elements are of this tag, or null if libnvpair has no such
     * array type
     */
    public @Nullable NvDataType getArrayType()
    {
        return arrayType;
    }

    /**
     * Returns the element tag of an array tag, or null if this is not an array tag
     */
    public @Nullable NvDataType getElementType()
    {
        return elementType;
    }

    public boolean isInteger()
    {
        boolean integer;
        switch (this)
        {
            case BYTE:
            case INT8:
            case UINT8:
            case INT16:
            case UINT16:
            case INT32:
            case UINT32:
            case INT64:
            case UINT64:
                integer = true;
                break;
            default:
                integer = false;
                break;
        }
        return integer;
    }

    public String getAddFunctionName()
    {
        return suffix == null ? "nvlist_add_boolean" : "nvlist_add_" + suffix;
    }

    public String getValueFunctionName()
    {
        return "nvpair_value_" + suffix;
    }

    public static @Nullable NvDataType fromWireId(int wireId)
    {
        NvDataType type = null;
        if (wireId >= 0 && wireId < BY_WIRE_ID.length)
        {
            type = BY_WIRE_ID[wireId];
        }
        return type;
    }
}
