package com.linbit.lzc.core;

/**
 * Types of datasets that can be created, with their {@code dmu_objset_type_t} ids
 */
public enum DatasetType
{
    FILESYSTEM(2),
    VOLUME(3);

    private final int objsetType;

    DatasetType(int objsetTypeRef)
    {
        objsetType = objsetTypeRef;
    }

    public int getObjsetType()
    {
        return objsetType;
    }
}
