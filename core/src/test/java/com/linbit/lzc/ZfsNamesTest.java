package com.linbit.lzc;

import java.util.Arrays;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ZfsNamesTest
{
    @Test
    public void testValidComponents()
    {
        assertTrue(ZfsNames.isValidNameComponent("data"));
        assertTrue(ZfsNames.isValidNameComponent("a-b_c.d:e f"));
        assertTrue(ZfsNames.isValidNameComponent("2024"));
    }

    @Test
    public void testInvalidComponents()
    {
        assertFalse(ZfsNames.isValidNameComponent(""));
        assertFalse(ZfsNames.isValidNameComponent("a/b"));
        assertFalse(ZfsNames.isValidNameComponent("a@b"));
        assertFalse(ZfsNames.isValidNameComponent("a#b"));
        assertFalse(ZfsNames.isValidNameComponent("ä"));
    }

    @Test
    public void testFsNames()
    {
        assertTrue(ZfsNames.isValidFsName("pool"));
        assertTrue(ZfsNames.isValidFsName("pool/fs/child"));
        assertFalse(ZfsNames.isValidFsName(""));
        assertFalse(ZfsNames.isValidFsName("pool/"));
        assertFalse(ZfsNames.isValidFsName("/pool"));
        assertFalse(ZfsNames.isValidFsName("pool//fs"));
        assertFalse(ZfsNames.isValidFsName("pool/fs@snap"));
    }

    @Test
    public void testSnapAndBookmarkNames()
    {
        assertTrue(ZfsNames.isValidSnapName("pool/fs@snap"));
        assertFalse(ZfsNames.isValidSnapName("pool/fs"));
        assertFalse(ZfsNames.isValidSnapName("pool/fs@"));
        assertFalse(ZfsNames.isValidSnapName("pool/fs@a@b"));
        assertFalse(ZfsNames.isValidSnapName("pool/fs#mark"));

        assertTrue(ZfsNames.isValidBookmarkName("pool/fs#mark"));
        assertFalse(ZfsNames.isValidBookmarkName("pool/fs@snap"));
        assertFalse(ZfsNames.isValidBookmarkName("#mark"));
    }

    @Test
    public void testLength()
    {
        char[] name = new char[ZfsNames.MAX_NAME_LENGTH];
        Arrays.fill(name, 'a');
        String longest = new String(name);

        assertFalse(ZfsNames.isTooLong(longest));
        assertTrue(ZfsNames.isTooLong(longest + "a"));
    }

    @Test
    public void testDecomposition()
    {
        assertEquals("pool", ZfsNames.poolName("pool/fs@snap"));
        assertEquals("pool", ZfsNames.poolName("pool#mark"));
        assertEquals("pool", ZfsNames.poolName("pool"));
        assertEquals("pool/fs", ZfsNames.fsName("pool/fs@snap"));
        assertEquals("pool/fs", ZfsNames.fsName("pool/fs#mark"));
        assertEquals("pool/fs", ZfsNames.fsName("pool/fs"));
        assertNull(ZfsNames.poolNameOrNull(null));
        assertNull(ZfsNames.fsNameOrNull(null));
    }

    @Test
    public void testSamePool()
    {
        assertTrue(ZfsNames.isSamePool(Arrays.asList("p/a@1", "p/b@2", "p@3")));
        assertFalse(ZfsNames.isSamePool(Arrays.asList("p/a@1", "q/a@1")));
        assertTrue(ZfsNames.isSamePool(Arrays.<String>asList()));
    }
}
