package org.ftpbrowse.controllers.ftp;

import org.apache.commons.net.ftp.FTPFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FTP Stat Cache Tests")
public class FTPStatCacheTest {

    private static FTPFile file(String name) {
        FTPFile file = new FTPFile();
        file.setName(name);
        file.setType(FTPFile.FILE_TYPE);
        return file;
    }

    @Test
    @DisplayName("Should evict the least recently used entry when full")
    void testLeastRecentlyUsedEviction() {
        FTPStatCache cache = new FTPStatCache(2);
        cache.put("/a", file("a"));
        cache.put("/b", file("b"));
        assertNotNull(cache.get("/a"));

        cache.put("/c", file("c"));

        assertEquals(2, cache.size());
        assertNotNull(cache.get("/a"));
        assertNull(cache.get("/b"));
        assertNotNull(cache.get("/c"));
    }

    @Test
    @DisplayName("Should invalidate a path and everything below it")
    void testInvalidateSubtree() {
        FTPStatCache cache = new FTPStatCache();
        cache.put("/dir", file("dir"));
        cache.put("/dir/one", file("one"));
        cache.put("/dir/sub/two", file("two"));
        cache.put("/directory", file("directory"));

        cache.invalidate("/dir");

        assertNull(cache.get("/dir"));
        assertNull(cache.get("/dir/one"));
        assertNull(cache.get("/dir/sub/two"));
        assertNotNull(cache.get("/directory"));
    }

    @Test
    @DisplayName("Should drop the oldest entries when shrunk")
    void testResize() {
        FTPStatCache cache = new FTPStatCache();
        assertEquals(FTPStatCache.DEFAULT_MAX_SIZE, cache.getMaxSize());
        for (int i = 0; i < 10; i++) {
            cache.put("/f" + i, file("f" + i));
        }

        cache.resize(3);

        assertEquals(3, cache.getMaxSize());
        assertEquals(3, cache.size());
        assertNull(cache.get("/f6"));
        assertNotNull(cache.get("/f9"));

        cache.resize(20000);
        assertEquals(20000, cache.getMaxSize());
        assertEquals(3, cache.size());
        assertThrows(IllegalArgumentException.class, () -> cache.resize(0));
    }

    @Test
    @DisplayName("Should empty the cache on clear")
    void testClear() {
        FTPStatCache cache = new FTPStatCache();
        cache.put("/a", file("a"));

        cache.clear();

        assertEquals(0, cache.size());
        assertNull(cache.get("/a"));
    }
}
