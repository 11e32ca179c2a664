package io.chainindex.core.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LogicalFileTest {

    @TempDir
    Path tempDir;

    @Test
    void writesSpanPartFiles() throws Exception {
        LogicalFile file = new LogicalFile(tempDir.resolve("hashes"), 2, 10);
        byte[] data = new byte[25];
        for (int i = 0; i < data.length; i++) data[i] = (byte) i;
        file.write(3, data);

        assertTrue(Files.exists(tempDir.resolve("hashes00")));
        assertTrue(Files.exists(tempDir.resolve("hashes02")));
        assertEquals(8, file.read(20, 8).length);
        byte[] back = file.read(3, 25);
        assertArrayEquals(data, back);
    }

    @Test
    void readsPastTheEndReturnFewerBytes() {
        LogicalFile file = new LogicalFile(tempDir.resolve("headers"), 2, 16);
        file.write(0, new byte[20]);
        assertEquals(20, file.read(0, 100).length);
        assertEquals(0, file.read(64, 4).length);
    }
}
