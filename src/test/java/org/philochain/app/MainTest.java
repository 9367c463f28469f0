package org.philochain.app;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.philochain.io.GraphLoadException;
import org.philochain.io.ShardKey;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path cacheDir;

    @Test
    void testRunWithoutArgumentsReportsUsage() {
        assertEquals(2, Main.run(new String[0]));
    }

    @Test
    void testRunOverCacheDirectory() throws IOException {
        for (String key : ShardKey.ALL) {
            Files.writeString(ShardKey.fileFor(cacheDir, key), "{}", StandardCharsets.UTF_8);
        }
        Files.writeString(ShardKey.fileFor(cacheDir, "p"),
                "{\"Philosophy\": \"Reason\", \"Plato\": \"Philosophy\"}", StandardCharsets.UTF_8);
        Files.writeString(ShardKey.fileFor(cacheDir, "r"), "{\"Reason\": \"Philosophy\"}", StandardCharsets.UTF_8);

        assertEquals(0, Main.run(new String[]{cacheDir.toString(), "Plato", "Atlantis"}));
    }

    @Test
    void testRunOverMissingDirectoryFails() {
        assertThrows(GraphLoadException.class,
                () -> Main.run(new String[]{cacheDir.resolve("absent").toString()}));
    }
}
