package work.pollochang.imagebudget.file;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class AtomicFileReplacerTest {

    private final AtomicFileReplacer replacer =
            new AtomicFileReplacer(new RetryPolicy(2, Duration.ofMillis(1)), new WritePermissions());

    private static Path write(Path path, String content) throws IOException {
        return Files.write(path, content.getBytes(StandardCharsets.UTF_8));
    }

    private static String read(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    @Test
    void testReplace_ShouldOverwriteExistingDestination(@TempDir Path tempDir) throws IOException {
        Path source = write(tempDir.resolve("photo.png.tmp"), "新內容");
        Path destination = write(tempDir.resolve("photo.jpg"), "舊內容");

        assertTrue(replacer.replace(source, destination));

        assertEquals("新內容", read(destination));
        assertFalse(Files.exists(source));
    }

    @Test
    void testReplace_MissingDestination_ShouldMove(@TempDir Path tempDir) throws IOException {
        Path source = write(tempDir.resolve("photo.png.tmp"), "內容");
        Path destination = tempDir.resolve("photo.jpg");

        assertTrue(replacer.replace(source, destination));

        assertEquals("內容", read(destination));
    }

    /**
     * 唯讀的目標檔案先解除唯讀再覆蓋
     */
    @Test
    void testReplace_ReadOnlyDestination_ShouldStillReplace(@TempDir Path tempDir) throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path source = write(tempDir.resolve("photo.png.tmp"), "新內容");
        Path destination = write(tempDir.resolve("photo.jpg"), "舊內容");
        Files.setPosixFilePermissions(destination, PosixFilePermissions.fromString("r--r--r--"));

        assertTrue(replacer.replace(source, destination));

        assertEquals("新內容", read(destination));
    }

    /**
     * 重試用完只回傳 false，不拋出例外
     */
    @Test
    void testReplace_MissingSource_ShouldReturnFalse(@TempDir Path tempDir) throws IOException {
        Path destination = write(tempDir.resolve("photo.jpg"), "舊內容");

        assertFalse(replacer.replace(tempDir.resolve("missing.tmp"), destination));

        assertEquals("舊內容", read(destination));
    }
}
