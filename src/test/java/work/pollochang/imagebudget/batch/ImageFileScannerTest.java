package work.pollochang.imagebudget.batch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ImageFileScannerTest {

    private final ImageFileScanner scanner = new ImageFileScanner();

    /**
     * 遞迴掃描支援的副檔名，略過備份檔與暫存檔
     */
    @Test
    void testScanDirectory_ShouldFindSupportedImages(@TempDir Path tempDir) throws IOException {
        Files.createFile(tempDir.resolve("a.jpg"));
        Files.createFile(tempDir.resolve("b.PNG"));
        Files.createDirectories(tempDir.resolve("sub"));
        Files.createFile(tempDir.resolve("sub").resolve("c.webp"));
        Files.createFile(tempDir.resolve("d.png.bak"));
        Files.createFile(tempDir.resolve("e.jpg.tmp"));
        Files.createFile(tempDir.resolve("notes.txt"));

        List<Path> found = scanner.scanDirectory(tempDir);

        assertEquals(3, found.size());
        assertTrue(found.stream().allMatch(Path::isAbsolute));
        assertEquals(Map.of("JPG", 1L, "PNG", 1L, "WEBP", 1L), ImageFileScanner.countByExtension(found));
    }

    @Test
    void testCollect_ShouldMergeFileListAndRootsWithoutDuplicates(@TempDir Path tempDir) throws IOException {
        Path a = Files.createFile(tempDir.resolve("a.jpg"));
        Path b = Files.createFile(tempDir.resolve("b.gif"));
        Path list = Files.write(tempDir.resolve("list.txt"),
                (a + "\n\n   \n" + b + "\n").getBytes(StandardCharsets.UTF_8));

        List<Path> collected = scanner.collect(List.of(a), list);

        assertEquals(List.of(a.toAbsolutePath(), b.toAbsolutePath()), collected);
    }
}
