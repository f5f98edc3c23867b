package work.pollochang.imagebudget;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ExecuteTest {

    private static int execute(String... args) {
        return new CommandLine(new Execute()).execute(args);
    }

    private static void writePng(Path path, Color color) throws IOException {
        BufferedImage image = new BufferedImage(120, 90, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setPaint(color);
            g.fillRect(0, 0, 120, 90);
        } finally {
            g.dispose();
        }
        ImageIO.write(image, "png", path.toFile());
    }

    @Test
    void testInvalidTarget_ShouldExitWithTwo(@TempDir Path tempDir) throws IOException {
        writePng(tempDir.resolve("a.png"), Color.RED);

        assertEquals(2, execute("-t", "0", tempDir.toString()));
        assertEquals(2, execute("-w", "17", tempDir.toString()));
        assertTrue(Files.exists(tempDir.resolve("a.png")));
    }

    @Test
    void testNoImages_ShouldExitWithTwo(@TempDir Path tempDir) {
        assertEquals(2, execute(tempDir.toString()));
    }

    /**
     * 正常執行：資料夾內的 PNG 轉為 JPEG 並寫出報告
     */
    @Test
    void testFolderRun_ShouldCompressAndWriteReport(@TempDir Path tempDir) throws IOException {
        Path images = Files.createDirectories(tempDir.resolve("images"));
        writePng(images.resolve("a.png"), Color.RED);
        writePng(images.resolve("b.png"), Color.BLUE);
        Path report = tempDir.resolve("report.json");

        int exitCode = execute("-t", "50", "-w", "2", "--report", report.toString(), images.toString());

        assertEquals(0, exitCode);
        assertTrue(Files.exists(images.resolve("a.jpg")));
        assertTrue(Files.exists(images.resolve("b.jpg")));
        assertFalse(Files.exists(images.resolve("a.png")));
        JsonNode root = new ObjectMapper().readTree(report.toFile());
        assertEquals(2, root.get("succeeded").asInt());
    }

    @Test
    void testBrokenImage_ShouldExitWithOne(@TempDir Path tempDir) throws IOException {
        Path broken = Files.write(tempDir.resolve("broken.png"), "壞掉".getBytes(StandardCharsets.UTF_8));

        assertEquals(1, execute("--no-auto-resize", broken.toString()));
        assertTrue(Files.exists(broken));
    }
}
