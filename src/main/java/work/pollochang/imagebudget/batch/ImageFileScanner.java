package work.pollochang.imagebudget.batch;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.imagebudget.tools.ImagePaths;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 收集要處理的圖片路徑：目錄會遞迴掃描支援的副檔名，檔案列表則逐行讀取。
 * 回傳的路徑皆為絕對路徑且不重複，維持出現順序。
 */
@Slf4j
public class ImageFileScanner {

    public List<Path> collect(List<Path> roots, Path fileList) throws IOException {
        Set<Path> found = new LinkedHashSet<>();
        if (fileList != null) {
            found.addAll(readFileList(fileList));
        }
        for (Path root : roots) {
            Path absolute = root.toAbsolutePath().normalize();
            if (Files.isDirectory(absolute)) {
                found.addAll(scanDirectory(absolute));
            } else {
                found.add(absolute);
            }
        }
        return new ArrayList<>(found);
    }

    public List<Path> scanDirectory(Path directory) throws IOException {
        log.info("正在掃描: {}", directory);
        try (Stream<Path> files = Files.walk(directory)) {
            return files.filter(Files::isRegularFile)
                    .filter(ImagePaths::isSupported)
                    .map(path -> path.toAbsolutePath().normalize())
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * 使用 Stream API 逐行讀取，忽略空白行。
     */
    public List<Path> readFileList(Path fileList) throws IOException {
        try (Stream<String> lines = Files.lines(fileList)) {
            return lines.map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .map(line -> Paths.get(line).toAbsolutePath().normalize())
                    .collect(Collectors.toList());
        }
    }

    /**
     * 依副檔名統計數量，鍵為大寫副檔名。
     */
    public static SortedMap<String, Long> countByExtension(List<Path> paths) {
        SortedMap<String, Long> counts = new TreeMap<>();
        for (Path path : paths) {
            counts.merge(ImagePaths.extensionOf(path).toUpperCase(Locale.ROOT), 1L, Long::sum);
        }
        return counts;
    }
}
