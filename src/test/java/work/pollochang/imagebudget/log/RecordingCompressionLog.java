package work.pollochang.imagebudget.log;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 測試用：記錄所有輸出的訊息，可被多個執行緒同時呼叫。
 */
public class RecordingCompressionLog implements CompressionLog {

    public enum Level { INFO, WARN, ERROR }

    public static final class Event {
        public final Level level;
        public final String message;

        Event(Level level, String message) {
            this.level = level;
            this.message = message;
        }

        @Override
        public String toString() {
            return level + " " + message;
        }
    }

    private final List<Event> events = new ArrayList<>();

    @Override
    public synchronized void info(String message) {
        events.add(new Event(Level.INFO, message));
    }

    @Override
    public synchronized void warn(String message) {
        events.add(new Event(Level.WARN, message));
    }

    @Override
    public synchronized void error(String message) {
        events.add(new Event(Level.ERROR, message));
    }

    public synchronized List<Event> events() {
        return new ArrayList<>(events);
    }

    public synchronized List<String> messages(Level level) {
        return events.stream().filter(e -> e.level == level).map(e -> e.message).collect(Collectors.toList());
    }

    public long count(Level level) {
        return messages(level).size();
    }
}
