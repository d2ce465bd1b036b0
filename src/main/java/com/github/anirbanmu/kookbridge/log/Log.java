package com.github.anirbanmu.kookbridge.log;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

// key=value event log. lines are queued and written by one drain thread so
// gateway loops never block on stdout.
public final class Log {
    private static final Logger logger = System.getLogger("kookbridge");
    private static final BlockingQueue<String> QUEUE = new ArrayBlockingQueue<>(4096);
    private static final OutputStream OUT = new FileOutputStream(FileDescriptor.out);
    private static final DateTimeFormatter TIME_FMT = DateTimeFormatter.ISO_INSTANT;
    private static final String REDACTED_KEY = "token";

    static {
        Thread drainThread = new Thread(Log::drainLoop, "kookbridge-log-drain");
        drainThread.setDaemon(true);
        drainThread.start();

        // daemon thread, so flush on exit
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            drainThread.interrupt();
            try {
                drainThread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
    }

    private Log() {}

    public static void info(String evt, Object... kv) {
        log(Level.INFO, evt, null, kv, null);
    }

    public static void error(String evt, Throwable t, Object... kv) {
        log(Level.ERROR, evt, null, kv, t);
    }

    public static void error(String evt, Object... kv) {
        log(Level.ERROR, evt, null, kv, null);
    }

    public static void warn(String evt, Object... kv) {
        log(Level.WARNING, evt, null, kv, null);
    }

    public static void warn(String evt, Throwable t, Object... kv) {
        log(Level.WARNING, evt, null, kv, t);
    }

    public static void debug(String evt, Object... kv) {
        log(Level.DEBUG, evt, null, kv, null);
    }

    // fixed leading pairs for every line, e.g. scope("account", "default")
    public static Scope scope(Object... kv) {
        return new Scope(kv);
    }

    public static final class Scope {
        private final Object[] prefix;

        private Scope(Object[] prefix) {
            this.prefix = prefix.clone();
        }

        public void info(String evt, Object... kv) {
            log(Level.INFO, evt, prefix, kv, null);
        }

        public void warn(String evt, Object... kv) {
            log(Level.WARNING, evt, prefix, kv, null);
        }

        public void warn(String evt, Throwable t, Object... kv) {
            log(Level.WARNING, evt, prefix, kv, t);
        }

        public void error(String evt, Object... kv) {
            log(Level.ERROR, evt, prefix, kv, null);
        }

        public void error(String evt, Throwable t, Object... kv) {
            log(Level.ERROR, evt, prefix, kv, t);
        }

        public void debug(String evt, Object... kv) {
            log(Level.DEBUG, evt, prefix, kv, null);
        }
    }

    private static void drainLoop() {
        List<String> batch = new ArrayList<>(128);
        try {
            while (!Thread.currentThread().isInterrupted()) {
                try {
                    batch.add(QUEUE.take());
                    QUEUE.drainTo(batch, 127);
                    write(batch);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (Exception e) {
                    System.err.println("PANIC: LOGGING FAILED");
                    e.printStackTrace();
                    batch.clear();
                }
            }
        } finally {
            try {
                if (!batch.isEmpty()) {
                    write(batch);
                }
                while (!QUEUE.isEmpty()) {
                    batch.clear();
                    QUEUE.drainTo(batch, 128);
                    write(batch);
                }
            } catch (Exception e) {
                System.err.println("PANIC: FLUSH FAILED");
            }
        }
    }

    private static void write(List<String> batch) throws IOException {
        StringBuilder chunk = new StringBuilder(batch.size() * 128);
        for (String msg : batch) {
            chunk.append(msg).append('\n');
        }
        OUT.write(chunk.toString().getBytes(StandardCharsets.UTF_8));
        batch.clear();
    }

    private static void log(Level level, String evt, Object[] prefix, Object[] kv, Throwable t) {
        if (!logger.isLoggable(level)) {
            return;
        }

        StringBuilder sb = new StringBuilder(128);
        TIME_FMT.formatTo(Instant.now().truncatedTo(ChronoUnit.MILLIS), sb);
        sb.append(" ").append(level.name());

        if (evt != null) {
            sb.append(" evt=").append(escape(evt));
        }

        appendPairs(sb, prefix);
        appendPairs(sb, kv);

        if (t != null) {
            sb.append(" err=").append(escape(t.getClass().getSimpleName()))
              .append(" msg=").append(escape(t.getMessage()));

            if (t.getStackTrace().length > 0) {
                sb.append(" loc=").append(escape(t.getStackTrace()[0].toString()));
            }
        }

        QUEUE.offer(sb.toString());
    }

    private static void appendPairs(StringBuilder sb, Object[] kv) {
        if (kv == null) {
            return;
        }
        for (int i = 0; i < kv.length; i += 2) {
            String key = String.valueOf(kv[i]);
            Object value = (i + 1 < kv.length) ? kv[i + 1] : "null";
            sb.append(" ").append(key).append("=");
            if (REDACTED_KEY.equals(key) && value != null) {
                sb.append("REDACTED");
            } else {
                sb.append(escape(String.valueOf(value)));
            }
        }
    }

    private static String escape(String s) {
        if (s == null) {
            return "null";
        }

        if (s.isEmpty()) {
            return "\"\"";
        }

        boolean safe = true;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c <= ' ' || c == '=' || c == '"') {
                safe = false;
                break;
            }
        }

        if (safe) {
            return s;
        }

        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"') {
                sb.append('\\');
            }
            if (c == '\n') {
                sb.append("\\n");
                continue;
            }
            sb.append(c);
        }
        sb.append('"');
        return sb.toString();
    }
}
