package dev.rocksscheduler.config;

import org.rocksdb.CompressionType;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.time.Duration;
import java.time.ZoneId;

@Getter
@Setter
@Accessors(chain = true)
public class SchedulerConfig {
    public static final long DEFAULT_INTERVAL_MILLIS = 5000L;

    // System property helpers for deployment overrides (safe fallbacks)
    private static String prop(String key, String def) {
        String v = System.getProperty(key);
        return v == null ? def : v;
    }
    private static boolean boolProp(String key, boolean def) {
        String v = System.getProperty(key);
        return v == null ? def : Boolean.parseBoolean(v);
    }
    private static long longProp(String key, long def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Long.parseLong(v.trim()); } catch (NumberFormatException e) { return def; }
    }
    private static ZoneId zoneProp() {
        try { return ZoneId.of(prop("rs.zoneId", ZoneId.systemDefault().getId())); }
        catch (Exception ignored) { return ZoneId.systemDefault(); }
    }

    // Paths
    private String basePath = prop("rs.basePath", "./data/rocksscheduler");
    private String delayedDirName = "delayed";
    private String queuesDirName = "queues";

    // Worker
    private Duration pollInterval = Duration.ofMillis(longProp("rs.intervalMillis", DEFAULT_INTERVAL_MILLIS));
    private ZoneId zoneId = zoneProp();     // zone used when rendering due times in log lines
    private boolean handleSignals = boolProp("rs.handleSignals", true);

    // RocksDB
    private boolean syncWrites = boolProp("rs.syncWrites", false);  // WAL fsync on each write
    private boolean disableWAL = false;       // keep WAL by default
    private int writeBufferSizeMB = 16;       // per memtable
    private int maxWriteBufferNumber = 3;
    private CompressionType compressionType = CompressionType.LZ4_COMPRESSION;
    private long readaheadSizeBytes = 4L * 1024 * 1024; // readahead for timestamp scans
}
