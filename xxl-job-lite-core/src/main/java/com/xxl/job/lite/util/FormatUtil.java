package com.xxl.job.lite.util;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * 打印远程调用日志时用到的格式化方法
 */
public class FormatUtil {

    private static final long KB = 1024;
    private static final long MB = KB * 1024;
    private static final long GB = MB * 1024;

    /**
     * 字节数转成 12b / 1.50kb / 2.00mb / 1.00gb 这样的格式
     */
    public static String readableSize(long size) {
        double s = size;
        if (size >= GB) {
            return String.format(Locale.ROOT, "%.2fgb", s / GB);
        } else if (size >= MB) {
            return String.format(Locale.ROOT, "%.2fmb", s / MB);
        } else if (size >= KB) {
            return String.format(Locale.ROOT, "%.2fkb", s / KB);
        }
        return size + "b";
    }

    /**
     * 1秒以上原样返回，1毫秒以上截断到毫秒，否则截断到微秒
     */
    public static Duration truncateDuration(Duration d) {
        if (d.compareTo(Duration.ofSeconds(1)) >= 0) {
            return d;
        }
        if (d.compareTo(Duration.ofMillis(1)) >= 0) {
            return d.truncatedTo(ChronoUnit.MILLIS);
        }
        return d.truncatedTo(ChronoUnit.MICROS);
    }

    /**
     * 以 1.234s / 12ms / 35µs 的形式打印耗时
     */
    public static String readableDuration(Duration d) {
        Duration truncated = truncateDuration(d);
        if (truncated.compareTo(Duration.ofSeconds(1)) >= 0) {
            return String.format(Locale.ROOT, "%.3fs", truncated.toNanos() / 1_000_000_000d);
        }
        if (truncated.compareTo(Duration.ofMillis(1)) >= 0) {
            return truncated.toMillis() + "ms";
        }
        return (truncated.toNanos() / 1000) + "µs";
    }

}
