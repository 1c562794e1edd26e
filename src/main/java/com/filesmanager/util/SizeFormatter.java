package com.filesmanager.util;

import java.util.Locale;

/**
 * 字节数格式化为可读字符串。
 */
public final class SizeFormatter {
    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB", "PB", "EB"};

    private SizeFormatter() {
    }

    public static String format(long bytes) {
        if (bytes < 1024) {
            return Math.max(bytes, 0) + " B";
        }
        double value = bytes;
        int unitIndex = 0;
        while (value >= 1024 && unitIndex < UNITS.length - 1) {
            value /= 1024.0;
            unitIndex++;
        }
        return String.format(Locale.ROOT, "%.2f %s", value, UNITS[unitIndex]);
    }
}
