package com.filesmanager.util;

import java.time.Instant;

/**
 * 修改时间比较工具。
 *
 * 不同文件系统保存的时间精度不同，统一按毫秒比较。
 */
public final class FileTimes {
    private FileTimes() {
    }

    public static boolean sameModifiedTime(Instant left, Instant right) {
        if (left == null || right == null) {
            return false;
        }
        return left.toEpochMilli() == right.toEpochMilli();
    }
}
