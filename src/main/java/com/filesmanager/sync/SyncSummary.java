package com.filesmanager.sync;

import com.filesmanager.error.FileError;

import java.util.ArrayList;
import java.util.List;

/**
 * 同步运行汇总，试运行时 copied 与 bytesCopied 表示“将会”复制的数量。
 */
public record SyncSummary(
        int sourceFiles,
        int destinationFiles,
        long copied,
        long skipped,
        long abandoned,
        long bytesCopied,
        List<FileError> errors,
        boolean dryRun
) {
    public SyncSummary {
        errors = List.copyOf(errors);
    }

    public SyncSummary withScanCounts(int sourceCount, int destinationCount, List<FileError> extraErrors) {
        List<FileError> merged = new ArrayList<>(extraErrors);
        merged.addAll(errors);
        return new SyncSummary(sourceCount, destinationCount, copied, skipped, abandoned, bytesCopied, merged, dryRun);
    }
}
