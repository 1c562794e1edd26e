package com.filesmanager.duplicate;

import com.filesmanager.error.FileError;

import java.util.List;

/**
 * 删除阶段汇总，试运行时 deleted 与 bytesReclaimed 表示“将会”删除的数量。
 */
public record DeletionSummary(
        int groups,
        int duplicateFiles,
        long deleted,
        long bytesReclaimed,
        long skipped,
        long abandoned,
        List<FileError> errors,
        boolean dryRun
) {
    public DeletionSummary {
        errors = List.copyOf(errors);
    }
}
