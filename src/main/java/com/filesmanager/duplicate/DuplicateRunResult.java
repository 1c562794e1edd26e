package com.filesmanager.duplicate;

import com.filesmanager.error.FileError;

import java.util.List;
import java.util.Optional;

/**
 * duplicates 命令一次运行的汇总。
 *
 * @param filesScanned 扫描到的文件数，从报告加载时为 0
 * @param report       重复报告
 * @param warnings     扫描警告数
 * @param errors       哈希阶段的单文件错误
 * @param deletion     删除阶段汇总，未请求删除时为空
 */
public record DuplicateRunResult(
        int filesScanned,
        DuplicateReport report,
        int warnings,
        List<FileError> errors,
        Optional<DeletionSummary> deletion
) {
    public DuplicateRunResult {
        errors = List.copyOf(errors);
    }

    public int errorCount() {
        return errors.size() + deletion.map(summary -> summary.errors().size()).orElse(0);
    }
}
