package com.filesmanager.duplicate;

import com.filesmanager.error.FileError;

import java.util.List;

/**
 * 重复检测结果。
 *
 * @param groups       重复组，按大小降序、摘要升序排列
 * @param errors       哈希失败的文件
 * @param hashedFiles  实际计算摘要的候选文件数
 * @param complete     哈希阶段是否完整结束
 */
public record DetectionResult(List<DuplicateGroup> groups, List<FileError> errors, int hashedFiles, boolean complete) {

    public DetectionResult {
        groups = List.copyOf(groups);
        errors = List.copyOf(errors);
    }

    public int duplicateFileCount() {
        int count = 0;
        for (DuplicateGroup group : groups) {
            count += group.redundant().size();
        }
        return count;
    }

    public long totalWastedBytes() {
        long total = 0L;
        for (DuplicateGroup group : groups) {
            total += group.totalWastedBytes();
        }
        return total;
    }
}
