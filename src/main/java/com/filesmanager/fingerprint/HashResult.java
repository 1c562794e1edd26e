package com.filesmanager.fingerprint;

import com.filesmanager.error.FileError;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 批量哈希结果。
 *
 * @param digests  成功计算的摘要
 * @param errors   读取失败的文件
 * @param complete 是否所有文件都已处理（取消时为 false）
 */
public record HashResult(Map<Path, Digest> digests, List<FileError> errors, boolean complete) {

    public HashResult {
        digests = Map.copyOf(digests);
        errors = List.copyOf(errors);
    }
}
