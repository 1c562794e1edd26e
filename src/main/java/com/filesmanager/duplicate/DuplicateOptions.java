package com.filesmanager.duplicate;

import java.nio.file.Path;

/**
 * duplicates 命令的输入参数。
 *
 * @param scanRoot   要扫描的目录，与 inputJson 二选一
 * @param inputJson  已有报告，优先于 scanRoot
 * @param outputJson 报告输出路径，为 null 时不写报告
 * @param delete     是否删除多余文件
 * @param dryRun     试运行，只记录将要删除的文件
 */
public record DuplicateOptions(Path scanRoot, Path inputJson, Path outputJson, boolean delete, boolean dryRun) {
}
