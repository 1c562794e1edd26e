package com.filesmanager.scan;

import com.filesmanager.error.FileErrorKind;

import java.nio.file.Path;

/**
 * 扫描过程中无法读取的目录或文件，扫描会跳过并继续。
 */
public record ScanWarning(Path path, FileErrorKind kind, String message) {
}
