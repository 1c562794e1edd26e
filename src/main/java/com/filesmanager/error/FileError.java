package com.filesmanager.error;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 单文件错误记录，汇总到运行报告中，不会中断批处理。
 */
public record FileError(Path path, FileErrorKind kind, String message) {

    public static FileError of(Path path, IOException exception) {
        String message = exception.getMessage() == null
                ? exception.getClass().getSimpleName()
                : exception.getMessage();
        return new FileError(path, FileErrorKind.classify(exception), message);
    }
}
