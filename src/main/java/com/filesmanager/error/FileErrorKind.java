package com.filesmanager.error;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;

/**
 * 单文件错误分类。
 */
public enum FileErrorKind {
    /** 读写或复制失败 */
    IO,
    /** 访问被拒绝 */
    PERMISSION,
    /** 路径在扫描与操作之间消失 */
    NOT_FOUND;

    /**
     * 根据异常类型归类。
     */
    public static FileErrorKind classify(IOException exception) {
        if (exception instanceof AccessDeniedException) {
            return PERMISSION;
        }
        if (exception instanceof NoSuchFileException) {
            return NOT_FOUND;
        }
        return IO;
    }
}
