package com.filesmanager.storage;

import com.filesmanager.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * 原子文件写入工具：先写同目录临时文件，再重命名到目标路径，
 * 保证目标路径上永远不会出现写了一半的文件。
 */
public final class AtomicFiles {
    private static final Logger logger = LoggerFactory.getLogger(AtomicFiles.class);

    private AtomicFiles() {
    }

    /**
     * 原子写入目标文件。
     *
     * @param target 目标路径
     * @param writer 内容写入回调
     * @throws IOException 写入或重命名失败时抛出，临时文件会被清理
     */
    public static void write(Path target, StreamWriter writer) throws IOException {
        Path absoluteTarget = target.toAbsolutePath().normalize();
        Path parent = absoluteTarget.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tempFile = createSiblingTemp(absoluteTarget);
        try {
            writeAndForce(tempFile, writer);
            moveIntoPlace(tempFile, absoluteTarget);
        } catch (IOException | RuntimeException exception) {
            deleteQuietly(tempFile);
            throw exception;
        }
    }

    /**
     * 覆盖写入已存在的文件，并在返回前 fsync，之后的重命名不会把未落盘的内容放到最终路径。
     *
     * @return 写入后的文件大小
     */
    public static long writeAndForce(Path file, StreamWriter writer) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            OutputStream out = new NonClosingOutputStream(Channels.newOutputStream(channel));
            writer.write(out);
            out.flush();
            channel.force(true);
            return channel.size();
        }
    }

    /**
     * 在目标文件所在目录创建临时文件。
     */
    public static Path createSiblingTemp(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        String fileName = target.getFileName() == null ? "file" : target.getFileName().toString();
        return Files.createTempFile(parent, Constants.TEMP_FILE_PREFIX + fileName + ".", Constants.TEMP_FILE_SUFFIX);
    }

    /**
     * 将临时文件重命名到目标位置，文件系统不支持原子移动时退化为普通替换。
     */
    public static void moveIntoPlace(Path tempFile, Path target) throws IOException {
        try {
            Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException exception) {
            logger.debug("文件系统不支持原子移动，退化为普通替换: {}", target);
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * 判断文件名是否为本工具遗留的临时文件。
     */
    public static boolean isTempFileName(String fileName) {
        return fileName.startsWith(Constants.TEMP_FILE_PREFIX) && fileName.endsWith(Constants.TEMP_FILE_SUFFIX);
    }

    /**
     * 删除文件，失败只记录日志。
     */
    public static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException exception) {
            logger.warn("无法删除临时文件: {} - {}", path, exception.getMessage());
        }
    }

    @FunctionalInterface
    public interface StreamWriter {
        void write(OutputStream out) throws IOException;
    }

    /**
     * 序列化库会在写完后关闭目标流，这里拦截关闭以便随后执行 fsync。
     */
    private static final class NonClosingOutputStream extends FilterOutputStream {
        NonClosingOutputStream(OutputStream delegate) {
            super(delegate);
        }

        @Override
        public void write(byte[] buffer, int offset, int length) throws IOException {
            out.write(buffer, offset, length);
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }
}
