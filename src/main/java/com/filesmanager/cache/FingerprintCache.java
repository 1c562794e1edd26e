package com.filesmanager.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.filesmanager.fingerprint.Digest;
import com.filesmanager.storage.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 持久化指纹缓存：相对路径到（大小, 修改时间, 摘要, 最近校验时间）的映射。
 *
 * <p>文件格式为单个 JSON 对象，键为相对路径，按字典序排列。已删除文件的条目不会自动清理。
 * 每次 {@link #flush()} 都通过临时文件加重命名写出完整文档，不会留下残缺的 JSON。</p>
 *
 * <p>线程安全：{@link #upsert(CacheEntry)} 可并发调用；{@link #flush()} 串行执行，
 * 同一时刻只有一个写者。</p>
 */
public final class FingerprintCache {
    private static final Logger logger = LoggerFactory.getLogger(FingerprintCache.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Path storage;
    private final Map<String, CacheEntry> entries = new TreeMap<>();
    private final Object flushLock = new Object();

    private long version;
    private long flushedVersion;

    private FingerprintCache(Path storage, Map<String, CacheEntry> initialEntries) {
        this.storage = storage;
        this.entries.putAll(initialEntries);
    }

    /**
     * 加载缓存。文件不存在时返回空缓存；文件损坏或不可读时记录警告并返回空缓存。
     *
     * @param storage 缓存文件路径
     * @return 缓存实例，绑定到该路径
     */
    public static FingerprintCache load(Path storage) {
        Path absoluteStorage = storage.toAbsolutePath().normalize();
        if (!Files.exists(absoluteStorage)) {
            logger.info("缓存文件不存在，使用空缓存: {}", absoluteStorage);
            return new FingerprintCache(absoluteStorage, Map.of());
        }
        try {
            Map<String, CacheEntry> loaded = read(absoluteStorage);
            logger.info("已加载缓存 {} 条: {}", loaded.size(), absoluteStorage);
            return new FingerprintCache(absoluteStorage, loaded);
        } catch (CorruptCacheException exception) {
            logger.warn("{}，将使用空缓存", exception.getMessage());
        } catch (IOException exception) {
            logger.warn("读取缓存失败，将使用空缓存: {} - {}", absoluteStorage, exception.getMessage());
        }
        return new FingerprintCache(absoluteStorage, Map.of());
    }

    /**
     * 按相对路径查找条目。
     */
    public synchronized Optional<CacheEntry> lookup(String relativePath) {
        return Optional.ofNullable(entries.get(relativePath));
    }

    /**
     * 仅当条目与当前大小、修改时间一致时返回摘要。
     */
    public synchronized Optional<Digest> validDigest(String relativePath, long sizeBytes, Instant modifiedTime) {
        CacheEntry entry = entries.get(relativePath);
        if (entry == null || !entry.matches(sizeBytes, modifiedTime)) {
            return Optional.empty();
        }
        return Optional.of(entry.digest());
    }

    /**
     * 插入或更新条目，只修改内存状态，需随后调用 {@link #flush()} 落盘。
     */
    public synchronized void upsert(CacheEntry entry) {
        entries.put(entry.relativePath(), entry);
        version++;
    }

    /**
     * 将当前完整内容原子写入缓存文件。内容自上次落盘后未变化时直接返回。
     *
     * @throws IOException 写入失败时抛出，磁盘上保留上一次完整的文档
     */
    public void flush() throws IOException {
        synchronized (flushLock) {
            Map<String, CacheEntry> snapshot;
            long snapshotVersion;
            synchronized (this) {
                if (version == flushedVersion && Files.exists(storage)) {
                    return;
                }
                snapshot = new TreeMap<>(entries);
                snapshotVersion = version;
            }
            ObjectNode document = OBJECT_MAPPER.createObjectNode();
            for (Map.Entry<String, CacheEntry> entry : snapshot.entrySet()) {
                document.set(entry.getKey(), OBJECT_MAPPER.valueToTree(StoredEntry.from(entry.getValue())));
            }
            AtomicFiles.write(storage, out -> OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, document));
            synchronized (this) {
                flushedVersion = Math.max(flushedVersion, snapshotVersion);
            }
        }
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * 返回按相对路径排序的条目快照。
     */
    public synchronized Map<String, CacheEntry> snapshot() {
        return new TreeMap<>(entries);
    }

    public Path storage() {
        return storage;
    }

    private static Map<String, CacheEntry> read(Path storage) throws IOException {
        JsonNode root;
        try (InputStream input = Files.newInputStream(storage)) {
            root = OBJECT_MAPPER.readTree(input);
        } catch (JsonProcessingException exception) {
            throw new CorruptCacheException(storage, exception.getOriginalMessage(), exception);
        }
        if (root == null || root.isMissingNode()) {
            throw new CorruptCacheException(storage, "文件为空", null);
        }
        if (!root.isObject()) {
            throw new CorruptCacheException(storage, "顶层必须是 JSON 对象", null);
        }

        Map<String, CacheEntry> loaded = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            CacheEntry entry = toEntry(field.getKey(), field.getValue());
            if (entry == null) {
                logger.warn("丢弃无效缓存条目: {}", field.getKey());
            } else {
                loaded.put(entry.relativePath(), entry);
            }
        }
        return loaded;
    }

    private static CacheEntry toEntry(String relativePath, JsonNode node) {
        if (!node.isObject()) {
            return null;
        }
        StoredEntry stored;
        try {
            stored = OBJECT_MAPPER.treeToValue(node, StoredEntry.class);
        } catch (JsonProcessingException | IllegalArgumentException exception) {
            logger.debug("缓存条目解析失败: {} - {}", relativePath, exception.getMessage());
            return null;
        }
        if (stored.sizeBytes() == null || stored.sizeBytes() < 0 || stored.modifiedTime() == null
                || stored.digest() == null || stored.lastVerifiedTime() == null) {
            return null;
        }
        try {
            return new CacheEntry(relativePath, stored.sizeBytes(), stored.modifiedTime(),
                    Digest.parse(stored.digest()), stored.lastVerifiedTime());
        } catch (IllegalArgumentException exception) {
            logger.debug("缓存条目摘要非法: {} - {}", relativePath, exception.getMessage());
            return null;
        }
    }
}
