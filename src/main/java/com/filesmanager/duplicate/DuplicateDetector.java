package com.filesmanager.duplicate;

import com.filesmanager.fingerprint.Digest;
import com.filesmanager.fingerprint.HashPool;
import com.filesmanager.fingerprint.HashResult;
import com.filesmanager.scan.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 重复文件检测。
 *
 * <ol>
 *     <li>按大小分桶，成员少于 2 的桶直接丢弃，不做哈希；</li>
 *     <li>剩余候选交给哈希线程池，等待全部摘要完成；</li>
 *     <li>按（大小, 摘要）重新分桶，成员不少于 2 的桶成为重复组。</li>
 * </ol>
 *
 * 结果与输入顺序无关。
 */
public final class DuplicateDetector {
    private static final Logger logger = LoggerFactory.getLogger(DuplicateDetector.class);

    static final Comparator<DuplicateGroup> GROUP_ORDER = Comparator
            .comparingLong(DuplicateGroup::sizeBytes).reversed()
            .thenComparing(DuplicateGroup::digest);

    private final HashPool hashPool;

    public DuplicateDetector(HashPool hashPool) {
        this.hashPool = hashPool;
    }

    public DetectionResult detect(Collection<FileRecord> records) {
        Map<Long, List<FileRecord>> bySize = new HashMap<>();
        for (FileRecord record : records) {
            bySize.computeIfAbsent(record.sizeBytes(), size -> new ArrayList<>()).add(record);
        }

        List<FileRecord> candidates = new ArrayList<>();
        int sizeBuckets = 0;
        for (List<FileRecord> bucket : bySize.values()) {
            if (bucket.size() > 1) {
                candidates.addAll(bucket);
                sizeBuckets++;
            }
        }
        logger.info("发现 {} 组大小相同的文件，共 {} 个候选，开始计算内容摘要", sizeBuckets, candidates.size());

        List<Path> paths = new ArrayList<>(candidates.size());
        for (FileRecord candidate : candidates) {
            paths.add(candidate.absolutePath());
        }
        HashResult hashResult = hashPool.digestAll(paths);

        Map<GroupKey, List<FileRecord>> byContent = new HashMap<>();
        for (FileRecord candidate : candidates) {
            Digest digest = hashResult.digests().get(candidate.absolutePath());
            if (digest == null) {
                continue;
            }
            byContent.computeIfAbsent(new GroupKey(candidate.sizeBytes(), digest), key -> new ArrayList<>())
                    .add(candidate.withDigest(digest));
        }

        List<DuplicateGroup> groups = new ArrayList<>();
        for (Map.Entry<GroupKey, List<FileRecord>> entry : byContent.entrySet()) {
            List<FileRecord> members = entry.getValue();
            if (members.size() < 2) {
                continue;
            }
            members.sort(FileRecord.RETENTION_ORDER);
            groups.add(new DuplicateGroup(entry.getKey().digest(), entry.getKey().sizeBytes(), members));
        }
        groups.sort(GROUP_ORDER);

        DetectionResult result = new DetectionResult(groups, hashResult.errors(), paths.size(), hashResult.complete());
        logger.info("重复检测完成: {} 组重复，{} 个多余文件", groups.size(), result.duplicateFileCount());
        return result;
    }

    private record GroupKey(long sizeBytes, Digest digest) {
    }
}
