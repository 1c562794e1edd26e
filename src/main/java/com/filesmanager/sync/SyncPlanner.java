package com.filesmanager.sync;

import com.filesmanager.cache.FingerprintCache;
import com.filesmanager.error.FileError;
import com.filesmanager.fingerprint.Digest;
import com.filesmanager.fingerprint.HashPool;
import com.filesmanager.fingerprint.HashResult;
import com.filesmanager.scan.FileRecord;
import com.filesmanager.scan.ScanResult;
import com.filesmanager.util.FileTimes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 根据源端、目标端扫描结果和指纹缓存生成最小动作列表。
 *
 * <ul>
 *     <li>仅源端存在：复制；</li>
 *     <li>两端都存在，浅比较：大小与修改时间相同则跳过，否则复制；</li>
 *     <li>两端都存在，深比较：摘要相同则跳过，否则复制。源文件的缓存条目与其当前大小、修改时间一致时直接复用摘要，
 *     目标文件总是重新计算；</li>
 *     <li>仅目标端存在：不产生动作，单向同步从不删除目标端文件。</li>
 * </ul>
 */
public final class SyncPlanner {
    private static final Logger logger = LoggerFactory.getLogger(SyncPlanner.class);

    private final SyncMode mode;
    private final FingerprintCache cache;
    private final HashPool hashPool;

    public SyncPlanner(SyncMode mode, FingerprintCache cache, HashPool hashPool) {
        this.mode = mode;
        this.cache = cache;
        this.hashPool = hashPool;
    }

    public SyncPlan plan(ScanResult source, ScanResult destination) {
        Map<String, FileRecord> destinationIndex = destination.byRelativePath();
        List<FileRecord> sourceRecords = new ArrayList<>(source.records());
        sourceRecords.sort(Comparator.comparing(FileRecord::relativePath));

        SyncPlan plan = mode == SyncMode.DEEP
                ? planDeep(sourceRecords, destinationIndex)
                : planShallow(sourceRecords, destinationIndex);
        logger.info("同步计划 ({}): 复制 {} 个，跳过 {} 个，错误 {} 个", mode, plan.copies().size(),
                plan.skips().size(), plan.errors().size());
        return plan;
    }

    private SyncPlan planShallow(List<FileRecord> sourceRecords, Map<String, FileRecord> destinationIndex) {
        List<SyncAction> actions = new ArrayList<>(sourceRecords.size());
        for (FileRecord sourceRecord : sourceRecords) {
            FileRecord destinationRecord = destinationIndex.get(sourceRecord.relativePath());
            if (destinationRecord == null) {
                actions.add(new SyncAction.Copy(sourceRecord, SyncAction.CopyReason.MISSING_IN_DESTINATION));
            } else if (sameMetadata(sourceRecord, destinationRecord)) {
                actions.add(new SyncAction.Skip(sourceRecord, SyncAction.SkipReason.UNCHANGED));
            } else {
                actions.add(new SyncAction.Copy(sourceRecord, SyncAction.CopyReason.METADATA_CHANGED));
            }
        }
        return new SyncPlan(actions, List.of(), true);
    }

    private SyncPlan planDeep(List<FileRecord> sourceRecords, Map<String, FileRecord> destinationIndex) {
        Map<Path, Digest> known = new HashMap<>();
        List<Path> toHash = new ArrayList<>();
        for (FileRecord sourceRecord : sourceRecords) {
            FileRecord destinationRecord = destinationIndex.get(sourceRecord.relativePath());
            if (destinationRecord == null || destinationRecord.sizeBytes() != sourceRecord.sizeBytes()) {
                continue;
            }
            resolveSourceDigest(sourceRecord, known, toHash);
            // 缓存条目由源文件摘要写入，目标文件保留源修改时间，不能用它证明目标内容
            toHash.add(destinationRecord.absolutePath());
        }
        logger.info("深度比较: 缓存命中 {} 个，需计算摘要 {} 个", known.size(), toHash.size());

        HashResult hashResult = toHash.isEmpty()
                ? new HashResult(Map.of(), List.of(), true)
                : hashPool.digestAll(toHash);
        known.putAll(hashResult.digests());

        Map<Path, FileError> failures = new HashMap<>();
        for (FileError error : hashResult.errors()) {
            failures.put(error.path(), error);
        }

        List<SyncAction> actions = new ArrayList<>(sourceRecords.size());
        List<FileError> errors = new ArrayList<>();
        for (FileRecord sourceRecord : sourceRecords) {
            FileRecord destinationRecord = destinationIndex.get(sourceRecord.relativePath());
            if (destinationRecord == null) {
                actions.add(new SyncAction.Copy(sourceRecord, SyncAction.CopyReason.MISSING_IN_DESTINATION));
                continue;
            }
            if (destinationRecord.sizeBytes() != sourceRecord.sizeBytes()) {
                actions.add(new SyncAction.Copy(sourceRecord, SyncAction.CopyReason.CONTENT_CHANGED));
                continue;
            }
            FileError sourceFailure = failures.get(sourceRecord.absolutePath());
            if (sourceFailure != null) {
                logger.error("源文件无法读取，本次不同步: {} ({})", sourceRecord.relativePath(), sourceFailure.message());
                errors.add(sourceFailure);
                continue;
            }
            Digest sourceDigest = known.get(sourceRecord.absolutePath());
            Digest destinationDigest = known.get(destinationRecord.absolutePath());
            if (sourceDigest == null) {
                // 哈希阶段被取消
                continue;
            }
            FileError destinationFailure = failures.get(destinationRecord.absolutePath());
            if (destinationFailure != null) {
                logger.warn("目标文件无法读取，重新复制: {} ({})", destinationRecord.relativePath(),
                        destinationFailure.message());
            }
            FileRecord withDigest = sourceRecord.withDigest(sourceDigest);
            if (sourceDigest.equals(destinationDigest)) {
                actions.add(new SyncAction.Skip(withDigest, SyncAction.SkipReason.UNCHANGED));
            } else {
                actions.add(new SyncAction.Copy(withDigest, SyncAction.CopyReason.CONTENT_CHANGED));
            }
        }
        return new SyncPlan(actions, errors, hashResult.complete());
    }

    private void resolveSourceDigest(FileRecord record, Map<Path, Digest> known, List<Path> toHash) {
        Optional<Digest> cached = cache.validDigest(record.relativePath(), record.sizeBytes(), record.modifiedTime());
        if (cached.isPresent()) {
            known.put(record.absolutePath(), cached.get());
        } else {
            toHash.add(record.absolutePath());
        }
    }

    private static boolean sameMetadata(FileRecord left, FileRecord right) {
        return left.sizeBytes() == right.sizeBytes()
                && FileTimes.sameModifiedTime(left.modifiedTime(), right.modifiedTime());
    }
}
