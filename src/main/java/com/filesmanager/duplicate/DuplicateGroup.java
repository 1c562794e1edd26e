package com.filesmanager.duplicate;

import com.filesmanager.fingerprint.Digest;
import com.filesmanager.scan.FileRecord;

import java.util.List;
import java.util.Objects;

/**
 * 一组内容完全相同的文件。
 *
 * members 按保留规则排序，第一个成员被保留，其余成员为待删除候选。
 */
public record DuplicateGroup(Digest digest, long sizeBytes, List<FileRecord> members) {

    public DuplicateGroup {
        Objects.requireNonNull(digest, "digest");
        members = List.copyOf(members);
        if (members.size() < 2) {
            throw new IllegalArgumentException("重复组至少需要 2 个成员: " + digest);
        }
        for (FileRecord member : members) {
            if (member.sizeBytes() != sizeBytes) {
                throw new IllegalArgumentException("重复组成员大小不一致: " + member.absolutePath());
            }
        }
    }

    public FileRecord kept() {
        return members.get(0);
    }

    public List<FileRecord> redundant() {
        return members.subList(1, members.size());
    }

    public long totalWastedBytes() {
        return (members.size() - 1L) * sizeBytes;
    }
}
