package com.filesmanager.sync;

import com.filesmanager.scan.FileRecord;

/**
 * 规划器产生、执行器消费的同步动作，创建后不可变。
 */
public sealed interface SyncAction permits SyncAction.Copy, SyncAction.Skip {

    /** 源端文件记录 */
    FileRecord record();

    /** 复制原因 */
    enum CopyReason {
        MISSING_IN_DESTINATION("目标端缺失"),
        METADATA_CHANGED("大小或修改时间不同"),
        CONTENT_CHANGED("内容不同");

        private final String description;

        CopyReason(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    /** 跳过原因 */
    enum SkipReason {
        UNCHANGED("未变化");

        private final String description;

        SkipReason(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    record Copy(FileRecord record, CopyReason reason) implements SyncAction {
    }

    record Skip(FileRecord record, SkipReason reason) implements SyncAction {
    }
}
