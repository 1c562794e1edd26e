package com.filesmanager.sync;

import com.filesmanager.error.FileError;

import java.util.ArrayList;
import java.util.List;

/**
 * 同步计划：按相对路径排序的动作列表。
 *
 * @param actions  动作列表
 * @param errors   规划阶段的单文件错误（如源文件无法读取），这些文件不产生动作
 * @param complete 规划是否完整（取消时为 false）
 */
public record SyncPlan(List<SyncAction> actions, List<FileError> errors, boolean complete) {

    public SyncPlan {
        actions = List.copyOf(actions);
        errors = List.copyOf(errors);
    }

    public List<SyncAction.Copy> copies() {
        List<SyncAction.Copy> copies = new ArrayList<>();
        for (SyncAction action : actions) {
            if (action instanceof SyncAction.Copy copy) {
                copies.add(copy);
            }
        }
        return copies;
    }

    public List<SyncAction.Skip> skips() {
        List<SyncAction.Skip> skips = new ArrayList<>();
        for (SyncAction action : actions) {
            if (action instanceof SyncAction.Skip skip) {
                skips.add(skip);
            }
        }
        return skips;
    }
}
