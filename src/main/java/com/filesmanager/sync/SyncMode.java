package com.filesmanager.sync;

/**
 * 同步比较模式。
 */
public enum SyncMode {
    /** 只比较大小和修改时间，不读取内容 */
    SHALLOW,
    /** 比较内容摘要，摘要优先从缓存获取 */
    DEEP
}
