package com.filesmanager.error;

/**
 * 参数或路径配置非法，在任何工作线程启动前抛出。
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
