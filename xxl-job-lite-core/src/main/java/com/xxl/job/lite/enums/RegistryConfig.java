package com.xxl.job.lite.enums;

/**
 * <h1>注册默认参数配置</h1>
 */
public class RegistryConfig {

    /**
     * 执行器默认每10秒重新注册一次，刷新注册时间。
     * 调度中心不会主动探测执行器是否存活，所以执行器必须靠定时注册来保持心跳。
     */
    public static final int BEAT_TIMEOUT = 10;
    /**
     * 注册类型
     */
    public enum RegistType{ EXECUTOR }

}
