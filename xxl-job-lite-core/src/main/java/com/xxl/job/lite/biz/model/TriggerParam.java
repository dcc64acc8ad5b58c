package com.xxl.job.lite.biz.model;

import lombok.Data;

import java.io.Serializable;

/**
 * 调度中心 => 执行器 触发任务时传递的参数，也就是/run接口的请求体
 */
@Data
public class TriggerParam implements Serializable {

    private static final long serialVersionUID = 42L;

    private int jobId; // 定时任务 ID，执行器这一端按它判断同一个任务是否正在执行


    // === 执行器相关 ===

    private String executorHandler;       // JobHandler的名字
    private String executorParams;        // 定时任务参数
    private String executorBlockStrategy; // 阻塞策略，为空时按单机串行处理
    private int executorTimeout;          // 超时时间，单位秒，0表示不超时


    // === 日志相关 ===

    private long logId;                   // 日志ID，每次调度都不一样
    private long logDateTime;             // 调度时间，毫秒


    // === 执行模式相关 ===
    // 只接收不执行，这个执行器只支持BEAN模式

    private String glueType;
    private String glueSource;
    private long glueUpdatetime;


    // === 分片相关 ===

    private int broadcastIndex;           // 分片索引
    private int broadcastTotal;           // 分片总数

}
