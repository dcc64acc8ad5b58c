package com.xxl.job.lite.handler;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 传给定时任务的执行参数
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobParam implements Serializable {

    private static final long serialVersionUID = 42L;

    private String params;      // 调度中心配置的任务参数，原样传递
    private int shardIndex;     // 分片索引
    private int shardTotal;     // 分片总数

}
