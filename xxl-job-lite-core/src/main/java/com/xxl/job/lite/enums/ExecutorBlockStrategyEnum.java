package com.xxl.job.lite.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 任务阻塞处理策略。
 * 场景：一个定时任务每隔5秒调度一次，但是本次执行耗时比较长，过了6秒还没有执行完，
 * 下一次调度到来的时候，同一个jobId的任务还在执行，这时候就由阻塞策略决定怎么处理
 * 新到来的这次调度。
 */
@Getter
@AllArgsConstructor
public enum ExecutorBlockStrategyEnum {

    /**
     * 单机串行(默认)。
     * 新的调度被接受，但是要等同一个jobId的旧任务从执行器的任务表中移除之后才开始执行。
     */
    SERIAL_EXECUTION("Serial execution"),
    /**
     * 丢弃后续调度。
     * 同一个jobId的任务还在执行，本次调度直接返回失败，不会排队。
     */
    DISCARD_LATER("Discard Later"),
    /**
     * 覆盖之前调度。
     * 先终止正在执行的旧任务，再按单机串行的方式执行本次调度。
     */
    COVER_EARLY("Cover Early");

    private final String title;

    public static ExecutorBlockStrategyEnum match(String name, ExecutorBlockStrategyEnum defaultItem) {
        if (name != null) {
            for (ExecutorBlockStrategyEnum item : ExecutorBlockStrategyEnum.values()) {
                if (item.name().equals(name)) {
                    return item;
                }
            }
        }
        return defaultItem;
    }
}
