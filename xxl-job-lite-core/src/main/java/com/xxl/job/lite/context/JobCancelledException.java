package com.xxl.job.lite.context;

/**
 * 任务被终止(kill、覆盖之前调度、执行器销毁)或者执行超时的时候，
 * {@link XxlJobContext#checkCancelled()} 抛出这个异常
 */
public class JobCancelledException extends RuntimeException {

    private static final long serialVersionUID = 42L;

    public JobCancelledException(String reason) {
        super(reason);
    }

}
