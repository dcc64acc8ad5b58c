package com.xxl.job.lite.handler;

import com.xxl.job.lite.context.XxlJobContext;

/**
 * 定时任务的执行单元，按名字注册到执行器中。
 * <p>
 * 正常返回就是执行成功，抛出异常就是执行失败，异常信息会回调给调度中心。
 * 任务被终止或者超时的时候，执行器只会取消context并中断执行任务的线程，
 * 不会强行停止线程，所以耗时的任务需要自己检查 {@link XxlJobContext#isCancelled()}
 * 或者调用 {@link XxlJobContext#checkCancelled()}。
 * </p>
 */
@FunctionalInterface
public interface IJobHandler {

	/**
	 * 每次执行前调用
	 */
	default void init() throws Exception {
		// do something
	}

	void execute(XxlJobContext context, JobParam param) throws Exception;

	/**
	 * 每次执行后调用，不管成功还是失败
	 */
	default void destroy() throws Exception {
		// do something
	}
}
