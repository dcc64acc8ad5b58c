package com.xxl.job.lite.thread;

import com.xxl.job.lite.biz.model.TriggerParam;
import com.xxl.job.lite.context.JobCancelledException;
import com.xxl.job.lite.context.XxlJobContext;
import com.xxl.job.lite.executor.XxlJobExecutor;
import com.xxl.job.lite.handler.IJobHandler;
import com.xxl.job.lite.handler.JobParam;
import com.xxl.job.lite.log.XxlJobFileAppender;
import com.xxl.job.lite.util.DateUtil;
import com.xxl.job.lite.util.FormatUtil;
import com.xxl.job.lite.util.ThrowableUtil;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Date;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 一次调度对应一个JobThread对象，它就是执行器任务表里存放的"正在执行的任务"。
 * <p>
 * JobThread由执行器的任务线程池执行，执行之前先等待：任务表里还有同一个jobId的旧任务，
 * 就每隔一段时间看一次，直到旧任务被移除，再把自己放进任务表，然后执行任务方法。这样同一
 * 个jobId的任务就是串行执行的，但并没有真正的队列，等待的JobThread不在任务表中。
 * </p>
 * 执行结果放进只能完成一次的done里，由执行器的监听线程取走，再回调给调度中心。
 * 一个JobThread只执行一次，同一个jobId的下一次调度会创建新的JobThread。
 */
@Slf4j
@Getter
public class JobThread implements Runnable {

    @Getter(AccessLevel.NONE)
    private final XxlJobExecutor executor;

    private final int jobId;
    private final long logId;
    private final long logDateTime;
    // JobHandler的名字和注册表中的执行单元，JobThread不拥有它
    private final String handlerName;
    private final IJobHandler handler;
    private final JobParam param;
    // 超时时间，秒，0表示不超时
    private final int timeout;

    // 上下文，也是这次执行的取消令牌
    private final XxlJobContext context;

    @Getter(AccessLevel.NONE)
    private final CompletableFuture<Void> done = new CompletableFuture<>();

    private volatile long startTime;
    private volatile long endTime;

    public JobThread(XxlJobExecutor executor, TriggerParam triggerParam, IJobHandler handler) {
        this.executor = executor;
        this.jobId = triggerParam.getJobId();
        this.logId = triggerParam.getLogId();
        this.logDateTime = triggerParam.getLogDateTime();
        this.handlerName = triggerParam.getExecutorHandler();
        this.handler = handler;
        this.param = new JobParam(
                triggerParam.getExecutorParams(),
                triggerParam.getBroadcastIndex(),
                triggerParam.getBroadcastTotal());
        this.timeout = triggerParam.getExecutorTimeout();

        // 开启了本地日志文件，就先把这次调度的日志文件名定下来
        XxlJobFileAppender fileAppender = executor.getFileAppender();
        String logFileName = fileAppender != null
                ? fileAppender.makeLogFileName(new Date(logDateTime), logId)
                : null;
        this.context = new XxlJobContext(jobId, logId, param.getParams(), logFileName,
                param.getShardIndex(), param.getShardTotal());
    }

    @Override
    public void run() {
        try {
            waitForTurn();
        } catch (InterruptedException e) {
            done.completeExceptionally(new JobCancelledException("job not executed, executor is stopping."));
            return;
        } catch (JobCancelledException e) {
            done.completeExceptionally(e);
            return;
        }

        log.info(">>>>>>>>>>> xxl-job [{}:{}] job starts, handler:{}", jobId, logId, handlerName);

        // 设置了超时时间，到时间就取消上下文
        ScheduledFuture<?> timeoutFuture = timeout > 0 ? executor.scheduleTimeout(context, timeout) : null;

        Throwable error = null;
        XxlJobContext.setXxlJobContext(context);
        startTime = System.currentTimeMillis();
        try {
            appendJobLog("----------- xxl-job job execute start -----------");
            appendJobLog("----------- id=" + jobId + " logId=" + logId + " handler=" + handlerName + " params=" + param.getParams());

            handler.init();
            try {
                // 在进入任务方法之前就已经被kill了，就不执行了
                context.checkCancelled();
                handler.execute(context, param);
            } finally {
                try {
                    handler.destroy();
                } catch (Throwable e) {
                    log.error(e.getMessage(), e);
                }
            }
        } catch (Throwable e) {
            error = e;
        } finally {
            endTime = System.currentTimeMillis();
            if (timeoutFuture != null) {
                timeoutFuture.cancel(false);
            }
            if (error == null) {
                appendJobLog("----------- xxl-job job execute end(finish) ----------- job success");
            } else {
                appendJobLog("----------- xxl-job job execute end(error) ----------- job failed: " + ThrowableUtil.toString(error));
            }
            XxlJobContext.removeXxlJobContext();
        }

        if (error == null) {
            done.complete(null);
        } else {
            done.completeExceptionally(error);
        }
    }

    /**
     * 任务表中还有同一个jobId的任务，就每隔serialWaitInterval毫秒看一次，
     * 直到能把自己放进任务表为止
     */
    private void waitForTurn() throws InterruptedException {
        long waitStart = System.currentTimeMillis();
        while (true) {
            if (executor.isToStop()) {
                throw new JobCancelledException("job not executed, executor is stopping.");
            }
            if (context.isCancelled()) {
                throw new JobCancelledException(context.getCancelReason() + " [job not executed, killed.]");
            }
            if (executor.registJobThread(this)) {
                return;
            }
            TimeUnit.MILLISECONDS.sleep(executor.getSerialWaitInterval());
            log.info(">>>>>>>>>>> xxl-job [{}:{}] waiting for old job to finish, time elapsed: {}",
                    jobId, logId, FormatUtil.readableDuration(Duration.ofMillis(System.currentTimeMillis() - waitStart)));
        }
    }

    private void appendJobLog(String line) {
        String logFileName = context.getJobLogFileName();
        if (logFileName != null) {
            XxlJobFileAppender.appendLog(logFileName, DateUtil.formatDateTime(new Date()) + " " + line);
        }
    }

    /**
     * 终止任务：取消上下文并中断正在执行任务方法的线程，不等待任务方法返回
     */
    public void toStop(String stopReason) {
        if (context.cancel(stopReason)) {
            log.info(">>>>>>>>>>> xxl-job [{}:{}] job is stopped, reason:{}", jobId, logId, stopReason);
        }
    }

    /**
     * 阻塞直到任务执行完成
     *
     * @return 执行成功返回null，执行失败返回异常
     */
    public Throwable awaitResult() throws InterruptedException {
        try {
            done.get();
            return null;
        } catch (ExecutionException e) {
            return e.getCause();
        }
    }

    public Duration getDuration() {
        if (startTime == 0 || endTime == 0) {
            return Duration.ZERO;
        }
        return FormatUtil.truncateDuration(Duration.ofMillis(endTime - startTime));
    }

}
