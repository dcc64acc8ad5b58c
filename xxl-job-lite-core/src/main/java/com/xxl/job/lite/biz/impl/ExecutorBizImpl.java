package com.xxl.job.lite.biz.impl;

import com.xxl.job.lite.biz.ExecutorBiz;
import com.xxl.job.lite.biz.model.IdleBeatParam;
import com.xxl.job.lite.biz.model.KillParam;
import com.xxl.job.lite.biz.model.LogParam;
import com.xxl.job.lite.biz.model.LogResult;
import com.xxl.job.lite.biz.model.ReturnT;
import com.xxl.job.lite.biz.model.TriggerParam;
import com.xxl.job.lite.enums.ExecutorBlockStrategyEnum;
import com.xxl.job.lite.executor.XxlJobExecutor;
import com.xxl.job.lite.handler.IJobHandler;
import com.xxl.job.lite.log.XxlJobFileAppender;
import com.xxl.job.lite.thread.JobThread;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.util.Date;
import java.util.concurrent.RejectedExecutionException;

/**
 * 该类就是在执行器端处理调度中心请求的类，阻塞策略也是在这里生效的
 */
@Slf4j
public class ExecutorBizImpl implements ExecutorBiz {

    private final XxlJobExecutor executor;

    public ExecutorBizImpl(XxlJobExecutor executor) {
        this.executor = executor;
    }

    @Override
    public ReturnT<String> beat() {
        return ReturnT.SUCCESS;
    }

    @Override
    public ReturnT<String> idleBeat(IdleBeatParam idleBeatParam) {
        // 任务表中有这个定时任务，说明执行器正在执行它
        if (executor.loadJobThread(idleBeatParam.getJobId()) != null) {
            return new ReturnT<>(ReturnT.FAIL_CODE, "job is running");
        }
        return ReturnT.SUCCESS;
    }

    @Override
    public ReturnT<String> run(TriggerParam triggerParam) {
        int jobId = triggerParam.getJobId();
        long logId = triggerParam.getLogId();

        // 同一次调度被重复触发，不管是什么阻塞策略都直接失败。
        // 登记在任务进任务表之前就完成，连续两次相同的调度也只会接收一次
        if (!executor.acceptTrigger(jobId, logId)) {
            return new ReturnT<>(ReturnT.FAIL_CODE, "repeate trigger job, duplicate log id:" + logId);
        }

        ReturnT<String> result = admit(triggerParam);
        if (result.getCode() != ReturnT.SUCCESS_CODE) {
            executor.releaseTrigger(logId);
        }
        return result;
    }

    private ReturnT<String> admit(TriggerParam triggerParam) {
        int jobId = triggerParam.getJobId();
        long logId = triggerParam.getLogId();

        // 任务表中正在执行的旧任务
        JobThread jobThread = executor.loadJobThread(jobId);

        // 得到定时任务的阻塞策略，默认是单机串行
        ExecutorBlockStrategyEnum blockStrategy = ExecutorBlockStrategyEnum.match(
                triggerParam.getExecutorBlockStrategy(), ExecutorBlockStrategyEnum.SERIAL_EXECUTION);
        if (ExecutorBlockStrategyEnum.DISCARD_LATER == blockStrategy/*丢弃后续调度*/) {
            if (jobThread != null) {
                log.info(">>>>>>>>>>> xxl-job [{}:{}] is still running", jobId, jobThread.getLogId());
                return new ReturnT<>(ReturnT.FAIL_CODE, "block strategy effect：" + ExecutorBlockStrategyEnum.DISCARD_LATER.getTitle()
                        + ", a job of same id is already running");
            }
        } else if (ExecutorBlockStrategyEnum.COVER_EARLY == blockStrategy/*覆盖之前调度*/) {
            // 旧任务不执行了，终止之后直接执行这个新的调度
            if (jobThread != null) {
                executor.removeJobThread(jobThread, "block strategy effect：" + ExecutorBlockStrategyEnum.COVER_EARLY.getTitle());
            }
        }

        // 根据名字找到定时任务的执行实体，找不到就不创建任务
        IJobHandler jobHandler = executor.loadJobHandler(triggerParam.getExecutorHandler());
        if (jobHandler == null) {
            return new ReturnT<>(ReturnT.FAIL_CODE, "job handler [" + triggerParam.getExecutorHandler() + "] not found.");
        }

        // 创建新的任务异步执行，串行执行的等待也在任务线程中进行，这里立即返回
        JobThread newJobThread = new JobThread(executor, triggerParam, jobHandler);
        try {
            executor.submitJobThread(newJobThread);
        } catch (RejectedExecutionException e) {
            log.warn(">>>>>>>>>>> xxl-job [{}:{}] trigger rejected, executor is stopping.", jobId, logId);
            return new ReturnT<>(ReturnT.FAIL_CODE, "executor is stopping.");
        }
        log.info(">>>>>>>>>>> xxl-job [{}:{}] trigger job, handler:{}, blockStrategy:{}", jobId, logId,
                triggerParam.getExecutorHandler(), blockStrategy);
        return ReturnT.SUCCESS;
    }

    @Override
    public ReturnT<String> kill(KillParam killParam) {
        // 任务存在就终止并移除，不存在也返回成功
        JobThread jobThread = executor.removeJobThread(killParam.getJobId(), "scheduling center kill job.");
        if (jobThread != null) {
            log.info(">>>>>>>>>>> xxl-job [{}:{}] job killed.", jobThread.getJobId(), jobThread.getLogId());
            return ReturnT.SUCCESS;
        }
        return new ReturnT<>(ReturnT.SUCCESS_CODE, "job thread already killed.");
    }

    @Override
    public ReturnT<LogResult> log(LogParam logParam) {
        // 没有开启本地任务日志，返回固定的结果
        XxlJobFileAppender fileAppender = executor.getFileAppender();
        if (fileAppender == null) {
            return new ReturnT<>(LogResult.notAvailable());
        }

        String logFileName = fileAppender.findLogFileName(new Date(logParam.getLogDateTim()), logParam.getLogId());
        if (!new File(logFileName).exists()) {
            return new ReturnT<>(LogResult.notAvailable());
        }

        LogResult logResult = XxlJobFileAppender.readLog(logFileName, logParam.getFromLineNum());
        // 这次调度不在任务表中了，日志就不会再增加
        logResult.setEnd(!executor.isRunningLog(logParam.getLogId()));
        return new ReturnT<>(logResult);
    }
}
