package com.xxl.job.lite.sample.jobhandler;

import com.xxl.job.lite.context.XxlJobContext;
import com.xxl.job.lite.context.XxlJobHelper;
import com.xxl.job.lite.handler.JobParam;
import com.xxl.job.lite.handler.annotation.XxlJob;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;

/**
 * 定时任务示例。
 * 开发步骤：
 * 1、在对象中写任务方法，方法上加 "@XxlJob(value="自定义jobhandler名称", init = "JobHandler初始化方法", destroy = "JobHandler销毁方法")"，
 *    "value" 对应的是调度中心新建任务的 JobHandler 属性的值；
 * 2、任务日志：通过 "XxlJobHelper.log" 打印执行日志；
 * 3、任务结果：正常返回就是成功，抛出异常就是失败；
 * 4、耗时的任务要检查 "XxlJobContext#isCancelled"，被终止或者超时的时候尽快返回。
 */
@Slf4j
public class SampleXxlJob {

    /**
     * 1、简单任务示例
     */
    @XxlJob("demoJobHandler")
    public void demoJobHandler(String params) {
        XxlJobHelper.log("XXL-JOB, Hello World. params:{}", params);
    }

    /**
     * 2、分片广播任务
     */
    @XxlJob("shardingJobHandler")
    public void shardingJobHandler(JobParam param) {
        int shardIndex = param.getShardIndex();
        int shardTotal = param.getShardTotal();

        XxlJobHelper.log("分片参数：当前分片序号 = {}, 总分片数 = {}", shardIndex, shardTotal);
        for (int i = 0; i < shardTotal; i++) {
            if (i == shardIndex) {
                XxlJobHelper.log("第 {} 片, 命中分片开始处理", i);
            } else {
                XxlJobHelper.log("第 {} 片, 忽略", i);
            }
        }
    }

    /**
     * 3、耗时任务，每秒一步，被终止或者超时的时候结束
     */
    @XxlJob(value = "longRunningJobHandler", init = "init", destroy = "destroy")
    public void longRunningJobHandler(XxlJobContext context, JobParam param) throws Exception {
        int steps = parseSteps(param.getParams());
        for (int i = 1; i <= steps; i++) {
            XxlJobHelper.log("beat at step {}/{}", i, steps);
            if (context.awaitCancellation(1, TimeUnit.SECONDS)) {
                XxlJobHelper.log("job cancelled at step {}, reason:{}", i, context.getCancelReason());
                context.checkCancelled();
            }
        }
    }

    static int parseSteps(String params) {
        if (params == null || params.trim().isEmpty()) {
            return 5;
        }
        return Integer.parseInt(params.trim());
    }

    public void init() {
        log.info("longRunningJobHandler init");
    }

    public void destroy() {
        log.info("longRunningJobHandler destroy");
    }
}
