package com.xxl.job.lite.sample;

import com.xxl.job.lite.executor.impl.XxlJobSimpleExecutor;
import com.xxl.job.lite.sample.config.FrameLessXxlJobConfig;
import com.xxl.job.lite.sample.jobhandler.SampleXxlJob;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.concurrent.CountDownLatch;

/**
 * 不依赖任何框架的执行器示例，进程收到中断或终止信号时停止执行器
 */
@Slf4j
public class FramelessApplication {

    public static void main(String[] args) {
        try {
            FrameLessXxlJobConfig config = FrameLessXxlJobConfig.load(FrameLessXxlJobConfig.DEFAULT_CONFIG_FILE);
            XxlJobSimpleExecutor executor = config.buildExecutor(Collections.singletonList(new SampleXxlJob()));
            executor.start();
            executor.registerShutdownHook();

            // 主线程一直等待，由关闭钩子停止执行器
            new CountDownLatch(1).await();
        } catch (InterruptedException e) {
            log.info(">>>>>>>>>>> xxl-job sample interrupted.");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error(e.getMessage(), e);
            System.exit(1);
        }
    }
}
