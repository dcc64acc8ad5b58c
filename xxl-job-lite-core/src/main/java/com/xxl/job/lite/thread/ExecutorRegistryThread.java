package com.xxl.job.lite.thread;

import com.xxl.job.lite.biz.AdminBiz;
import com.xxl.job.lite.biz.model.RegistryParam;
import com.xxl.job.lite.biz.model.ReturnT;
import com.xxl.job.lite.enums.RegistryConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 执行器注册线程。
 * 调度中心不会主动检查执行器是否存活，所以执行器每隔registryInterval毫秒重新注册一次，这就是心跳。
 * 线程停止的时候向调度中心发送一次注销请求。
 */
@Slf4j
public class ExecutorRegistryThread {

    private final List<AdminBiz> adminBizList;
    @Getter
    private final RegistryParam registryParam;
    private final long registryInterval;

    // 将执行器注册到调度中心的线程，也是真正干活的线程
    private Thread registryThread;
    // 线程终止标志
    private volatile boolean toStop = false;

    public ExecutorRegistryThread(List<AdminBiz> adminBizList, String appname, String address, long registryInterval) {
        this.adminBizList = adminBizList;
        this.registryParam = new RegistryParam(RegistryConfig.RegistType.EXECUTOR.name(), appname, address);
        this.registryInterval = registryInterval;
    }

    public void start() {
        // 对appName判空，这个就是执行器要记录在调度中心的名称
        if (registryParam.getRegistryKey() == null || registryParam.getRegistryKey().trim().isEmpty()) {
            log.warn(">>>>>>>>>>> xxl-job, executor registry config fail, appname is null.");
            return;
        }

        if (adminBizList == null || adminBizList.isEmpty()) {
            log.warn(">>>>>>>>>>> xxl-job, executor registry config fail, adminAddresses is null.");
            return;
        }

        registryThread = new Thread(() -> {
            // ====== 执行器注册 ======
            while (!toStop) {
                try {
                    registry();
                } catch (Exception e) {
                    if (!toStop) {
                        log.error(e.getMessage(), e);
                    }
                }

                try {
                    if (!toStop) {
                        TimeUnit.MILLISECONDS.sleep(registryInterval);
                    }
                } catch (InterruptedException e) {
                    if (!toStop) {
                        log.warn(">>>>>>>>>>> xxl-job, executor registry thread interrupted, error msg:{}", e.getMessage());
                    }
                }
            }

            // ====== 执行器注销 ======
            try {
                registryRemove();
            } catch (Exception e) {
                log.error(e.getMessage(), e);
            }

            log.info(">>>>>>>>>>> xxl-job, executor registry thread destroy.");
        });
        registryThread.setDaemon(true);
        registryThread.setName("xxl-job, executor ExecutorRegistryThread");
        registryThread.start();
    }

    /**
     * 注册 => {调度中心根地址}/api/registry，成功一个调度中心就结束
     */
    private void registry() {
        for (AdminBiz adminBiz : adminBizList) {
            try {
                ReturnT<String> registryResult = adminBiz.registry(registryParam);
                if (registryResult != null && ReturnT.SUCCESS_CODE == registryResult.getCode()) {
                    log.debug(">>>>>>>>>>> xxl-job registry success, registryParam:{}, registryResult:{}", registryParam, registryResult);
                    return;
                }
                // 注册失败了，就找下一个调度中心继续注册
                log.info(">>>>>>>>>>> xxl-job registry fail, registryParam:{}, registryResult:{}", registryParam, registryResult);
            } catch (Exception e) {
                log.info(">>>>>>>>>>> xxl-job registry error, registryParam:{}", registryParam, e);
            }
        }
    }

    /**
     * 注销 => {调度中心根地址}/api/registryRemove，尽力而为，失败只记录日志
     */
    private void registryRemove() {
        for (AdminBiz adminBiz : adminBizList) {
            try {
                ReturnT<String> registryResult = adminBiz.registryRemove(registryParam);
                if (registryResult != null && ReturnT.SUCCESS_CODE == registryResult.getCode()) {
                    log.info(">>>>>>>>>>> xxl-job registry-remove success, registryParam:{}, registryResult:{}", registryParam, registryResult);
                    return;
                }
                log.info(">>>>>>>>>>> xxl-job registry-remove fail, registryParam:{}, registryResult:{}", registryParam, registryResult);
            } catch (Exception e) {
                log.info(">>>>>>>>>>> xxl-job registry-remove error, registryParam:{}", registryParam, e);
            }
        }
    }

    public void toStop() {
        toStop = true;
        if (registryThread != null) {
            // 中断注册线程，然后等它发送完注销请求
            registryThread.interrupt();
            try {
                registryThread.join();
            } catch (InterruptedException e) {
                log.error(e.getMessage(), e);
            }
        }
    }
}
