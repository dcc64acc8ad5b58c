package com.xxl.job.lite.thread;

import com.xxl.job.lite.biz.AdminBiz;
import com.xxl.job.lite.biz.model.HandleCallbackParam;
import com.xxl.job.lite.biz.model.ReturnT;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * <h1>回调调度中心的线程</h1>
 * 执行完的任务把结果放进有界的回调队列，队列满了放入的一方就阻塞等待。
 * 回调线程每隔callbackInterval毫秒把队列里现有的数据全部取出来，一次性发送给调度中心。
 * 发送失败只记录日志，不重试也不放回队列。
 */
@Slf4j
public class TriggerCallbackThread {

    private final List<AdminBiz> adminBizList;
    private final long callbackInterval;

    /**
     * 要被回调给调度中心的定时任务执行结果的信息，先放在该队列中
     */
    private final LinkedBlockingQueue<HandleCallbackParam> callBackQueue;

    /**
     * 回调线程，就是这个线程把回调信息通过 HTTP 发送给调度中心的
     */
    private Thread triggerCallbackThread;
    private volatile boolean toStop = false;

    /**
     * @param adminBizList      访问调度中心的客户端，可能为空
     * @param callbackBufferSize 回调队列的容量
     * @param callbackInterval  回调间隔，毫秒
     */
    public TriggerCallbackThread(List<AdminBiz> adminBizList, int callbackBufferSize, long callbackInterval) {
        this.adminBizList = adminBizList;
        this.callBackQueue = new LinkedBlockingQueue<>(callbackBufferSize);
        this.callbackInterval = callbackInterval;
    }

    /**
     * <h2>把回调信息放进队列，队列满了就阻塞</h2>
     */
    public void pushCallBack(HandleCallbackParam callback) throws InterruptedException {
        callBackQueue.put(callback);
        log.debug(">>>>>>>>>>> xxl-job, push callback request, logId:{}", callback.getLogId());
    }

    public int getQueueSize() {
        return callBackQueue.size();
    }

    /**
     * <h2>启动回调线程</h2>
     */
    public void start() {
        if (adminBizList == null || adminBizList.isEmpty()) {
            log.warn(">>>>>>>>>>> xxl-job, executor callback config fail, adminAddresses is null, callback will be dropped.");
        }

        triggerCallbackThread = new Thread(() -> {
            while (!toStop) {
                try {
                    flush();
                } catch (Exception e) {
                    if (!toStop) {
                        log.error(e.getMessage(), e);
                    }
                }

                try {
                    if (!toStop) {
                        TimeUnit.MILLISECONDS.sleep(callbackInterval);
                    }
                } catch (InterruptedException e) {
                    if (!toStop) {
                        log.warn(">>>>>>>>>>> xxl-job, executor callback thread interrupted, error msg:{}", e.getMessage());
                    }
                }
            }

            // 退出循环之后，把队列里剩下的数据最后回调一次
            try {
                flush();
            } catch (Exception e) {
                log.error(e.getMessage(), e);
            }
            log.info(">>>>>>>>>>> xxl-job, executor callback thread destroy.");
        });
        triggerCallbackThread.setDaemon(true);
        triggerCallbackThread.setName("xxl-job, executor TriggerCallbackThread");
        triggerCallbackThread.start();
    }

    /**
     * <h2>终止回调线程，等待最后一次回调结束</h2>
     */
    public void toStop() {
        toStop = true;
        if (triggerCallbackThread != null) {
            triggerCallbackThread.interrupt();
            try {
                triggerCallbackThread.join();
            } catch (InterruptedException e) {
                log.error(e.getMessage(), e);
            }
        }
    }

    /**
     * 队列为空什么都不做，否则取出当前所有的数据，作为一批回调
     */
    void flush() {
        if (callBackQueue.isEmpty()) {
            return;
        }
        List<HandleCallbackParam> callbackParamList = new ArrayList<>();
        callBackQueue.drainTo(callbackParamList);
        if (!callbackParamList.isEmpty()) {
            doCallback(callbackParamList);
        }
    }

    /**
     * <h2>回调定时任务的执行信息给调度中心，有多个调度中心时成功一个就结束</h2>
     */
    private void doCallback(List<HandleCallbackParam> callbackParamList) {
        if (adminBizList == null || adminBizList.isEmpty()) {
            log.warn(">>>>>>>>>>> xxl-job job callback dropped, no admin, size:{}", callbackParamList.size());
            return;
        }
        for (AdminBiz adminBiz : adminBizList) {
            try {
                ReturnT<String> callbackResult = adminBiz.callback(callbackParamList);
                if (callbackResult != null && ReturnT.SUCCESS_CODE == callbackResult.getCode()) {
                    log.debug(">>>>>>>>>>> xxl-job job callback finish, size:{}", callbackParamList.size());
                    return;
                }
                log.error(">>>>>>>>>>> xxl-job job callback fail, callbackResult:{}", callbackResult);
            } catch (Exception e) {
                log.error(">>>>>>>>>>> xxl-job job callback error, errorMsg:{}", e.getMessage(), e);
            }
        }
    }

}
