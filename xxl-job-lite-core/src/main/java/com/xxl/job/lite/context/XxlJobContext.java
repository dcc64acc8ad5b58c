package com.xxl.job.lite.context;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 定时任务的上下文，每次调度创建一个，同时也是这次执行的取消令牌。
 * <p>
 * 任务被终止或者超时的时候，上下文被取消：取消原因被记录下来，等待取消的线程被唤醒，
 * 正在执行任务的线程被中断一次。中断只是通知，任务方法要自己检查取消状态并尽快返回，
 * 执行器不会强行停止线程。
 * </p>
 * 执行任务的线程会把上下文放到线程本地变量中，任务方法里可以通过 {@link XxlJobHelper} 取到。
 */
@Getter
public class XxlJobContext {

    // 200是成功，500是失败
    public static final int HANDLE_CODE_SUCCESS = 200;
    public static final int HANDLE_CODE_FAIL = 500;

    // ---------------------- base info ----------------------

    private final int jobId;

    private final long logId;

    private final String jobParam;

    // ---------------------- for log ----------------------

    private final String jobLogFileName;

    // ---------------------- for shard ----------------------

    private final int shardIndex;
    private final int shardTotal;

    // ---------------------- for cancel ----------------------

    @Getter(AccessLevel.NONE)
    private final CountDownLatch cancelLatch = new CountDownLatch(1);
    private volatile String cancelReason;
    // 正在执行任务方法的线程，取消的时候中断它，只在同步块中读写
    @Getter(AccessLevel.NONE)
    private Thread runner;


    public XxlJobContext(int jobId, long logId, String jobParam, String jobLogFileName, int shardIndex, int shardTotal) {
        this.jobId = jobId;
        this.logId = logId;
        this.jobParam = jobParam;
        this.jobLogFileName = jobLogFileName;
        this.shardIndex = shardIndex;
        this.shardTotal = shardTotal;
    }

    public boolean isCancelled() {
        return cancelReason != null;
    }

    /**
     * 已经被取消就抛出 {@link JobCancelledException}，任务方法可以在循环里调用
     */
    public void checkCancelled() {
        String reason = cancelReason;
        if (reason != null) {
            throw new JobCancelledException(reason);
        }
    }

    /**
     * 等待上下文被取消，最多等待timeout
     *
     * @return 被取消返回true，等待超时返回false
     */
    public boolean awaitCancellation(long timeout, TimeUnit unit) throws InterruptedException {
        return cancelLatch.await(timeout, unit);
    }

    /**
     * 取消上下文，只有第一次调用生效
     *
     * @return 本次调用是否真正取消了上下文
     */
    public boolean cancel(String reason) {
        synchronized (this) {
            if (cancelReason != null) {
                return false;
            }
            cancelReason = reason != null ? reason : "job cancelled";
            if (runner != null) {
                runner.interrupt();
            }
        }
        cancelLatch.countDown();
        return true;
    }

    /**
     * 执行任务方法之前绑定当前线程
     */
    void bindRunner(Thread thread) {
        synchronized (this) {
            runner = thread;
        }
    }

    /**
     * 任务方法返回之后解绑，并清掉可能残留的中断标记，线程池的线程还要接着用
     */
    void unbindRunner() {
        synchronized (this) {
            runner = null;
        }
        Thread.interrupted();
    }

    // ---------------------- tool ----------------------

    /*
    执行任务的线程把上下文存到这里，任务方法里创建的子线程也能拿到。
    线程池的线程会被复用，所以任务执行完一定要调用remove。
     */
    private static final InheritableThreadLocal<XxlJobContext> contextHolder = new InheritableThreadLocal<>();

    /**
     * 绑定到当前线程：放入线程本地变量，取消时中断当前线程
     */
    public static void setXxlJobContext(XxlJobContext xxlJobContext) {
        contextHolder.set(xxlJobContext);
        xxlJobContext.bindRunner(Thread.currentThread());
    }

    public static XxlJobContext getXxlJobContext() {
        return contextHolder.get();
    }

    public static void removeXxlJobContext() {
        XxlJobContext xxlJobContext = contextHolder.get();
        contextHolder.remove();
        if (xxlJobContext != null) {
            xxlJobContext.unbindRunner();
        }
    }
}
