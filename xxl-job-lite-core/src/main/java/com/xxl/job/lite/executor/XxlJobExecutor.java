package com.xxl.job.lite.executor;

import com.xxl.job.lite.biz.AdminBiz;
import com.xxl.job.lite.biz.client.AdminBizClient;
import com.xxl.job.lite.biz.impl.ExecutorBizImpl;
import com.xxl.job.lite.biz.model.HandleCallbackParam;
import com.xxl.job.lite.context.XxlJobContext;
import com.xxl.job.lite.enums.RegistryConfig;
import com.xxl.job.lite.handler.IJobHandler;
import com.xxl.job.lite.handler.annotation.XxlJob;
import com.xxl.job.lite.handler.impl.MethodJobHandler;
import com.xxl.job.lite.log.XxlJobFileAppender;
import com.xxl.job.lite.server.EmbedServer;
import com.xxl.job.lite.thread.ExecutorRegistryThread;
import com.xxl.job.lite.thread.JobLogFileCleanThread;
import com.xxl.job.lite.thread.JobThread;
import com.xxl.job.lite.thread.TriggerCallbackThread;
import com.xxl.job.lite.util.IpUtil;
import com.xxl.job.lite.util.NetUtil;
import com.xxl.job.lite.util.ThrowableUtil;
import com.xxl.job.lite.util.XxlJobRemotingUtil;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 执行器启动的入口类。XxlJobSpringExecutor和XxlJobSimpleExecutor先注册好JobHandler，再调用这里的#start方法，
 * 真正启动执行器组件。
 * <p>
 * 执行器这一端执行定时任务的模式是这样的：内嵌的Netty服务器接收调度中心发送过来的请求，交给ExecutorBizImpl处理，
 * ExecutorBizImpl根据阻塞策略决定这次调度是否执行。每一次调度都会创建一个新的JobThread，交给任务线程池执行，
 * 同时给它开启一个监听任务：JobThread执行结束之后，监听任务把它从任务表中移除，然后把执行结果放进回调队列，
 * 由回调线程统一发送给调度中心。
 * </p>
 * 同一个jobId在任务表中最多只有一个JobThread，后来的JobThread要等任务表中的旧任务被移除之后才能执行，
 * 这样就保证了同一个定时任务不会并发执行。
 */
@Slf4j
@Setter
public class XxlJobExecutor {

    // 回调信息中执行结果的最大长度
    public static final int MAX_HANDLE_MSG_LENGTH = 50000;

    // 下面这些成员变量都是执行器的配置，时间单位都是毫秒

    private String appname;                      // 执行器的名称，注册执行器到调度中心的时候，使用的就是这个名称
    private String adminAddresses;               // 调度中心的地址，多个用逗号分隔
    @Getter
    private String accessToken = "default_token"; // TOKEN令牌，这个令牌要和调度中心那一端的令牌配置成一样的
    private String address;                      // 执行器的地址，为空表示使用默认地址http://ip:port/
    private String ip;                           // 执行器的IP地址
    private int port = 9999;                     // 执行器的端口号，小于等于0就从9999开始找一个可用的端口
    private int clientTimeout = 3000;            // 访问调度中心的超时时间
    private int callbackBufferSize = 1024;       // 回调队列的容量
    private long callbackInterval = 1000;        // 回调间隔
    private long registryInterval = RegistryConfig.BEAT_TIMEOUT * 1000L; // 注册间隔，也是执行器的心跳间隔
    private long sizeLimit = XxlJobRemotingUtil.DEFAULT_SIZE_LIMIT; // 响应体超过这个字节数，日志中就不打印了
    private long idleTimeout = 60000;            // Netty连接的读写空闲超时
    private long readTimeout = 15000;            // Netty连接的读空闲超时
    private long writeTimeout = 15000;           // Netty连接的写空闲超时
    private long waitTimeout = 15000;            // 停止服务器时等待处理中的请求的时间
    private String logPath;                      // 任务日志的路径，为空表示不记录本地任务日志
    private int logRetentionDays = 7;            // 任务日志的保留天数
    private long logCleanupInterval = 24L * 60 * 60 * 1000; // 清理过期任务日志的间隔
    @Getter
    private long serialWaitInterval = 1000;      // 串行执行时，等待旧任务结束的检查间隔


    // ---------------------- runtime ----------------------

    @Getter
    @Setter(AccessLevel.NONE)
    private volatile boolean toStop = false;

    @Getter
    @Setter(AccessLevel.NONE)
    private XxlJobFileAppender fileAppender;

    @Setter(AccessLevel.NONE)
    private ExecutorService jobThreadPool;
    @Setter(AccessLevel.NONE)
    private ExecutorService jobWatchPool;
    @Setter(AccessLevel.NONE)
    private ScheduledExecutorService timeoutScheduler;

    @Getter
    @Setter(AccessLevel.NONE)
    private TriggerCallbackThread triggerCallbackThread;
    @Setter(AccessLevel.NONE)
    private ExecutorRegistryThread executorRegistryThread;
    @Setter(AccessLevel.NONE)
    private JobLogFileCleanThread jobLogFileCleanThread;
    @Setter(AccessLevel.NONE)
    private Thread shutdownHook;


    public void start() throws Exception {
        // 配置了日志路径，才初始化任务日志组件
        if (logPath != null && !logPath.trim().isEmpty()) {
            fileAppender = new XxlJobFileAppender(logPath.trim());
        }

        /*
        初始化访问调度中心的客户端，如果是在集群环境下，可能会有多个调度中心，
        执行器会按顺序访问这些调度中心，成功一个就结束。
         */
        if (adminBizList == null) {
            adminBizList = initAdminBizList(adminAddresses, accessToken);
        }

        // 执行定时任务的线程池、监听执行结果的线程池和超时定时器
        jobThreadPool = Executors.newCachedThreadPool(namedThreadFactory("xxl-job, executor JobThread-"));
        jobWatchPool = Executors.newCachedThreadPool(namedThreadFactory("xxl-job, executor JobWatcher-"));
        timeoutScheduler = Executors.newSingleThreadScheduledExecutor(namedThreadFactory("xxl-job, executor JobTimeout-"));

        // 启动回调执行结果信息给调度中心的组件
        triggerCallbackThread = new TriggerCallbackThread(adminBizList, callbackBufferSize, callbackInterval);
        triggerCallbackThread.start();

        // 该组件的功能是用来清除执行器端的过期日志的
        if (fileAppender != null) {
            jobLogFileCleanThread = new JobLogFileCleanThread(fileAppender.getLogBasePath(), logRetentionDays, logCleanupInterval);
            jobLogFileCleanThread.start();
        }

        // 启动内嵌的Netty服务器，端口绑定失败直接抛出异常，然后把执行器注册到调度中心
        try {
            initEmbedServer();
        } catch (Exception e) {
            log.error(">>>>>>>>>>> xxl-job executor start fail, port:{}", port, e);
            destroy();
            throw e;
        }
    }

    public synchronized void destroy() {
        // 关闭钩子和容器销毁都可能调用，只执行一次
        if (toStop) {
            return;
        }
        toStop = true;

        // 停止内嵌的Netty服务器，不再接收新的请求
        stopEmbedServer();

        // 停止注册线程，停止的时候会从调度中心注销
        if (executorRegistryThread != null) {
            executorRegistryThread.toStop();
        }

        // 终止任务表中还在执行的任务
        for (Map.Entry<Integer, JobThread> item : jobThreadRepository.entrySet()) {
            removeJobThread(item.getValue(), "web container destroy and kill the job.");
        }

        // 中断还在执行或等待的任务线程，然后等监听任务把结果都放进回调队列
        if (jobThreadPool != null) {
            jobThreadPool.shutdownNow();
        }
        if (jobWatchPool != null) {
            jobWatchPool.shutdown();
            try {
                if (!jobWatchPool.awaitTermination(waitTimeout, TimeUnit.MILLISECONDS)) {
                    log.warn(">>>>>>>>>>> xxl-job, job watchers not finished in {} ms.", waitTimeout);
                    jobWatchPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                log.error(e.getMessage(), e);
                jobWatchPool.shutdownNow();
            }
        }

        // 停止回调线程，停止之前会把队列中剩下的回调信息发送出去
        if (triggerCallbackThread != null) {
            triggerCallbackThread.toStop();
        }

        // 停止清除执行器端的过期日志的线程
        if (jobLogFileCleanThread != null) {
            jobLogFileCleanThread.toStop();
        }

        if (timeoutScheduler != null) {
            timeoutScheduler.shutdownNow();
        }

        // 清空缓存jobHandler的Map
        jobHandlerRepository.clear();
        log.info(">>>>>>>>>>> xxl-job executor destroyed.");
    }

    /**
     * 注册JVM关闭钩子，进程收到中断或终止信号退出之前，先把执行器停掉
     */
    public void registerShutdownHook() {
        if (shutdownHook != null) {
            return;
        }
        shutdownHook = new Thread(this::destroy, "xxl-job, executor ShutdownHook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }


    // ========== admin-client (rpc invoker) ==========

    @Getter
    private List<AdminBiz> adminBizList;

    /**
     * 根据配置的调度中心地址，把用来访问调度中心的客户端初始化好
     */
    private List<AdminBiz> initAdminBizList(String adminAddresses, String accessToken) {
        List<AdminBiz> list = new ArrayList<>();
        if (adminAddresses != null && !adminAddresses.trim().isEmpty()) {
            for (String address : adminAddresses.trim().split(",")) {
                if (address != null && !address.trim().isEmpty()) {
                    list.add(new AdminBizClient(address.trim(), accessToken, clientTimeout, sizeLimit));
                }
            }
        }
        return list;
    }


    // ========== executor-server (rpc provider) ==========

    // 内嵌的Netty服务器对象
    @Setter(AccessLevel.NONE)
    private EmbedServer embedServer = null;

    /**
     * 初始化并启动执行器端内嵌的Netty服务器，然后把执行器注册到调度中心
     */
    private void initEmbedServer() throws Exception {
        // 端口号小于等于0，就从9999开始找一个可用的端口
        port = port > 0 ? port : NetUtil.findAvailablePort(9999);
        ip = (ip != null && !ip.trim().isEmpty()) ? ip : IpUtil.getIp();

        // 没有配置执行器地址，就把IP地址和端口号拼接起来，得到默认的执行器地址
        if (address == null || address.trim().isEmpty()) {
            address = "http://{ip_port}/".replace("{ip_port}", IpUtil.getIpPort(ip, port));
        }

        // 校验TOKEN，启动的时候把入站请求的校验方式打印出来
        if (accessToken == null || accessToken.trim().isEmpty()) {
            log.warn(">>>>>>>>>>> xxl-job accessToken is empty, inbound requests are not validated. To ensure system security, please set the accessToken.");
        } else {
            log.info(">>>>>>>>>>> xxl-job inbound requests must carry header {} matching the configured accessToken.",
                    XxlJobRemotingUtil.XXL_JOB_ACCESS_TOKEN);
        }

        embedServer = new EmbedServer(new ExecutorBizImpl(this), accessToken, idleTimeout, readTimeout, writeTimeout);
        embedServer.start(port);

        // 服务器启动成功之后，再把执行器注册到调度中心
        executorRegistryThread = new ExecutorRegistryThread(adminBizList, appname, address, registryInterval);
        executorRegistryThread.start();
    }

    /** 停止内嵌的Netty服务器 */
    private void stopEmbedServer() {
        if (embedServer != null) {
            try {
                embedServer.stop(waitTimeout);
            } catch (Exception e) {
                log.error(e.getMessage(), e);
            }
        }
    }

    public int getPort() {
        return embedServer != null ? embedServer.getPort() : port;
    }

    public String getAddress() {
        return address;
    }


    // ========== job handler repository ==========

    /**
     * 存放IJobHandler对象的本地缓存，key是JobHandler的名字
     */
    private final ConcurrentMap<String, IJobHandler> jobHandlerRepository = new ConcurrentHashMap<>();

    public IJobHandler loadJobHandler(String name) {
        if (name == null) {
            return null;
        }
        return jobHandlerRepository.get(name);
    }

    public IJobHandler registJobHandler(String name, IJobHandler jobHandler) {
        log.info(">>>>>>>>>>> xxl-job register jobhandler success, name:{}, jobHandler:{}", name, jobHandler);
        return jobHandlerRepository.put(name, jobHandler);
    }

    public IJobHandler removeJobHandler(String name) {
        return jobHandlerRepository.remove(name);
    }

    /**
     * 将Bean中被@XxlJob注解标注的方法包装成MethodJobHandler，注册到JobHandler的本地缓存中
     */
    protected void registJobHandler(XxlJob xxlJob, Object bean, Method executeMethod) {
        if (xxlJob == null) {
            return;
        }

        String name = xxlJob.value();
        Class<?> clazz = bean.getClass();
        String methodName = executeMethod.getName();
        if (name.trim().isEmpty()) {
            throw new RuntimeException("xxl-job method-jobhandler name invalid, for[" + clazz + "#" + methodName + "] .");
        }
        if (loadJobHandler(name) != null) {
            throw new RuntimeException("xxl-job jobhandler[" + name + "] naming conflicts.");
        }

        executeMethod.setAccessible(true);

        // 注解中写了初始化方法和销毁方法，每次执行任务方法的前后都会调用
        Method initMethod = null;
        Method destroyMethod = null;
        if (!xxlJob.init().trim().isEmpty()) {
            try {
                initMethod = clazz.getDeclaredMethod(xxlJob.init());
                initMethod.setAccessible(true);
            } catch (NoSuchMethodException e) {
                throw new RuntimeException("xxl-job method-jobhandler initMethod invalid, for[" + clazz + "#" + methodName + "] .");
            }
        }
        if (!xxlJob.destroy().trim().isEmpty()) {
            try {
                destroyMethod = clazz.getDeclaredMethod(xxlJob.destroy());
                destroyMethod.setAccessible(true);
            } catch (NoSuchMethodException e) {
                throw new RuntimeException("xxl-job method-jobhandler destroyMethod invalid, for[" + clazz + "#" + methodName + "] .");
            }
        }

        registJobHandler(name, new MethodJobHandler(bean, executeMethod, initMethod, destroyMethod));
    }


    // ========== job thread repository ==========

    /**
     * 任务表，key是定时任务的ID，value是正在执行这个定时任务的JobThread。
     * 等待执行的JobThread不在这里面。
     */
    private final ConcurrentMap<Integer, JobThread> jobThreadRepository = new ConcurrentHashMap<>();

    /**
     * 把JobThread放进任务表，同一个jobId已经有任务了就放不进去
     *
     * @return 是否放进了任务表
     */
    public boolean registJobThread(JobThread jobThread) {
        return jobThreadRepository.putIfAbsent(jobThread.getJobId(), jobThread) == null;
    }

    /**
     * 根据定时任务ID，获取正在执行的JobThread
     */
    public JobThread loadJobThread(int jobId) {
        return jobThreadRepository.get(jobId);
    }

    /**
     * 终止并移除任务表中的JobThread，不等待任务方法返回
     */
    public JobThread removeJobThread(int jobId, String removeOldReason) {
        JobThread oldJobThread = jobThreadRepository.remove(jobId);
        if (oldJobThread != null) {
            oldJobThread.toStop(removeOldReason);
        }
        return oldJobThread;
    }

    /**
     * 只有任务表中还是这个JobThread时才终止并移除它
     */
    public boolean removeJobThread(JobThread jobThread, String removeOldReason) {
        boolean removed = jobThreadRepository.remove(jobThread.getJobId(), jobThread);
        jobThread.toStop(removeOldReason);
        return removed;
    }

    /**
     * 已经接收、还没有执行结束的调度，key是logId，value是jobId。
     * JobThread要等到任务线程中才进任务表，重复的调度在接收的时候就靠它拦下来。
     */
    private final ConcurrentMap<Long, Integer> acceptedTriggerRepository = new ConcurrentHashMap<>();

    /**
     * 登记一次调度，同一个logId已经登记过就登记不上
     *
     * @return 是否登记成功
     */
    public boolean acceptTrigger(int jobId, long logId) {
        return acceptedTriggerRepository.putIfAbsent(logId, jobId) == null;
    }

    /**
     * 调度被拒绝或者执行结束，释放登记的logId
     */
    public void releaseTrigger(long logId) {
        acceptedTriggerRepository.remove(logId);
    }

    /**
     * 任务表中是否有这次调度正在执行
     */
    public boolean isRunningLog(long logId) {
        for (JobThread jobThread : jobThreadRepository.values()) {
            if (jobThread.getLogId() == logId) {
                return true;
            }
        }
        return false;
    }


    // ========== job execution ==========

    /**
     * 把JobThread交给任务线程池执行，并开启一个监听任务等待执行结果
     */
    public void submitJobThread(JobThread jobThread) {
        jobThreadPool.execute(jobThread);
        jobWatchPool.execute(() -> watch(jobThread));
    }

    /**
     * 超时时间到了就取消上下文
     */
    public ScheduledFuture<?> scheduleTimeout(XxlJobContext context, int timeoutSeconds) {
        return timeoutScheduler.schedule(() -> {
            if (context.cancel("job execute timeout")) {
                log.info(">>>>>>>>>>> xxl-job [{}:{}] job execute timeout, timeout:{}s", context.getJobId(), context.getLogId(), timeoutSeconds);
            }
        }, timeoutSeconds, TimeUnit.SECONDS);
    }

    /**
     * 监听任务：等JobThread执行结束，按身份把它从任务表中移除，再把执行结果放进回调队列
     */
    private void watch(JobThread jobThread) {
        Throwable error;
        try {
            error = jobThread.awaitResult();
        } catch (InterruptedException e) {
            log.warn(">>>>>>>>>>> xxl-job [{}:{}] job watcher interrupted.", jobThread.getJobId(), jobThread.getLogId());
            releaseTrigger(jobThread.getLogId());
            Thread.currentThread().interrupt();
            return;
        }

        // 按身份移除，任务表中已经换成了新的JobThread就不动它
        jobThreadRepository.remove(jobThread.getJobId(), jobThread);
        releaseTrigger(jobThread.getLogId());

        HandleCallbackParam callbackParam = buildCallbackParam(jobThread, error);
        if (error == null) {
            log.info(">>>>>>>>>>> xxl-job [{}:{}] job finished, duration:{}", jobThread.getJobId(), jobThread.getLogId(), jobThread.getDuration());
        } else {
            log.info(">>>>>>>>>>> xxl-job [{}:{}] job failed, msg:{}", jobThread.getJobId(), jobThread.getLogId(), error.getMessage());
        }

        try {
            triggerCallbackThread.pushCallBack(callbackParam);
        } catch (InterruptedException e) {
            log.warn(">>>>>>>>>>> xxl-job [{}:{}] callback dropped, watcher interrupted.", jobThread.getJobId(), jobThread.getLogId());
            Thread.currentThread().interrupt();
        }
    }

    static HandleCallbackParam buildCallbackParam(JobThread jobThread, Throwable error) {
        if (error == null) {
            return new HandleCallbackParam(jobThread.getLogId(), jobThread.getLogDateTime(),
                    XxlJobContext.HANDLE_CODE_SUCCESS, "OK");
        }
        // 被终止或者超时的任务，回调终止原因
        XxlJobContext context = jobThread.getContext();
        String handleMsg = context.isCancelled()
                ? context.getCancelReason()
                : ThrowableUtil.toString(error);
        if (handleMsg.length() > MAX_HANDLE_MSG_LENGTH) {
            handleMsg = handleMsg.substring(0, MAX_HANDLE_MSG_LENGTH);
        }
        return new HandleCallbackParam(jobThread.getLogId(), jobThread.getLogDateTime(),
                XxlJobContext.HANDLE_CODE_FAIL, handleMsg);
    }
}
