package com.xxl.job.lite.thread;

import com.xxl.job.lite.util.DateUtil;
import com.xxl.job.lite.util.FileUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.text.ParseException;
import java.util.Calendar;
import java.util.Date;
import java.util.concurrent.TimeUnit;

/**
 * Job日志清除线程，每隔cleanupInterval毫秒删除一次过期的日期目录
 */
@Slf4j
public class JobLogFileCleanThread {

    private final String logBasePath;
    private final int logRetentionDays;
    private final long cleanupInterval;

    // 日志清除工作线程
    private Thread localThread;
    private volatile boolean toStop = false;

    public JobLogFileCleanThread(String logBasePath, int logRetentionDays, long cleanupInterval) {
        this.logBasePath = logBasePath;
        this.logRetentionDays = logRetentionDays;
        this.cleanupInterval = cleanupInterval;
    }

    public void start() {
        // 保留天数小于1天就不清理了
        if (logRetentionDays < 1) {
            return;
        }

        localThread = new Thread(() -> {
            while (!toStop) {
                try {
                    cleanExpiredLogs(new Date());
                } catch (Exception e) {
                    if (!toStop) {
                        log.error(e.getMessage(), e);
                    }
                }

                try {
                    if (!toStop) {
                        TimeUnit.MILLISECONDS.sleep(cleanupInterval);
                    }
                } catch (InterruptedException e) {
                    if (!toStop) {
                        log.error(e.getMessage(), e);
                    }
                }
            }

            log.info(">>>>>>>>>>> xxl-job, executor JobLogFileCleanThread thread destroy.");
        });

        localThread.setDaemon(true);
        localThread.setName("xxl-job, executor JobLogFileCleanThread");
        localThread.start();
    }

    /**
     * 日志目录下的子目录名就是调度日期，距今达到保留天数就删除
     *
     * @return 删除的目录个数
     */
    int cleanExpiredLogs(Date now) {
        File[] childDirs = new File(logBasePath).listFiles();
        if (childDirs == null || childDirs.length == 0) {
            return 0;
        }

        Calendar todayCal = Calendar.getInstance();
        todayCal.setTime(now);
        todayCal.set(Calendar.HOUR_OF_DAY, 0);
        todayCal.set(Calendar.MINUTE, 0);
        todayCal.set(Calendar.SECOND, 0);
        todayCal.set(Calendar.MILLISECOND, 0);
        // 日期不晚于这一天的目录都过期了
        todayCal.add(Calendar.DAY_OF_MONTH, -logRetentionDays);
        Date expireDate = todayCal.getTime();

        int deleted = 0;
        for (File childFile : childDirs) {
            if (!childFile.isDirectory()) {
                continue;
            }
            if (!childFile.getName().contains("-")) {
                continue;
            }

            Date logFileCreateDate;
            try {
                logFileCreateDate = DateUtil.parseDate(childFile.getName());
            } catch (ParseException e) {
                log.warn(">>>>>>>>>>> xxl-job, skip unknown log dir:{}", childFile.getName());
                continue;
            }

            if (!logFileCreateDate.after(expireDate)) {
                if (FileUtil.deleteRecursively(childFile)) {
                    deleted++;
                }
            }
        }
        return deleted;
    }

    public void toStop() {
        toStop = true;
        if (localThread == null) {
            return;
        }
        localThread.interrupt();
        try {
            localThread.join();
        } catch (InterruptedException e) {
            log.error(e.getMessage(), e);
        }
    }
}
