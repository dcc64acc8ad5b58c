package com.xxl.job.lite.context;

import com.xxl.job.lite.log.XxlJobFileAppender;
import com.xxl.job.lite.util.DateUtil;
import com.xxl.job.lite.util.ThrowableUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.FormattingTuple;
import org.slf4j.helpers.MessageFormatter;

import java.util.Date;

/**
 * <h1>任务方法里使用的工具类，从当前线程的上下文中取数据、记录任务日志</h1>
 */
public class XxlJobHelper {

    // ---------------------- base info ----------------------

    public static long getJobId() {
        XxlJobContext xxlJobContext = XxlJobContext.getXxlJobContext();
        if (xxlJobContext == null) {
            return -1;
        }

        return xxlJobContext.getJobId();
    }

    public static String getJobParam() {
        XxlJobContext xxlJobContext = XxlJobContext.getXxlJobContext();
        if (xxlJobContext == null) {
            return null;
        }

        return xxlJobContext.getJobParam();
    }

    /**
     * 当前任务是否已经被终止或者超时
     */
    public static boolean isCancelled() {
        XxlJobContext xxlJobContext = XxlJobContext.getXxlJobContext();
        return xxlJobContext != null && xxlJobContext.isCancelled();
    }

    // ---------------------- for log ----------------------

    public static String getJobLogFileName() {
        XxlJobContext xxlJobContext = XxlJobContext.getXxlJobContext();
        if (xxlJobContext == null) {
            return null;
        }

        return xxlJobContext.getJobLogFileName();
    }

    // ---------------------- for shard ----------------------

    public static int getShardIndex() {
        XxlJobContext xxlJobContext = XxlJobContext.getXxlJobContext();
        if (xxlJobContext == null) {
            return -1;
        }

        return xxlJobContext.getShardIndex();
    }

    public static int getShardTotal() {
        XxlJobContext xxlJobContext = XxlJobContext.getXxlJobContext();
        if (xxlJobContext == null) {
            return -1;
        }

        return xxlJobContext.getShardTotal();
    }

    // ---------------------- tool for log ----------------------

    private static final Logger logger = LoggerFactory.getLogger("xxl-job logger");

    /**
     * <h2>记录任务日志，格式和slf4j一样用{}占位</h2>
     * 开启了本地日志文件就写到这次调度对应的文件里，否则写到"xxl-job logger"
     */
    public static boolean log(String appendLogPattern, Object ... appendLogArguments) {
        FormattingTuple ft = MessageFormatter.arrayFormat(appendLogPattern, appendLogArguments);
        String appendLog = ft.getMessage();
        if (ft.getThrowable() != null) {
            appendLog = appendLog + "\n" + ThrowableUtil.toString(ft.getThrowable());
        }
        // 从栈帧中获得方法的调用信息
        StackTraceElement callInfo = new Throwable().getStackTrace()[1];
        return logDetail(callInfo, appendLog);
    }

    /**
     * <h2>把异常栈记录到任务日志中</h2>
     */
    public static boolean log(Throwable e) {
        String appendLog = ThrowableUtil.toString(e);
        StackTraceElement callInfo = new Throwable().getStackTrace()[1];
        return logDetail(callInfo, appendLog);
    }

    private static boolean logDetail(StackTraceElement callInfo, String appendLog) {
        XxlJobContext xxlJobContext = XxlJobContext.getXxlJobContext();

        String formatAppendLog = DateUtil.formatDateTime(new Date()) + " " +
                "[" + callInfo.getClassName() + "#" + callInfo.getMethodName() + "]" + "-" +
                "[" + callInfo.getLineNumber() + "]" + "-" +
                "[" + Thread.currentThread().getName() + "]" + " " +
                (appendLog != null ? appendLog : "");

        String logFileName = xxlJobContext != null ? xxlJobContext.getJobLogFileName() : null;
        if (logFileName != null && logFileName.trim().length() > 0) {
            XxlJobFileAppender.appendLog(logFileName, formatAppendLog);
            return true;
        } else {
            logger.info(">>>>>>>>>>> {}", formatAppendLog);
            return false;
        }
    }

}
