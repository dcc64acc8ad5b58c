package com.xxl.job.lite.log;

import com.xxl.job.lite.biz.model.LogResult;
import com.xxl.job.lite.util.DateUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.LineNumberReader;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * 任务日志文件的读写都封装在这里。
 * 只有配置了日志路径，执行器才会给每次调度记录一个本地日志文件，目录结构是：
 * <pre>
 * ---/
 * ---/2017-12-25/
 * ---/2017-12-25/639.log
 * ---/2017-12-25/821.log
 * </pre>
 * 日期是调度时间(logDateTime)，文件名是logId。
 */
@Slf4j
public class XxlJobFileAppender {

    @Getter
    private final String logBasePath;

    public XxlJobFileAppender(String logPath) {
        File logPathDir = new File(logPath);
        if (!logPathDir.exists()) {
            logPathDir.mkdirs();
        }
        this.logBasePath = logPathDir.getPath();
    }

    /**
     * 根据调度时间和日志id拼出日志文件名，日期目录不存在就创建
     */
    public String makeLogFileName(Date triggerDate, long logId) {
        File logFilePath = new File(logBasePath, DateUtil.formatDate(triggerDate));
        if (!logFilePath.exists()) {
            logFilePath.mkdirs();
        }
        return logFileName(logFilePath, logId);
    }

    /**
     * 只拼文件名，不创建目录，读日志的时候用
     */
    public String findLogFileName(Date triggerDate, long logId) {
        return logFileName(new File(logBasePath, DateUtil.formatDate(triggerDate)), logId);
    }

    private static String logFileName(File logFilePath, long logId) {
        return logFilePath.getPath()
                .concat(File.separator)
                .concat(String.valueOf(logId))
                .concat(".log");
    }

    /**
     * 追加一行日志到文件中
     */
    public static void appendLog(String logFileName, String appendLog) {
        if (logFileName == null || logFileName.trim().isEmpty()) {
            return;
        }
        File logFile = new File(logFileName);

        if (!logFile.exists()) {
            try {
                logFile.createNewFile();
            } catch (IOException e) {
                log.error(e.getMessage(), e);
                return;
            }
        }

        if (appendLog == null) {
            appendLog = "";
        }
        appendLog += "\r\n";

        try (FileOutputStream fos = new FileOutputStream(logFile, true)) {
            fos.write(appendLog.getBytes(StandardCharsets.UTF_8));
            fos.flush();
        } catch (IOException e) {
            log.error(e.getMessage(), e);
        }
    }

    /**
     * 从fromLineNum行开始读日志，行号从1开始
     */
    public static LogResult readLog(String logFileName, int fromLineNum) {
        if (logFileName == null || logFileName.trim().isEmpty()) {
            return new LogResult(fromLineNum, 0, "readLog fail, logFile not found", true);
        }

        File logFile = new File(logFileName);
        if (!logFile.exists()) {
            return new LogResult(fromLineNum, 0, "readLog fail, logFile not exists", true);
        }

        StringBuilder logContentBuffer = new StringBuilder();
        int toLineNum = 0;
        try (LineNumberReader reader = new LineNumberReader(new InputStreamReader(new FileInputStream(logFile), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                toLineNum = reader.getLineNumber();
                if (toLineNum >= fromLineNum) {
                    logContentBuffer.append(line).append("\n");
                }
            }
        } catch (IOException e) {
            log.error(e.getMessage(), e);
        }

        return new LogResult(fromLineNum, toLineNum, logContentBuffer.toString(), false);
    }

}
