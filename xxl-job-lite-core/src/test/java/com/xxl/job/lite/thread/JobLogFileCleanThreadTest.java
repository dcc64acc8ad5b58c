package com.xxl.job.lite.thread;

import com.xxl.job.lite.util.DateUtil;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Calendar;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobLogFileCleanThreadTest {

    @TempDir
    Path logDir;

    private File dayDir(Date now, int daysAgo) throws Exception {
        Calendar cal = Calendar.getInstance();
        cal.setTime(now);
        cal.add(Calendar.DAY_OF_MONTH, -daysAgo);
        File dir = logDir.resolve(DateUtil.formatDate(cal.getTime())).toFile();
        assertTrue(dir.mkdirs());
        Files.write(dir.toPath().resolve("1.log"), "x".getBytes());
        return dir;
    }

    @Test
    void deletesOnlyExpiredDateDirectories() throws Exception {
        Date now = new Date();
        File today = dayDir(now, 0);
        File sixDaysAgo = dayDir(now, 6);
        File sevenDaysAgo = dayDir(now, 7);
        File thirtyDaysAgo = dayDir(now, 30);
        File other = logDir.resolve("not-a-date").toFile();
        assertTrue(other.mkdirs());

        int deleted = new JobLogFileCleanThread(logDir.toString(), 7, 1000).cleanExpiredLogs(now);

        assertEquals(2, deleted);
        assertTrue(today.exists());
        assertTrue(sixDaysAgo.exists());
        assertFalse(sevenDaysAgo.exists());
        assertFalse(thirtyDaysAgo.exists());
        assertTrue(other.exists());
    }

    @Test
    void emptyLogDirectory() {
        assertEquals(0, new JobLogFileCleanThread(logDir.resolve("missing").toString(), 7, 1000).cleanExpiredLogs(new Date()));
    }
}
