package com.xxl.job.lite.sample.jobhandler;

import com.xxl.job.lite.context.JobCancelledException;
import com.xxl.job.lite.context.XxlJobContext;
import com.xxl.job.lite.handler.JobParam;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SampleXxlJobTest {

    private final SampleXxlJob sampleXxlJob = new SampleXxlJob();

    @Test
    void stepsDefaultToFive() {
        assertEquals(5, SampleXxlJob.parseSteps(null));
        assertEquals(5, SampleXxlJob.parseSteps(" "));
        assertEquals(3, SampleXxlJob.parseSteps("3"));
    }

    @Test
    void shardingHandlerRunsOutsideExecutor() {
        assertDoesNotThrow(() -> sampleXxlJob.shardingJobHandler(new JobParam(null, 1, 3)));
    }

    @Test
    void longRunningHandlerStopsWhenCancelled() {
        XxlJobContext context = new XxlJobContext(1, 1, "60", null, 0, 1);
        context.cancel("scheduling center kill job.");

        JobCancelledException e = assertThrows(JobCancelledException.class,
                () -> sampleXxlJob.longRunningJobHandler(context, new JobParam("60", 0, 1)));
        assertEquals("scheduling center kill job.", e.getMessage());
    }
}
