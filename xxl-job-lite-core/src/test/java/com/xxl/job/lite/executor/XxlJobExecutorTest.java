package com.xxl.job.lite.executor;

import com.xxl.job.lite.biz.impl.ExecutorBizImpl;
import com.xxl.job.lite.biz.model.HandleCallbackParam;
import com.xxl.job.lite.biz.model.LogParam;
import com.xxl.job.lite.biz.model.LogResult;
import com.xxl.job.lite.biz.model.TriggerParam;
import com.xxl.job.lite.context.JobCancelledException;
import com.xxl.job.lite.handler.IJobHandler;
import com.xxl.job.lite.handler.annotation.XxlJob;
import com.xxl.job.lite.thread.JobThread;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class XxlJobExecutorTest {

    static class AnnotatedBean {

        @XxlJob(value = "annotated", init = "init", destroy = "destroy")
        public void annotated() {
        }

        @XxlJob(" ")
        public void blankName() {
        }

        @XxlJob(value = "badInit", init = "missing")
        public void badInit() {
        }

        void init() {
        }

        void destroy() {
        }
    }

    private static Method method(String name) throws NoSuchMethodException {
        return AnnotatedBean.class.getMethod(name);
    }

    private static TriggerParam trigger(int jobId, long logId) {
        TriggerParam triggerParam = new TriggerParam();
        triggerParam.setJobId(jobId);
        triggerParam.setLogId(logId);
        triggerParam.setLogDateTime(1700000000000L);
        triggerParam.setExecutorHandler("noop");
        return triggerParam;
    }

    private final XxlJobExecutor executor = new XxlJobExecutor();
    private final IJobHandler noop = (context, param) -> {
    };

    @Test
    void handlerRepository() {
        assertNull(executor.loadJobHandler("noop"));
        assertNull(executor.loadJobHandler(null));

        executor.registJobHandler("noop", noop);
        assertSame(noop, executor.loadJobHandler("noop"));

        assertSame(noop, executor.removeJobHandler("noop"));
        assertNull(executor.loadJobHandler("noop"));
    }

    @Test
    void annotatedMethodRegistration() throws Exception {
        AnnotatedBean bean = new AnnotatedBean();
        Method annotated = method("annotated");
        executor.registJobHandler(annotated.getAnnotation(XxlJob.class), bean, annotated);
        assertNotNull(executor.loadJobHandler("annotated"));

        RuntimeException conflict = assertThrows(RuntimeException.class,
                () -> executor.registJobHandler(annotated.getAnnotation(XxlJob.class), bean, annotated));
        assertEquals("xxl-job jobhandler[annotated] naming conflicts.", conflict.getMessage());

        Method blankName = method("blankName");
        assertThrows(RuntimeException.class,
                () -> executor.registJobHandler(blankName.getAnnotation(XxlJob.class), bean, blankName));

        Method badInit = method("badInit");
        RuntimeException e = assertThrows(RuntimeException.class,
                () -> executor.registJobHandler(badInit.getAnnotation(XxlJob.class), bean, badInit));
        assertTrue(e.getMessage().contains("initMethod invalid"));
    }

    @Test
    void jobTableInsertIfAbsentAndIdentityRemoval() {
        JobThread first = new JobThread(executor, trigger(1, 1), noop);
        JobThread second = new JobThread(executor, trigger(1, 2), noop);

        assertTrue(executor.registJobThread(first));
        assertFalse(executor.registJobThread(second));
        assertTrue(executor.isRunningLog(1));
        assertFalse(executor.isRunningLog(2));

        // 任务表中不是second，不能移除
        assertFalse(executor.removeJobThread(second, "stale"));
        assertSame(first, executor.loadJobThread(1));

        assertSame(first, executor.removeJobThread(1, "kill"));
        assertTrue(first.getContext().isCancelled());
        assertNull(executor.loadJobThread(1));
        assertNull(executor.removeJobThread(1, "kill"));
    }

    @Test
    void triggerIsAcceptedOnceUntilReleased() {
        assertTrue(executor.acceptTrigger(1, 10));
        assertFalse(executor.acceptTrigger(1, 10));
        assertTrue(executor.acceptTrigger(1, 11));

        executor.releaseTrigger(10);
        assertTrue(executor.acceptTrigger(1, 10));
    }

    @Test
    void callbackParamForSuccessFailureAndCancel() {
        JobThread jobThread = new JobThread(executor, trigger(2, 5), noop);

        HandleCallbackParam success = XxlJobExecutor.buildCallbackParam(jobThread, null);
        assertEquals(new HandleCallbackParam(5, 1700000000000L, 200, "OK"), success);

        StringBuilder longMessage = new StringBuilder();
        for (int i = 0; i < 60000; i++) {
            longMessage.append('x');
        }
        HandleCallbackParam failure = XxlJobExecutor.buildCallbackParam(jobThread, new IllegalStateException(longMessage.toString()));
        assertEquals(500, failure.getHandleCode());
        assertEquals(XxlJobExecutor.MAX_HANDLE_MSG_LENGTH, failure.getHandleMsg().length());
        assertTrue(failure.getHandleMsg().startsWith("java.lang.IllegalStateException"));

        jobThread.toStop("scheduling center kill job.");
        HandleCallbackParam cancelled = XxlJobExecutor.buildCallbackParam(jobThread, new JobCancelledException("scheduling center kill job."));
        assertEquals(500, cancelled.getHandleCode());
        assertEquals("scheduling center kill job.", cancelled.getHandleMsg());
    }

    @Test
    void logIsNotAvailableWithoutLogPath() {
        LogResult logResult = new ExecutorBizImpl(executor).log(new LogParam(1700000000000L, 1, 1)).getContent();
        assertEquals(LogResult.notAvailable(), logResult);
    }
}
