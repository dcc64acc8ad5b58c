package com.xxl.job.lite.thread;

import com.xxl.job.lite.biz.AdminBiz;
import com.xxl.job.lite.biz.model.RegistryParam;
import com.xxl.job.lite.biz.model.ReturnT;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExecutorRegistryThreadTest {

    @Test
    void registersPeriodicallyAndDeregistersOnStop() {
        AdminBiz adminBiz = mock(AdminBiz.class);
        when(adminBiz.registry(any())).thenReturn(ReturnT.SUCCESS);
        when(adminBiz.registryRemove(any())).thenReturn(ReturnT.SUCCESS);

        ExecutorRegistryThread thread = new ExecutorRegistryThread(Collections.singletonList(adminBiz),
                "demo-app", "http://127.0.0.1:9999/", 50);
        thread.start();

        verify(adminBiz, timeout(5000).atLeast(3)).registry(any());
        thread.toStop();

        RegistryParam expected = new RegistryParam("EXECUTOR", "demo-app", "http://127.0.0.1:9999/");
        verify(adminBiz, atLeast(3)).registry(expected);
        verify(adminBiz, times(1)).registryRemove(expected);
        assertEquals(expected, thread.getRegistryParam());
    }

    @Test
    void failingAdminIsSkipped() {
        AdminBiz down = mock(AdminBiz.class);
        AdminBiz up = mock(AdminBiz.class);
        when(down.registry(any())).thenReturn(ReturnT.fail("down"));
        when(up.registry(any())).thenReturn(ReturnT.SUCCESS);

        ExecutorRegistryThread thread = new ExecutorRegistryThread(Arrays.asList(down, up),
                "demo-app", "http://127.0.0.1:9999/", 10_000);
        thread.start();

        verify(up, timeout(5000)).registry(any());
        thread.toStop();
        verify(down, times(1)).registry(any());
    }

    @Test
    void blankAppnameDisablesRegistry() {
        AdminBiz adminBiz = mock(AdminBiz.class);
        ExecutorRegistryThread thread = new ExecutorRegistryThread(Collections.singletonList(adminBiz),
                " ", "http://127.0.0.1:9999/", 10);
        thread.start();
        thread.toStop();

        verify(adminBiz, never()).registry(any());
        verify(adminBiz, never()).registryRemove(any());
    }
}
