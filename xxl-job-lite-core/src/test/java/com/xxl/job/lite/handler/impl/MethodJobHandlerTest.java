package com.xxl.job.lite.handler.impl;

import com.xxl.job.lite.context.XxlJobContext;
import com.xxl.job.lite.handler.JobParam;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MethodJobHandlerTest {

    static class DemoBean {
        final List<String> calls = new ArrayList<>();
        XxlJobContext context;
        JobParam param;

        public void full(XxlJobContext context, JobParam param) {
            this.context = context;
            this.param = param;
            calls.add("full");
        }

        public void paramsOnly(String params) {
            calls.add("params:" + params);
        }

        public void noArgs() {
            calls.add("noArgs");
        }

        public void failing() throws IOException {
            throw new IOException("disk full");
        }

        public void init() {
            calls.add("init");
        }

        public void destroy() {
            calls.add("destroy");
        }
    }

    private final DemoBean bean = new DemoBean();
    private final XxlJobContext context = new XxlJobContext(1, 2, "p", null, 0, 1);
    private final JobParam param = new JobParam("p", 0, 1);

    @Test
    void passesArgumentsByType() throws Exception {
        new MethodJobHandler(bean, DemoBean.class.getMethod("full", XxlJobContext.class, JobParam.class), null, null)
                .execute(context, param);
        new MethodJobHandler(bean, DemoBean.class.getMethod("paramsOnly", String.class), null, null)
                .execute(context, param);
        new MethodJobHandler(bean, DemoBean.class.getMethod("noArgs"), null, null)
                .execute(context, param);

        assertSame(context, bean.context);
        assertSame(param, bean.param);
        assertEquals(List.of("full", "params:p", "noArgs"), bean.calls);
    }

    @Test
    void unwrapsHandlerException() throws Exception {
        MethodJobHandler handler = new MethodJobHandler(bean, DemoBean.class.getMethod("failing"), null, null);
        IOException e = assertThrows(IOException.class, () -> handler.execute(context, param));
        assertEquals("disk full", e.getMessage());
    }

    @Test
    void lifecycleMethods() throws Exception {
        MethodJobHandler handler = new MethodJobHandler(bean, DemoBean.class.getMethod("noArgs"),
                DemoBean.class.getMethod("init"), DemoBean.class.getMethod("destroy"));
        handler.init();
        handler.execute(context, param);
        handler.destroy();
        assertEquals(List.of("init", "noArgs", "destroy"), bean.calls);
    }
}
