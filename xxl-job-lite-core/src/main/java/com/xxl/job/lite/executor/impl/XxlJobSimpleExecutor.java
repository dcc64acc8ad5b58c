package com.xxl.job.lite.executor.impl;

import com.xxl.job.lite.executor.XxlJobExecutor;
import com.xxl.job.lite.handler.annotation.XxlJob;
import lombok.Getter;
import lombok.Setter;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;

/**
 * 不依赖Spring的执行器，用户把带有@XxlJob方法的对象交给它，启动的时候注册成JobHandler
 */
public class XxlJobSimpleExecutor extends XxlJobExecutor {

    @Getter
    @Setter
    private List<Object> xxlJobBeanList = new ArrayList<>();

    @Override
    public void start() throws Exception {
        initJobHandlerMethodRepository(xxlJobBeanList);
        super.start();
    }

    private void initJobHandlerMethodRepository(List<Object> xxlJobBeanList) {
        if (xxlJobBeanList == null || xxlJobBeanList.isEmpty()) {
            return;
        }

        for (Object bean : xxlJobBeanList) {
            Method[] methods = bean.getClass().getDeclaredMethods();
            for (Method executeMethod : methods) {
                XxlJob xxlJob = executeMethod.getAnnotation(XxlJob.class);
                registJobHandler(xxlJob, bean, executeMethod);
            }
        }
    }
}
