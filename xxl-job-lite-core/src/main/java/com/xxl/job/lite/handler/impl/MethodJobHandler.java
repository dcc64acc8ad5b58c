package com.xxl.job.lite.handler.impl;

import com.xxl.job.lite.context.XxlJobContext;
import com.xxl.job.lite.handler.IJobHandler;
import com.xxl.job.lite.handler.JobParam;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

/**
 * 利用反射执行@XxlJob标注的方法
 */
public class MethodJobHandler implements IJobHandler {

    // 目标对象，就是用户定义的Bean
    private final Object target;

    // 要被执行的定时任务方法
    private final Method method;

    // Bean对象的初始化方法，对应#init
    private final Method initMethod;

    // Bean对象的销毁方法，对应#destroy
    private final Method destroyMethod;

    public MethodJobHandler(Object target, Method method,
                            Method initMethod, Method destroyMethod) {
        this.target = target;
        this.method = method;
        this.initMethod = initMethod;
        this.destroyMethod = destroyMethod;
    }

    @Override
    public void init() throws Exception {
        if (initMethod != null) {
            invoke(initMethod);
        }
    }

    /**
     * 按参数类型把context和param传进去，不认识的参数类型传null
     */
    @Override
    public void execute(XxlJobContext context, JobParam param) throws Exception {
        Class<?>[] paramTypes = method.getParameterTypes();
        Object[] args = new Object[paramTypes.length];
        for (int i = 0; i < paramTypes.length; i++) {
            if (paramTypes[i] == XxlJobContext.class) {
                args[i] = context;
            } else if (paramTypes[i] == JobParam.class) {
                args[i] = param;
            } else if (paramTypes[i] == String.class) {
                args[i] = param != null ? param.getParams() : null;
            }
        }
        invoke(method, args);
    }

    @Override
    public void destroy() throws Exception {
        if (destroyMethod != null) {
            invoke(destroyMethod);
        }
    }

    /**
     * 把反射包装的异常拆出来，回调给调度中心的是方法本身抛出的异常
     */
    private void invoke(Method m, Object... args) throws Exception {
        try {
            m.invoke(target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    @Override
    public String toString() {
        return super.toString() + "[" + target.getClass() + "#" + method.getName() + "]";
    }
}
