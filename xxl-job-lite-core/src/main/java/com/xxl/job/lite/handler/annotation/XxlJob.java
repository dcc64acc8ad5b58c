package com.xxl.job.lite.handler.annotation;

import java.lang.annotation.*;

/**
 * 标注在Bean的方法上，把这个方法注册成一个定时任务。
 * 方法的参数可以是 XxlJobContext、JobParam、String(任务参数) 的任意组合，也可以没有参数。
 */
@Inherited
@Documented
@Target({ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface XxlJob {

    /**
     * 定时任务的名称，就是调度中心配置的JobHandler
     */
    String value();

    /**
     * 初始化方法，每次执行前调用
     */
    String init() default "";

    /**
     * 销毁方法，每次执行后调用
     */
    String destroy() default "";
}
