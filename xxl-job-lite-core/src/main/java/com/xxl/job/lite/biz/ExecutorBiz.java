package com.xxl.job.lite.biz;

import com.xxl.job.lite.biz.model.IdleBeatParam;
import com.xxl.job.lite.biz.model.KillParam;
import com.xxl.job.lite.biz.model.LogParam;
import com.xxl.job.lite.biz.model.LogResult;
import com.xxl.job.lite.biz.model.ReturnT;
import com.xxl.job.lite.biz.model.TriggerParam;

/**
 * 执行器 RESTful API，提供给调度中心进行调用
 */
public interface ExecutorBiz {

    /**
     * 心跳检测
     * ------
     * 说明：    调度中心检测执行器是否在线时使用，总是成功
     * 地址格式：{执行器内嵌服务根地址}/beat
     */
    ReturnT<String> beat();

    /**
     * 忙碌检测
     * ------
     * 说明：    指定jobId的任务不在执行器的任务表中才算空闲
     * 地址格式：{执行器内嵌服务根地址}/idleBeat
     */
    ReturnT<String> idleBeat(IdleBeatParam idleBeatParam);

    /**
     * 触发任务
     * ------
     * 说明：    按阻塞策略决定是否接受本次调度，接受后异步执行，立即返回
     * 地址格式：{执行器内嵌服务根地址}/run
     */
    ReturnT<String> run(TriggerParam triggerParam);

    /**
     * 终止任务
     * ------
     * 说明：    任务不存在时也返回成功
     * 地址格式：{执行器内嵌服务根地址}/kill
     */
    ReturnT<String> kill(KillParam killParam);

    /**
     * 查看执行日志
     * ------
     * 说明：    滚动方式加载，没有开启本地日志文件时返回固定结果
     * 地址格式：{执行器内嵌服务根地址}/log
     */
    ReturnT<LogResult> log(LogParam logParam);

}
