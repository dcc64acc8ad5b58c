package com.xxl.job.lite.biz.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 执行器回调定时任务执行结果的包装类，每个执行完的任务产生一个，批量发送给调度中心
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HandleCallbackParam implements Serializable {

    private static final long serialVersionUID = 42L;

    private long logId;
    private long logDateTim;   // 字段名就是这样，调度中心按这个名字解析

    private int handleCode;    // 200成功，500失败
    private String handleMsg;

}
