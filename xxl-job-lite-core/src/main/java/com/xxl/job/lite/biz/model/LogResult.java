package com.xxl.job.lite.biz.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LogResult implements Serializable {

    private static final long serialVersionUID = 42L;

    /**
     * 执行器没有开启本地日志文件时，/log接口固定返回这个结果
     */
    public static final String NOT_AVAILABLE = "N/A";

    private int     fromLineNum;
    private int     toLineNum;
    private String  logContent;
    private boolean isEnd;

    public static LogResult notAvailable() {
        return new LogResult(1, 2, NOT_AVAILABLE, true);
    }

}
