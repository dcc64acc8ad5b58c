package com.xxl.job.lite.biz.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 返回信息的实体类，执行器的五个接口和调用调度中心的三个接口都用它作为响应体。
 * 注意：不管成功还是失败，HTTP状态码总是200，真正的结果看code。
 */
@Data
@NoArgsConstructor
public class ReturnT<T> implements Serializable {

    public static final long serialVersionUID = 42L;

    public static final int SUCCESS_CODE = 200;
    public static final int FAIL_CODE = 500;

    public static final ReturnT<String> SUCCESS = new ReturnT<>(null);

    private int code;
    private String msg;
    private T content;

    public ReturnT(int code, String msg) {
        this.code = code;
        this.msg = msg;
    }

    public ReturnT(T content) {
        this.code = SUCCESS_CODE;
        this.content = content;
    }

    public static <T> ReturnT<T> fail(String msg) {
        return new ReturnT<>(FAIL_CODE, msg);
    }

    public boolean isSuccess() {
        return code == SUCCESS_CODE;
    }

}
