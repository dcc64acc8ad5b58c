package com.xxl.job.lite.biz.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 注册执行器到调度中心时发送的注册参数
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegistryParam implements Serializable {

    private static final long serialVersionUID = 42L;

    /**
     * 注册类型，执行器这一端固定是EXECUTOR
     */
    private String registryGroup;
    /**
     * 执行器的唯一标识appname
     */
    private String registryKey;
    /**
     * 执行器的地址，调度中心就是通过这个地址访问执行器内嵌的服务器的
     */
    private String registryValue;
}
