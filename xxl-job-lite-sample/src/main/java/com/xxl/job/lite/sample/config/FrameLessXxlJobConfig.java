package com.xxl.job.lite.sample.config;

import com.xxl.job.lite.executor.impl.XxlJobSimpleExecutor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Properties;

/**
 * 从classpath中的properties文件读取执行器配置，创建不依赖Spring的执行器
 */
@Slf4j
public class FrameLessXxlJobConfig {

    public static final String DEFAULT_CONFIG_FILE = "xxl-job-executor.properties";

    private final Properties xxlJobProp;

    public FrameLessXxlJobConfig(Properties xxlJobProp) {
        this.xxlJobProp = xxlJobProp;
    }

    public static FrameLessXxlJobConfig load(String propertyFileName) throws IOException {
        return new FrameLessXxlJobConfig(loadProperties(propertyFileName));
    }

    /**
     * 创建并配置执行器，没有启动
     */
    public XxlJobSimpleExecutor buildExecutor(List<Object> xxlJobBeanList) {
        XxlJobSimpleExecutor executor = new XxlJobSimpleExecutor();
        executor.setAdminAddresses(xxlJobProp.getProperty("xxl.job.admin.addresses"));
        executor.setAccessToken(xxlJobProp.getProperty("xxl.job.accessToken", "default_token"));
        executor.setAppname(xxlJobProp.getProperty("xxl.job.executor.appname"));
        executor.setAddress(xxlJobProp.getProperty("xxl.job.executor.address"));
        executor.setIp(xxlJobProp.getProperty("xxl.job.executor.ip"));
        executor.setPort(intValue("xxl.job.executor.port", 9999));
        executor.setLogPath(xxlJobProp.getProperty("xxl.job.executor.logpath"));
        executor.setLogRetentionDays(intValue("xxl.job.executor.logretentiondays", 7));
        executor.setClientTimeout(intValue("xxl.job.executor.clientTimeout", 3000));
        executor.setCallbackBufferSize(intValue("xxl.job.executor.callbackBufferSize", 1024));
        executor.setCallbackInterval(longValue("xxl.job.executor.callbackInterval", 1000));
        executor.setRegistryInterval(longValue("xxl.job.executor.registryInterval", 10000));
        executor.setSizeLimit(longValue("xxl.job.executor.sizeLimit", 10240));
        executor.setIdleTimeout(longValue("xxl.job.executor.idleTimeout", 60000));
        executor.setReadTimeout(longValue("xxl.job.executor.readTimeout", 15000));
        executor.setWriteTimeout(longValue("xxl.job.executor.writeTimeout", 15000));
        executor.setWaitTimeout(longValue("xxl.job.executor.waitTimeout", 15000));
        executor.setXxlJobBeanList(xxlJobBeanList);
        return executor;
    }

    private int intValue(String key, int defaultValue) {
        String value = xxlJobProp.getProperty(key);
        return value == null || value.trim().isEmpty() ? defaultValue : Integer.parseInt(value.trim());
    }

    private long longValue(String key, long defaultValue) {
        String value = xxlJobProp.getProperty(key);
        return value == null || value.trim().isEmpty() ? defaultValue : Long.parseLong(value.trim());
    }

    private static Properties loadProperties(String propertyFileName) throws IOException {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        try (InputStream in = loader.getResourceAsStream(propertyFileName)) {
            if (in == null) {
                throw new IOException("xxl-job config file not found: " + propertyFileName);
            }
            Properties prop = new Properties();
            prop.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            return prop;
        }
    }
}
