package com.xxl.job.lite.biz.client;

import com.xxl.job.lite.biz.AdminBiz;
import com.xxl.job.lite.biz.model.HandleCallbackParam;
import com.xxl.job.lite.biz.model.RegistryParam;
import com.xxl.job.lite.biz.model.ReturnT;
import com.xxl.job.lite.util.XxlJobRemotingUtil;
import lombok.Getter;

import java.util.List;

/**
 * 执行器 => 调度中心
 */
public class AdminBizClient implements AdminBiz {

    public AdminBizClient(String addressUrl, String accessToken, int timeout, long sizeLimit) {
        this.addressUrl = addressUrl;
        this.accessToken = accessToken;
        this.timeout = timeout;
        this.sizeLimit = sizeLimit;
        // 地址没有协议头的时候默认用http
        if (!this.addressUrl.startsWith("http")) {
            this.addressUrl = "http://" + this.addressUrl;
        }
        if (!this.addressUrl.endsWith("/")) {
            this.addressUrl = this.addressUrl + "/";
        }
    }

    @Getter
    private String addressUrl;  // 调度中心的根地址
    private final String accessToken; // TOKEN 令牌，执行器和调度中心两端要一致
    private final int timeout;        // 访问超时时间，毫秒
    private final long sizeLimit;     // 响应体超过这个大小就不打印到日志里

    @Override
    public ReturnT<String> callback(List<HandleCallbackParam> callbackParamList) {
        return XxlJobRemotingUtil.postBody(addressUrl + "api/callback",
                accessToken, timeout, sizeLimit, callbackParamList, String.class);
    }

    @Override
    public ReturnT<String> registry(RegistryParam registryParam) {
        return XxlJobRemotingUtil.postBody(addressUrl + "api/registry",
                accessToken, timeout, sizeLimit, registryParam, String.class);
    }

    @Override
    public ReturnT<String> registryRemove(RegistryParam registryParam) {
        return XxlJobRemotingUtil.postBody(addressUrl + "api/registryRemove",
                accessToken, timeout, sizeLimit, registryParam, String.class);
    }
}
