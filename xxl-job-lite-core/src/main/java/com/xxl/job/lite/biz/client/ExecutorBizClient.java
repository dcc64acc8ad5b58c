package com.xxl.job.lite.biz.client;

import com.xxl.job.lite.biz.ExecutorBiz;
import com.xxl.job.lite.biz.model.IdleBeatParam;
import com.xxl.job.lite.biz.model.KillParam;
import com.xxl.job.lite.biz.model.LogParam;
import com.xxl.job.lite.biz.model.LogResult;
import com.xxl.job.lite.biz.model.ReturnT;
import com.xxl.job.lite.biz.model.TriggerParam;
import com.xxl.job.lite.util.XxlJobRemotingUtil;

/**
 * 调度中心 => 执行器
 */
public class ExecutorBizClient implements ExecutorBiz {

    public ExecutorBizClient(String addressUrl, String accessToken) {
        this(addressUrl, accessToken, 3 * 1000);
    }

    public ExecutorBizClient(String addressUrl, String accessToken, int timeout) {
        this.addressUrl = addressUrl;
        this.accessToken = accessToken;
        this.timeout = timeout;
        if (!this.addressUrl.endsWith("/")) {
            this.addressUrl = this.addressUrl + "/";
        }
    }

    private String addressUrl;  // 执行器内嵌服务的根地址
    private final String accessToken; // TOKEN 令牌，执行器和调度中心两端要一致
    private final int timeout;        // 访问超时时间，毫秒

    @Override
    public ReturnT<String> beat() {
        return XxlJobRemotingUtil.postBody(addressUrl + "beat", accessToken, timeout, "", String.class);
    }

    @Override
    public ReturnT<String> idleBeat(IdleBeatParam idleBeatParam) {
        return XxlJobRemotingUtil.postBody(addressUrl + "idleBeat", accessToken, timeout, idleBeatParam, String.class);
    }

    @Override
    public ReturnT<String> run(TriggerParam triggerParam) {
        return XxlJobRemotingUtil.postBody(addressUrl + "run", accessToken, timeout, triggerParam, String.class);
    }

    @Override
    public ReturnT<String> kill(KillParam killParam) {
        return XxlJobRemotingUtil.postBody(addressUrl + "kill", accessToken, timeout, killParam, String.class);
    }

    @Override
    public ReturnT<LogResult> log(LogParam logParam) {
        return XxlJobRemotingUtil.postBody(addressUrl + "log", accessToken, timeout, logParam, LogResult.class);
    }
}
