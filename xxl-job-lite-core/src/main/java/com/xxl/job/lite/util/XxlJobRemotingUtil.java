package com.xxl.job.lite.util;

import com.xxl.job.lite.biz.model.ReturnT;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.HttpsURLConnection;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.security.cert.X509Certificate;
import java.time.Duration;

/**
 * <h1>用于执行远程调用的工具类</h1>
 * 执行器调用调度中心(registry、registryRemove、callback)，以及测试或者外部程序调用执行器，都走这里。
 */
@Slf4j
public class XxlJobRemotingUtil {

    public static final String XXL_JOB_ACCESS_TOKEN = "XXL-JOB-ACCESS-TOKEN";

    /**
     * 响应体超过这个字节数，日志里就不打印响应内容了
     */
    public static final long DEFAULT_SIZE_LIMIT = 10240;

    /**
     * <h2>信任该 HTTPS 链接</h2>
     */
    private static void trustAllHosts(HttpsURLConnection connection) {
        try {
            SSLContext sc = SSLContext.getInstance("TLS");
            sc.init(null, trustAllCerts, new java.security.SecureRandom());
            SSLSocketFactory newFactory = sc.getSocketFactory();

            connection.setSSLSocketFactory(newFactory);
        } catch (Exception e) {
            log.error(e.getMessage(), e);
        }
        connection.setHostnameVerifier((hostname, session) -> true);
    }
    private static final TrustManager[] trustAllCerts = new TrustManager[]{new X509TrustManager() {
        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[]{};
        }
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }
        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }
    }};
    // trust-https end


    public static <T> ReturnT<T> postBody(String url, String accessToken, int timeout, Object requestObj, Class<T> returnTargClassOfT) {
        return postBody(url, accessToken, timeout, DEFAULT_SIZE_LIMIT, requestObj, returnTargClassOfT);
    }

    /**
     * <h2>发送 POST 请求</h2>
     *
     * @param timeout   读超时，毫秒
     * @param sizeLimit 响应体超过这个字节数时日志里只打印 omitted
     */
    @SuppressWarnings("unchecked")
    public static <T> ReturnT<T> postBody(String url, String accessToken, int timeout, long sizeLimit,
                                          Object requestObj, Class<T> returnTargClassOfT) {
        HttpURLConnection connection = null;
        long start = System.nanoTime();
        try {
            // 创建连接
            URL realUrl = new URL(url);
            connection = (HttpURLConnection) realUrl.openConnection();
            // 判断是否为 https 开头的
            boolean useHttps = url.startsWith("https");
            if (useHttps) {
                HttpsURLConnection https = (HttpsURLConnection) connection;
                trustAllHosts(https);
            }
            connection.setRequestMethod("POST");
            connection.setDoOutput(true);
            connection.setDoInput(true);
            connection.setUseCaches(false);
            connection.setReadTimeout(timeout);
            connection.setConnectTimeout(3 * 1000);
            connection.setRequestProperty("connection", "Keep-Alive");
            connection.setRequestProperty("Content-Type", "application/json;charset=UTF-8");
            connection.setRequestProperty("Accept-Charset", "application/json;charset=UTF-8");
            // 配置了 TOKEN 才带上请求头
            if (accessToken != null && accessToken.trim().length() > 0) {
                connection.setRequestProperty(XXL_JOB_ACCESS_TOKEN, accessToken);
            }
            connection.connect();

            // write requestBody
            if (requestObj != null) {
                String requestBody = GsonTool.toJson(requestObj);
                try (OutputStream outputStream = connection.getOutputStream()) {
                    outputStream.write(requestBody.getBytes(StandardCharsets.UTF_8));
                    outputStream.flush();
                }
            }

            int statusCode = connection.getResponseCode();
            if (statusCode != 200) {
                logResponse(statusCode, 0, start, url, "");
                return new ReturnT<>(ReturnT.FAIL_CODE, "xxl-job remoting fail, StatusCode(" + statusCode + ") invalid. for url : " + url);
            }

            // 接收返回信息
            byte[] responseBytes;
            try (InputStream inputStream = connection.getInputStream()) {
                responseBytes = inputStream.readAllBytes();
            }
            String resultJson = new String(responseBytes, StandardCharsets.UTF_8);
            logResponse(statusCode, responseBytes.length, start, url, responseBytes.length > sizeLimit ? "omitted" : resultJson);

            try {
                ReturnT<T> returnT = GsonTool.fromJson(resultJson, ReturnT.class, returnTargClassOfT);
                if (returnT == null) {
                    return new ReturnT<>(ReturnT.FAIL_CODE, "xxl-job remoting (url=" + url + ") response content empty.");
                }
                return returnT;
            } catch (Exception e) {
                log.error("xxl-job remoting (url=" + url + ") response content invalid(" + resultJson + ").", e);
                return new ReturnT<>(ReturnT.FAIL_CODE, "xxl-job remoting (url=" + url + ") response content invalid(" + resultJson + ").");
            }

        } catch (Exception e) {
            log.error(">>>>>>>>>>> xxl-job remoting error, url:{}, error:{}", url, e.getMessage());
            return new ReturnT<>(ReturnT.FAIL_CODE, "xxl-job remoting error(" + e.getMessage() + "), for url : " + url);
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private static void logResponse(int statusCode, long size, long startNanos, String url, String body) {
        Duration cost = Duration.ofNanos(System.nanoTime() - startNanos);
        log.info(">>>>>>>>>>> xxl-job [{}][{}][{}] url: {}, res: {}",
                statusCode, FormatUtil.readableSize(size), FormatUtil.readableDuration(cost), url, body);
    }

}
