package com.xxl.job.lite.server;

import com.xxl.job.lite.biz.ExecutorBiz;
import com.xxl.job.lite.biz.client.ExecutorBizClient;
import com.xxl.job.lite.biz.model.IdleBeatParam;
import com.xxl.job.lite.biz.model.KillParam;
import com.xxl.job.lite.biz.model.LogParam;
import com.xxl.job.lite.biz.model.LogResult;
import com.xxl.job.lite.biz.model.ReturnT;
import com.xxl.job.lite.biz.model.TriggerParam;
import com.xxl.job.lite.util.GsonTool;
import com.xxl.job.lite.util.XxlJobRemotingUtil;
import io.netty.handler.codec.http.HttpMethod;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.ServerSocket;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EmbedServerTest {

    private static final String TOKEN = "test_token";

    private ExecutorBiz executorBiz;
    private EmbedServer embedServer;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        executorBiz = mock(ExecutorBiz.class);
        when(executorBiz.beat()).thenReturn(ReturnT.SUCCESS);
        when(executorBiz.run(any())).thenReturn(ReturnT.SUCCESS);
        when(executorBiz.idleBeat(any())).thenReturn(new ReturnT<>(ReturnT.FAIL_CODE, "job is running"));
        when(executorBiz.kill(any())).thenReturn(ReturnT.SUCCESS);
        when(executorBiz.log(any())).thenReturn(new ReturnT<>(LogResult.notAvailable()));

        embedServer = new EmbedServer(executorBiz, TOKEN, 60000, 15000, 15000);
        embedServer.start(0);
        baseUrl = "http://127.0.0.1:" + embedServer.getPort() + "/";
    }

    @AfterEach
    void tearDown() throws Exception {
        embedServer.stop(1000);
    }

    private static String[] post(String url, String method, String token, String body) throws IOException {
        HttpURLConnection connection = (HttpURLConnection) new URL(url).openConnection();
        connection.setRequestMethod(method);
        connection.setConnectTimeout(3000);
        connection.setReadTimeout(3000);
        if (token != null) {
            connection.setRequestProperty(XxlJobRemotingUtil.XXL_JOB_ACCESS_TOKEN, token);
        }
        if (body != null) {
            connection.setDoOutput(true);
            try (OutputStream out = connection.getOutputStream()) {
                out.write(body.getBytes(StandardCharsets.UTF_8));
            }
        }
        try (InputStream in = connection.getInputStream()) {
            return new String[]{String.valueOf(connection.getResponseCode()),
                    connection.getContentType(),
                    new String(in.readAllBytes(), StandardCharsets.UTF_8)};
        } finally {
            connection.disconnect();
        }
    }

    @Test
    void endpointsThroughClient() {
        ExecutorBizClient client = new ExecutorBizClient(baseUrl, TOKEN);

        assertEquals(ReturnT.SUCCESS_CODE, client.beat().getCode());

        TriggerParam triggerParam = new TriggerParam();
        triggerParam.setJobId(1);
        triggerParam.setLogId(11);
        triggerParam.setExecutorHandler("demo");
        assertEquals(ReturnT.SUCCESS_CODE, client.run(triggerParam).getCode());

        ReturnT<String> idle = client.idleBeat(new IdleBeatParam(1));
        assertEquals(ReturnT.FAIL_CODE, idle.getCode());
        assertEquals("job is running", idle.getMsg());

        assertEquals(ReturnT.SUCCESS_CODE, client.kill(new KillParam(1)).getCode());
        assertEquals(LogResult.notAvailable(), client.log(new LogParam(0, 11, 1)).getContent());

        ArgumentCaptor<TriggerParam> captor = ArgumentCaptor.forClass(TriggerParam.class);
        verify(executorBiz).run(captor.capture());
        assertEquals(11, captor.getValue().getLogId());
        assertEquals("demo", captor.getValue().getExecutorHandler());
    }

    @Test
    void responsesAreHttp200Json() throws Exception {
        String[] response = post(baseUrl + "run", "POST", TOKEN, "not json");

        assertEquals("200", response[0]);
        assertTrue(response[1].startsWith("application/json"));
        ReturnT<?> returnT = GsonTool.fromJson(response[2], ReturnT.class);
        assertEquals(ReturnT.FAIL_CODE, returnT.getCode());
        assertTrue(returnT.getMsg().startsWith("invalid request, request body decode error"));
    }

    @Test
    void beatAcceptsAnyMethod() throws Exception {
        String[] response = post(baseUrl + "beat", "GET", TOKEN, null);

        assertEquals("200", response[0]);
        ReturnT<?> returnT = GsonTool.fromJson(response[2], ReturnT.class);
        assertEquals(ReturnT.SUCCESS_CODE, returnT.getCode());

        EmbedServer.EmbedHttpServerHandler handler = new EmbedServer.EmbedHttpServerHandler(executorBiz, TOKEN,
                new ThreadPoolExecutor(0, 1, 1, TimeUnit.SECONDS, new LinkedBlockingQueue<>()));
        for (HttpMethod method : new HttpMethod[]{HttpMethod.GET, HttpMethod.HEAD, HttpMethod.PUT, HttpMethod.POST}) {
            assertEquals(ReturnT.SUCCESS_CODE, ((ReturnT<?>) handler.process(method, "/beat", "", TOKEN)).getCode(), method.name());
        }
        // 请求方法不限制，TOKEN还是要校验
        ReturnT<?> wrongToken = (ReturnT<?>) handler.process(HttpMethod.GET, "/beat", "", "wrong");
        assertEquals("The access token is wrong.", wrongToken.getMsg());
    }

    @Test
    void wrongTokenIsRejected() throws Exception {
        ReturnT<?> returnT = GsonTool.fromJson(post(baseUrl + "beat", "POST", "wrong", "")[2], ReturnT.class);

        assertEquals(ReturnT.FAIL_CODE, returnT.getCode());
        assertEquals("The access token is wrong.", returnT.getMsg());
        verify(executorBiz, never()).beat();
    }

    @Test
    void processRejectsBadRequests() {
        EmbedServer.EmbedHttpServerHandler handler = new EmbedServer.EmbedHttpServerHandler(executorBiz, TOKEN,
                new ThreadPoolExecutor(0, 1, 1, TimeUnit.SECONDS, new LinkedBlockingQueue<>()));

        ReturnT<?> get = (ReturnT<?>) handler.process(HttpMethod.GET, "/run", "", TOKEN);
        assertEquals("invalid request, HttpMethod not support.", get.getMsg());

        ReturnT<?> unknown = (ReturnT<?>) handler.process(HttpMethod.POST, "/unknown", "{}", TOKEN);
        assertEquals(ReturnT.FAIL_CODE, unknown.getCode());
        assertEquals("invalid request, uri-mapping(/unknown) not found.", unknown.getMsg());

        for (String uri : new String[]{"/idleBeat", "/run", "/kill", "/log"}) {
            for (String body : new String[]{"", "not json", "{\"jobId\":\"abc\"}", "[1,2]"}) {
                ReturnT<?> result = (ReturnT<?>) handler.process(HttpMethod.POST, uri, body, TOKEN);
                assertEquals(ReturnT.FAIL_CODE, result.getCode(), uri + " " + body);
                assertTrue(result.getMsg().startsWith("invalid request, request body decode error"), uri + " " + body);
            }
        }
        verify(executorBiz, never()).run(any());
    }

    @Test
    void emptyTokenSkipsCheck() {
        EmbedServer.EmbedHttpServerHandler handler = new EmbedServer.EmbedHttpServerHandler(executorBiz, "",
                new ThreadPoolExecutor(0, 1, 1, TimeUnit.SECONDS, new LinkedBlockingQueue<>()));

        ReturnT<?> beat = (ReturnT<?>) handler.process(HttpMethod.POST, "/beat", "", null);
        assertEquals(ReturnT.SUCCESS_CODE, beat.getCode());
    }

    @Test
    void bindFailureIsFatal() throws Exception {
        try (ServerSocket occupied = new ServerSocket(0)) {
            EmbedServer second = new EmbedServer(executorBiz, TOKEN, 60000, 15000, 15000);
            assertThrows(Exception.class, () -> second.start(occupied.getLocalPort()));
        }
    }
}
