package com.xxl.job.lite.server;

import com.google.gson.JsonParseException;
import com.xxl.job.lite.biz.ExecutorBiz;
import com.xxl.job.lite.biz.model.IdleBeatParam;
import com.xxl.job.lite.biz.model.KillParam;
import com.xxl.job.lite.biz.model.LogParam;
import com.xxl.job.lite.biz.model.ReturnT;
import com.xxl.job.lite.biz.model.TriggerParam;
import com.xxl.job.lite.util.GsonTool;
import com.xxl.job.lite.util.ThrowableUtil;
import com.xxl.job.lite.util.XxlJobRemotingUtil;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.CharsetUtil;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 执行器这一端内嵌的Netty服务器，调度中心通过HTTP POST访问它。
 * 不管处理结果如何，HTTP状态码都是200，成功失败放在响应体ReturnT的code中。
 */
@Slf4j
public class EmbedServer {

    private final ExecutorBiz executorBiz;
    private final String accessToken;
    private final long idleTimeout;
    private final long readTimeout;
    private final long writeTimeout;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private ThreadPoolExecutor bizThreadPool;
    private Channel serverChannel;

    // 实际监听的端口
    @Getter
    private int port;

    /**
     * @param executorBiz  处理请求的执行器接口
     * @param accessToken  配置了TOKEN就校验请求头中的TOKEN
     * @param idleTimeout  读写空闲超时，毫秒
     * @param readTimeout  读空闲超时，毫秒
     * @param writeTimeout 写空闲超时，毫秒
     */
    public EmbedServer(ExecutorBiz executorBiz, String accessToken, long idleTimeout, long readTimeout, long writeTimeout) {
        this.executorBiz = executorBiz;
        this.accessToken = accessToken;
        this.idleTimeout = idleTimeout;
        this.readTimeout = readTimeout;
        this.writeTimeout = writeTimeout;
    }

    /**
     * 启动内嵌的Netty服务器，端口绑定成功才返回，绑定失败抛出异常
     *
     * @param port 端口号，0表示随便找一个可用的端口
     */
    public void start(int port) throws Exception {
        // 业务线程池，Netty的单线程执行器只负责IO，请求在这里处理
        bizThreadPool = new ThreadPoolExecutor(
                0,
                200,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(2000),
                r -> new Thread(r, "xxl-job, EmbedServer bizThreadPool-" + r.hashCode()),
                (r, executor) -> {
                    throw new RuntimeException("xxl-job, EmbedServer bizThreadPool is EXHAUSTED!");
                }
        );

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        public void initChannel(SocketChannel channel) throws Exception {
                            channel.pipeline()
                                    // 空闲检测，超时就关闭连接
                                    .addLast(new IdleStateHandler(readTimeout, writeTimeout, idleTimeout, TimeUnit.MILLISECONDS))
                                    // HTTP编解码器
                                    .addLast(new HttpServerCodec())
                                    // 把拆开的HTTP消息聚合成一个完整的请求
                                    .addLast(new HttpObjectAggregator(5 * 1024 * 1024))
                                    .addLast(new EmbedHttpServerHandler(executorBiz, accessToken, bizThreadPool));
                        }
                    });

            serverChannel = bootstrap.bind(port).sync().channel();
            this.port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
            log.info(">>>>>>>>>>> xxl-job remoting server start success, nettype = {}, port = {}", EmbedServer.class, this.port);
        } catch (Exception e) {
            log.error(">>>>>>>>>>> xxl-job remoting server start fail, port = {}", port, e);
            shutdownGroups();
            bizThreadPool.shutdownNow();
            throw e;
        }
    }

    /**
     * 停止服务器：先不再接收新的连接，再等待处理中的请求，最多等待waitTimeout毫秒
     */
    public void stop(long waitTimeout) throws Exception {
        if (serverChannel != null) {
            serverChannel.close().sync();
        }

        if (bizThreadPool != null) {
            bizThreadPool.shutdown();
            if (!bizThreadPool.awaitTermination(waitTimeout, TimeUnit.MILLISECONDS)) {
                log.warn(">>>>>>>>>>> xxl-job remoting server, requests not finished in {} ms.", waitTimeout);
                bizThreadPool.shutdownNow();
            }
        }

        shutdownGroups();
        log.info(">>>>>>>>>>> xxl-job remoting server destroy success.");
    }

    private void shutdownGroups() {
        try {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            }
        } catch (Exception e) {
            log.error(e.getMessage(), e);
        }
    }


    /**
     * 执行器端入站处理器，调度中心的请求就会走到这里来
     */
    @AllArgsConstructor
    public static class EmbedHttpServerHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

        private ExecutorBiz executorBiz;
        private String accessToken;
        private ThreadPoolExecutor bizThreadPool;

        @Override
        protected void channelRead0(final ChannelHandlerContext ctx, FullHttpRequest msg) throws Exception {
            String requestData = msg.content().toString(CharsetUtil.UTF_8);
            String uri = msg.uri();
            HttpMethod httpMethod = msg.method();
            boolean keepAlive = HttpUtil.isKeepAlive(msg);
            String accessTokenReq = msg.headers().get(XxlJobRemotingUtil.XXL_JOB_ACCESS_TOKEN);

            // 请求交给业务线程池处理，不占用Netty的IO线程
            bizThreadPool.execute(() -> {
                Object responseObj = process(httpMethod, uri, requestData, accessTokenReq);
                String responseJson = GsonTool.toJson(responseObj);
                writeResponse(ctx, keepAlive, responseJson);
            });
        }

        Object process(HttpMethod httpMethod, String uri, String requestData, String accessTokenReq) {
            // 心跳检测不限制请求方法，其余接口只接收POST
            if (HttpMethod.POST != httpMethod && !"/beat".equals(uri)) {
                return new ReturnT<String>(ReturnT.FAIL_CODE, "invalid request, HttpMethod not support.");
            }
            if (uri == null || uri.trim().isEmpty()) {
                return new ReturnT<String>(ReturnT.FAIL_CODE, "invalid request, uri-mapping empty.");
            }
            // 配置了TOKEN，请求头中的TOKEN就必须一样
            if (accessToken != null && !accessToken.trim().isEmpty() && !accessToken.equals(accessTokenReq)) {
                return new ReturnT<String>(ReturnT.FAIL_CODE, "The access token is wrong.");
            }

            try {
                switch (uri) {
                    case "/beat":
                        return executorBiz.beat();
                    case "/idleBeat":
                        return executorBiz.idleBeat(decode(requestData, IdleBeatParam.class));
                    case "/run":
                        return executorBiz.run(decode(requestData, TriggerParam.class));
                    case "/kill":
                        return executorBiz.kill(decode(requestData, KillParam.class));
                    case "/log":
                        return executorBiz.log(decode(requestData, LogParam.class));
                    default:
                        return new ReturnT<String>(ReturnT.FAIL_CODE, "invalid request, uri-mapping(" + uri + ") not found.");
                }
            } catch (RequestDecodeException e) {
                log.warn(">>>>>>>>>>> xxl-job invalid request, uri:{}, msg:{}", uri, e.getMessage());
                return new ReturnT<String>(ReturnT.FAIL_CODE, "invalid request, request body decode error: " + e.getMessage());
            } catch (Exception e) {
                log.error(e.getMessage(), e);
                return new ReturnT<String>(ReturnT.FAIL_CODE, "request error:" + ThrowableUtil.toString(e));
            }
        }

        private static <T> T decode(String requestData, Class<T> paramClass) {
            T param;
            try {
                param = GsonTool.fromJson(requestData, paramClass);
            } catch (JsonParseException e) {
                throw new RequestDecodeException(e.getMessage(), e);
            }
            if (param == null) {
                throw new RequestDecodeException("empty request body");
            }
            return param;
        }

        private void writeResponse(ChannelHandlerContext ctx, boolean keepAlive, String responseJson) {
            FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK, Unpooled.copiedBuffer(responseJson, CharsetUtil.UTF_8));
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json;charset=UTF-8");
            response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
            if (keepAlive) {
                response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            }
            ctx.writeAndFlush(response);
        }

        @Override
        public void channelReadComplete(ChannelHandlerContext ctx) throws Exception {
            ctx.flush();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.error(">>>>>>>>>>> xxl-job provider netty_http server caught exception", cause);
            ctx.close();
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
            if (evt instanceof IdleStateEvent) {
                ctx.channel().close();
                log.debug(">>>>>>>>>>> xxl-job provider netty_http server close an idle channel.");
            } else {
                super.userEventTriggered(ctx, evt);
            }
        }
    }

    /**
     * 请求体不是合法的JSON
     */
    static class RequestDecodeException extends RuntimeException {

        RequestDecodeException(String message) {
            super(message);
        }

        RequestDecodeException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
