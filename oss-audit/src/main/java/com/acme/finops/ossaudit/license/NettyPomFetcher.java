package com.acme.finops.ossaudit.license;

import com.acme.finops.ossaudit.util.AuditDefaults;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.URI;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * HTTP(S) POM downloader on a small Netty event loop.
 *
 * <p>One connection per request. Status 429/502/503/504, connect failures and
 * timeouts are retried up to {@code tries} times with a fixed delay; other
 * non-200 statuses fail at once. Redirects are followed without consuming a
 * try.</p>
 */
public final class NettyPomFetcher implements PomFetcher, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(NettyPomFetcher.class.getName());
    private static final Set<Integer> RETRY_STATUS_CODES = Set.of(429, 502, 503, 504);
    private static final Set<Integer> REDIRECT_STATUS_CODES = Set.of(301, 302, 303, 307, 308);
    private static final int OK = 200;
    private static final long COMPLETION_GRACE_MILLIS = 1_000L;

    private final EventLoopGroup ioGroup;
    private final Bootstrap bootstrap;
    private final SslContext sslContext;
    private final int responseTimeoutMillis;
    private final int tries;
    private final long retryDelayMillis;

    public NettyPomFetcher() {
        this(AuditDefaults.DEFAULT_RESPONSE_TIMEOUT_MS, AuditDefaults.DEFAULT_FETCH_TRIES, AuditDefaults.DEFAULT_RETRY_DELAY_MS);
    }

    public NettyPomFetcher(int responseTimeoutMillis, int tries, long retryDelayMillis) {
        this.responseTimeoutMillis = Math.max(1, responseTimeoutMillis);
        this.tries = Math.max(1, tries);
        this.retryDelayMillis = Math.max(0L, retryDelayMillis);
        this.ioGroup = new NioEventLoopGroup(AuditDefaults.DEFAULT_IO_THREADS);
        this.bootstrap = new Bootstrap()
            .group(ioGroup)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.TCP_NODELAY, true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.min(AuditDefaults.DEFAULT_CONNECT_TIMEOUT_MS, this.responseTimeoutMillis));
        try {
            this.sslContext = SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new IllegalStateException("Failed to build TLS context", e);
        }
    }

    @Override
    public byte[] fetch(URI pomUri) throws LicenseLookupException {
        URI target = pomUri;
        int attempt = 0;
        int redirects = 0;
        while (true) {
            validate(target);
            attempt++;
            PomResponse response;
            try {
                response = get(target).get(responseTimeoutMillis + COMPLETION_GRACE_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LicenseLookupException("interrupted while downloading " + target, e);
            } catch (ExecutionException | TimeoutException e) {
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                if (attempt >= tries) {
                    throw new LicenseLookupException("unable to download " + target + ": " + cause, cause);
                }
                final URI failed = target;
                LOG.fine(() -> "Download failed: " + failed + ": " + cause + ", retrying in " + retryDelayMillis + " ms");
                pause(target);
                continue;
            }

            int status = response.status();
            if (status == OK) {
                return response.body();
            }
            if (REDIRECT_STATUS_CODES.contains(status) && response.location() != null) {
                if (++redirects > AuditDefaults.MAX_REDIRECTS) {
                    throw new LicenseLookupException("too many redirects from " + pomUri);
                }
                try {
                    target = target.resolve(response.location());
                } catch (IllegalArgumentException e) {
                    throw new LicenseLookupException("malformed redirect from " + target + ": " + response.location(), e);
                }
                attempt--;
                continue;
            }
            if (!RETRY_STATUS_CODES.contains(status) || attempt >= tries) {
                throw new LicenseLookupException("unable to download " + target + ": HTTP " + status);
            }
            final URI failed = target;
            LOG.fine(() -> "Download failed: " + failed + ": HTTP " + status + ", retrying in " + retryDelayMillis + " ms");
            pause(target);
        }
    }

    private CompletableFuture<PomResponse> get(URI target) {
        CompletableFuture<PomResponse> result = new CompletableFuture<>();
        String host = target.getHost();
        int port = resolvePort(target);
        boolean https = isHttps(target);

        Bootstrap perRequest = bootstrap.clone().handler(new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                if (https) {
                    p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                }
                p.addLast(new HttpClientCodec());
                p.addLast(new HttpObjectAggregator(AuditDefaults.POM_RESPONSE_LIMIT));
                p.addLast(new PomResponseHandler(result));
            }
        });

        perRequest.connect(host, port).addListener((ChannelFutureListener) connectFuture -> {
            if (!connectFuture.isSuccess()) {
                result.completeExceptionally(connectFuture.cause());
                return;
            }
            Channel ch = connectFuture.channel();
            ScheduledFuture<?> timeoutFuture = ch.eventLoop().schedule(() -> {
                if (result.completeExceptionally(new TimeoutException("response timeout from " + host))) {
                    ch.close();
                }
            }, responseTimeoutMillis, TimeUnit.MILLISECONDS);
            result.whenComplete((ignored, error) -> {
                timeoutFuture.cancel(false);
                ch.close();
            });

            FullHttpRequest req = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1,
                HttpMethod.GET,
                pathAndQuery(target),
                Unpooled.EMPTY_BUFFER
            );
            req.headers().set(HttpHeaderNames.HOST, hostHeader(target));
            req.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            req.headers().set(HttpHeaderNames.ACCEPT, "application/xml, text/xml, */*");
            req.headers().set(HttpHeaderNames.USER_AGENT, "oss-audit-licensetool/1");
            ch.writeAndFlush(req).addListener((ChannelFutureListener) writeFuture -> {
                if (!writeFuture.isSuccess()) {
                    result.completeExceptionally(writeFuture.cause());
                    writeFuture.channel().close();
                }
            });
        });
        return result;
    }

    private void pause(URI target) throws LicenseLookupException {
        if (retryDelayMillis <= 0L) {
            return;
        }
        try {
            Thread.sleep(retryDelayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LicenseLookupException("interrupted while waiting to retry " + target, e);
        }
    }

    private static void validate(URI target) throws LicenseLookupException {
        String scheme = target.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new LicenseLookupException("unsupported scheme: " + target);
        }
        if (target.getHost() == null || target.getHost().isBlank()) {
            throw new LicenseLookupException("missing host: " + target);
        }
    }

    @Override
    public void close() {
        ioGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).syncUninterruptibly();
    }

    private record PomResponse(int status, String location, byte[] body) {}

    private static final class PomResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
        private final CompletableFuture<PomResponse> result;

        private PomResponseHandler(CompletableFuture<PomResponse> result) {
            this.result = result;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse msg) {
            result.complete(new PomResponse(
                msg.status().code(),
                msg.headers().get(HttpHeaderNames.LOCATION),
                ByteBufUtil.getBytes(msg.content())
            ));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            result.completeExceptionally(cause);
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            if (!result.isDone()) {
                result.completeExceptionally(new IOException("connection closed before response"));
            }
            ctx.fireChannelInactive();
        }
    }

    private static boolean isHttps(URI uri) {
        return "https".equalsIgnoreCase(uri.getScheme());
    }

    private static int resolvePort(URI uri) {
        if (uri.getPort() > 0) {
            return uri.getPort();
        }
        return isHttps(uri) ? AuditDefaults.HTTPS_DEFAULT_PORT : AuditDefaults.HTTP_DEFAULT_PORT;
    }

    private static String hostHeader(URI uri) {
        return uri.getPort() > 0 ? uri.getHost() + ":" + uri.getPort() : uri.getHost();
    }

    private static String pathAndQuery(URI uri) {
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (uri.getRawQuery() != null && !uri.getRawQuery().isEmpty()) {
            return path + "?" + uri.getRawQuery();
        }
        return path;
    }
}
