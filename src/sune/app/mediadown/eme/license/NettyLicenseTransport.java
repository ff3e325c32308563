package sune.app.mediadown.eme.license;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import javax.net.ssl.SSLException;

import org.slf4j.Logger;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
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
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.timeout.ReadTimeoutHandler;
import sune.app.mediadown.eme.EMEConstants;
import sune.app.mediadown.eme.EMELog;

public final class NettyLicenseTransport implements LicenseTransport, AutoCloseable {
	
	private static final Logger logger = EMELog.get();
	private static final String DEFAULT_MIME_TYPE = "application/octet-stream";
	
	private final EventLoopGroup group;
	private final int timeoutMs;
	private SslContext sslContext;
	
	public NettyLicenseTransport() {
		this(EMEConstants.TIMEOUT);
	}
	
	public NettyLicenseTransport(int timeoutMs) {
		if(timeoutMs <= 0) {
			throw new IllegalArgumentException("Timeout must be > 0.");
		}
		
		this.group = new NioEventLoopGroup(1);
		this.timeoutMs = timeoutMs;
	}
	
	private static final boolean isSecure(URI uri) {
		return "https".equalsIgnoreCase(uri.getScheme());
	}
	
	private static final int port(URI uri) {
		int port = uri.getPort();
		return port != -1 ? port : (isSecure(uri) ? 443 : 80);
	}
	
	private static final String pathAndQuery(URI uri) {
		String path = uri.getRawPath();
		if(path == null || path.isEmpty()) path = "/";
		String query = uri.getRawQuery();
		return query != null ? path + '?' + query : path;
	}
	
	private static final FullHttpRequest toHttpRequest(LicenseRequest request) {
		URI uri = request.uri();
		ByteBuf content = Unpooled.wrappedBuffer(request.body());
		FullHttpRequest httpRequest = new DefaultFullHttpRequest(
			HttpVersion.HTTP_1_1, request.method(), pathAndQuery(uri), content
		);
		
		httpRequest.headers().set(request.headers());
		httpRequest.headers().set(HttpHeaderNames.HOST, uri.getPort() != -1 ? uri.getHost() + ':' + uri.getPort() : uri.getHost());
		httpRequest.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
		httpRequest.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes());
		
		if(!httpRequest.headers().contains(HttpHeaderNames.CONTENT_TYPE)) {
			httpRequest.headers().set(HttpHeaderNames.CONTENT_TYPE, DEFAULT_MIME_TYPE);
		}
		
		return httpRequest;
	}
	
	private final synchronized SslContext sslContext() throws SSLException {
		if(sslContext == null) {
			sslContext = SslContextBuilder.forClient().build();
		}
		
		return sslContext;
	}
	
	@Override
	public CompletableFuture<LicenseResponse> send(LicenseRequest request) {
		CompletableFuture<LicenseResponse> future = new CompletableFuture<>();
		URI uri = request.uri();
		String host = uri.getHost();
		int port = port(uri);
		boolean secure = isSecure(uri);
		
		if(host == null) {
			future.completeExceptionally(new IllegalArgumentException("Invalid license server URL: " + uri));
			return future;
		}
		
		Bootstrap bootstrap = new Bootstrap()
			.group(group)
			.channel(NioSocketChannel.class)
			.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMs)
			.handler(new ChannelInitializer<SocketChannel>() {
				
				@Override
				protected void initChannel(SocketChannel channel) throws Exception {
					ChannelPipeline pipeline = channel.pipeline();
					if(secure) {
						pipeline.addLast(sslContext().newHandler(channel.alloc(), host, port));
					}
					pipeline.addLast(new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS));
					pipeline.addLast(new HttpClientCodec());
					pipeline.addLast(new HttpObjectAggregator(EMEConstants.LICENSE_MAX_RESPONSE_SIZE));
					pipeline.addLast(new LicenseResponseHandler(future));
				}
			});
		
		if(logger.isDebugEnabled())
			logger.debug("Connecting to license server: host={}, port={}", host, port);
		
		bootstrap.connect(host, port).addListener((ChannelFutureListener) (connect) -> {
			if(!connect.isSuccess()) {
				future.completeExceptionally(connect.cause());
				return;
			}
			
			connect.channel().writeAndFlush(toHttpRequest(request)).addListener((ChannelFutureListener) (write) -> {
				if(!write.isSuccess()) {
					future.completeExceptionally(write.cause());
					write.channel().close();
				}
			});
		});
		
		return future;
	}
	
	@Override
	public void close() {
		group.shutdownGracefully(0L, timeoutMs, TimeUnit.MILLISECONDS);
	}
	
	private static final class LicenseResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
		
		private final CompletableFuture<LicenseResponse> future;
		
		public LicenseResponseHandler(CompletableFuture<LicenseResponse> future) {
			this.future = future;
		}
		
		@Override
		protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response) {
			ByteBuf buf = response.content();
			byte[] bytes = new byte[buf.readableBytes()];
			buf.getBytes(buf.readerIndex(), bytes);
			future.complete(new LicenseResponse(response.status().code(), response.headers().copy(), bytes));
			ctx.close();
		}
		
		@Override
		public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
			future.completeExceptionally(cause);
			ctx.close();
		}
		
		@Override
		public void channelInactive(ChannelHandlerContext ctx) throws Exception {
			if(!future.isDone()) {
				future.completeExceptionally(new IOException("Connection closed before the response was received"));
			}
			
			super.channelInactive(ctx);
		}
	}
}
