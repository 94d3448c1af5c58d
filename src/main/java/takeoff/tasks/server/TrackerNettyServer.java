package takeoff.tasks.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * HTTP server for the public API and worker hooks.
 */
public final class TrackerNettyServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TrackerNettyServer.class);

    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private final RouterHandler router;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public TrackerNettyServer(RouterHandler router) {
        this.router = router;
    }

    private ChannelInitializer<SocketChannel> pipelineInitializer() {
        return new ChannelInitializer<>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(60, 0, 0, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                p.addLast(router);
            }
        };
    }

    /**
     * Bind and start serving. Blocks until the port is bound.
     *
     * @throws IllegalStateException if the port cannot be bound
     */
    public synchronized void start(String host, int port) {
        if (running) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer());

            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            running = true;
            log.info("Task tracker listening on {}:{}", host, port);
        } catch (Exception e) {
            stop();
            throw new IllegalStateException("Failed to start server on port " + port, e);
        }
    }

    public synchronized void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
                bossGroup = null;
            }
            if (running) {
                log.info("Task tracker server stopped");
            }
            running = false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        stop();
    }
}
