package hintvote.coordinator.server;

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
import hintvote.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Netty HTTP front end for the coordinator.
 */
public final class CoordinatorNettyServer {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorNettyServer.class);
    private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

    private final CoordinatorConfig config;
    private final RouterHandler router;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public CoordinatorNettyServer(CoordinatorConfig config, RouterHandler router) {
        this.config = config;
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

    public synchronized boolean start() {
        if (running)
            return true;
        try {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer());

            serverChannel = b.bind(config.serverHost(), config.serverPort()).syncUninterruptibly().channel();
            running = true;
            log.info("Coordinator started on {}:{}", config.serverHost(), config.serverPort());
            return true;
        } catch (Exception e) {
            log.error("Start error on port {}", config.serverPort(), e);
            stop();
            return false;
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
                workerGroup.shutdownGracefully();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
                bossGroup = null;
            }
            if (running) {
                log.info("Coordinator stopped");
            }
            running = false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    public int port() {
        return config.serverPort();
    }
}
