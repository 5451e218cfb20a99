package site.respkv.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.respkv.core.Backend;
import site.respkv.core.ConcurrentBackend;
import site.respkv.protocol.handler.RespDecoder;
import site.respkv.protocol.handler.RespEncoder;
import site.respkv.server.config.RespKvServerConfig;
import site.respkv.server.executor.CommandDispatcher;
import site.respkv.server.handler.RespCommandHandler;

import java.net.InetSocketAddress;

/**
 * 基于Netty的服务器实现
 *
 * <h2>线程模型：</h2>
 * <ul>
 *     <li><strong>boss线程</strong>：接受连接</li>
 *     <li><strong>worker线程</strong>：套接字读写以及RESP编解码</li>
 *     <li><strong>命令执行线程</strong>：每个连接的命令处理器固定在其中一个线程上，
 *     同一连接内严格有序，不同连接之间并行</li>
 * </ul>
 *
 * <p>传输层按平台选择：Linux使用Epoll，macOS/BSD使用KQueue，其余使用NIO。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
@Getter
public class RespKvMiniServer implements RespKvServer {

    private final RespKvServerConfig config;

    private final Backend backend;

    private final CommandDispatcher dispatcher;

    private Class<? extends ServerChannel> serverChannelClass;

    private EventLoopGroup bossGroup;

    private EventLoopGroup workerGroup;

    private EventExecutorGroup commandExecutor;

    private volatile Channel serverChannel;

    public RespKvMiniServer(final RespKvServerConfig config) {
        this(config, new ConcurrentBackend());
    }

    public RespKvMiniServer(final RespKvServerConfig config, final Backend backend) {
        if (config == null) {
            throw new IllegalArgumentException("服务器配置不能为null");
        }
        config.validate();
        this.config = config;
        this.backend = backend;
        this.dispatcher = new CommandDispatcher(backend);

        // 1. 初始化事件循环组和命令执行器
        initializeEventLoopGroups();
        initializeCommandExecutor();
    }

    @Override
    public void start() {
        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_RCVBUF, config.getReceiveBufferSize())
                .childOption(ChannelOption.SO_SNDBUF, config.getSendBufferSize())
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new RespDecoder());
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(commandExecutor, new RespCommandHandler(dispatcher));
                    }
                });
        try {
            serverChannel = serverBootstrap.bind(config.getHost(), config.getPort()).sync().channel();
            log.info("RespKv服务器已启动: {}:{}", config.getHost(), getBoundPort());
        } catch (InterruptedException e) {
            log.error("服务器启动被中断", e);
            stop();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("服务器启动被中断", e);
        } catch (Exception e) {
            // bind 失败时 sync() 直接抛出原始异常，例如端口被占用
            log.error("服务器启动失败: {}:{}", config.getHost(), config.getPort(), e);
            stop();
            throw new IllegalStateException("服务器启动失败: " + e.getMessage(), e);
        }
    }

    @Override
    public void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
                serverChannel = null;
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully().sync();
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully().sync();
            }
            if (commandExecutor != null) {
                commandExecutor.shutdownGracefully().sync();
            }
            log.info("RespKv服务器已停止，普通键 {} 个，哈希键 {} 个", backend.size(), backend.hashSize());
        } catch (InterruptedException e) {
            log.error("服务器停止被中断", e);
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public int getBoundPort() {
        final Channel channel = serverChannel;
        if (channel == null) {
            return -1;
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();

        if (Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (KQueue.isAvailable()) {
            log.info("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }

    private void initializeCommandExecutor() {
        log.info("命令执行线程数: {}，同一连接内的命令串行执行", config.getCommandExecutorThreadCount());
        this.commandExecutor = new DefaultEventExecutorGroup(
                config.getCommandExecutorThreadCount(),
                new DefaultThreadFactory("respkv-cmd"));
    }
}
