package site.respkv.server.config;

import lombok.Builder;
import lombok.Data;

/**
 * 服务器配置
 *
 * <p>配置分为两类：
 * <ul>
 *     <li>网络配置：监听地址、端口和套接字缓冲区</li>
 *     <li>线程配置：Netty的boss/worker线程以及命令执行线程</li>
 * </ul>
 *
 * <p>端口为0时由操作系统分配，实际端口通过
 * {@link site.respkv.server.RespKvServer#getBoundPort()} 获取。
 *
 * @author respkv
 * @since 1.0.0
 */
@Data
@Builder
public class RespKvServerConfig {

    // ========== 网络配置 ==========

    /** 监听地址 */
    @Builder.Default
    private String host = "127.0.0.1";

    /** 监听端口，0表示由系统分配 */
    @Builder.Default
    private int port = 6379;

    /** 连接队列长度 */
    @Builder.Default
    private int backlogSize = 1024;

    @Builder.Default
    private int receiveBufferSize = 32 * 1024;

    @Builder.Default
    private int sendBufferSize = 32 * 1024;

    // ========== 线程配置 ==========

    @Builder.Default
    private int bossThreadCount = 1;

    @Builder.Default
    private int workerThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    /** 命令执行线程数，每个连接固定在其中一个线程上 */
    @Builder.Default
    private int commandExecutorThreadCount = Runtime.getRuntime().availableProcessors();

    // ========== 工厂方法 ==========

    public static RespKvServerConfig defaultConfig() {
        return RespKvServerConfig.builder().build();
    }

    /**
     * 开发环境配置：只监听本机，少量线程
     */
    public static RespKvServerConfig developmentConfig() {
        return RespKvServerConfig.builder()
                .host("127.0.0.1")
                .port(6379)
                .workerThreadCount(2)
                .commandExecutorThreadCount(2)
                .build();
    }

    /**
     * 生产环境配置：监听所有地址，更大的缓冲区和连接队列
     */
    public static RespKvServerConfig productionConfig() {
        return RespKvServerConfig.builder()
                .host("0.0.0.0")
                .port(6379)
                .backlogSize(2048)
                .receiveBufferSize(64 * 1024)
                .sendBufferSize(64 * 1024)
                .bossThreadCount(1)
                .workerThreadCount(Runtime.getRuntime().availableProcessors() * 2)
                .commandExecutorThreadCount(Runtime.getRuntime().availableProcessors())
                .build();
    }

    /**
     * 从命令行参数构建配置，未指定的项使用默认值
     *
     * <p>支持的参数：{@code --host}、{@code --port}、{@code --workers}、{@code --executors}，
     * 每个参数后面跟一个值。
     *
     * @param args 命令行参数
     * @return 配置
     * @throws IllegalArgumentException 参数无法识别、缺少值或数值格式错误
     */
    public static RespKvServerConfig fromArgs(final String[] args) {
        final RespKvServerConfig config = defaultConfig();
        for (int i = 0; i < args.length; i++) {
            final String option = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("参数缺少值: " + option);
            }
            final String value = args[++i];
            switch (option) {
                case "--host":
                    config.setHost(value);
                    break;
                case "--port":
                    config.setPort(parseInt(option, value));
                    break;
                case "--workers":
                    config.setWorkerThreadCount(parseInt(option, value));
                    break;
                case "--executors":
                    config.setCommandExecutorThreadCount(parseInt(option, value));
                    break;
                default:
                    throw new IllegalArgumentException("未知参数: " + option);
            }
        }
        return config;
    }

    private static int parseInt(final String option, final String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("参数 " + option + " 的值不是整数: " + value, e);
        }
    }

    /**
     * 校验配置
     *
     * @throws IllegalArgumentException 配置项无效
     */
    public void validate() {
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("监听地址不能为空");
        }

        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在0-65535范围内");
        }

        if (bossThreadCount <= 0 || workerThreadCount <= 0 || commandExecutorThreadCount <= 0) {
            throw new IllegalArgumentException("线程数量必须大于0");
        }

        if (backlogSize <= 0 || receiveBufferSize <= 0 || sendBufferSize <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须大于0");
        }
    }
}
