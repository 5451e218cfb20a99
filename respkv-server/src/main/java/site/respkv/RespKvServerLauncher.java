package site.respkv;

import lombok.extern.slf4j.Slf4j;
import site.respkv.server.RespKvMiniServer;
import site.respkv.server.RespKvServer;
import site.respkv.server.config.RespKvServerConfig;

/**
 * 服务器启动入口
 *
 * <p>用法：{@code java site.respkv.RespKvServerLauncher [--host h] [--port p] [--workers n] [--executors n]}
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class RespKvServerLauncher {

    public static void main(String[] args) {
        final RespKvServerConfig config = RespKvServerConfig.fromArgs(args);
        final RespKvServer server = new RespKvMiniServer(config);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("正在关闭服务器...");
            server.stop();
        }, "respkv-shutdown"));

        server.start();
    }
}
