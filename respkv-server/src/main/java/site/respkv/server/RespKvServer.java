package site.respkv.server;

import site.respkv.core.Backend;

/**
 * 服务器接口
 *
 * @author respkv
 * @since 1.0.0
 */
public interface RespKvServer {

    /**
     * 绑定端口并开始接受连接，返回时已经可以连接
     */
    void start();

    /**
     * 关闭监听和所有线程组
     */
    void stop();

    /**
     * 所有连接共享的存储
     */
    Backend getBackend();

    /**
     * 实际监听的端口，未启动时返回-1
     */
    int getBoundPort();
}
