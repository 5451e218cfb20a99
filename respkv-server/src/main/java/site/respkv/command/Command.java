package site.respkv.command;

import site.respkv.core.Backend;
import site.respkv.protocol.Resp;

/**
 * 命令接口
 *
 * <p>每个实现类对应一种命令，参数在解析阶段已经校验并解码为文本，
 * 实例不可变，可以在任意线程上执行。
 *
 * <p>实现要求：
 * <ul>
 *     <li>执行只依赖传入的存储，不持有连接状态</li>
 *     <li>执行不会失败，所有参数错误都在解析阶段报告</li>
 *     <li>响应是一个完整的RESP值</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
public interface Command {

    /**
     * 获取命令类型
     *
     * @return 命令类型枚举值
     */
    CommandType getType();

    /**
     * 对存储执行命令
     *
     * @param backend 共享存储
     * @return 响应值
     */
    Resp execute(Backend backend);
}
