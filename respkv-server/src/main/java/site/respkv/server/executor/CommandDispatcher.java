package site.respkv.server.executor;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.respkv.command.Command;
import site.respkv.command.CommandParser;
import site.respkv.core.Backend;
import site.respkv.protocol.Resp;

/**
 * 命令分派器
 *
 * <p>把解码后的请求解析为命令，并在共享存储上执行。分派器本身无状态，
 * 所有连接处理器共享同一个实例。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
@Getter
public class CommandDispatcher {

    /** 所有连接共享的存储 */
    private final Backend backend;

    public CommandDispatcher(final Backend backend) {
        if (backend == null) {
            throw new IllegalArgumentException("存储不能为null");
        }
        this.backend = backend;
    }

    /**
     * 解析并执行一个请求
     *
     * @param request 解码后的请求
     * @return 响应值
     * @throws site.respkv.command.CommandException 请求无法解析为命令
     */
    public Resp dispatch(final Resp request) {
        return execute(CommandParser.parse(request));
    }

    /**
     * 执行已解析的命令
     *
     * @param command 命令
     * @return 响应值
     */
    public Resp execute(final Command command) {
        final Resp response = command.execute(backend);
        log.debug("执行命令: {} -> {}", command, response.getType());
        return response;
    }
}
