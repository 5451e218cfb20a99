package site.respkv.command;

import lombok.Getter;

/**
 * 命令解析失败
 *
 * <p>消息会以 "-ERR 消息" 的形式原样返回给客户端，随后连接被关闭。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public class CommandException extends RuntimeException {

    private final CommandError error;

    public CommandException(final CommandError error, final String message) {
        super(message);
        this.error = error;
    }

    public CommandException(final CommandError error, final String message, final Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
