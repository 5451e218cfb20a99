package site.respkv.command.impl.string;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import site.respkv.command.Command;
import site.respkv.command.CommandParser;
import site.respkv.command.CommandType;
import site.respkv.core.Backend;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.RespNull;

import java.util.List;
import java.util.Objects;

/**
 * GET key
 *
 * <p>返回键对应的值，键不存在时返回 {@link RespNull}。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Get implements Command {

    private final String key;

    public Get(final String key) {
        this.key = Objects.requireNonNull(key, "key");
    }

    /**
     * 从请求数组解析
     *
     * @throws site.respkv.command.CommandException 请求格式不对
     */
    public static Get parse(final RespArray request) {
        final List<Resp> args = CommandParser.validate(
                request, new String[]{CommandType.GET.getToken()}, CommandType.GET.getExtraArgs());
        return new Get(CommandParser.toText(args.get(0), "Invalid key"));
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public Resp execute(final Backend backend) {
        return backend.get(key).orElse(RespNull.INSTANCE);
    }
}
