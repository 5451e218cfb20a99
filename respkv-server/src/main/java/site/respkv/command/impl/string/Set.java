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
import site.respkv.protocol.SimpleString;

import java.util.List;
import java.util.Objects;

/**
 * SET key value
 *
 * <p>值按收到的RESP值原样保存，之后的 GET 返回同一个值。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Set implements Command {

    private final String key;
    private final Resp value;

    public Set(final String key, final Resp value) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value");
    }

    public static Set parse(final RespArray request) {
        final List<Resp> args = CommandParser.validate(
                request, new String[]{CommandType.SET.getToken()}, CommandType.SET.getExtraArgs());
        return new Set(CommandParser.toText(args.get(0), "Invalid key or value"), args.get(1));
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public Resp execute(final Backend backend) {
        backend.set(key, value);
        return SimpleString.OK;
    }
}
