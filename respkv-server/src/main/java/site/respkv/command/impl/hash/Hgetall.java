package site.respkv.command.impl.hash;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import site.respkv.command.Command;
import site.respkv.command.CommandParser;
import site.respkv.command.CommandType;
import site.respkv.core.Backend;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.RespMap;
import site.respkv.protocol.RespNull;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;

/**
 * HGETALL key
 *
 * <p>响应为RESP3映射，字段按字典序输出：
 * <ul>
 *     <li>哈希键存在：字段名作为简单字符串键，值原样输出</li>
 *     <li>哈希键不存在或没有字段：{@link RespNull}</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Hgetall implements Command {

    private final String key;

    public Hgetall(final String key) {
        this.key = Objects.requireNonNull(key, "key");
    }

    public static Hgetall parse(final RespArray request) {
        final List<Resp> args = CommandParser.validate(
                request, new String[]{CommandType.HGETALL.getToken()}, CommandType.HGETALL.getExtraArgs());
        return new Hgetall(CommandParser.toText(args.get(0), "Invalid key"));
    }

    @Override
    public CommandType getType() {
        return CommandType.HGETALL;
    }

    @Override
    public Resp execute(final Backend backend) {
        final Optional<SortedMap<String, Resp>> fields = backend.hgetall(key);
        if (fields.isEmpty() || fields.get().isEmpty()) {
            return RespNull.INSTANCE;
        }
        return RespMap.of(fields.get());
    }
}
