package site.respkv.command.impl.hash;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import site.respkv.command.Command;
import site.respkv.command.CommandError;
import site.respkv.command.CommandException;
import site.respkv.command.CommandParser;
import site.respkv.command.CommandType;
import site.respkv.core.Backend;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.SimpleString;

import java.util.List;
import java.util.Objects;

/**
 * HSET key field value
 *
 * <p>哈希键不存在时由存储原子地创建，字段已存在时覆盖。总是返回 OK。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Hset implements Command {

    private final String key;
    private final String field;
    private final Resp value;

    public Hset(final String key, final String field, final Resp value) {
        this.key = Objects.requireNonNull(key, "key");
        this.field = Objects.requireNonNull(field, "field");
        this.value = Objects.requireNonNull(value, "value");
    }

    public static Hset parse(final RespArray request) {
        final List<Resp> args = CommandParser.validate(
                request, new String[]{CommandType.HSET.getToken()}, CommandType.HSET.getExtraArgs());
        final String key = CommandParser.toText(args.get(0), "Invalid key or field");
        final String field = CommandParser.toText(args.get(1), "Invalid key or field");
        // 字段名在 HGETALL 中作为简单字符串输出，不能包含换行符
        if (field.indexOf('\r') >= 0 || field.indexOf('\n') >= 0) {
            throw new CommandException(CommandError.INVALID_ARGUMENTS, "Invalid key or field");
        }
        return new Hset(key, field, args.get(2));
    }

    @Override
    public CommandType getType() {
        return CommandType.HSET;
    }

    @Override
    public Resp execute(final Backend backend) {
        backend.hset(key, field, value);
        return SimpleString.OK;
    }
}
