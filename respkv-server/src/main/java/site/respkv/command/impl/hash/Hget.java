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
import site.respkv.protocol.RespNull;

import java.util.List;
import java.util.Objects;

/**
 * HGET key field
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Hget implements Command {

    private final String key;
    private final String field;

    public Hget(final String key, final String field) {
        this.key = Objects.requireNonNull(key, "key");
        this.field = Objects.requireNonNull(field, "field");
    }

    public static Hget parse(final RespArray request) {
        final List<Resp> args = CommandParser.validate(
                request, new String[]{CommandType.HGET.getToken()}, CommandType.HGET.getExtraArgs());
        return new Hget(
                CommandParser.toText(args.get(0), "Invalid key or field"),
                CommandParser.toText(args.get(1), "Invalid key or field"));
    }

    @Override
    public CommandType getType() {
        return CommandType.HGET;
    }

    @Override
    public Resp execute(final Backend backend) {
        return backend.hget(key, field).orElse(RespNull.INSTANCE);
    }
}
