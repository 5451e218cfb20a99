package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 布尔类型，编码为 "#t\r\n" 或 "#f\r\n"
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public final class RespBoolean extends Resp {
    private static final byte[] TRUE_BYTES = "#t\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] FALSE_BYTES = "#f\r\n".getBytes(StandardCharsets.US_ASCII);

    public static final RespBoolean TRUE = new RespBoolean(true);
    public static final RespBoolean FALSE = new RespBoolean(false);

    private final boolean content;

    private RespBoolean(final boolean content) {
        this.content = content;
    }

    public static RespBoolean valueOf(final boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public RespType getType() {
        return RespType.BOOLEAN;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeBytes(content ? TRUE_BYTES : FALSE_BYTES);
    }

    @Override
    protected int compareContent(final Resp other) {
        return Boolean.compare(content, ((RespBoolean) other).content);
    }

    @Override
    public String toString() {
        return "RespBoolean(" + content + ")";
    }
}
