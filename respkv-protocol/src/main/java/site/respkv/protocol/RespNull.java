package site.respkv.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;

/**
 * 通用空值，编码为 "_\r\n"
 *
 * <p>单例，GET/HGET/HGETALL 未命中时返回。
 *
 * @author respkv
 * @since 1.0.0
 */
public final class RespNull extends Resp {
    private static final byte[] NULL_BYTES = "_\r\n".getBytes(StandardCharsets.US_ASCII);

    public static final RespNull INSTANCE = new RespNull();

    private RespNull() {
    }

    @Override
    public RespType getType() {
        return RespType.NULL;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeBytes(NULL_BYTES);
    }

    @Override
    protected int compareContent(final Resp other) {
        return 0;
    }

    @Override
    public String toString() {
        return "RespNull";
    }
}
