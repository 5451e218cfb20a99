package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 64位有符号整数类型
 *
 * <p>编码时总是写出符号："+"表示非负数，"-"表示负数，例如 ":+123\r\n"、":-123\r\n"。
 * 基于享元模式，-10 到 127 范围内的实例被缓存复用。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class RespInteger extends Resp {
    /** 缓存范围下限 */
    private static final int CACHE_LOW = -10;

    /** 缓存范围上限 */
    private static final int CACHE_HIGH = 127;

    /** 整数实例缓存数组 */
    private static final RespInteger[] CACHE = new RespInteger[CACHE_HIGH - CACHE_LOW + 1];

    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new RespInteger(i + CACHE_LOW);
        }
    }

    public static final RespInteger ZERO = CACHE[-CACHE_LOW];
    public static final RespInteger ONE = CACHE[1 - CACHE_LOW];
    public static final RespInteger MINUS_ONE = CACHE[-1 - CACHE_LOW];

    /** 整数值 */
    private final long content;

    private RespInteger(final long content) {
        this.content = content;
    }

    /**
     * 工厂方法：缓存范围内返回共享实例
     *
     * @param value 整数值
     * @return RespInteger 实例
     */
    public static RespInteger valueOf(final long value) {
        if (value >= CACHE_LOW && value <= CACHE_HIGH) {
            return CACHE[(int) value - CACHE_LOW];
        }
        return new RespInteger(value);
    }

    @Override
    public RespType getType() {
        return RespType.INTEGER;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte(':');
        if (content >= 0) {
            byteBuf.writeByte('+');
        }
        // 负数自带 '-'，Long.MIN_VALUE 也能正确输出
        byteBuf.writeBytes(Long.toString(content).getBytes(StandardCharsets.US_ASCII));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    protected int compareContent(final Resp other) {
        return Long.compare(content, ((RespInteger) other).content);
    }

    @Override
    public String toString() {
        return "RespInteger(" + content + ")";
    }
}
