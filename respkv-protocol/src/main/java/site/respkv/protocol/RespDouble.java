package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

/**
 * 双精度浮点类型
 *
 * <p>编码格式：
 * <ul>
 *     <li>绝对值 &gt;= 1e8 或 &lt; 1e-8（非零）时使用科学计数法，例如 ",+1.23456e8\r\n"</li>
 *     <li>其余情况使用定点表示，例如 ",+123.456\r\n"、",-0.0000000123456\r\n"</li>
 *     <li>符号总是写出；非有限值写作 "+inf"、"-inf"、"nan"</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public final class RespDouble extends Resp {
    /** 科学计数法的上界（含） */
    private static final double SCIENTIFIC_UPPER = 1e8;

    /** 科学计数法的下界（不含） */
    private static final double SCIENTIFIC_LOWER = 1e-8;

    private final double content;

    private RespDouble(final double content) {
        this.content = content;
    }

    public static RespDouble valueOf(final double value) {
        return new RespDouble(value);
    }

    /**
     * 按协议格式化浮点数，不含类型标识和CRLF
     *
     * @param value 浮点值
     * @return 带符号的文本表示
     */
    static String format(final double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "+inf" : "-inf";
        }

        // -0.0 也写出负号，保证解码后仍是 -0.0
        final String sign = Double.doubleToRawLongBits(value) < 0 ? "-" : "+";
        final double abs = Math.abs(value);
        if (abs == 0.0) {
            return sign + "0";
        }

        // BigDecimal.valueOf 使用 Double.toString 的最短往返表示
        final BigDecimal decimal = BigDecimal.valueOf(abs).stripTrailingZeros();
        if (abs >= SCIENTIFIC_UPPER || abs < SCIENTIFIC_LOWER) {
            final String digits = decimal.unscaledValue().toString();
            final int exponent = decimal.precision() - decimal.scale() - 1;
            final StringBuilder sb = new StringBuilder(digits.length() + 8);
            sb.append(sign).append(digits.charAt(0));
            if (digits.length() > 1) {
                sb.append('.').append(digits, 1, digits.length());
            }
            return sb.append('e').append(exponent).toString();
        }
        return sign + decimal.toPlainString();
    }

    @Override
    public RespType getType() {
        return RespType.DOUBLE;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte(',');
        byteBuf.writeBytes(format(content).getBytes(StandardCharsets.US_ASCII));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    protected int compareContent(final Resp other) {
        return Double.compare(content, ((RespDouble) other).content);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RespDouble)) {
            return false;
        }
        return Double.compare(content, ((RespDouble) o).content) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(content);
    }

    @Override
    public String toString() {
        return "RespDouble(" + content + ")";
    }
}
