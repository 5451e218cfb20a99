package site.respkv.protocol;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 解码结果
 *
 * <p>三种状态：
 * <ul>
 *     <li>PARSED - 得到一个完整的值，consumed 为该帧占用的字节数</li>
 *     <li>INCOMPLETE - 目前的数据是某个帧的合法前缀，需要更多数据后重试，不是错误</li>
 *     <li>MALFORMED - 数据违反协议且无法再变得合法，连接应当关闭</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class RespDecodeResult {

    public enum Status {
        PARSED,
        INCOMPLETE,
        MALFORMED
    }

    private static final RespDecodeResult INCOMPLETE = new RespDecodeResult(Status.INCOMPLETE, null, 0, null);

    private final Status status;

    /** 解析出的值，仅 PARSED 时非null */
    private final Resp value;

    /** 消耗的字节数，仅 PARSED 时有意义 */
    private final int consumed;

    /** 格式错误的原因，仅 MALFORMED 时非null */
    private final String reason;

    public static RespDecodeResult parsed(final Resp value, final int consumed) {
        return new RespDecodeResult(Status.PARSED, value, consumed, null);
    }

    public static RespDecodeResult incomplete() {
        return INCOMPLETE;
    }

    public static RespDecodeResult malformed(final String reason) {
        return new RespDecodeResult(Status.MALFORMED, null, 0, reason);
    }

    public boolean isParsed() {
        return status == Status.PARSED;
    }

    public boolean isIncomplete() {
        return status == Status.INCOMPLETE;
    }

    public boolean isMalformed() {
        return status == Status.MALFORMED;
    }

    @Override
    public String toString() {
        switch (status) {
            case PARSED:
                return "PARSED(" + value + ", " + consumed + ")";
            case MALFORMED:
                return "MALFORMED(" + reason + ")";
            default:
                return "INCOMPLETE";
        }
    }
}
