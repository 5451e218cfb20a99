package site.respkv.protocol.handler;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import site.respkv.protocol.Errors;

/**
 * 协议错误消息
 *
 * <p>由 {@link RespDecoder} 在遇到格式错误的帧时放入入站消息流，排在之前所有完整帧之后。
 * 下游处理器按顺序处理完前面的请求后，写出 {@link #toError()} 并关闭连接。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ProtocolViolation {

    /** 协议错误响应的前缀 */
    public static final String PROTOCOL_ERROR_PREFIX = "ERR Protocol error: ";

    private final String reason;

    public ProtocolViolation(final String reason) {
        this.reason = reason == null ? "malformed frame" : reason.replace('\r', ' ').replace('\n', ' ');
    }

    /**
     * 转换为发给客户端的错误响应
     */
    public Errors toError() {
        return new Errors(PROTOCOL_ERROR_PREFIX + reason);
    }
}
