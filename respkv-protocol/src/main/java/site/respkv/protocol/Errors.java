package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 错误消息类型
 *
 * <p>错误格式：
 * <ul>
 *     <li>语法："-Error message\r\n"</li>
 *     <li>示例："-ERR Invalid command: foo"</li>
 *     <li>示例："-ERR Protocol error: unknown type tag 'x'"</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class Errors extends Resp {
    /** 错误消息内容 */
    private final String content;

    /**
     * 创建错误消息实例
     *
     * @param content 错误消息内容，不能包含换行符
     */
    public Errors(final String content) {
        this.content = SimpleString.checkLine(content, "Errors");
    }

    @Override
    public RespType getType() {
        return RespType.ERROR;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    protected int compareContent(final Resp other) {
        return content.compareTo(((Errors) other).content);
    }

    @Override
    public String toString() {
        return "Errors(" + content + ")";
    }
}
