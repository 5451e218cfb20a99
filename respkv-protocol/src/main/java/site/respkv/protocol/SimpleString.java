package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 简单字符串类型
 *
 * <p>短小、可信、不含换行符的文本，编码为 "+内容\r\n"。
 * 常用响应使用预定义常量，避免每次响应都重新分配。
 *
 * <p>预定义常量：
 * <ul>
 *     <li>OK - 成功响应，SET/HSET 共用</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(callSuper = false, of = "content")
public final class SimpleString extends Resp {
    /** 预定义的成功响应 */
    public static final SimpleString OK = new SimpleString("OK");

    /** 字符串内容 */
    private final String content;

    /** 字符串的字节表示 */
    @Getter(lombok.AccessLevel.NONE)
    private final byte[] contentBytes;

    /**
     * 构造函数
     *
     * @param content 字符串内容，不能包含 \r 或 \n
     * @throws IllegalArgumentException 内容包含换行符时
     */
    public SimpleString(final String content) {
        this.content = checkLine(content, "SimpleString");
        this.contentBytes = content.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 工厂方法：常用内容返回缓存实例
     *
     * @param content 字符串内容
     * @return SimpleString 实例
     */
    public static SimpleString valueOf(final String content) {
        if ("OK".equals(content)) {
            return OK;
        }
        return new SimpleString(content);
    }

    static String checkLine(final String content, final String typeName) {
        if (content == null) {
            throw new IllegalArgumentException(typeName + "内容不能为null");
        }
        if (content.indexOf('\r') >= 0 || content.indexOf('\n') >= 0) {
            throw new IllegalArgumentException(typeName + "内容不能包含换行符");
        }
        return content;
    }

    @Override
    public RespType getType() {
        return RespType.SIMPLE_STRING;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('+');
        byteBuf.writeBytes(contentBytes);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    protected int compareContent(final Resp other) {
        return content.compareTo(((SimpleString) other).content);
    }

    @Override
    public String toString() {
        return "SimpleString(" + content + ")";
    }
}
