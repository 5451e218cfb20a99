package site.respkv.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 批量字符串类型
 *
 * <p>长度已知的任意二进制内容，编码为 "$长度\r\n内容\r\n"。
 * {@link #NULL} 表示空批量字符串 "$-1\r\n"，与长度为0的空字符串不同。
 *
 * <p>使用建议：
 * <ul>
 *     <li>外部数据使用 {@link #create(byte[])}，会复制输入数组</li>
 *     <li>解码器等可信路径使用 {@link #wrapTrusted(byte[])}，不复制</li>
 *     <li>读取内容使用 {@link #getBytes()}，返回副本</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
public final class BulkString extends Resp {
    /** 空值的RESP编码 */
    private static final byte[] NULL_BYTES = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 空字符串的RESP编码 */
    private static final byte[] EMPTY_BULK = "$0\r\n\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 空批量字符串 */
    public static final BulkString NULL = new BulkString(null);

    /** 字符串内容，为null时表示空批量字符串 */
    private final byte[] content;

    private BulkString(final byte[] content) {
        this.content = content;
    }

    /**
     * 创建BulkString的工厂方法：安全模式，复制输入数组
     *
     * @param content 字节数组内容，为null时返回 {@link #NULL}
     * @return BulkString实例
     */
    public static BulkString create(final byte[] content) {
        if (content == null) {
            return NULL;
        }
        return new BulkString(content.clone());
    }

    /**
     * 零拷贝工厂方法
     *
     * <p>警告：调用者必须保证数组之后不会被修改。仅在解码器等可信代码中使用。</p>
     *
     * @param trustedBytes 受信任的字节数组
     * @return BulkString实例
     */
    public static BulkString wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return NULL;
        }
        return new BulkString(trustedBytes);
    }

    /**
     * 从字符串创建，使用UTF-8编码
     *
     * @param str 字符串内容
     * @return BulkString实例
     */
    public static BulkString fromString(final String str) {
        if (str == null) {
            return NULL;
        }
        return new BulkString(str.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isNull() {
        return content == null;
    }

    /**
     * 获取内容的副本
     *
     * @return 字节数组副本，空批量字符串返回null
     */
    public byte[] getBytes() {
        return content == null ? null : content.clone();
    }

    /**
     * 内容长度，空批量字符串返回-1
     */
    public int length() {
        return content == null ? -1 : content.length;
    }

    /**
     * 判断内容是否与给定字节完全一致
     */
    public boolean contentEquals(final byte[] other) {
        return content != null && Arrays.equals(content, other);
    }

    /**
     * 以UTF-8宽松解码内容，非法字节会被替换，仅用于日志和展示
     *
     * @return 字符串内容，空批量字符串返回null
     */
    public String getString() {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public RespType getType() {
        return content == null ? RespType.NULL_BULK_STRING : RespType.BULK_STRING;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content == null) {
            byteBuf.writeBytes(NULL_BYTES);
            return;
        }
        if (content.length == 0) {
            byteBuf.writeBytes(EMPTY_BULK);
            return;
        }

        // 1. 预分配缓冲区空间，'$' + 长度 + CRLF + 内容 + CRLF
        byteBuf.ensureWritable(content.length + 16);

        // 2. 写入头部
        writeHeader(byteBuf, RespType.BULK_STRING, content.length);

        // 3. 写入内容和结束分隔符
        byteBuf.writeBytes(content);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    protected int compareContent(final Resp other) {
        final byte[] otherContent = ((BulkString) other).content;
        if (content == null || otherContent == null) {
            return 0;
        }
        return Arrays.compareUnsigned(content, otherContent);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BulkString)) {
            return false;
        }
        return Arrays.equals(content, ((BulkString) o).content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return content == null ? "BulkString(null)" : "BulkString(" + getString() + ")";
    }
}
