package site.respkv.protocol;

import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 数组类型
 *
 * <p>有序、可包含不同类型元素的序列，编码为 "*数量\r\n" 后依次编码每个元素。
 * 请求统一以数组形式到达，第一个元素是命令名。
 *
 * <p>预定义实例：
 * <ul>
 *     <li>EMPTY - 空数组，对应"*0\r\n"</li>
 *     <li>NULL - null数组，对应"*-1\r\n"，与空数组不同</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
public final class RespArray extends Resp {
    /** null数组的RESP编码 */
    private static final byte[] NULL_ARRAY_BYTES = "*-1\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 预定义的空数组实例 */
    public static final RespArray EMPTY = new RespArray(new Resp[0]);

    /** 预定义的null数组实例 */
    public static final RespArray NULL = new RespArray(null);

    /** 数组内容，为null时表示null数组 */
    private final Resp[] content;

    private RespArray(final Resp[] content) {
        this.content = content;
    }

    /**
     * 创建数组，复制输入的元素
     *
     * @param elements 数组元素，不能包含null
     * @return RespArray 实例
     */
    public static RespArray of(final Resp... elements) {
        return valueOf(checkElements(elements));
    }

    /**
     * 工厂方法：空数组和null数组返回缓存实例，其余情况复制输入数组
     *
     * @param content 数组内容，为null时返回 {@link #NULL}
     * @return RespArray 实例
     */
    public static RespArray valueOf(final Resp[] content) {
        if (content == null) {
            return NULL;
        }
        if (content.length == 0) {
            return EMPTY;
        }
        return new RespArray(checkElements(content).clone());
    }

    /**
     * 解码器专用：直接持有数组，不复制
     */
    static RespArray wrapTrusted(final Resp[] content) {
        return content.length == 0 ? EMPTY : new RespArray(content);
    }

    static Resp[] checkElements(final Resp[] content) {
        if (content == null) {
            throw new IllegalArgumentException("元素数组不能为null");
        }
        for (final Resp element : content) {
            if (element == null) {
                throw new IllegalArgumentException("元素不能为null");
            }
        }
        return content;
    }

    public boolean isNull() {
        return content == null;
    }

    /**
     * 元素数量，null数组返回-1
     */
    public int size() {
        return content == null ? -1 : content.length;
    }

    /**
     * 获取指定位置的元素
     */
    public Resp get(final int index) {
        if (content == null) {
            throw new IllegalStateException("null数组没有元素");
        }
        return content[index];
    }

    /**
     * 获取内容的副本
     *
     * @return 元素数组副本，null数组返回null
     */
    public Resp[] getContent() {
        return content == null ? null : content.clone();
    }

    @Override
    public RespType getType() {
        return content == null ? RespType.NULL_ARRAY : RespType.ARRAY;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        // 1. 处理null数组
        if (content == null) {
            byteBuf.writeBytes(NULL_ARRAY_BYTES);
            return;
        }

        // 2. 写入数组头部
        writeHeader(byteBuf, RespType.ARRAY, content.length);

        // 3. 编码所有数组元素
        for (final Resp element : content) {
            element.encode(byteBuf);
        }
    }

    @Override
    protected int compareContent(final Resp other) {
        final Resp[] otherContent = ((RespArray) other).content;
        if (content == null || otherContent == null) {
            return 0;
        }
        return compareElements(content, otherContent);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RespArray)) {
            return false;
        }
        return Arrays.equals(content, ((RespArray) o).content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return content == null ? "RespArray(null)" : "RespArray" + Arrays.toString(content);
    }
}
