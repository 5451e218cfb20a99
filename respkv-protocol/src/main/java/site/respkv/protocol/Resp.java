package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.nio.charset.StandardCharsets;

/**
 * RESP协议值的基础类
 *
 * <p>所有协议值类型的公共父类，定义统一的编码接口、结构化比较规则以及解码入口。
 * 每个子类对应协议中的一种值类型，实例一经创建即不可变，编码过程不会修改实例。
 *
 * <p>支持的数据类型：
 * <ul>
 *     <li>简单字符串 - 以"+"开头</li>
 *     <li>错误消息 - 以"-"开头</li>
 *     <li>整数 - 以":"开头，总是带符号</li>
 *     <li>批量字符串 - 以"$"开头</li>
 *     <li>数组 - 以"*"开头</li>
 *     <li>空值 - "_"</li>
 *     <li>布尔 - 以"#"开头</li>
 *     <li>浮点数 - 以","开头</li>
 *     <li>映射 - 以"%"开头</li>
 *     <li>集合 - 以"~"开头</li>
 * </ul>
 *
 * <p>比较规则：不同类型按 {@link RespType} 的声明顺序比较，相同类型按内容逐项比较。
 *
 * <p>嵌套上限：编码不限制复合类型的嵌套层数，但 {@link #decode(ByteBuf)} 拒绝超过128层的帧，
 * 超过该深度的值编码后无法再解码。
 *
 * @author respkv
 * @since 1.0.0
 */
public abstract class Resp implements Comparable<Resp> {
    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 批量字符串的最大长度 512MB */
    public static final int PROTO_MAX_BULK_LEN = 512 * 1024 * 1024;

    /** 聚合类型的最大元素数量 */
    public static final int PROTO_MAX_AGGREGATE_LEN = 1024 * 1024;

    /** 单行内容的最大长度 64KB */
    public static final int PROTO_MAX_LINE_LEN = 64 * 1024;

    /** 最大缓存数字 */
    protected static final int MAX_CACHED_NUMBER = 255;

    /** 数字的字节表示缓存 */
    private static final byte[][] NUMBERS = new byte[MAX_CACHED_NUMBER + 1][];

    static {
        for (int i = 0; i <= MAX_CACHED_NUMBER; i++) {
            NUMBERS[i] = String.valueOf(i).getBytes(StandardCharsets.US_ASCII);
        }
    }

    /**
     * 写入非负长度或计数，常用数字走缓存
     *
     * @param buf 目标缓冲区
     * @param value 长度或计数
     */
    protected static void writeLengthAsBytes(final ByteBuf buf, final int value) {
        if (value >= 0 && value <= MAX_CACHED_NUMBER) {
            buf.writeBytes(NUMBERS[value]);
        } else {
            buf.writeBytes(String.valueOf(value).getBytes(StandardCharsets.US_ASCII));
        }
    }

    /**
     * 写入"类型标识 + 长度 + CRLF"形式的头部
     */
    protected static void writeHeader(final ByteBuf buf, final RespType type, final int length) {
        buf.writeByte(type.getTag());
        writeLengthAsBytes(buf, length);
        buf.writeBytes(CRLF);
    }

    /**
     * RESP 协议解码方法
     *
     * <p>解码结果分三种：完整解析（读索引前进恰好一个帧的长度）、数据不完整
     * （读索引不变，等待更多数据后重试）、格式错误（读索引不变，连接应当关闭）。
     *
     * @param buffer 输入缓冲区
     * @return 解码结果，不会为null
     */
    public static RespDecodeResult decode(final ByteBuf buffer) {
        // 1. 没有可读数据，直接返回不完整
        if (!buffer.isReadable()) {
            return RespDecodeResult.incomplete();
        }

        // 2. 在读索引的副本上解析，只有完整解析时才移动读索引
        final int start = buffer.readerIndex();
        final RespDecodeResult result = new RespParser(buffer, start).parse();
        if (result.isParsed()) {
            buffer.readerIndex(start + result.getConsumed());
        }
        return result;
    }

    /**
     * 获取值的协议类型
     *
     * @return 协议类型
     */
    public abstract RespType getType();

    /**
     * 将当前值编码到缓冲区
     *
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(ByteBuf byteBuf);

    /**
     * 比较同类型的两个值
     *
     * @param other 类型相同的另一个值
     * @return 比较结果
     */
    protected abstract int compareContent(Resp other);

    /**
     * 将当前值编码为独立的字节数组
     *
     * @return 编码后的字节
     */
    public byte[] toBytes() {
        final ByteBuf buf = Unpooled.buffer();
        try {
            encode(buf);
            final byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }

    @Override
    public final int compareTo(final Resp other) {
        final int byType = getType().compareTo(other.getType());
        if (byType != 0) {
            return byType;
        }
        return compareContent(other);
    }

    /**
     * 按元素逐项比较两个序列，前缀较短者在前
     */
    protected static int compareElements(final Resp[] left, final Resp[] right) {
        final int common = Math.min(left.length, right.length);
        for (int i = 0; i < common; i++) {
            final int cmp = left[i].compareTo(right[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.length, right.length);
    }
}
