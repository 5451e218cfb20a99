package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.util.ByteProcessor;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * 可恢复的RESP解析器
 *
 * <p>基于类型标识的递归下降解析。解析过程只读取缓冲区，不移动读索引：
 * 游标 {@code index} 从起始位置向后推进，数据不足时返回null，
 * 由 {@link Resp#decode(ByteBuf)} 决定是否提交读索引。
 * 因此复合类型是原子的，部分解析的数组、集合、映射不会暴露给调用者。
 *
 * @author respkv
 * @since 1.0.0
 */
final class RespParser {

    /** 最大嵌套深度 */
    static final int MAX_NESTING_DEPTH = 128;

    private static final Pattern DOUBLE_PATTERN =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final ByteBuf buffer;
    private final int start;
    private final int limit;

    /** 当前解析位置（绝对索引） */
    private int index;

    /** 当前嵌套深度 */
    private int depth;

    RespParser(final ByteBuf buffer, final int start) {
        this.buffer = buffer;
        this.start = start;
        this.limit = buffer.writerIndex();
        this.index = start;
    }

    /**
     * 解析一个完整的帧
     *
     * @return 解码结果
     */
    RespDecodeResult parse() {
        try {
            final Resp value = parseValue();
            if (value == null) {
                return RespDecodeResult.incomplete();
            }
            return RespDecodeResult.parsed(value, index - start);
        } catch (MalformedFrameException e) {
            return RespDecodeResult.malformed(e.getMessage());
        }
    }

    private Resp parseValue() {
        // 1. 读取类型标识
        if (index >= limit) {
            return null;
        }
        final byte tag = buffer.getByte(index);
        final RespType type = RespType.fromTag(tag);
        if (type == null) {
            throw new MalformedFrameException(String.format("unknown type tag 0x%02x", tag & 0xFF));
        }
        index++;

        // 2. 按类型分派
        switch (type) {
            case SIMPLE_STRING: {
                final String line = readLine();
                return line == null ? null : new SimpleString(line);
            }
            case ERROR: {
                final String line = readLine();
                return line == null ? null : new Errors(line);
            }
            case INTEGER: {
                final String line = readLine();
                return line == null ? null : RespInteger.valueOf(parseSignedLong(line));
            }
            case BULK_STRING:
                return parseBulkString();
            case NULL: {
                final String line = readLine();
                if (line == null) {
                    return null;
                }
                if (!line.isEmpty()) {
                    throw new MalformedFrameException("null frame must have an empty payload");
                }
                return RespNull.INSTANCE;
            }
            case BOOLEAN: {
                final String line = readLine();
                return line == null ? null : parseBoolean(line);
            }
            case DOUBLE: {
                final String line = readLine();
                return line == null ? null : RespDouble.valueOf(parseDouble(line));
            }
            case ARRAY:
            case SET:
            case MAP:
                return parseAggregate(type);
            default:
                throw new MalformedFrameException("unsupported type " + type);
        }
    }

    private Resp parseBulkString() {
        // 1. 解析声明的长度
        final String header = readLine();
        if (header == null) {
            return null;
        }
        final int length = parseLength(header, true, Resp.PROTO_MAX_BULK_LEN);
        if (length == -1) {
            return BulkString.NULL;
        }

        // 2. 内容和结尾的CRLF都到齐之前，长度不算数
        if ((long) limit - index < (long) length + 2) {
            return null;
        }
        if (buffer.getByte(index + length) != '\r' || buffer.getByte(index + length + 1) != '\n') {
            throw new MalformedFrameException("bulk string payload is not terminated by CRLF");
        }

        final byte[] content = new byte[length];
        buffer.getBytes(index, content);
        index += length + 2;
        return BulkString.wrapTrusted(content);
    }

    private Resp parseAggregate(final RespType type) {
        final String header = readLine();
        if (header == null) {
            return null;
        }
        final int count = parseLength(header, type == RespType.ARRAY, Resp.PROTO_MAX_AGGREGATE_LEN);
        if (count == -1) {
            return RespArray.NULL;
        }
        if (++depth > MAX_NESTING_DEPTH) {
            throw new MalformedFrameException("nesting deeper than " + MAX_NESTING_DEPTH);
        }
        try {
            if (type == RespType.MAP) {
                return parseMapEntries(count);
            }

            // 头部声明的数量不可信，按实际解析出的元素增长
            final List<Resp> elements = new ArrayList<>(Math.min(count, 16));
            for (int i = 0; i < count; i++) {
                final Resp element = parseValue();
                if (element == null) {
                    return null;
                }
                elements.add(element);
            }
            final Resp[] array = elements.toArray(new Resp[0]);
            return type == RespType.ARRAY ? RespArray.wrapTrusted(array) : RespSet.wrapTrusted(array);
        } finally {
            depth--;
        }
    }

    private Resp parseMapEntries(final int count) {
        final TreeMap<String, Resp> entries = new TreeMap<>();
        for (int i = 0; i < count; i++) {
            final Resp key = parseValue();
            if (key == null) {
                return null;
            }
            if (!(key instanceof SimpleString)) {
                throw new MalformedFrameException("map key must be a simple string, got " + key.getType());
            }
            final Resp value = parseValue();
            if (value == null) {
                return null;
            }
            final String keyText = ((SimpleString) key).getContent();
            if (entries.put(keyText, value) != null) {
                throw new MalformedFrameException("duplicate map key '" + keyText + "'");
            }
        }
        return RespMap.wrapTrusted(entries);
    }

    /**
     * 读取到CRLF为止的一行，游标移动到CRLF之后
     *
     * @return 行内容，数据不完整时返回null
     */
    private String readLine() {
        // 1. 查找第一个 \r 或 \n，最多查找一行的长度上限
        final int searchLength = Math.min(limit - index, Resp.PROTO_MAX_LINE_LEN + 1);
        final int end = searchLength <= 0 ? -1 : buffer.forEachByte(index, searchLength, ByteProcessor.FIND_CRLF);
        if (end < 0) {
            if (searchLength > Resp.PROTO_MAX_LINE_LEN) {
                throw new MalformedFrameException("line exceeds " + Resp.PROTO_MAX_LINE_LEN + " bytes");
            }
            return null;
        }

        // 2. 校验行结束符
        if (buffer.getByte(end) == '\n') {
            throw new MalformedFrameException("line terminated by bare LF");
        }
        if (end + 1 >= limit) {
            return null;
        }
        if (buffer.getByte(end + 1) != '\n') {
            throw new MalformedFrameException("expected CRLF line terminator");
        }

        final String line = decodeUtf8(end - index);
        index = end + 2;
        return line;
    }

    /**
     * 严格解码UTF-8，非法字节序列视为格式错误
     */
    private String decodeUtf8(final int length) {
        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(buffer.nioBuffer(index, length)).toString();
        } catch (CharacterCodingException e) {
            throw new MalformedFrameException("line is not valid UTF-8");
        }
    }

    /**
     * 解析整数，必须带有显式符号
     */
    private static long parseSignedLong(final String line) {
        if (line.length() < 2 || (line.charAt(0) != '+' && line.charAt(0) != '-')) {
            throw new MalformedFrameException("integer requires an explicit sign: '" + line + "'");
        }
        for (int i = 1; i < line.length(); i++) {
            final char c = line.charAt(i);
            if (c < '0' || c > '9') {
                throw new MalformedFrameException("invalid integer: '" + line + "'");
            }
        }
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new MalformedFrameException("integer out of range: '" + line + "'");
        }
    }

    /**
     * 解析长度或数量：非负十进制数字，或在允许时为 -1
     */
    private static int parseLength(final String line, final boolean allowNull, final int max) {
        if ("-1".equals(line)) {
            if (allowNull) {
                return -1;
            }
            throw new MalformedFrameException("negative length is not allowed here");
        }
        if (line.isEmpty() || line.length() > 10) {
            throw new MalformedFrameException("invalid length: '" + line + "'");
        }
        long value = 0;
        for (int i = 0; i < line.length(); i++) {
            final char c = line.charAt(i);
            if (c < '0' || c > '9') {
                throw new MalformedFrameException("invalid length: '" + line + "'");
            }
            value = value * 10 + (c - '0');
        }
        if (value > max) {
            throw new MalformedFrameException("length " + value + " exceeds limit " + max);
        }
        return (int) value;
    }

    private static RespBoolean parseBoolean(final String line) {
        if ("t".equals(line)) {
            return RespBoolean.TRUE;
        }
        if ("f".equals(line)) {
            return RespBoolean.FALSE;
        }
        throw new MalformedFrameException("invalid boolean: '" + line + "'");
    }

    private static double parseDouble(final String line) {
        switch (line) {
            case "inf":
            case "+inf":
                return Double.POSITIVE_INFINITY;
            case "-inf":
                return Double.NEGATIVE_INFINITY;
            case "nan":
                return Double.NaN;
            default:
                break;
        }
        if (!DOUBLE_PATTERN.matcher(line).matches()) {
            throw new MalformedFrameException("invalid double: '" + line + "'");
        }
        return Double.parseDouble(line);
    }

    /**
     * 格式错误，在解析器内部传递，由 {@link #parse()} 转换为结果
     */
    private static final class MalformedFrameException extends RuntimeException {
        MalformedFrameException(final String message) {
            super(message, null, false, false);
        }
    }
}
