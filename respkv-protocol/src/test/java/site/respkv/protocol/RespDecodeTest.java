package site.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RESP流式解码测试
 */
class RespDecodeTest {

    private final List<ByteBuf> buffers = new ArrayList<>();

    @AfterEach
    void tearDown() {
        buffers.forEach(ByteBuf::release);
    }

    private ByteBuf buffer(String text) {
        ByteBuf buf = Unpooled.copiedBuffer(text, StandardCharsets.UTF_8);
        buffers.add(buf);
        return buf;
    }

    private Resp decodeFully(String text) {
        ByteBuf buf = buffer(text);
        RespDecodeResult result = Resp.decode(buf);
        assertTrue(result.isParsed(), "应当完整解析: " + result);
        assertEquals(buf.writerIndex(), result.getConsumed());
        assertEquals(buf.writerIndex(), buf.readerIndex());
        return result.getValue();
    }

    private void assertMalformed(String text) {
        ByteBuf buf = buffer(text);
        RespDecodeResult result = Resp.decode(buf);
        assertTrue(result.isMalformed(), "应当判定为格式错误: " + text.replace("\r\n", "\\r\\n") + " -> " + result);
        assertNotNull(result.getReason());
        assertEquals(0, buf.readerIndex());
    }

    @Test
    void testScalarTypes() {
        assertEquals(SimpleString.OK, decodeFully("+OK\r\n"));
        assertEquals(new Errors("ERR oops"), decodeFully("-ERR oops\r\n"));
        assertEquals(RespInteger.valueOf(123), decodeFully(":+123\r\n"));
        assertEquals(RespInteger.valueOf(-123), decodeFully(":-123\r\n"));
        assertSame(RespNull.INSTANCE, decodeFully("_\r\n"));
        assertSame(RespBoolean.TRUE, decodeFully("#t\r\n"));
        assertSame(RespBoolean.FALSE, decodeFully("#f\r\n"));
    }

    @Test
    void testBulkString() {
        assertEquals(BulkString.fromString("hello"), decodeFully("$5\r\nhello\r\n"));
        assertSame(BulkString.NULL, decodeFully("$-1\r\n"));
        BulkString empty = (BulkString) decodeFully("$0\r\n\r\n");
        assertEquals(0, empty.length());
        assertFalse(empty.isNull());

        // 内容中的CRLF按长度读取，不视为结束符
        assertEquals(BulkString.fromString("a\r\nb"), decodeFully("$4\r\na\r\nb\r\n"));
    }

    @Test
    void testDouble() {
        assertEquals(RespDouble.valueOf(1.5), decodeFully(",1.5\r\n"));
        assertEquals(RespDouble.valueOf(123.456), decodeFully(",+123.456\r\n"));
        assertEquals(RespDouble.valueOf(1.23456e8), decodeFully(",+1.23456e8\r\n"));
        assertEquals(RespDouble.valueOf(Double.POSITIVE_INFINITY), decodeFully(",inf\r\n"));
        assertEquals(RespDouble.valueOf(Double.NEGATIVE_INFINITY), decodeFully(",-inf\r\n"));
        assertTrue(Double.isNaN(((RespDouble) decodeFully(",nan\r\n")).getContent()));
        assertEquals(RespDouble.valueOf(-0.0), decodeFully(",-0\r\n"));
    }

    @Test
    void testAggregates() {
        RespArray array = (RespArray) decodeFully("*2\r\n$3\r\nget\r\n$5\r\nhello\r\n");
        assertEquals(RespArray.of(BulkString.fromString("get"), BulkString.fromString("hello")), array);
        assertSame(RespArray.NULL, decodeFully("*-1\r\n"));
        assertSame(RespArray.EMPTY, decodeFully("*0\r\n"));

        RespSet set = (RespSet) decodeFully("~2\r\n:+1\r\n:+2\r\n");
        assertEquals(2, set.size());
        assertEquals(RespInteger.valueOf(2), set.get(1));

        RespMap map = (RespMap) decodeFully("%2\r\n+hello\r\n$5\r\nworld\r\n+foo\r\n:+1\r\n");
        assertEquals(2, map.size());
        assertEquals(BulkString.fromString("world"), map.get("hello"));
        assertEquals("foo", map.getContent().firstKey());
    }

    @Test
    @DisplayName("任意严格前缀都是不完整，读索引不动")
    void testStrictPrefixesAreIncomplete() {
        String frame = "*3\r\n$4\r\nhset\r\n%1\r\n+f\r\n,1.5\r\n*-1\r\n";
        for (int i = 0; i < frame.length(); i++) {
            ByteBuf buf = buffer(frame.substring(0, i));
            RespDecodeResult result = Resp.decode(buf);
            assertTrue(result.isIncomplete(), "前缀长度 " + i + " 应当不完整: " + result);
            assertEquals(0, buf.readerIndex());
        }
        assertEquals(RespType.ARRAY, decodeFully(frame).getType());
    }

    @Test
    @DisplayName("分片到达的帧")
    void testFrameArrivingInChunks() {
        ByteBuf buf = buffer("*2\r\n$3\r\nget\r\n$5\r\nhel");
        assertTrue(Resp.decode(buf).isIncomplete());

        buf.writeBytes("lo\r\n".getBytes(StandardCharsets.UTF_8));
        RespDecodeResult result = Resp.decode(buf);
        assertTrue(result.isParsed());
        assertEquals(2, ((RespArray) result.getValue()).size());
        assertFalse(buf.isReadable());
    }

    @Test
    @DisplayName("连续的多个帧按顺序解析")
    void testPipelinedFrames() {
        ByteBuf buf = buffer("+OK\r\n:+1\r\n$1\r\na");

        RespDecodeResult first = Resp.decode(buf);
        assertEquals(SimpleString.OK, first.getValue());
        assertEquals(5, first.getConsumed());

        RespDecodeResult second = Resp.decode(buf);
        assertEquals(RespInteger.ONE, second.getValue());
        assertEquals(10, buf.readerIndex());

        assertTrue(Resp.decode(buf).isIncomplete());
        assertEquals(10, buf.readerIndex());
    }

    @Test
    void testEmptyBufferIsIncomplete() {
        assertTrue(Resp.decode(Unpooled.EMPTY_BUFFER).isIncomplete());
    }

    @Test
    @DisplayName("格式错误的帧")
    void testMalformedFrames() {
        // 1. 未知类型标识
        assertMalformed("?hello\r\n");
        assertMalformed("hello\r\n");

        // 2. 行结束符错误
        assertMalformed("+OK\n");
        assertMalformed("+OK\rX");

        // 3. 数字格式
        assertMalformed(":123\r\n");
        assertMalformed(":+12a\r\n");
        assertMalformed(":+99999999999999999999\r\n");
        assertMalformed("$abc\r\n");
        assertMalformed("$-2\r\n");
        assertMalformed("*1x\r\n");

        // 4. 批量字符串长度与内容不符
        assertMalformed("$3\r\nabcd\r\n");

        // 5. 其他标量
        assertMalformed("#x\r\n");
        assertMalformed(",abc\r\n");
        assertMalformed(",1.5.1\r\n");
        assertMalformed("_x\r\n");

        // 6. 只有数组允许 -1
        assertMalformed("~-1\r\n");
        assertMalformed("%-1\r\n");
    }

    @Test
    @DisplayName("映射的键必须是不重复的简单字符串")
    void testMalformedMapKeys() {
        assertMalformed("%1\r\n:+1\r\n:+2\r\n");
        assertMalformed("%1\r\n$1\r\na\r\n:+2\r\n");
        assertMalformed("%2\r\n+a\r\n:+1\r\n+a\r\n:+2\r\n");
    }

    @Test
    @DisplayName("行类型必须是合法的UTF-8")
    void testInvalidUtf8InLine() {
        assertMalformedBytes(new byte[]{'+', (byte) 0xFF, '\r', '\n'});
        assertMalformedBytes(new byte[]{'-', 'E', (byte) 0xC3, '\r', '\n'});

        // 两个不同的非法键不能被折叠成同一个键
        assertMalformedBytes(new byte[]{'%', '1', '\r', '\n', '+', (byte) 0xFE, '\r', '\n', ':', '+', '1', '\r', '\n'});

        // 合法的多字节字符正常解码
        byte[] snowman = "+\u2603\r\n".getBytes(StandardCharsets.UTF_8);
        assertEquals(new SimpleString("\u2603"), Resp.decode(Unpooled.wrappedBuffer(snowman)).getValue());
    }

    private void assertMalformedBytes(byte[] bytes) {
        ByteBuf buf = Unpooled.wrappedBuffer(bytes);
        RespDecodeResult result = Resp.decode(buf);
        assertTrue(result.isMalformed(), result.toString());
        assertEquals(0, buf.readerIndex());
    }

    @Test
    @DisplayName("格式错误在数据完整之前也能发现")
    void testMalformedInsideIncompleteAggregate() {
        assertMalformed("*3\r\n:+1\r\n?");
    }

    @Test
    @DisplayName("嵌套深度上限")
    void testNestingDepthLimit() {
        StringBuilder allowed = new StringBuilder();
        for (int i = 0; i < RespParser.MAX_NESTING_DEPTH; i++) {
            allowed.append("*1\r\n");
        }
        allowed.append(":+1\r\n");
        assertEquals(RespType.ARRAY, decodeFully(allowed.toString()).getType());

        assertMalformed("*1\r\n" + allowed);

        // 编码不受限制，超过上限的值编码后解码被拒绝
        Resp deep = RespInteger.ONE;
        for (int i = 0; i <= RespParser.MAX_NESTING_DEPTH; i++) {
            deep = RespArray.of(deep);
        }
        assertMalformed(new String(deep.toBytes(), StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("编码后解码得到相等的值")
    void testRoundTrip() {
        TreeMap<String, Resp> fields = new TreeMap<>();
        fields.put("name", BulkString.fromString("respkv"));
        fields.put("ratio", RespDouble.valueOf(-1.23456e-9));
        fields.put("zero", RespDouble.valueOf(-0.0));
        Resp value = RespArray.of(
                SimpleString.OK,
                new Errors("ERR boom"),
                RespInteger.valueOf(Long.MIN_VALUE),
                BulkString.create(new byte[]{0, '\r', '\n', (byte) 0x80}),
                BulkString.NULL,
                RespArray.NULL,
                RespArray.EMPTY,
                RespNull.INSTANCE,
                RespBoolean.TRUE,
                RespDouble.valueOf(1e100),
                RespMap.of(fields),
                RespSet.of(RespInteger.ONE, RespInteger.MINUS_ONE));

        String encoded = new String(value.toBytes(), StandardCharsets.ISO_8859_1);
        ByteBuf buf = Unpooled.wrappedBuffer(value.toBytes());
        buffers.add(buf);
        RespDecodeResult result = Resp.decode(buf);

        assertTrue(result.isParsed());
        assertEquals(encoded.length(), result.getConsumed());
        assertEquals(value, result.getValue());
    }
}
