package site.respkv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.RespArray;
import site.respkv.protocol.RespInteger;
import site.respkv.protocol.SimpleString;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RespDecoderTest {

    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        channel = new EmbeddedChannel(new RespDecoder());
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private static ByteBuf bytes(String text) {
        return Unpooled.copiedBuffer(text, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("半包：数据到齐之前不产生消息")
    void testPartialFrame() {
        assertFalse(channel.writeInbound(bytes("*2\r\n$3\r\nget\r\n$5\r\nhel")));
        assertNull(channel.readInbound());

        assertTrue(channel.writeInbound(bytes("lo\r\n")));
        RespArray request = channel.readInbound();
        assertEquals(RespArray.of(BulkString.fromString("get"), BulkString.fromString("hello")), request);
        assertTrue(channel.isOpen());
    }

    @Test
    @DisplayName("粘包：一次读取中的多个帧按顺序产生")
    void testMultipleFramesInOneRead() {
        assertTrue(channel.writeInbound(bytes("+OK\r\n:+1\r\n:-1\r\n")));

        assertEquals(SimpleString.OK, channel.readInbound());
        assertEquals(RespInteger.ONE, channel.readInbound());
        assertEquals(RespInteger.MINUS_ONE, channel.readInbound());
        assertNull(channel.readInbound());
    }

    @Test
    @DisplayName("格式错误：之前的帧照常交付，随后是协议错误消息")
    void testMalformedFrameFollowsParsedFrames() {
        assertTrue(channel.writeInbound(bytes("+OK\r\n?bad\r\n:+1\r\n")));

        assertEquals(SimpleString.OK, channel.readInbound());
        ProtocolViolation violation = channel.readInbound();
        assertEquals("unknown type tag 0x3f", violation.getReason());
        assertEquals("ERR Protocol error: unknown type tag 0x3f", violation.toError().getContent());
        assertNull(channel.readInbound());

        // 解码器自己不写响应，也不关闭连接
        assertNull(channel.readOutbound());
        assertTrue(channel.isOpen());
    }

    @Test
    @DisplayName("格式错误之后的输入全部丢弃")
    void testInputAfterMalformedFrameIsDiscarded() {
        channel.writeInbound(bytes("$x\r\n"));
        assertNotNull(channel.readInbound());

        assertFalse(channel.writeInbound(bytes("+OK\r\n")));
        assertNull(channel.readInbound());
    }
}
