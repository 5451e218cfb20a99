package site.respkv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;
import site.respkv.protocol.Resp;

/**
 * RESP协议编码器
 *
 * <p>把响应值直接编码到输出ByteBuf。编码本身是全函数，不会因为值的内容失败。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class RespEncoder extends MessageToByteEncoder<Resp> {

    @Override
    protected void encode(ChannelHandlerContext ctx, Resp msg, ByteBuf out) {
        msg.encode(out);
        log.debug("成功编码RESP响应: {} (大小: {} bytes)", msg.getType(), out.readableBytes());
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("RespEncoder异常: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
