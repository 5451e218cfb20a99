package site.respkv.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespDecodeResult;

import java.util.List;

/**
 * RESP协议解码器
 *
 * <p>基于Netty的ByteToMessageDecoder，把连接上的字节流切分为完整的RESP值。
 * 累积缓冲区由父类维护，数据不完整时保持原样，等下一批字节到达后重新解析。
 *
 * <p>处理策略：
 * <ul>
 *     <li>完整帧 - 交给后续处理器，一次调用可能产出多个帧</li>
 *     <li>数据不完整 - 不消费任何字节，等待更多数据</li>
 *     <li>格式错误 - 字节流无法再同步，停止解码并在已解析的帧之后放入一条 {@link ProtocolViolation}，
 *     由下游处理器在响应完前面的请求后回复错误并关闭连接</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder extends ByteToMessageDecoder {

    /** 出现格式错误后丢弃后续所有输入 */
    private boolean corrupted;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (corrupted) {
            in.skipBytes(in.readableBytes());
            return;
        }

        while (in.isReadable()) {
            final RespDecodeResult result = Resp.decode(in);
            switch (result.getStatus()) {
                case PARSED:
                    out.add(result.getValue());
                    log.debug("成功解码RESP帧: {} ({} bytes)", result.getValue().getType(), result.getConsumed());
                    break;
                case INCOMPLETE:
                    // 数据不完整，等待更多数据
                    return;
                case MALFORMED:
                default:
                    handleMalformed(ctx, in, out, result.getReason());
                    return;
            }
        }
    }

    private void handleMalformed(final ChannelHandlerContext ctx, final ByteBuf in,
                                 final List<Object> out, final String reason) {
        corrupted = true;
        log.warn("RESP格式错误 {}: {}", ctx.channel().remoteAddress(), reason);
        in.skipBytes(in.readableBytes());

        // 排在已解析的帧之后，保证错误响应不会抢在它们的响应之前
        out.add(new ProtocolViolation(reason));
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("RespDecoder异常: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
