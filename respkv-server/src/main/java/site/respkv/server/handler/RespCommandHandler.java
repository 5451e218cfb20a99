package site.respkv.server.handler;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;
import site.respkv.command.CommandException;
import site.respkv.protocol.Errors;
import site.respkv.protocol.Resp;
import site.respkv.protocol.handler.ProtocolViolation;
import site.respkv.server.executor.CommandDispatcher;

/**
 * 命令处理器
 *
 * <p>每个连接一个实例，运行在命令执行线程组中固定的一个线程上，
 * 因此同一连接的请求严格按到达顺序执行和响应。
 *
 * <p>处理规则：
 * <ul>
 *     <li>每个请求恰好产生一个响应</li>
 *     <li>请求无法解析为命令时，写出 "-ERR 消息" 后关闭连接</li>
 *     <li>收到解码器的 {@link ProtocolViolation} 时，写出 "-ERR Protocol error: 原因" 后关闭连接，
 *     此前到达的请求都已响应</li>
 *     <li>进入关闭流程后到达的请求直接丢弃</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class RespCommandHandler extends SimpleChannelInboundHandler<Object> {

    static final String ERROR_PREFIX = "ERR ";

    private final CommandDispatcher dispatcher;

    /** 只在本连接的执行线程上读写 */
    private boolean closing;

    public RespCommandHandler(final CommandDispatcher dispatcher) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("命令分派器不能为null");
        }
        this.dispatcher = dispatcher;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        log.debug("客户端已连接: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (closing) {
            log.debug("连接正在关闭，丢弃消息: {}", msg);
            return;
        }

        if (msg instanceof ProtocolViolation) {
            closing = true;
            log.warn("协议错误，关闭连接 {}: {}", ctx.channel().remoteAddress(), ((ProtocolViolation) msg).getReason());
            ctx.writeAndFlush(((ProtocolViolation) msg).toError()).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        if (!(msg instanceof Resp)) {
            log.warn("忽略未知消息类型: {}", msg.getClass().getName());
            return;
        }

        try {
            final Resp response = dispatcher.dispatch((Resp) msg);
            ctx.writeAndFlush(response);
        } catch (CommandException e) {
            // 写完错误响应再关闭
            closing = true;
            log.warn("命令解析失败，关闭连接 {}: [{}] {}", ctx.channel().remoteAddress(), e.getError(), e.getMessage());
            ctx.writeAndFlush(toError(e)).addListener(ChannelFutureListener.CLOSE);
        }
    }

    /**
     * 把命令异常转换为错误响应，消息中的换行符替换为空格
     */
    static Errors toError(final CommandException e) {
        final String message = String.valueOf(e.getMessage()).replace('\r', ' ').replace('\n', ' ');
        return new Errors(ERROR_PREFIX + message);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.debug("客户端已断开: {}", ctx.channel().remoteAddress());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("连接异常: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
