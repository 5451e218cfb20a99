package site.respkv.command;

import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespArray;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 命令解析器
 *
 * <p>把解码后的请求数组转换为 {@link Command}。解析分两步：
 * <ul>
 *     <li>顶层识别：第一个元素必须是批量字符串，内容选择具体命令的解析器</li>
 *     <li>命令解析：{@link #validate} 校验参数个数和命令名，再把键、字段解码为文本</li>
 * </ul>
 *
 * <p>所有失败都以 {@link CommandException} 报告，消息直接作为错误响应的内容。
 *
 * @author respkv
 * @since 1.0.0
 */
public final class CommandParser {

    private static final String FIRST_ARGUMENT_MESSAGE = "Command must have a BulkString as the first argument";

    private CommandParser() {
    }

    /**
     * 解析请求
     *
     * @param request 客户端发送的任意RESP值
     * @return 命令实例
     * @throws CommandException 请求无法转换为命令
     */
    public static Command parse(final Resp request) {
        // 1. 请求必须是非空数组
        if (!(request instanceof RespArray) || ((RespArray) request).isNull()) {
            throw new CommandException(CommandError.INVALID_COMMAND,
                    "Invalid command: expected an array of bulk strings, got "
                            + (request == null ? "nothing" : request.getType()));
        }
        final RespArray array = (RespArray) request;
        if (array.size() == 0) {
            throw new CommandException(CommandError.INVALID_COMMAND, "Invalid command: empty request");
        }

        // 2. 第一个元素选择命令
        final Resp first = array.get(0);
        if (!(first instanceof BulkString) || ((BulkString) first).isNull()) {
            throw new CommandException(CommandError.INVALID_COMMAND, FIRST_ARGUMENT_MESSAGE);
        }
        final CommandType type = CommandType.findByBytes(((BulkString) first).getBytes());
        if (type == null) {
            throw new CommandException(CommandError.INVALID_COMMAND,
                    "Invalid command: " + ((BulkString) first).getString());
        }

        // 3. 交给具体命令解析
        return type.parse(array);
    }

    /**
     * 校验请求的形状
     *
     * @param request   请求数组
     * @param names     期望的命令名令牌，按顺序比较，大小写不敏感
     * @param extraArgs 命令名之后的参数个数
     * @return 命令名之后的参数，只读
     * @throws CommandException 元素个数不对，或命令名不匹配
     */
    public static List<Resp> validate(final RespArray request, final String[] names, final int extraArgs) {
        // 1. 元素个数必须精确匹配
        if (request.size() != names.length + extraArgs) {
            throw new CommandException(CommandError.INVALID_ARGUMENTS, String.format(
                    "%s command must have exactly %d argument", String.join(" ", names), extraArgs));
        }

        // 2. 逐个比较命令名
        for (int i = 0; i < names.length; i++) {
            final Resp element = request.get(i);
            if (!(element instanceof BulkString) || ((BulkString) element).isNull()) {
                throw new CommandException(CommandError.INVALID_COMMAND, FIRST_ARGUMENT_MESSAGE);
            }
            final byte[] token = ((BulkString) element).getBytes();
            if (!Arrays.equals(asciiLowercase(token), names[i].getBytes(StandardCharsets.US_ASCII))) {
                throw new CommandException(CommandError.INVALID_COMMAND, String.format(
                        "Invalid command: expected %s, got %s", names[i], ((BulkString) element).getString()));
            }
        }

        // 3. 返回剩余参数
        final List<Resp> args = new ArrayList<>(extraArgs);
        for (int i = names.length; i < request.size(); i++) {
            args.add(request.get(i));
        }
        return Collections.unmodifiableList(args);
    }

    /**
     * 只把ASCII大写字母转为小写，其余字节原样保留
     */
    static byte[] asciiLowercase(final byte[] bytes) {
        final byte[] lower = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            final byte b = bytes[i];
            lower[i] = (b >= 'A' && b <= 'Z') ? (byte) (b + ('a' - 'A')) : b;
        }
        return lower;
    }

    /**
     * 把参数严格解码为UTF-8文本
     *
     * @param arg     参数
     * @param message 参数不是批量字符串时的错误消息
     * @return 解码后的文本
     * @throws CommandException 参数不是非空批量字符串，或内容不是合法的UTF-8
     */
    public static String toText(final Resp arg, final String message) {
        if (!(arg instanceof BulkString) || ((BulkString) arg).isNull()) {
            throw new CommandException(CommandError.INVALID_ARGUMENTS, message);
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(((BulkString) arg).getBytes()))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new CommandException(CommandError.TEXT_DECODE, "Utf8 error: " + e.getMessage(), e);
        }
    }
}
