package site.respkv.command;

import lombok.Getter;
import site.respkv.command.impl.hash.Hget;
import site.respkv.command.impl.hash.Hgetall;
import site.respkv.command.impl.hash.Hset;
import site.respkv.command.impl.string.Get;
import site.respkv.command.impl.string.Set;
import site.respkv.protocol.RespArray;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * 支持的命令类型
 *
 * <p>每种命令记录：
 * <ul>
 *     <li>命令名：小写的请求令牌</li>
 *     <li>额外参数个数：命令名之后必须紧跟的参数数量</li>
 *     <li>解析器：从请求数组构造命令实例</li>
 * </ul>
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public enum CommandType {
    // ========== 字符串命令 ==========
    /** GET key */
    GET("get", 1, Get::parse),
    /** SET key value */
    SET("set", 2, Set::parse),

    // ========== 哈希命令 ==========
    /** HGET key field */
    HGET("hget", 2, Hget::parse),
    /** HSET key field value */
    HSET("hset", 3, Hset::parse),
    /** HGETALL key */
    HGETALL("hgetall", 1, Hgetall::parse);

    /** 命令查找缓存，键为小写命令名 */
    private static final Map<String, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : CommandType.values()) {
            COMMAND_CACHE.put(type.token, type);
        }
    }

    /** 小写命令名 */
    private final String token;

    /** 命令名之后的参数个数 */
    private final int extraArgs;

    @Getter(lombok.AccessLevel.NONE)
    private final Function<RespArray, Command> parser;

    CommandType(final String token, final int extraArgs, final Function<RespArray, Command> parser) {
        this.token = token;
        this.extraArgs = extraArgs;
        this.parser = parser;
    }

    /**
     * 根据命令名字节查找命令类型，ASCII大小写不敏感
     *
     * @param bytes 请求中第一个批量字符串的内容
     * @return 命令类型，无法识别时返回null
     */
    public static CommandType findByBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return null;
        }

        // ISO-8859-1 一个字节对应一个字符，非ASCII内容不会与任何命令名相等
        return COMMAND_CACHE.get(new String(CommandParser.asciiLowercase(bytes), StandardCharsets.ISO_8859_1));
    }

    /**
     * 用本命令的解析器解析请求
     *
     * @param request 完整的请求数组
     * @return 命令实例
     * @throws CommandException 请求不符合本命令的格式
     */
    public Command parse(final RespArray request) {
        return parser.apply(request);
    }
}
