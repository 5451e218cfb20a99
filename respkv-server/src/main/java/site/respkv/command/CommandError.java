package site.respkv.command;

/**
 * 命令错误的种类
 *
 * @author respkv
 * @since 1.0.0
 */
public enum CommandError {
    /** 命令名无法识别、请求结构不对或第一个元素不是批量字符串 */
    INVALID_COMMAND,
    /** 参数数量或参数类型不对 */
    INVALID_ARGUMENTS,
    /** 键或字段不是合法的UTF-8 */
    TEXT_DECODE
}
