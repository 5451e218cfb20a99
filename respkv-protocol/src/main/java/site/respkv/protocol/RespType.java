package site.respkv.protocol;

import lombok.Getter;

/**
 * RESP数据类型枚举
 *
 * <p>声明顺序即不同类型之间的比较顺序，NULL_BULK_STRING 与 NULL_ARRAY
 * 与各自的非空类型共用同一个类型标识符。
 *
 * @author respkv
 * @since 1.0.0
 */
@Getter
public enum RespType {
    SIMPLE_STRING('+'),
    ERROR('-'),
    INTEGER(':'),
    BULK_STRING('$'),
    NULL_BULK_STRING('$'),
    ARRAY('*'),
    NULL('_'),
    NULL_ARRAY('*'),
    BOOLEAN('#'),
    DOUBLE(','),
    MAP('%'),
    SET('~');

    /** 类型标识符 */
    private final byte tag;

    RespType(final char tag) {
        this.tag = (byte) tag;
    }

    /**
     * 根据类型标识符查找类型
     *
     * @param tag 首字节
     * @return 对应的类型，无法识别时返回null
     */
    public static RespType fromTag(final byte tag) {
        switch (tag) {
            case '+':
                return SIMPLE_STRING;
            case '-':
                return ERROR;
            case ':':
                return INTEGER;
            case '$':
                return BULK_STRING;
            case '*':
                return ARRAY;
            case '_':
                return NULL;
            case '#':
                return BOOLEAN;
            case ',':
                return DOUBLE;
            case '%':
                return MAP;
            case '~':
                return SET;
            default:
                return null;
        }
    }
}
