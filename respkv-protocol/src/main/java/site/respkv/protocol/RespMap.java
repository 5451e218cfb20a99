package site.respkv.protocol;

import io.netty.buffer.ByteBuf;

import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 映射类型
 *
 * <p>键为文本、值为任意协议值，编码为 "%数量\r\n" 后按键的自然顺序依次写出
 * SimpleString(键) 与值。按键排序是编码约定，保证同一映射总是得到相同的字节。
 *
 * @author respkv
 * @since 1.0.0
 */
public final class RespMap extends Resp {
    public static final RespMap EMPTY = new RespMap(new TreeMap<>());

    /** 按键排序的只读内容 */
    private final SortedMap<String, Resp> content;

    private RespMap(final TreeMap<String, Resp> content) {
        this.content = Collections.unmodifiableSortedMap(content);
    }

    /**
     * 从任意映射创建，复制其内容
     *
     * @param entries 映射内容，键和值都不能为null，键不能包含换行符
     * @return RespMap 实例
     */
    public static RespMap of(final Map<String, ? extends Resp> entries) {
        final TreeMap<String, Resp> copy = new TreeMap<>();
        for (final Map.Entry<String, ? extends Resp> entry : entries.entrySet()) {
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("映射的值不能为null: " + entry.getKey());
            }
            copy.put(SimpleString.checkLine(entry.getKey(), "RespMap键"), entry.getValue());
        }
        return copy.isEmpty() ? EMPTY : new RespMap(copy);
    }

    /**
     * 解码器专用：直接持有已排序的映射
     */
    static RespMap wrapTrusted(final TreeMap<String, Resp> content) {
        return content.isEmpty() ? EMPTY : new RespMap(content);
    }

    public int size() {
        return content.size();
    }

    public Resp get(final String key) {
        return content.get(key);
    }

    /**
     * 获取只读内容
     *
     * @return 按键排序的只读视图
     */
    public SortedMap<String, Resp> getContent() {
        return content;
    }

    @Override
    public RespType getType() {
        return RespType.MAP;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        writeHeader(byteBuf, RespType.MAP, content.size());
        for (final Map.Entry<String, Resp> entry : content.entrySet()) {
            SimpleString.valueOf(entry.getKey()).encode(byteBuf);
            entry.getValue().encode(byteBuf);
        }
    }

    @Override
    protected int compareContent(final Resp other) {
        final Iterator<Map.Entry<String, Resp>> left = content.entrySet().iterator();
        final Iterator<Map.Entry<String, Resp>> right = ((RespMap) other).content.entrySet().iterator();
        while (left.hasNext() && right.hasNext()) {
            final Map.Entry<String, Resp> l = left.next();
            final Map.Entry<String, Resp> r = right.next();
            int cmp = l.getKey().compareTo(r.getKey());
            if (cmp == 0) {
                cmp = l.getValue().compareTo(r.getValue());
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        return Boolean.compare(left.hasNext(), right.hasNext());
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RespMap)) {
            return false;
        }
        return content.equals(((RespMap) o).content);
    }

    @Override
    public int hashCode() {
        return content.hashCode();
    }

    @Override
    public String toString() {
        return "RespMap" + content;
    }
}
