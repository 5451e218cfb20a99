package site.respkv.protocol;

import io.netty.buffer.ByteBuf;

import java.util.Arrays;

/**
 * 集合类型，编码为 "~数量\r\n" 后依次编码每个元素
 *
 * <p>"集合"只是协议中的类型名，这一层不做去重，元素保持原有顺序。
 *
 * @author respkv
 * @since 1.0.0
 */
public final class RespSet extends Resp {
    public static final RespSet EMPTY = new RespSet(new Resp[0]);

    private final Resp[] content;

    private RespSet(final Resp[] content) {
        this.content = content;
    }

    public static RespSet of(final Resp... elements) {
        final Resp[] checked = RespArray.checkElements(elements);
        return checked.length == 0 ? EMPTY : new RespSet(checked.clone());
    }

    static RespSet wrapTrusted(final Resp[] content) {
        return content.length == 0 ? EMPTY : new RespSet(content);
    }

    public int size() {
        return content.length;
    }

    public Resp get(final int index) {
        return content[index];
    }

    public Resp[] getContent() {
        return content.clone();
    }

    @Override
    public RespType getType() {
        return RespType.SET;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        writeHeader(byteBuf, RespType.SET, content.length);
        for (final Resp element : content) {
            element.encode(byteBuf);
        }
    }

    @Override
    protected int compareContent(final Resp other) {
        return compareElements(content, ((RespSet) other).content);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RespSet)) {
            return false;
        }
        return Arrays.equals(content, ((RespSet) o).content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "RespSet" + Arrays.toString(content);
    }
}
