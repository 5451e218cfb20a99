package site.respkv.core;

import lombok.extern.slf4j.Slf4j;
import site.respkv.protocol.Resp;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于 ConcurrentHashMap 的存储实现
 *
 * <h2>线程安全设计：</h2>
 * <ul>
 *     <li><strong>普通键</strong>：单层 ConcurrentHashMap，同一键的写入串行化，后写者胜出</li>
 *     <li><strong>哈希键</strong>：两层 ConcurrentHashMap，内层映射通过 computeIfAbsent 原子创建</li>
 *     <li><strong>快照</strong>：hgetall 复制内层映射，不暴露正在被修改的结构</li>
 * </ul>
 *
 * <p>不同键上的操作只在 ConcurrentHashMap 的桶级别竞争，不存在跨键的锁，因此不会死锁。
 * 实例由服务器持有，并以引用的方式共享给所有连接处理器。
 *
 * @author respkv
 * @since 1.0.0
 */
@Slf4j
public class ConcurrentBackend implements Backend {

    /** 普通键空间 */
    private final ConcurrentHashMap<String, Resp> map = new ConcurrentHashMap<>();

    /** 哈希键空间 */
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, Resp>> hmap = new ConcurrentHashMap<>();

    @Override
    public Optional<Resp> get(final String key) {
        return Optional.ofNullable(map.get(Objects.requireNonNull(key, "key")));
    }

    @Override
    public void set(final String key, final Resp value) {
        map.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    @Override
    public Optional<Resp> hget(final String key, final String field) {
        Objects.requireNonNull(field, "field");
        final ConcurrentHashMap<String, Resp> fields = hmap.get(Objects.requireNonNull(key, "key"));
        if (fields == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(fields.get(field));
    }

    @Override
    public void hset(final String key, final String field, final Resp value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");

        // 1. 原子地获取或创建内层映射
        final ConcurrentHashMap<String, Resp> fields = hmap.computeIfAbsent(key, k -> {
            log.debug("创建哈希键: {}", k);
            return new ConcurrentHashMap<>();
        });

        // 2. 写入字段
        fields.put(field, value);
    }

    @Override
    public Optional<SortedMap<String, Resp>> hgetall(final String key) {
        final ConcurrentHashMap<String, Resp> fields = hmap.get(Objects.requireNonNull(key, "key"));
        if (fields == null) {
            return Optional.empty();
        }
        // 弱一致迭代复制出独立的快照
        return Optional.of(Collections.unmodifiableSortedMap(new TreeMap<>(fields)));
    }

    @Override
    public int size() {
        return map.size();
    }

    @Override
    public int hashSize() {
        return hmap.size();
    }
}
