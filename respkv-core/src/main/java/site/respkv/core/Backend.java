package site.respkv.core;

import site.respkv.protocol.Resp;

import java.util.Optional;
import java.util.SortedMap;

/**
 * 并发内存存储
 *
 * <p>包含两个互相独立的命名空间：
 * <ul>
 *   <li>普通键空间：key → value，由 SET 写入、GET 读取
 *   <li>哈希键空间：key → field → value，由 HSET 写入、HGET/HGETALL 读取
 * </ul>
 *
 * <p>实现要求：
 * <ul>
 *   <li>所有方法线程安全，可被任意数量的连接处理器并发调用
 *   <li>每个操作只对它触及的单个键保证原子性
 *   <li>操作不会失败，缺失用空的 Optional 表示
 *   <li>没有删除、过期和淘汰，数据在进程生命周期内一直存在
 * </ul>
 *
 * @author respkv
 * @since 1.0
 */
public interface Backend {

    /**
     * 读取普通键
     *
     * @param key 键
     * @return 值，不存在时为空
     */
    Optional<Resp> get(String key);

    /**
     * 写入普通键，覆盖已有的值
     *
     * @param key 键
     * @param value 值
     */
    void set(String key, Resp value);

    /**
     * 两级查找哈希字段，任何一级缺失都返回空
     *
     * @param key 哈希键
     * @param field 字段
     * @return 值，不存在时为空
     */
    Optional<Resp> hget(String key, String field);

    /**
     * 写入哈希字段
     *
     * <p>键对应的内层映射不存在时原子地创建，并发的首次写入不会丢失。
     *
     * @param key 哈希键
     * @param field 字段
     * @param value 值
     */
    void hset(String key, String field, Resp value);

    /**
     * 获取哈希键在调用时刻的只读快照
     *
     * <p>返回的是副本而不是实时视图，调用者可以在不持有锁的情况下遍历和编码。
     *
     * @param key 哈希键
     * @return 按字段排序的快照，键不存在时为空
     */
    Optional<SortedMap<String, Resp>> hgetall(String key);

    /**
     * @return 普通键数量
     */
    int size();

    /**
     * @return 哈希键数量
     */
    int hashSize();
}
