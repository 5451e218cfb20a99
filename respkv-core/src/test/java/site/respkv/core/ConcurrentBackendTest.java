package site.respkv.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import site.respkv.protocol.BulkString;
import site.respkv.protocol.Resp;
import site.respkv.protocol.RespInteger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentBackendTest {

    private ConcurrentBackend backend;

    @BeforeEach
    void setUp() {
        backend = new ConcurrentBackend();
    }

    @Test
    @DisplayName("写入后立即可读，后写者覆盖")
    void testSetAndGet() {
        assertEquals(Optional.empty(), backend.get("hello"));

        backend.set("hello", BulkString.fromString("world"));
        assertEquals(Optional.of(BulkString.fromString("world")), backend.get("hello"));

        backend.set("hello", RespInteger.valueOf(42));
        assertEquals(Optional.of(RespInteger.valueOf(42)), backend.get("hello"));
        assertEquals(1, backend.size());
    }

    @Test
    @DisplayName("普通键和哈希键是两个独立的命名空间")
    void testKeySpacesAreIndependent() {
        backend.set("k", BulkString.fromString("plain"));
        assertEquals(Optional.empty(), backend.hget("k", "f"));
        assertEquals(Optional.empty(), backend.hgetall("k"));

        backend.hset("k", "f", BulkString.fromString("hashed"));
        assertEquals(Optional.of(BulkString.fromString("plain")), backend.get("k"));
        assertEquals(Optional.of(BulkString.fromString("hashed")), backend.hget("k", "f"));
    }

    @Test
    void testHashFields() {
        backend.hset("user", "name", BulkString.fromString("alice"));
        backend.hset("user", "age", RespInteger.valueOf(30));
        backend.hset("user", "name", BulkString.fromString("bob"));

        assertEquals(Optional.of(BulkString.fromString("bob")), backend.hget("user", "name"));
        assertEquals(Optional.of(RespInteger.valueOf(30)), backend.hget("user", "age"));
        assertEquals(Optional.empty(), backend.hget("user", "missing"));
        assertEquals(Optional.empty(), backend.hget("nobody", "name"));
        assertEquals(1, backend.hashSize());
    }

    @Test
    @DisplayName("hgetall 返回有序且不可修改的快照")
    void testHgetallSnapshot() {
        backend.hset("h", "b", RespInteger.valueOf(2));
        backend.hset("h", "a", RespInteger.ONE);

        SortedMap<String, Resp> snapshot = backend.hgetall("h").orElseThrow();
        assertEquals("a", snapshot.firstKey());
        assertEquals(2, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("c", RespInteger.ZERO));

        // 之后的写入不影响已取得的快照
        backend.hset("h", "c", RespInteger.ZERO);
        assertEquals(2, snapshot.size());
        assertEquals(3, backend.hgetall("h").orElseThrow().size());
    }

    @Test
    void testNullArgumentsRejected() {
        assertThrows(NullPointerException.class, () -> backend.get(null));
        assertThrows(NullPointerException.class, () -> backend.set("k", null));
        assertThrows(NullPointerException.class, () -> backend.hset("k", null, RespInteger.ONE));
    }

    @Test
    @DisplayName("并发首次 hset 同一个键，所有字段都保留")
    void testConcurrentFirstHset() throws Exception {
        final int threads = 16;
        final int fieldsPerThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                final int id = t;
                futures.add(pool.submit(() -> {
                    startGate.await();
                    for (int i = 0; i < fieldsPerThread; i++) {
                        backend.hset("shared", "f-" + id + "-" + i, RespInteger.valueOf(i));
                    }
                    return null;
                }));
            }
            startGate.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(threads * fieldsPerThread, backend.hgetall("shared").orElseThrow().size());
        assertEquals(Optional.of(RespInteger.valueOf(7)), backend.hget("shared", "f-3-7"));
    }

    @Test
    @DisplayName("并发写不同键")
    void testConcurrentSetOnDistinctKeys() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                final int id = t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        String key = "k-" + id + "-" + i;
                        backend.set(key, RespInteger.valueOf(i));
                        assertEquals(Optional.of(RespInteger.valueOf(i)), backend.get(key));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(8 * 500, backend.size());
    }
}
