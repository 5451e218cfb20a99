package site.respkv.server.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RespKvServerConfigTest {

    @Test
    void testDefaults() {
        RespKvServerConfig config = RespKvServerConfig.defaultConfig();

        assertEquals("127.0.0.1", config.getHost());
        assertEquals(6379, config.getPort());
        assertEquals(1024, config.getBacklogSize());
        assertEquals(32 * 1024, config.getReceiveBufferSize());
        assertEquals(1, config.getBossThreadCount());
        assertEquals(Runtime.getRuntime().availableProcessors(), config.getCommandExecutorThreadCount());
        assertDoesNotThrow(config::validate);
    }

    @Test
    void testPresets() {
        assertEquals("0.0.0.0", RespKvServerConfig.productionConfig().getHost());
        assertEquals(2048, RespKvServerConfig.productionConfig().getBacklogSize());
        assertEquals(2, RespKvServerConfig.developmentConfig().getWorkerThreadCount());
        assertDoesNotThrow(() -> RespKvServerConfig.productionConfig().validate());
    }

    @Test
    @DisplayName("命令行参数覆盖默认值")
    void testFromArgs() {
        RespKvServerConfig config = RespKvServerConfig.fromArgs(
                new String[]{"--host", "0.0.0.0", "--port", "7000", "--workers", "3", "--executors", "5"});

        assertEquals("0.0.0.0", config.getHost());
        assertEquals(7000, config.getPort());
        assertEquals(3, config.getWorkerThreadCount());
        assertEquals(5, config.getCommandExecutorThreadCount());
        assertEquals(1024, config.getBacklogSize());

        assertEquals(RespKvServerConfig.defaultConfig(), RespKvServerConfig.fromArgs(new String[0]));
    }

    @Test
    void testFromArgsRejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> RespKvServerConfig.fromArgs(new String[]{"--port"}));
        assertThrows(IllegalArgumentException.class, () -> RespKvServerConfig.fromArgs(new String[]{"--port", "abc"}));
        assertThrows(IllegalArgumentException.class, () -> RespKvServerConfig.fromArgs(new String[]{"--dir", "/tmp"}));
    }

    @Test
    void testValidate() {
        assertThrows(IllegalArgumentException.class,
                () -> RespKvServerConfig.builder().port(70000).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> RespKvServerConfig.builder().commandExecutorThreadCount(0).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> RespKvServerConfig.builder().host(" ").build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> RespKvServerConfig.builder().sendBufferSize(0).build().validate());
        assertDoesNotThrow(() -> RespKvServerConfig.builder().port(0).build().validate());
    }
}
