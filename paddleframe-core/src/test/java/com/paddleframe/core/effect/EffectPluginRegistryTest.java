package com.paddleframe.core.effect;

import com.paddleframe.api.effect.EffectPlugin;
import com.paddleframe.api.effect.PowerUpType;
import com.paddleframe.core.plugin.PluginManager;
import com.paddleframe.core.plugin.PluginStatus;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EffectPluginRegistry 单元测试")
public class EffectPluginRegistryTest {

    private PluginManager manager;
    private EffectPluginRegistry registry;

    private ResizePaddlePlugin large;
    private ResizePaddlePlugin small;
    private StubEffectPlugin multiBall;

    @BeforeEach
    void setUp() {
        manager = new PluginManager();
        registry = new EffectPluginRegistry(manager);

        large = new ResizePaddlePlugin("paddle-large", 1.5);
        small = new ResizePaddlePlugin("paddle-small", 0.6);
        multiBall = new StubEffectPlugin("multi-ball", PowerUpType.MULTI_BALL);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    private void registerDefaults() {
        assertTrue(registry.register("multiball", multiBall));
        assertTrue(registry.register("paddle_large", large, "large"));
        assertTrue(registry.register("paddle_small", small, "small"));
    }

    @Nested
    @DisplayName("注册")
    class RegisterTests {

        @Test
        @DisplayName("注册时同时注册到 PluginManager")
        void registerShouldGoThroughManager() {
            registerDefaults();

            assertEquals(List.of("multiball", "paddle_large", "paddle_small"), registry.getRegisteredIds());
            assertEquals(List.of("multi-ball", "paddle-large", "paddle-small"), manager.getPluginNames());
            assertEquals(PluginStatus.REGISTERED, manager.getStatus("paddle-large").orElseThrow());
        }

        @Test
        @DisplayName("重复 id 应拒绝")
        void duplicateIdShouldFail() {
            registerDefaults();

            assertFalse(registry.register("paddle_large", new ResizePaddlePlugin("paddle-huge", 2.0)));
            assertFalse(manager.getPlugin("paddle-huge").isPresent());
        }

        @Test
        @DisplayName("管理器拒绝时注册表保持不变")
        void managerRejectionShouldLeaveRegistryUnchanged() {
            registerDefaults();

            // 插件名已被占用
            assertFalse(registry.register("paddle_large_v2", new ResizePaddlePlugin("paddle-large", 2.0)));
            assertFalse(registry.getPlugin("paddle_large_v2").isPresent());
            assertEquals(3, registry.getStatus().totalRegistered());
        }

        @Test
        @DisplayName("同类型的变体已被占用时应拒绝，且不注册到管理器")
        void takenVariantShouldBeRejected() {
            registerDefaults();

            assertFalse(registry.register("paddle_huge", new ResizePaddlePlugin("paddle-huge", 2.0), "large"));

            assertFalse(manager.getPlugin("paddle-huge").isPresent());
            assertSame(large, registry.getPluginByType(PowerUpType.PADDLE_SIZE, "large").orElseThrow());
            assertEquals(List.of("paddle_large", "paddle_small"),
                    registry.getStatus().pluginIdsByType().get(PowerUpType.PADDLE_SIZE));
        }

        @Test
        @DisplayName("不同类型可以使用相同的变体名")
        void sameVariantAcrossTypesShouldBeAllowed() {
            assertTrue(registry.register("paddle_large", large, "large"));
            assertTrue(registry.register("multiball_large", multiBall, "large"));

            assertSame(multiBall, registry.getPluginByType(PowerUpType.MULTI_BALL, "large").orElseThrow());
        }

        @Test
        @DisplayName("非法参数应拒绝")
        void invalidArgumentsShouldFail() {
            assertFalse(registry.register(" ", large));
            assertFalse(registry.register("paddle_large", null));
            assertTrue(registry.getRegisteredIds().isEmpty());
        }
    }

    @Nested
    @DisplayName("查找")
    class LookupTests {

        @BeforeEach
        void register() {
            registerDefaults();
        }

        @Test
        @DisplayName("按 id 查找")
        void lookupById() {
            assertSame(large, registry.getPlugin("paddle_large").orElseThrow());
            assertFalse(registry.getPlugin("laser").isPresent());
        }

        @Test
        @DisplayName("按类型与变体查找")
        void lookupByTypeAndVariant() {
            EffectPlugin found = registry.getPluginByType(PowerUpType.PADDLE_SIZE, "small").orElseThrow();

            assertSame(small, found);
        }

        @Test
        @DisplayName("未指定或未知变体回落到该类型第一个插件")
        void unknownVariantShouldFallBackToDefault() {
            assertSame(large, registry.getPluginByType(PowerUpType.PADDLE_SIZE).orElseThrow());
            assertSame(large, registry.getPluginByType(PowerUpType.PADDLE_SIZE, "tiny").orElseThrow());
            assertSame(multiBall, registry.getPluginByType(PowerUpType.MULTI_BALL).orElseThrow());
        }

        @Test
        @DisplayName("没有注册的类型返回空")
        void unregisteredTypeShouldBeEmpty() {
            assertFalse(registry.getPluginByType(PowerUpType.MAGNET).isPresent());
        }

        @Test
        @DisplayName("状态按类型分组")
        void statusShouldGroupByType() {
            EffectPluginRegistry.RegistryStatus status = registry.getStatus();

            assertEquals(3, status.totalRegistered());
            assertEquals(List.of("paddle_large", "paddle_small"), status.pluginIdsByType().get(PowerUpType.PADDLE_SIZE));
            assertEquals(List.of("multiball"), status.pluginIdsByType().get(PowerUpType.MULTI_BALL));
            assertNull(status.pluginIdsByType().get(PowerUpType.MAGNET));
        }
    }

    @Nested
    @DisplayName("注销")
    class UnregisterAllTests {

        @Test
        @DisplayName("应销毁激活的插件并全部注销")
        void unregisterAllShouldDestroyAndRemove() {
            registerDefaults();
            manager.initializeAll();
            assertTrue(large.isInitialized());

            int removed = registry.unregisterAll();

            assertEquals(3, removed);
            assertFalse(large.isInitialized());
            assertFalse(multiBall.isInitialized());
            assertTrue(registry.getRegisteredIds().isEmpty());
            assertTrue(manager.getPluginNames().isEmpty());
            assertFalse(registry.getPluginByType(PowerUpType.PADDLE_SIZE).isPresent());
        }

        @Test
        @DisplayName("未初始化的插件直接注销")
        void unregisterAllWithoutInitShouldRemove() {
            registerDefaults();

            assertEquals(3, registry.unregisterAll());
            assertTrue(manager.getPluginNames().isEmpty());
        }
    }
}
