package com.paddleframe.core.loader;

import com.paddleframe.api.exception.PaddleFrameException;
import com.paddleframe.core.config.PluginManagerConfig;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * 从 YAML 加载 PluginManager 配置
 * <pre>
 * paddleframe:
 *   performance-monitoring: true
 *   max-execution-time-per-frame: 2
 *   execution-timeout: 5000
 *   interrupt-on-timeout: false
 *   lifecycle-thread-prefix: paddleframe-lifecycle
 * </pre>
 * 根节点 paddleframe 可省略；缺失的键保留默认值。
 */
@Slf4j
public class PluginManagerConfigLoader {

    public static final String DEFAULT_RESOURCE = "paddleframe.yml";

    private static final String ROOT_KEY = "paddleframe";

    public static PluginManagerConfig load(InputStream inputStream) {
        // SnakeYAML 2.x 需要显式传入 LoaderOptions
        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new SafeConstructor(options));

        Object document;
        try {
            document = yaml.load(inputStream);
        } catch (RuntimeException e) {
            throw new PaddleFrameException("Invalid plugin manager configuration: " + e.getMessage(), e);
        }
        if (document == null) {
            return PluginManagerConfig.defaults();
        }
        if (!(document instanceof Map<?, ?> root)) {
            throw new PaddleFrameException("Plugin manager configuration must be a mapping");
        }

        Map<?, ?> section = root;
        if (root.containsKey(ROOT_KEY)) {
            Object nested = root.get(ROOT_KEY);
            if (!(nested instanceof Map<?, ?> nestedMap)) {
                throw new PaddleFrameException("'" + ROOT_KEY + "' must be a mapping");
            }
            section = nestedMap;
        }
        return bind(section);
    }

    /**
     * 从 classpath 加载，资源不存在时返回默认配置
     */
    public static PluginManagerConfig loadFromClasspath(String resource, ClassLoader classLoader) {
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                log.debug("Configuration resource {} not found, using defaults", resource);
                return PluginManagerConfig.defaults();
            }
            PluginManagerConfig config = load(in);
            log.info("Loaded plugin manager configuration from {}: {}", resource, config);
            return config;
        } catch (IOException e) {
            throw new PaddleFrameException("Failed to read " + resource, e);
        }
    }

    public static PluginManagerConfig loadFromClasspath() {
        return loadFromClasspath(DEFAULT_RESOURCE, PluginManagerConfigLoader.class.getClassLoader());
    }

    private static PluginManagerConfig bind(Map<?, ?> section) {
        PluginManagerConfig.PluginManagerConfigBuilder builder = PluginManagerConfig.builder();

        Object monitoring = section.get("performance-monitoring");
        if (monitoring != null) {
            builder.performanceMonitoring(asBoolean("performance-monitoring", monitoring));
        }

        Object budget = section.get("max-execution-time-per-frame");
        if (budget != null) {
            double value = asNumber("max-execution-time-per-frame", budget).doubleValue();
            if (value <= 0) {
                throw new PaddleFrameException("max-execution-time-per-frame must be positive: " + value);
            }
            builder.maxExecutionTimePerFrame(value);
        }

        Object timeout = section.get("execution-timeout");
        if (timeout != null) {
            long value = asNumber("execution-timeout", timeout).longValue();
            if (value <= 0) {
                throw new PaddleFrameException("execution-timeout must be positive: " + value);
            }
            builder.executionTimeout(value);
        }

        Object interrupt = section.get("interrupt-on-timeout");
        if (interrupt != null) {
            builder.interruptOnTimeout(asBoolean("interrupt-on-timeout", interrupt));
        }

        Object prefix = section.get("lifecycle-thread-prefix");
        if (prefix != null) {
            String value = prefix.toString();
            if (value.isBlank()) {
                throw new PaddleFrameException("lifecycle-thread-prefix cannot be blank");
            }
            builder.lifecycleThreadPrefix(value);
        }

        return builder.build();
    }

    private static boolean asBoolean(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new PaddleFrameException("'" + key + "' must be a boolean, got: " + value);
    }

    private static Number asNumber(String key, Object value) {
        if (value instanceof Number n) {
            return n;
        }
        throw new PaddleFrameException("'" + key + "' must be a number, got: " + value);
    }
}
