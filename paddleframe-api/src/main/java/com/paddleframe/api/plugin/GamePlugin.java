package com.paddleframe.api.plugin;

import java.util.Collections;
import java.util.List;

/**
 * 插件生命周期接口
 * 所有注册到 PluginManager 的插件都必须实现此接口
 * <p>
 * init/destroy 可以阻塞，由管理器在生命周期线程上执行并施加超时。
 * </p>
 *
 * @author PaddleFrame
 */
public interface GamePlugin {

    /**
     * 插件唯一名称（注册表的键）
     */
    String getName();

    /**
     * 插件版本号
     */
    String getVersion();

    /**
     * 插件描述
     */
    default String getDescription() {
        return "";
    }

    /**
     * 依赖的插件名称列表
     * <p>
     * 管理器在注册和每次依赖解析时都会重新读取此列表，顺序即遍历顺序。
     * </p>
     */
    default List<String> getDependencies() {
        return Collections.emptyList();
    }

    /**
     * 插件初始化
     *
     * @throws Exception 初始化失败
     */
    void init() throws Exception;

    /**
     * 插件销毁，释放资源
     *
     * @throws Exception 销毁失败
     */
    void destroy() throws Exception;
}
