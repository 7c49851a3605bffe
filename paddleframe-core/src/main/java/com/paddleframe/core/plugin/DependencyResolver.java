package com.paddleframe.core.plugin;

import com.paddleframe.core.exception.CircularDependencyException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * 依赖解析：深度优先后序遍历
 * <p>
 * 结果中每个元素都排在依赖它的元素之前；反转即为销毁顺序。
 * 遍历顺序由输入顺序和依赖声明顺序决定，因此结果是确定的。
 */
@Slf4j
public final class DependencyResolver {

    private DependencyResolver() {
    }

    /**
     * @param items        待排序元素（注册顺序）
     * @param nameFn       元素名称
     * @param dependencyFn 元素声明的依赖名称
     * @return 拓扑序
     * @throws CircularDependencyException 存在环
     */
    public static <T> List<T> resolve(Collection<T> items,
                                      Function<T, String> nameFn,
                                      Function<T, ? extends Collection<String>> dependencyFn) {
        Map<String, T> byName = new LinkedHashMap<>();
        for (T item : items) {
            byName.put(nameFn.apply(item), item);
        }

        List<T> sorted = new ArrayList<>(byName.size());
        Set<String> visited = new HashSet<>();
        // 有序：出现环时用于还原路径
        LinkedHashSet<String> visiting = new LinkedHashSet<>();

        for (String name : byName.keySet()) {
            visit(name, byName, dependencyFn, visiting, visited, sorted);
        }
        return sorted;
    }

    /**
     * 查找经过 start 的环（只从 start 出发遍历，图中其他位置已有的环不影响结果）
     *
     * @param lookup 按名称取元素，未注册时返回 null
     * @return 环路径，首尾均为 start
     */
    public static <T> Optional<List<String>> findCycleThrough(String start,
                                                              Function<String, T> lookup,
                                                              Function<T, ? extends Collection<String>> dependencyFn) {
        List<String> path = new ArrayList<>();
        path.add(start);
        Set<String> visited = new HashSet<>();
        visited.add(start);
        if (reaches(start, start, lookup, dependencyFn, visited, path)) {
            return Optional.of(path);
        }
        return Optional.empty();
    }

    private static <T> boolean reaches(String current,
                                       String target,
                                       Function<String, T> lookup,
                                       Function<T, ? extends Collection<String>> dependencyFn,
                                       Set<String> visited,
                                       List<String> path) {
        T item = lookup.apply(current);
        if (item == null) {
            return false;
        }
        Collection<String> dependencies = dependencyFn.apply(item);
        if (dependencies == null) {
            return false;
        }
        for (String dependency : dependencies) {
            if (target.equals(dependency)) {
                path.add(target);
                return true;
            }
            if (dependency != null && visited.add(dependency)) {
                path.add(dependency);
                if (reaches(dependency, target, lookup, dependencyFn, visited, path)) {
                    return true;
                }
                path.remove(path.size() - 1);
            }
        }
        return false;
    }

    private static <T> void visit(String name,
                                  Map<String, T> byName,
                                  Function<T, ? extends Collection<String>> dependencyFn,
                                  LinkedHashSet<String> visiting,
                                  Set<String> visited,
                                  List<T> sorted) {
        if (visited.contains(name)) {
            return;
        }
        if (visiting.contains(name)) {
            throw new CircularDependencyException(cyclePath(visiting, name));
        }

        T item = byName.get(name);
        if (item == null) {
            log.warn("Dependency {} is not registered, skipping", name);
            return;
        }

        visiting.add(name);
        Collection<String> dependencies = dependencyFn.apply(item);
        if (dependencies != null) {
            for (String dependency : dependencies) {
                visit(dependency, byName, dependencyFn, visiting, visited, sorted);
            }
        }
        visiting.remove(name);

        visited.add(name);
        sorted.add(item);
    }

    private static List<String> cyclePath(LinkedHashSet<String> visiting, String repeated) {
        List<String> path = new ArrayList<>();
        boolean inCycle = false;
        for (String name : visiting) {
            if (name.equals(repeated)) {
                inCycle = true;
            }
            if (inCycle) {
                path.add(name);
            }
        }
        path.add(repeated);
        return path;
    }
}
