package com.paddleframe.core.plugin;

import com.paddleframe.core.exception.CircularDependencyException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DependencyResolver 单元测试")
public class DependencyResolverTest {

    private static List<String> resolve(Map<String, List<String>> graph) {
        return DependencyResolver.resolve(graph.keySet(), name -> name, graph::get);
    }

    @Test
    @DisplayName("依赖应排在依赖者之前")
    void dependenciesShouldComeFirst() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("score", List.of("powerups", "renderer"));
        graph.put("powerups", List.of("physics"));
        graph.put("physics", List.of());
        graph.put("renderer", List.of());

        assertEquals(List.of("physics", "powerups", "renderer", "score"), resolve(graph));
    }

    @Test
    @DisplayName("无依赖时保持输入顺序")
    void independentItemsShouldKeepInputOrder() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("c", List.of());
        graph.put("a", List.of());
        graph.put("b", List.of());

        assertEquals(List.of("c", "a", "b"), resolve(graph));
    }

    @Test
    @DisplayName("菱形依赖只输出一次")
    void diamondShouldVisitOnce() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("top", List.of("left", "right"));
        graph.put("left", List.of("base"));
        graph.put("right", List.of("base"));
        graph.put("base", List.of());

        assertEquals(List.of("base", "left", "right", "top"), resolve(graph));
    }

    @Test
    @DisplayName("环应抛出并带有环路径")
    void cycleShouldReportPath() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("entry", List.of("a"));
        graph.put("a", List.of("b"));
        graph.put("b", List.of("c"));
        graph.put("c", List.of("a"));

        CircularDependencyException e = assertThrows(CircularDependencyException.class, () -> resolve(graph));

        assertEquals(List.of("a", "b", "c", "a"), e.getCycle());
        assertEquals("Circular dependency detected: a -> b -> c -> a", e.getMessage());
    }

    @Test
    @DisplayName("自依赖也是环")
    void selfDependencyShouldBeCycle() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("solo", List.of("solo"));

        CircularDependencyException e = assertThrows(CircularDependencyException.class, () -> resolve(graph));
        assertEquals(List.of("solo", "solo"), e.getCycle());
    }

    @Test
    @DisplayName("未知依赖被跳过")
    void unknownDependencyShouldBeSkipped() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("a", List.of("ghost"));
        graph.put("b", List.of("a"));

        assertEquals(List.of("a", "b"), resolve(graph));
    }

    @Test
    @DisplayName("从起点出发找到经过起点的环")
    void findCycleThroughShouldReturnPath() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("a", List.of("c"));
        graph.put("b", List.of("a"));
        graph.put("c", List.of("b"));

        Optional<List<String>> cycle = DependencyResolver.findCycleThrough("c", graph::get, deps -> deps);

        assertEquals(Optional.of(List.of("c", "b", "a", "c")), cycle);
    }

    @Test
    @DisplayName("起点之外已有的环不算经过起点")
    void findCycleThroughShouldIgnoreOtherCycles() {
        Map<String, List<String>> graph = new LinkedHashMap<>();
        graph.put("a", List.of("b"));
        graph.put("b", List.of("a"));
        graph.put("c", List.of("a", "ghost"));

        assertTrue(DependencyResolver.findCycleThrough("c", graph::get, deps -> deps).isEmpty());
    }
}
