package org.stackup.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stackup.assembly.AssemblyGraph;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 已加载装配图的会话存储（内存版）。
 * <p>
 * 工作流：{@code assembly_load} / {@code assembly_open} 生成 graphId 并暂存装配图；后续的路径查询、
 * 公差链生成与计算都通过 graphId 取图。图本身不可变，添加公差链后用 {@link #replace} 换成新实例。
 * <p>
 * 约束：
 * <ul>
 *   <li>每个会话有 TTL，最后一次访问起算，超时自动失效。</li>
 *   <li>会话数达到上限时淘汰最久未访问的会话。</li>
 *   <li>仅用于单进程场景。</li>
 * </ul>
 */
public class AssemblySessionStore {

    private static final Logger log = LoggerFactory.getLogger(AssemblySessionStore.class);

    private final Duration ttl;
    private final int maxGraphs;
    private final Clock clock;
    private final ConcurrentHashMap<String, Session> store = new ConcurrentHashMap<>();

    public AssemblySessionStore(Duration ttl, int maxGraphs) {
        this(ttl, maxGraphs, Clock.systemUTC());
    }

    AssemblySessionStore(Duration ttl, int maxGraphs, Clock clock) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("会话 TTL 必须为正");
        }
        if (maxGraphs < 1) {
            throw new IllegalArgumentException("会话上限必须 >= 1");
        }
        this.ttl = ttl;
        this.maxGraphs = maxGraphs;
        this.clock = clock;
    }

    /**
     * 保存装配图并返回新的 graphId。
     */
    public synchronized String put(AssemblyGraph graph) {
        if (graph == null) {
            throw new IllegalArgumentException("graph 不能为空");
        }
        cleanupExpired();
        while (store.size() >= maxGraphs) {
            evictOldest();
        }
        String graphId = UUID.randomUUID().toString();
        store.put(graphId, new Session(graphId, graph, clock.instant()));
        return graphId;
    }

    /**
     * 取图；不存在或已过期返回 null。命中时刷新访问时间。
     */
    public AssemblyGraph get(String graphId) {
        if (graphId == null || graphId.isBlank()) {
            return null;
        }
        Session session = store.get(graphId);
        if (session == null) {
            return null;
        }
        Instant now = clock.instant();
        if (session.isExpired(now, ttl)) {
            store.remove(graphId);
            return null;
        }
        store.replace(graphId, session, session.touch(now));
        return session.graph();
    }

    /**
     * 取图；不存在时抛出 {@link IllegalArgumentException}。
     */
    public AssemblyGraph require(String graphId) {
        AssemblyGraph graph = get(graphId);
        if (graph == null) {
            throw new IllegalArgumentException("graphId 不存在或已过期：" + graphId);
        }
        return graph;
    }

    /**
     * 用新实例替换已有会话中的图。
     */
    public void replace(String graphId, AssemblyGraph graph) {
        if (graph == null) {
            throw new IllegalArgumentException("graph 不能为空");
        }
        Session updated = store.computeIfPresent(graphId, (id, old) -> new Session(id, graph, clock.instant()));
        if (updated == null) {
            throw new IllegalArgumentException("graphId 不存在或已过期：" + graphId);
        }
    }

    public AssemblyGraph remove(String graphId) {
        Session session = store.remove(graphId);
        return session == null ? null : session.graph();
    }

    public int size() {
        return store.size();
    }

    private void cleanupExpired() {
        Instant now = clock.instant();
        for (Map.Entry<String, Session> entry : store.entrySet()) {
            if (entry.getValue().isExpired(now, ttl)) {
                store.remove(entry.getKey());
            }
        }
    }

    private void evictOldest() {
        store.values().stream()
                .min(Comparator.comparing(Session::lastAccess))
                .ifPresent(oldest -> {
                    store.remove(oldest.graphId());
                    log.info("会话数达到上限 {}，淘汰最久未访问的装配图：{}", maxGraphs, oldest.graphId());
                });
    }

    private record Session(String graphId, AssemblyGraph graph, Instant lastAccess) {

        boolean isExpired(Instant now, Duration ttl) {
            return now.isAfter(lastAccess.plus(ttl));
        }

        Session touch(Instant now) {
            return new Session(graphId, graph, now);
        }
    }
}
