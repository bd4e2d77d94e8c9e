package com.retrypolicy.policy;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 按线程隔离的生效策略注册表，一个具体 Policy 类型一个命名空间
 * - 每个线程首次访问时从根线程的注册表复制一份快照，之后互不影响
 * - 只从根线程复制，线程之间看不到彼此的策略
 * - 命名空间锁只保护首次访问时的初始化/复制
 *
 * institute / revoke 从不抛异常，结果只通过返回值表达
 */
public class PolicyRegistry<P extends Policy> {

    private static final ConcurrentMap<Class<?>, PolicyRegistry<?>> NAMESPACES = new ConcurrentHashMap<>();

    /** forType 新建命名空间时使用的根线程，默认为 JVM 主线程；为 null 时没有线程是根 */
    private static volatile Thread designatedRoot = primaryThread();

    private final String namespace;

    private final Thread rootContext;

    /** 命名空间锁，各命名空间独立 */
    private final ReentrantLock lock = new ReentrantLock();

    private final ThreadLocal<Map<String, P>> contextPolicies = new ThreadLocal<>();

    /** 根线程的注册表，首次访问时创建；其他线程复制时根线程可能正在写 */
    private volatile Map<String, P> rootPolicies;

    /**
     * @param rootContext 根线程；为 null 时根注册表始终为空，每个线程都从空注册表开始
     */
    public PolicyRegistry(String namespace, Thread rootContext) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.rootContext = rootContext;
    }

    /**
     * 返回该类型的注册表（namespace = 类型本身）
     */
    @SuppressWarnings("unchecked")
    public static <P extends Policy> PolicyRegistry<P> forType(Class<P> type) {
        Objects.requireNonNull(type, "type");
        return (PolicyRegistry<P>) NAMESPACES.computeIfAbsent(type,
                t -> new PolicyRegistry<>(t.getName(), designatedRoot));
    }

    /**
     * 指定之后新建命名空间的根线程，已存在的命名空间不受影响；null 表示没有根线程
     */
    public static void designateRootContext(Thread root) {
        designatedRoot = root;
    }

    public static Thread designatedRootContext() {
        return designatedRoot;
    }

    /**
     * JVM 启动线程（main 线程组中名为 main 的线程）
     * 已经结束或找不到时返回 null，不把任意工作线程当作根
     */
    static Thread primaryThread() {
        for (Thread t : Thread.getAllStackTraces().keySet()) {
            ThreadGroup group = t.getThreadGroup();
            if ("main".equals(t.getName()) && group != null && "main".equals(group.getName())) {
                return t;
            }
        }
        return null;
    }

    /**
     * 无同名策略生效时登记并返回 true，否则不修改并返回 false
     */
    public boolean institutePolicy(P policy) {
        Map<String, P> policies = policies();
        if (policies.containsKey(policy.getName())) {
            return false;
        }
        policies.put(policy.getName(), policy);
        return true;
    }

    /**
     * 当前线程中该名称登记的正是这个实例
     */
    public boolean policyInEffect(P policy) {
        return policies().get(policy.getName()) == policy;
    }

    /**
     * 该实例生效时移除并返回 true；同名的其他实例或未登记时返回 false
     */
    public boolean revokePolicy(P policy) {
        if (!policyInEffect(policy)) {
            return false;
        }
        policies().remove(policy.getName());
        return true;
    }

    /**
     * 丢弃当前线程的视图，下次访问重新从根线程复制
     * 线程池复用线程时使用；在根线程调用会清空根注册表
     */
    public void discardCurrentContext() {
        contextPolicies.remove();
        if (Thread.currentThread() == rootContext) {
            lock.lock();
            try {
                rootPolicies = null;
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * 当前线程的注册表，首次访问时创建
     */
    Map<String, P> policies() {
        Map<String, P> current = contextPolicies.get();
        if (current != null) {
            return current;
        }
        // 必须加锁，保证根注册表先于子线程的副本创建
        lock.lock();
        try {
            if (rootPolicies == null) {
                rootPolicies = new ConcurrentHashMap<>();
            }
            current = Thread.currentThread() == rootContext ? rootPolicies : new HashMap<>(rootPolicies);
            contextPolicies.set(current);
        } finally {
            lock.unlock();
        }
        return current;
    }

    /** 根注册表，未初始化时为 null */
    Map<String, P> rootPolicies() {
        return rootPolicies;
    }

    ReentrantLock lock() {
        return lock;
    }

    public String getNamespace() {
        return namespace;
    }

    public Thread getRootContext() {
        return rootContext;
    }

    @Override
    public String toString() {
        return "PolicyRegistry(" + namespace + ")";
    }
}
