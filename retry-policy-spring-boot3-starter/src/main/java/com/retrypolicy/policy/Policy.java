package com.retrypolicy.policy;

import java.util.Objects;

/**
 * 命名策略标记：登记到当前线程的注册表即表示“该行为在此生效”
 * 判定按实例身份，同名的不同实例不算生效；子类各自拥有独立的命名空间
 */
public class Policy {

    private final String name;

    public Policy(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    /** 委托 {@link PolicyRegistry#policyInEffect} */
    public boolean inEffect() {
        return registry().policyInEffect(this);
    }

    /** 委托 {@link PolicyRegistry#institutePolicy} */
    public boolean institute() {
        return registry().institutePolicy(this);
    }

    /** 委托 {@link PolicyRegistry#revokePolicy} */
    public boolean revoke() {
        return registry().revokePolicy(this);
    }

    @SuppressWarnings("unchecked")
    protected PolicyRegistry<Policy> registry() {
        return (PolicyRegistry<Policy>) (PolicyRegistry<?>) PolicyRegistry.forType(getClass());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
