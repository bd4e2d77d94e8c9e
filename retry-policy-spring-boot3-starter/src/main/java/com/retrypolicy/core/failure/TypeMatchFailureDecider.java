package com.retrypolicy.core.failure;

import com.retrypolicy.core.spi.FailureDecider;

import java.util.List;
import java.util.Objects;

/**
 * 按异常类型判定
 * - including: 异常 is-a 任一类型时可重试
 * - excluding: 异常 is-a 任一类型时不可重试，其余均可重试
 */
public final class TypeMatchFailureDecider implements FailureDecider {

    private final List<Class<? extends Throwable>> types;

    private final boolean including;

    private TypeMatchFailureDecider(List<Class<? extends Throwable>> types, boolean including) {
        this.types = types;
        this.including = including;
    }

    @SafeVarargs
    public static TypeMatchFailureDecider including(Class<? extends Throwable>... types) {
        return new TypeMatchFailureDecider(copyOf(types), true);
    }

    @SafeVarargs
    public static TypeMatchFailureDecider excluding(Class<? extends Throwable>... types) {
        return new TypeMatchFailureDecider(copyOf(types), false);
    }

    @Override
    public boolean isRetryable(Throwable t) {
        return matches(t) == including;
    }

    private boolean matches(Throwable t) {
        for (Class<? extends Throwable> type : types) {
            if (type.isInstance(t)) {
                return true;
            }
        }
        return false;
    }

    private static List<Class<? extends Throwable>> copyOf(Class<? extends Throwable>[] types) {
        Objects.requireNonNull(types, "types");
        return List.of(types);
    }

    @Override
    public String toString() {
        return (including ? "anyOf" : "noneOf") + types;
    }
}
