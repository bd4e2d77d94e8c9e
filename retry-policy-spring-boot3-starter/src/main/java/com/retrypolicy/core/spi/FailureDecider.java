package com.retrypolicy.core.spi;

import com.retrypolicy.core.failure.TypeMatchFailureDecider;

import java.util.function.Predicate;

/**
 * 失败判定器（按异常决定是否可重试）
 */
@FunctionalInterface
public interface FailureDecider {

    /**
     * @param t 本次执行抛出的异常
     * @return true=可重试，消耗一次预算；false=直接抛出，不记录事件
     */
    boolean isRetryable(Throwable t);

    /** 异常是列表中任一类型（含子类）时重试 */
    @SafeVarargs
    static FailureDecider anyOf(Class<? extends Throwable>... types) {
        return TypeMatchFailureDecider.including(types);
    }

    /** 异常不是列表中任一类型（含子类）时重试 */
    @SafeVarargs
    static FailureDecider noneOf(Class<? extends Throwable>... types) {
        return TypeMatchFailureDecider.excluding(types);
    }

    static FailureDecider of(Predicate<? super Throwable> predicate) {
        return predicate::test;
    }
}
