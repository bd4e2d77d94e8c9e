package com.retrypolicy.core.spi;

/**
 * 抖动随机源，测试时可替换为确定值
 */
@FunctionalInterface
public interface JitterSource {

    /**
     * @param maxMillis 抖动上限（不含）
     * @return [0, maxMillis) 内的毫秒数；maxMillis<=0 时返回 0
     */
    long nextJitterMillis(long maxMillis);
}
