package com.retrypolicy.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 重试事件
 */
@AllArgsConstructor
@Getter
public enum RetryEventType {
    ATTEMPT("attempt", "可重试失败，准备下一次尝试"),
    SUCCESS("success", "至少重试一次后成功"),
    FAILURE("failure", "重试预算耗尽，抛出原始异常")
    ;

    public final String code;
    public final String desc;
}
