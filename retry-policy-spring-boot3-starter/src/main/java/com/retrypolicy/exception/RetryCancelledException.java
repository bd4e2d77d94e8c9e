package com.retrypolicy.exception;

/**
 * 重试过程中调用线程被中断
 * cause 为 InterruptedException（若有），最后一次操作失败作为 suppressed 附带
 */
public class RetryCancelledException extends RuntimeException {

    private final String retryId;

    public RetryCancelledException(String retryId, Throwable cause, Throwable lastFailure) {
        super("retry cancelled, retryId=" + retryId, cause);
        this.retryId = retryId;
        if (lastFailure != null) {
            addSuppressed(lastFailure);
        }
    }

    public String getRetryId() {
        return retryId;
    }
}
