package org.persist.context.event;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * @author qiaohe
 * @date 2024/4/2
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InterceptorResult {
    private static final InterceptorResult PROCEED = new InterceptorResult(true, null);

    private final boolean continueExecution;
    private final String message;

    public static InterceptorResult proceed() {
        return PROCEED;
    }

    /**
     * 中止同一事件的后续拦截器，不影响事务提交
     *
     * @param message
     * @return
     */
    public static InterceptorResult halt(String message) {
        return new InterceptorResult(false, message);
    }
}
