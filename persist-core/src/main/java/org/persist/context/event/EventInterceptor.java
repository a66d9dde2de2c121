package org.persist.context.event;

import org.persist.context.ObservableDataContext;

/**
 * 提交事件拦截器
 * 执行顺序由 {@link org.springframework.core.annotation.Order} 或 {@link org.springframework.core.Ordered} 决定
 *
 * @author qiaohe
 * @date 2024/4/2
 */
public interface EventInterceptor<E extends SaveEvent> {

    /**
     * @return 关注的事件类型，子类事件同样分发
     */
    Class<E> forEventType();

    InterceptorResult apply(ObservableDataContext context, E event);
}
