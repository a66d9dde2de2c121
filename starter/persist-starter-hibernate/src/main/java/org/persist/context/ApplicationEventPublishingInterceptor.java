package org.persist.context;

import lombok.RequiredArgsConstructor;
import org.persist.context.event.EventInterceptor;
import org.persist.context.event.InterceptorResult;
import org.persist.context.event.SaveEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;

/**
 * 将提交事件转发为Spring应用事件
 *
 * @author qiaohe
 * @date 2024/4/5
 */
@Order(Ordered.LOWEST_PRECEDENCE)
@RequiredArgsConstructor
public class ApplicationEventPublishingInterceptor implements EventInterceptor<SaveEvent> {
    private final ApplicationEventPublisher applicationEventPublisher;

    @Override
    public Class<SaveEvent> forEventType() {
        return SaveEvent.class;
    }

    @Override
    public InterceptorResult apply(ObservableDataContext context, SaveEvent event) {
        applicationEventPublisher.publishEvent(event);
        return InterceptorResult.proceed();
    }
}
