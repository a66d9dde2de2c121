package org.persist.context.event;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.persist.context.ObservableDataContext;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * @author qiaohe
 * @date 2024/4/3
 */
@Slf4j
public class DefaultEventManager implements EventManager {
    private final List<EventInterceptor<?>> interceptors = new ArrayList<>();

    // 固定引用，取消订阅时按引用匹配
    private final SaveEventHandler<PreSaveEvent> preSaveHandler = this::dispatch;
    private final SaveEventHandler<PostSaveEvent> postSaveHandler = this::dispatch;

    @Getter
    private ObservableDataContext context;

    public DefaultEventManager() {
    }

    public DefaultEventManager(List<? extends EventInterceptor<?>> interceptors) {
        if (interceptors != null) {
            for (EventInterceptor<?> interceptor : interceptors) {
                register(interceptor);
            }
        }
    }

    public void register(EventInterceptor<?> interceptor) {
        Objects.requireNonNull(interceptor, "interceptor");
        interceptors.add(interceptor);
        AnnotationAwareOrderComparator.sort(interceptors);
    }

    public boolean unregister(EventInterceptor<?> interceptor) {
        return interceptors.remove(interceptor);
    }

    public List<EventInterceptor<?>> getInterceptors() {
        return Collections.unmodifiableList(interceptors);
    }

    @Override
    public void attach(ObservableDataContext context) {
        Objects.requireNonNull(context, "context");
        if (this.context == context) {
            return;
        }
        detach();
        this.context = context;
        context.subscribePreSave(preSaveHandler);
        context.subscribePostSave(postSaveHandler);
    }

    @Override
    public void detach() {
        if (this.context == null) {
            return;
        }
        this.context.unsubscribePreSave(preSaveHandler);
        this.context.unsubscribePostSave(postSaveHandler);
        this.context = null;
    }

    protected void dispatch(ObservableDataContext context, SaveEvent event) {
        for (EventInterceptor<?> interceptor : new ArrayList<>(interceptors)) {
            if (!interceptor.forEventType().isInstance(event)) {
                continue;
            }
            log.trace("\t\tIntercepting {} with {}", event.getClass().getSimpleName(), interceptor.getClass().getSimpleName());
            InterceptorResult result = apply(interceptor, context, event);
            if (result != null && !result.isContinueExecution()) {
                log.info("拦截器中止后续执行: interceptor={}, event={}, message={}",
                        interceptor.getClass().getSimpleName(), event.getClass().getSimpleName(), result.getMessage());
                return;
            }
        }
    }

    private static <E extends SaveEvent> InterceptorResult apply(EventInterceptor<E> interceptor,
                                                                 ObservableDataContext context, SaveEvent event) {
        return interceptor.apply(context, interceptor.forEventType().cast(event));
    }
}
