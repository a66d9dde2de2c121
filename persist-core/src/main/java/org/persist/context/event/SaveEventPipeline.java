package org.persist.context.event;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.persist.context.ObservableDataContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 有序事件订阅列表
 * 按订阅顺序同步触发，处理器抛出的异常中断后续处理器并向上抛出
 *
 * @author qiaohe
 * @date 2024/4/2
 */
@Slf4j
public class SaveEventPipeline<E extends SaveEvent> {
    @Getter
    private final String name;
    private final List<SaveEventHandler<E>> handlers = new ArrayList<>();

    public SaveEventPipeline(String name) {
        this.name = name;
    }

    public void subscribe(SaveEventHandler<E> handler) {
        Objects.requireNonNull(handler, "handler");
        handlers.add(handler);
    }

    /**
     * 移除该处理器最近一次的订阅
     *
     * @param handler
     * @return 是否存在该订阅
     */
    public boolean unsubscribe(SaveEventHandler<E> handler) {
        int index = handlers.lastIndexOf(handler);
        if (index < 0) {
            return false;
        }
        handlers.remove(index);
        return true;
    }

    public int size() {
        return handlers.size();
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    public void fire(ObservableDataContext context, E event) {
        if (handlers.isEmpty()) {
            return;
        }
        // 处理器内可能增删订阅
        List<SaveEventHandler<E>> snapshot = new ArrayList<>(handlers);
        log.trace("\tFiring {} to {} handler(s)", name, snapshot.size());
        for (SaveEventHandler<E> handler : snapshot) {
            handler.handle(context, event);
        }
    }
}
