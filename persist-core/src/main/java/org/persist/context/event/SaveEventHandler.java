package org.persist.context.event;

import org.persist.context.ObservableDataContext;

/**
 * @author qiaohe
 * @date 2024/4/2
 */
@FunctionalInterface
public interface SaveEventHandler<E extends SaveEvent> {
    void handle(ObservableDataContext context, E event);
}
