package org.persist.context.event;

import lombok.extern.slf4j.Slf4j;
import org.persist.context.ObservableDataContext;

import java.util.Objects;

/**
 * @author qiaohe
 * @date 2024/4/2
 */
@Slf4j
public class EventManagers {

    private EventManagers() {
    }

    /**
     * 双向登记：上下文持有管理器，管理器回指上下文
     *
     * @param context
     * @param eventManager
     */
    public static void register(ObservableDataContext context, EventManager eventManager) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(eventManager, "eventManager");
        EventManager previous = context.getEventManager();
        if (previous != null && previous != eventManager) {
            previous.detach();
        }
        context.assignEventManager(eventManager);
        eventManager.attach(context);
        log.debug("\tRegistered EventManager {}", eventManager.getClass().getSimpleName());
    }

    public static void unregister(ObservableDataContext context) {
        Objects.requireNonNull(context, "context");
        EventManager eventManager = context.getEventManager();
        if (eventManager == null) {
            return;
        }
        eventManager.detach();
        context.assignEventManager(null);
    }
}
