package org.persist.context;

import org.persist.context.event.EventManager;
import org.persist.context.event.PostSaveEvent;
import org.persist.context.event.PreSaveEvent;
import org.persist.context.event.SaveEventHandler;

/**
 * 支持提交前后事件的数据上下文
 *
 * @author qiaohe
 * @date 2024/4/2
 */
public interface ObservableDataContext extends DataContext {

    void subscribePreSave(SaveEventHandler<PreSaveEvent> handler);

    boolean unsubscribePreSave(SaveEventHandler<PreSaveEvent> handler);

    void subscribePostSave(SaveEventHandler<PostSaveEvent> handler);

    boolean unsubscribePostSave(SaveEventHandler<PostSaveEvent> handler);

    /**
     * @return 已登记的事件管理器，未登记时为null
     */
    EventManager getEventManager();

    /**
     * 仅记录引用，双向登记使用 {@link org.persist.context.event.EventManagers#register}
     *
     * @param eventManager
     */
    void assignEventManager(EventManager eventManager);
}
