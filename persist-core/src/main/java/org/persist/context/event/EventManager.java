package org.persist.context.event;

import org.persist.context.ObservableDataContext;

/**
 * 事件管理器
 * 订阅数据上下文的提交事件，并按顺序分发给拦截器
 *
 * @author qiaohe
 * @date 2024/4/2
 */
public interface EventManager {

    /**
     * @return 当前关联的数据上下文，未关联时为null
     */
    ObservableDataContext getContext();

    /**
     * 关联数据上下文并订阅其提交事件，已关联其他上下文时先解除
     *
     * @param context
     */
    void attach(ObservableDataContext context);

    /**
     * 解除关联并取消订阅
     */
    void detach();
}
