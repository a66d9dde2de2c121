package org.persist.context.event;

import org.springframework.context.ApplicationEvent;

/**
 * 提交事件
 *
 * @author qiaohe
 * @date 2024/4/2
 */
public abstract class SaveEvent extends ApplicationEvent {

    /**
     * @param source 触发提交的数据上下文
     */
    protected SaveEvent(Object source) {
        super(source);
    }
}
