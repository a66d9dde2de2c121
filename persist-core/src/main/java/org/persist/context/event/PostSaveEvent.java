package org.persist.context.event;

/**
 * 事务提交成功后
 *
 * @author qiaohe
 * @date 2024/4/2
 */
public class PostSaveEvent extends SaveEvent {
    public PostSaveEvent(Object source) {
        super(source);
    }
}
