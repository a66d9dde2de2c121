package org.persist.context.event;

/**
 * 事务提交前
 *
 * @author qiaohe
 * @date 2024/4/2
 */
public class PreSaveEvent extends SaveEvent {
    public PreSaveEvent(Object source) {
        super(source);
    }
}
