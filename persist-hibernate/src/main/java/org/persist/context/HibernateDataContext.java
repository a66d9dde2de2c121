package org.persist.context;

import lombok.Getter;
import org.hibernate.Session;
import org.hibernate.Transaction;
import org.persist.context.event.EventManager;
import org.persist.context.event.EventManagers;
import org.persist.context.event.PostSaveEvent;
import org.persist.context.event.PreSaveEvent;
import org.persist.context.event.SaveEventHandler;
import org.persist.context.event.SaveEventPipeline;
import org.persist.share.SqlParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Hibernate 会话的数据上下文实现
 * 会话由上下文独占，异常原样抛出
 *
 * @author qiaohe
 * @date 2024/4/3
 */
public class HibernateDataContext implements ObservableDataContext {
    @Getter
    private final Session session;
    private final Logger log;
    private final SessionSqlExecutor sqlExecutor;

    private final SaveEventPipeline<PreSaveEvent> preSave = new SaveEventPipeline<>("PreSave");
    private final SaveEventPipeline<PostSaveEvent> postSave = new SaveEventPipeline<>("PostSave");

    @Getter
    private EventManager eventManager;

    public HibernateDataContext(Session session) {
        this(session, LoggerFactory.getLogger(HibernateDataContext.class));
    }

    public HibernateDataContext(Session session, Logger log) {
        this.session = session;
        this.log = log;
        this.sqlExecutor = new SessionSqlExecutor(session);
    }

    /**
     * 返回延迟查询，"Queried" 日志在构建后即输出，实际执行由查询的终结操作记录
     *
     * @param entityClass
     * @param <T>
     * @return
     */
    @Override
    public <T> Queryable<T> asQueryable(Class<T> entityClass) {
        log.debug("Querying Object {}", entityClass.getSimpleName());
        Queryable<T> result = new CriteriaQueryable<>(session, entityClass, log);
        log.debug("Queried Object {}", entityClass.getSimpleName());
        return result;
    }

    @Override
    public <T> T add(T item) {
        log.debug("Adding Object {}", item);
        session.save(item);
        log.trace("Added Object {}", item);
        return item;
    }

    @Override
    public <T> T remove(T item) {
        log.debug("Removing Object {}", item);
        session.delete(item);
        log.trace("Removed Object {}", item);
        return item;
    }

    @Override
    public <T> T update(T item) {
        log.debug("Updating Object {}", item);
        session.update(item);
        log.trace("Updated Object {}", item);
        return item;
    }

    @Override
    public <T> T attach(T item) {
        log.debug("Attaching Object {}", item);
        session.persist(item);
        log.trace("Attached Object {}", item);
        return item;
    }

    @Override
    public <T> T detach(T item) {
        log.debug("Detaching Object {}", item);
        session.evict(item);
        log.trace("Detached Object {}", item);
        return item;
    }

    @Override
    public <T> T reload(T item) {
        log.debug("Reloading Object {}", item);
        session.refresh(item);
        log.trace("Reloaded Object {}", item);
        return item;
    }

    /**
     * 提交当前事务
     * PreSave 处理器在提交前执行，PostSave 仅在提交成功后执行
     *
     * @return 始终为0，Hibernate 提交不返回影响行数
     */
    @Override
    public int commit() {
        log.trace("\tCommit");
        preSave.fire(this, new PreSaveEvent(this));
        session.getTransaction().commit();
        postSave.fire(this, new PostSaveEvent(this));
        log.debug("\tCommitted Changes");
        return 0;
    }

    @Override
    public <T> List<T> executeSqlQuery(Class<T> resultClass, String sql, SqlParameter... parameters) {
        log.trace("Executing SQL {}, with parameters {}", sql, SqlParameter.describe(parameters));
        return sqlExecutor.query(resultClass, sql, parameters);
    }

    @Override
    public int executeSqlCommand(String sql, SqlParameter... parameters) {
        log.trace("Executing SQL {}, with parameters {}", sql, SqlParameter.describe(parameters));
        return sqlExecutor.update(sql, parameters);
    }

    @Override
    public int executeFunction(String procedureName, SqlParameter... parameters) {
        log.trace("Executing Procedure {}, with parameters {}", procedureName, SqlParameter.describe(parameters));
        return sqlExecutor.call(procedureName, parameters);
    }

    @Override
    public void subscribePreSave(SaveEventHandler<PreSaveEvent> handler) {
        preSave.subscribe(handler);
    }

    @Override
    public boolean unsubscribePreSave(SaveEventHandler<PreSaveEvent> handler) {
        return preSave.unsubscribe(handler);
    }

    @Override
    public void subscribePostSave(SaveEventHandler<PostSaveEvent> handler) {
        postSave.subscribe(handler);
    }

    @Override
    public boolean unsubscribePostSave(SaveEventHandler<PostSaveEvent> handler) {
        return postSave.unsubscribe(handler);
    }

    @Override
    public void assignEventManager(EventManager eventManager) {
        this.eventManager = eventManager;
    }

    /**
     * 未提交的事务将回滚
     */
    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        if (eventManager != null) {
            EventManagers.unregister(this);
        }
        try {
            Transaction transaction = session.getTransaction();
            if (transaction != null && transaction.isActive()) {
                log.debug("\tRolling back uncommitted changes");
                transaction.rollback();
            }
        } finally {
            session.close();
            log.trace("\tClosed");
        }
    }
}
