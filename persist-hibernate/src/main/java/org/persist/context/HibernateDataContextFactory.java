package org.persist.context;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.hibernate.HibernateException;
import org.hibernate.Session;
import org.hibernate.SessionFactory;
import org.hibernate.cfg.Configuration;
import org.persist.context.event.EventManager;
import org.persist.context.event.EventManagers;
import org.persist.share.DataContextException;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * 数据上下文工厂
 * 每次 open 打开新会话并开启事务，一个上下文对应一个工作单元
 *
 * @author qiaohe
 * @date 2024/4/3
 */
@Slf4j
public class HibernateDataContextFactory implements AutoCloseable {
    @Getter
    private final SessionFactory sessionFactory;
    private final boolean ownsSessionFactory;
    private final Supplier<? extends EventManager> eventManagerSupplier;

    public HibernateDataContextFactory(DataContextSettings settings, MappingConfiguration mapping) {
        this(settings, mapping, null);
    }

    public HibernateDataContextFactory(DataContextSettings settings, MappingConfiguration mapping,
                                       Supplier<? extends EventManager> eventManagerSupplier) {
        this(buildSessionFactory(settings, mapping), true, eventManagerSupplier);
    }

    /**
     * 使用外部 SessionFactory，关闭工厂时不关闭它
     *
     * @param sessionFactory
     * @param eventManagerSupplier 可为null
     */
    public HibernateDataContextFactory(SessionFactory sessionFactory, Supplier<? extends EventManager> eventManagerSupplier) {
        this(Objects.requireNonNull(sessionFactory, "sessionFactory"), false, eventManagerSupplier);
    }

    private HibernateDataContextFactory(SessionFactory sessionFactory, boolean ownsSessionFactory,
                                        Supplier<? extends EventManager> eventManagerSupplier) {
        this.sessionFactory = sessionFactory;
        this.ownsSessionFactory = ownsSessionFactory;
        this.eventManagerSupplier = eventManagerSupplier;
    }

    public HibernateDataContext open() {
        Session session = sessionFactory.openSession();
        try {
            session.beginTransaction();
        } catch (RuntimeException ex) {
            session.close();
            throw ex;
        }
        HibernateDataContext context = new HibernateDataContext(session);
        if (eventManagerSupplier != null) {
            try {
                EventManager eventManager = eventManagerSupplier.get();
                if (eventManager != null) {
                    EventManagers.register(context, eventManager);
                }
            } catch (RuntimeException ex) {
                context.close();
                throw ex;
            }
        }
        log.debug("\tOpened DataContext");
        return context;
    }

    @Override
    public void close() {
        if (ownsSessionFactory && sessionFactory.isOpen()) {
            sessionFactory.close();
        }
    }

    static SessionFactory buildSessionFactory(DataContextSettings settings, MappingConfiguration mapping) {
        if (settings == null || StringUtils.isBlank(settings.getUrl())) {
            throw new DataContextException("缺少数据库连接配置: url");
        }
        if (mapping == null) {
            throw new DataContextException("缺少实体映射配置");
        }
        Configuration configuration = new Configuration();
        configuration.addProperties(settings.toProperties());
        log.debug("\tOnModelCreating");
        log.trace("\t\tMapping : {}", mapping.getClass().getSimpleName());
        mapping.configure(configuration);
        try {
            return configuration.buildSessionFactory();
        } catch (HibernateException ex) {
            throw new DataContextException("SessionFactory 构建失败: url=" + settings.getUrl(), ex);
        }
    }
}
