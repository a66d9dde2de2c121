package org.persist.context;

import org.hibernate.Session;
import org.hibernate.SessionFactory;
import org.hibernate.Transaction;
import org.junit.jupiter.api.Test;
import org.persist.context.event.DefaultEventManager;
import org.persist.context.event.EventInterceptor;
import org.persist.context.event.InterceptorResult;
import org.persist.context.event.PreSaveEvent;
import org.persist.share.DataContextException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class HibernateDataContextFactoryTest {

    @Test
    void missing_url_is_rejected() {
        DataContextSettings settings = TestDatabase.settings().toBuilder().url(" ").build();

        assertThatThrownBy(() -> new HibernateDataContextFactory(settings, new AnnotatedClassMapping(Customer.class)))
                .isInstanceOf(DataContextException.class)
                .hasMessageContaining("url");
    }

    @Test
    void missing_mapping_is_rejected() {
        assertThatThrownBy(() -> new HibernateDataContextFactory(TestDatabase.settings(), null))
                .isInstanceOf(DataContextException.class);
    }

    @Test
    void open_begins_transaction() {
        try (HibernateDataContextFactory factory = TestDatabase.factory();
             HibernateDataContext context = factory.open()) {
            assertThat(context.getSession().getTransaction().isActive()).isTrue();
            assertThat(context.getEventManager()).isNull();
        }
    }

    @Test
    void open_registers_fresh_event_manager_per_context() {
        try (HibernateDataContextFactory factory = new HibernateDataContextFactory(TestDatabase.settings(),
                new AnnotatedClassMapping(Customer.class), DefaultEventManager::new);
             HibernateDataContext first = factory.open();
             HibernateDataContext second = factory.open()) {
            assertThat(first.getEventManager()).isInstanceOf(DefaultEventManager.class);
            assertThat(first.getEventManager().getContext()).isSameAs(first);
            assertThat(second.getEventManager()).isNotSameAs(first.getEventManager());
            assertThat(second.getEventManager().getContext()).isSameAs(second);
        }
    }

    @Test
    void registered_interceptors_run_on_commit() {
        List<String> calls = new ArrayList<>();
        EventInterceptor<PreSaveEvent> interceptor = new EventInterceptor<PreSaveEvent>() {
            @Override
            public Class<PreSaveEvent> forEventType() {
                return PreSaveEvent.class;
            }

            @Override
            public InterceptorResult apply(ObservableDataContext context, PreSaveEvent event) {
                calls.add("intercepted");
                return InterceptorResult.proceed();
            }
        };

        try (HibernateDataContextFactory factory = new HibernateDataContextFactory(TestDatabase.settings(),
                new AnnotatedClassMapping(Customer.class),
                () -> new DefaultEventManager(Collections.singletonList(interceptor)));
             HibernateDataContext context = factory.open()) {
            context.add(new Customer("alice", 1));
            context.commit();
        }

        assertThat(calls).containsExactly("intercepted");
    }

    @Test
    void failed_event_manager_creation_releases_session() {
        SessionFactory sessionFactory = mock(SessionFactory.class);
        Session session = mock(Session.class);
        Transaction transaction = mock(Transaction.class);
        IllegalStateException failure = new IllegalStateException("no interceptors");
        when(sessionFactory.openSession()).thenReturn(session);
        when(session.isOpen()).thenReturn(true);
        when(session.getTransaction()).thenReturn(transaction);
        when(transaction.isActive()).thenReturn(true);
        HibernateDataContextFactory factory = new HibernateDataContextFactory(sessionFactory, () -> {
            throw failure;
        });

        assertThatThrownBy(factory::open).isSameAs(failure);

        verify(session).beginTransaction();
        verify(transaction).rollback();
        verify(session).close();
    }

    @Test
    void external_session_factory_stays_open() {
        SessionFactory sessionFactory = HibernateDataContextFactory.buildSessionFactory(
                TestDatabase.settings(), new AnnotatedClassMapping(Customer.class));
        try {
            HibernateDataContextFactory factory = new HibernateDataContextFactory(sessionFactory, null);
            factory.close();

            assertThat(sessionFactory.isOpen()).isTrue();
        } finally {
            sessionFactory.close();
        }
    }

    @Test
    void owned_session_factory_closes_with_factory() {
        HibernateDataContextFactory factory = TestDatabase.factory();

        factory.close();

        assertThat(factory.getSessionFactory().isOpen()).isFalse();
    }
}
