package org.persist.context;

import org.junit.jupiter.api.Test;
import org.persist.context.event.EventInterceptor;
import org.persist.context.event.InterceptorResult;
import org.persist.context.event.PreSaveEvent;
import org.persist.context.event.SaveEvent;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class HibernateDataContextAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(HibernateDataContextAutoConfiguration.class));

    private static String[] h2Properties() {
        return new String[]{
                "persist.hibernate.url=jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
                "persist.hibernate.username=sa",
                "persist.hibernate.driverClass=org.h2.Driver",
                "persist.hibernate.dialect=org.hibernate.dialect.H2Dialect",
                "persist.hibernate.hbm2ddlAuto=create-drop",
                "persist.hibernate.annotatedClasses=org.persist.context.Ticket"
        };
    }

    @Test
    void backs_off_without_url() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean(HibernateDataContextFactory.class));
    }

    @Test
    void binds_settings_and_mapping_from_properties() {
        contextRunner.withPropertyValues(h2Properties()).run(context -> {
            assertThat(context).hasSingleBean(HibernateDataContextFactory.class);
            assertThat(context.getBean(DataContextSettings.class).getHbm2ddlAuto()).isEqualTo("create-drop");
            assertThat(context.getBean(DataContextSettings.class).isShowSql()).isFalse();
            AnnotatedClassMapping mapping = (AnnotatedClassMapping) context.getBean(MappingConfiguration.class);
            assertThat(mapping.getAnnotatedClasses()).containsExactly(Ticket.class);
        });
    }

    @Test
    void commit_runs_interceptors_and_publishes_application_events() {
        contextRunner.withPropertyValues(h2Properties())
                .withUserConfiguration(RecordingConfiguration.class)
                .run(context -> {
                    HibernateDataContextFactory factory = context.getBean(HibernateDataContextFactory.class);
                    try (HibernateDataContext dataContext = factory.open()) {
                        dataContext.add(new Ticket("T-1"));
                        dataContext.commit();
                    }

                    Recorder recorder = context.getBean(Recorder.class);
                    assertThat(recorder.calls).containsExactly(
                            "interceptor:PreSaveEvent",
                            "listener:PreSaveEvent",
                            "listener:PostSaveEvent");
                });
    }

    @Test
    void application_event_bridge_can_be_disabled() {
        contextRunner.withPropertyValues(h2Properties())
                .withPropertyValues("persist.event.publishApplicationEvents=false")
                .run(context -> assertThat(context).doesNotHaveBean(ApplicationEventPublishingInterceptor.class));
    }

    @Test
    void unknown_entity_class_fails_startup() {
        contextRunner.withPropertyValues(h2Properties())
                .withPropertyValues("persist.hibernate.annotatedClasses=com.example.Missing")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasStackTraceContaining("com.example.Missing");
                });
    }

    static class Recorder {
        final List<String> calls = new ArrayList<>();
    }

    @Configuration
    static class RecordingConfiguration {

        @Bean
        Recorder recorder() {
            return new Recorder();
        }

        @Bean
        RecordingInterceptor recordingInterceptor(Recorder recorder) {
            return new RecordingInterceptor(recorder);
        }

        @Bean
        SaveEventListener saveEventListener(Recorder recorder) {
            return new SaveEventListener(recorder);
        }
    }

    static class SaveEventListener implements ApplicationListener<SaveEvent> {
        private final Recorder recorder;

        SaveEventListener(Recorder recorder) {
            this.recorder = recorder;
        }

        @Override
        public void onApplicationEvent(SaveEvent event) {
            recorder.calls.add("listener:" + event.getClass().getSimpleName());
        }
    }

    static class RecordingInterceptor implements EventInterceptor<PreSaveEvent>, Ordered {
        private final Recorder recorder;

        RecordingInterceptor(Recorder recorder) {
            this.recorder = recorder;
        }

        @Override
        public Class<PreSaveEvent> forEventType() {
            return PreSaveEvent.class;
        }

        @Override
        public InterceptorResult apply(ObservableDataContext context, PreSaveEvent event) {
            recorder.calls.add("interceptor:" + event.getClass().getSimpleName());
            return InterceptorResult.proceed();
        }

        @Override
        public int getOrder() {
            return 0;
        }
    }
}
