package org.persist.context;

import org.apache.commons.lang3.StringUtils;
import org.persist.context.event.DefaultEventManager;
import org.persist.context.event.EventInterceptor;
import org.persist.share.DataContextException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.persist.share.Constants.*;

/**
 * @author qiaohe
 * @date 2024/4/5
 */
@Configuration
@ConditionalOnProperty(prefix = "persist.hibernate", name = "url")
public class HibernateDataContextAutoConfiguration {

    @Value(CONFIG_KEY_4_HIBERNATE_URL)
    private String url;
    @Value(CONFIG_KEY_4_HIBERNATE_USERNAME)
    private String username;
    @Value(CONFIG_KEY_4_HIBERNATE_PASSWORD)
    private String password;
    @Value(CONFIG_KEY_4_HIBERNATE_DRIVER_CLASS)
    private String driverClass;
    @Value(CONFIG_KEY_4_HIBERNATE_DIALECT)
    private String dialect;
    @Value(CONFIG_KEY_4_HIBERNATE_HBM2DDL_AUTO)
    private String hbm2ddlAuto;
    @Value(CONFIG_KEY_4_HIBERNATE_SHOW_SQL)
    private boolean showSql;

    @Bean
    @ConditionalOnMissingBean
    public DataContextSettings dataContextSettings() {
        return DataContextSettings.builder()
                .url(url)
                .username(username)
                .password(password)
                .driverClass(driverClass)
                .dialect(dialect)
                .hbm2ddlAuto(hbm2ddlAuto)
                .showSql(showSql)
                .build();
    }

    /**
     * persist.hibernate.annotatedClasses 逗号分隔的实体类名
     *
     * @param annotatedClasses
     * @return
     */
    @Bean
    @ConditionalOnMissingBean
    public MappingConfiguration mappingConfiguration(@Value(CONFIG_KEY_4_HIBERNATE_ANNOTATED_CLASSES) String annotatedClasses) {
        List<Class<?>> classes = new ArrayList<>();
        for (String className : StringUtils.split(StringUtils.defaultString(annotatedClasses), ',')) {
            if (StringUtils.isBlank(className)) {
                continue;
            }
            try {
                classes.add(ClassUtils.forName(className.trim(), getClass().getClassLoader()));
            } catch (ClassNotFoundException | LinkageError ex) {
                throw new DataContextException("实体类加载失败: " + className.trim(), ex);
            }
        }
        return new AnnotatedClassMapping(classes);
    }

    @Bean
    @ConditionalOnProperty(prefix = "persist.event", name = "publishApplicationEvents", havingValue = "true", matchIfMissing = true)
    public ApplicationEventPublishingInterceptor applicationEventPublishingInterceptor(ApplicationEventPublisher applicationEventPublisher) {
        return new ApplicationEventPublishingInterceptor(applicationEventPublisher);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public HibernateDataContextFactory hibernateDataContextFactory(DataContextSettings dataContextSettings,
                                                                  MappingConfiguration mappingConfiguration,
                                                                  ObjectProvider<EventInterceptor<?>> eventInterceptors) {
        return new HibernateDataContextFactory(dataContextSettings, mappingConfiguration,
                () -> new DefaultEventManager(eventInterceptors.orderedStream().collect(Collectors.toList())));
    }
}
