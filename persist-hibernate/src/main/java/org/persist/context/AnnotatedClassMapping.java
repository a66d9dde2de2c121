package org.persist.context;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.cfg.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 注解实体映射
 *
 * @author qiaohe
 * @date 2024/4/3
 */
@Slf4j
public class AnnotatedClassMapping implements MappingConfiguration {
    @Getter
    private final List<Class<?>> annotatedClasses;

    public AnnotatedClassMapping(Class<?>... annotatedClasses) {
        this(Arrays.asList(annotatedClasses));
    }

    public AnnotatedClassMapping(List<Class<?>> annotatedClasses) {
        this.annotatedClasses = Collections.unmodifiableList(new ArrayList<>(annotatedClasses));
    }

    @Override
    public void configure(Configuration configuration) {
        for (Class<?> annotatedClass : annotatedClasses) {
            log.trace("\t\tMapping Entity : {}", annotatedClass.getName());
            configuration.addAnnotatedClass(annotatedClass);
        }
    }
}
