package org.persist.context;

import org.hibernate.cfg.Configuration;

/**
 * 实体映射配置，在 SessionFactory 构建前应用
 *
 * @author qiaohe
 * @date 2024/4/3
 */
public interface MappingConfiguration {
    void configure(Configuration configuration);
}
