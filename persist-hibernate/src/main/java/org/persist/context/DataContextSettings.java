package org.persist.context;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.apache.commons.lang3.StringUtils;
import org.hibernate.cfg.AvailableSettings;

import java.util.Map;
import java.util.Properties;

/**
 * 数据库连接与Hibernate配置
 *
 * @author qiaohe
 * @date 2024/4/3
 */
@Getter
@Builder(toBuilder = true)
public class DataContextSettings {
    private final String url;
    private final String username;
    private final String password;
    private final String driverClass;
    private final String dialect;
    @Builder.Default
    private final String hbm2ddlAuto = "none";
    private final boolean showSql;
    /**
     * 其他Hibernate配置，覆盖同名项
     */
    @Singular
    private final Map<String, String> properties;

    public Properties toProperties() {
        Properties props = new Properties();
        put(props, AvailableSettings.URL, url);
        put(props, AvailableSettings.USER, username);
        put(props, AvailableSettings.PASS, password);
        put(props, AvailableSettings.DRIVER, driverClass);
        put(props, AvailableSettings.DIALECT, dialect);
        put(props, AvailableSettings.HBM2DDL_AUTO, hbm2ddlAuto);
        props.setProperty(AvailableSettings.SHOW_SQL, String.valueOf(showSql));
        props.putAll(properties);
        return props;
    }

    private static void put(Properties props, String key, String value) {
        if (StringUtils.isNotBlank(value)) {
            props.setProperty(key, value);
        }
    }
}
