package org.persist.share;

/**
 * @author qiaohe
 * @date 2024/4/2
 */
public class Constants {
    public static final String CONFIG_KEY_4_HIBERNATE_URL = "${persist.hibernate.url:}";
    public static final String CONFIG_KEY_4_HIBERNATE_USERNAME = "${persist.hibernate.username:}";
    public static final String CONFIG_KEY_4_HIBERNATE_PASSWORD = "${persist.hibernate.password:}";
    public static final String CONFIG_KEY_4_HIBERNATE_DRIVER_CLASS = "${persist.hibernate.driverClass:}";
    public static final String CONFIG_KEY_4_HIBERNATE_DIALECT = "${persist.hibernate.dialect:}";
    public static final String CONFIG_KEY_4_HIBERNATE_HBM2DDL_AUTO = "${persist.hibernate.hbm2ddlAuto:none}";
    public static final String CONFIG_KEY_4_HIBERNATE_SHOW_SQL = "${persist.hibernate.showSql:false}";
    public static final String CONFIG_KEY_4_HIBERNATE_ANNOTATED_CLASSES = "${persist.hibernate.annotatedClasses:}";
}
