package org.persist.context;

import org.hibernate.cfg.AvailableSettings;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class DataContextSettingsTest {

    @Test
    void renders_hibernate_properties_and_skips_blank_values() {
        Properties properties = DataContextSettings.builder()
                .url("jdbc:h2:mem:settings")
                .username("sa")
                .password("")
                .showSql(true)
                .build()
                .toProperties();

        assertThat(properties.getProperty(AvailableSettings.URL)).isEqualTo("jdbc:h2:mem:settings");
        assertThat(properties.getProperty(AvailableSettings.USER)).isEqualTo("sa");
        assertThat(properties.getProperty(AvailableSettings.SHOW_SQL)).isEqualTo("true");
        assertThat(properties.getProperty(AvailableSettings.HBM2DDL_AUTO)).isEqualTo("none");
        assertThat(properties).doesNotContainKey(AvailableSettings.PASS);
        assertThat(properties).doesNotContainKey(AvailableSettings.DIALECT);
    }

    @Test
    void extra_properties_override_named_settings() {
        Properties properties = DataContextSettings.builder()
                .url("jdbc:h2:mem:settings")
                .hbm2ddlAuto("create")
                .property(AvailableSettings.HBM2DDL_AUTO, "validate")
                .property("hibernate.jdbc.batch_size", "20")
                .build()
                .toProperties();

        assertThat(properties.getProperty(AvailableSettings.HBM2DDL_AUTO)).isEqualTo("validate");
        assertThat(properties.getProperty("hibernate.jdbc.batch_size")).isEqualTo("20");
    }
}
