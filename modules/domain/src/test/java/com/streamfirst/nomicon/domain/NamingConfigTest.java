package com.streamfirst.nomicon.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class NamingConfigTest {

    @Test
    void nullsBecomeEmpty() {
        NamingConfig config = NamingConfig.builder().build();

        assertThat(config.getCloud()).isEmpty();
        assertThat(config.getRegionMap()).isEmpty();
        assertThat(config.getResourceStyleOverrides()).isEmpty();
        assertThat(config.getRegionalResources()).isEmpty();
    }

    @Test
    void styleListsAreDetachedFromCallerCollections() {
        List<String> widgetStyles = new ArrayList<>(List.of("straight"));
        Map<String, List<String>> overrides = new HashMap<>();
        overrides.put("widget", widgetStyles);

        NamingConfig config = NamingConfig.builder().resourceStyleOverrides(overrides).build();
        widgetStyles.add("pascal");
        overrides.put("gadget", List.of("camel"));

        assertThat(config.getResourceStyleOverrides()).containsOnlyKeys("widget");
        assertThat(config.getResourceStyleOverrides().get("widget")).containsExactly("straight");
        assertThatThrownBy(() -> config.getResourceStyleOverrides().get("widget").add("camel"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void settingsStyleListsAreDetachedToo() {
        List<String> widgetStyles = new ArrayList<>(List.of("dashed"));

        NamingSettings settings = NamingSettings.builder()
            .resourceStyleOverrides(Map.of("widget", widgetStyles))
            .build();
        widgetStyles.clear();

        assertThat(settings.getResourceStyleOverrides().get("widget")).containsExactly("dashed");
    }
}
