package com.streamfirst.nomicon.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class NamingStyleTest {

    @Test
    void resolvesWireNamesLeniently() {
        assertThat(NamingStyle.fromWireName(" Dashed ")).contains(NamingStyle.DASHED);
        assertThat(NamingStyle.fromWireName("PASCALDASHED")).contains(NamingStyle.PASCAL_DASHED);
        assertThat(NamingStyle.fromWireName("kebab")).isEmpty();
        assertThat(NamingStyle.fromWireName(null)).isEmpty();
    }

    @Test
    void defaultPriorityStartsWithDashed() {
        assertThat(NamingStyle.defaultPriority())
            .containsExactly("dashed", "pascal", "pascaldashed", "camel", "straight", "underscore");
    }
}
