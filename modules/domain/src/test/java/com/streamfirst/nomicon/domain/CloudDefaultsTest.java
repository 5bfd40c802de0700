package com.streamfirst.nomicon.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CloudDefaultsTest {

    private CloudDefaults sample() {
        Map<String, List<String>> styles = new HashMap<>();
        styles.put("s3", new ArrayList<>(List.of("dashed", "straight")));
        return CloudDefaults.builder()
            .regionMap(new HashMap<>(Map.of("us-east-1", "use1")))
            .resourceAcronyms(new HashMap<>(Map.of("s3", "s3b")))
            .resourceStyleOverrides(styles)
            .resourceConstraints(new HashMap<>(Map.of("s3", ResourceConstraint.builder().minLength(3).build())))
            .regionalResources(new HashSet<>(Set.of("s3")))
            .build();
    }

    @Test
    void copyIsDeep() {
        CloudDefaults original = sample();
        CloudDefaults copy = original.copy();

        copy.getRegionMap().put("eu-west-1", "euw1");
        copy.getResourceStyleOverrides().get("s3").add("pascal");
        copy.getRegionalResources().clear();

        assertThat(original.getRegionMap()).containsOnlyKeys("us-east-1");
        assertThat(original.getResourceStyleOverrides().get("s3")).containsExactly("dashed", "straight");
        assertThat(original.getRegionalResources()).containsExactly("s3");
    }

    @Test
    void unmodifiableViewRejectsWritesButCopiesAreMutable() {
        CloudDefaults frozen = sample().unmodifiable();

        assertThatThrownBy(() -> frozen.getResourceAcronyms().put("sqs", "sqs"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> frozen.getResourceStyleOverrides().get("s3").add("camel"))
            .isInstanceOf(UnsupportedOperationException.class);

        CloudDefaults copy = frozen.copy();
        copy.getResourceAcronyms().put("sqs", "sqs");
        copy.getResourceStyleOverrides().get("s3").add("camel");
        assertThat(frozen.getResourceAcronyms()).doesNotContainKey("sqs");
    }

    @Test
    void missingTablesBecomeEmpty() {
        CloudDefaults empty = CloudDefaults.builder().build();
        assertThat(empty.getRegionMap()).isEmpty();
        assertThat(empty.getRegionalResources()).isEmpty();
    }
}
