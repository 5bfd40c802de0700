package com.streamfirst.nomicon.adapters;

import com.streamfirst.nomicon.domain.CloudDefaults;
import com.streamfirst.nomicon.domain.ResourceConstraint;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class AwsCloudProfileAdapterTest {

    private final AwsCloudProfileAdapter profile = new AwsCloudProfileAdapter();

    @Test
    void servesAwsTables() {
        CloudDefaults defaults = profile.defaults();

        assertThat(profile.cloud()).isEqualTo("aws");
        assertThat(defaults.getRegionMap())
            .hasSize(34)
            .containsEntry("us-east-1", "use1")
            .containsEntry("ap-southeast-1", "apse1")
            .containsEntry("us-gov-west-1", "usgw1");
        assertThat(defaults.getResourceAcronyms())
            .containsEntry("s3_bucket", "s3bk")
            .containsEntry("lambda", "lmbd")
            .containsEntry("sfn", "stfn");
        assertThat(defaults.getResourceStyleOverrides().get("s3_bucket")).containsExactly("dashed", "straight");
    }

    @Test
    void globalResourcesAreNotRegional() {
        CloudDefaults defaults = profile.defaults();

        assertThat(defaults.getRegionalResources()).contains("s3_bucket", "lambda", "vpc");
        assertThat(defaults.getRegionalResources())
            .doesNotContain("iam_role", "role", "cloudfront", "route53_zone", "route53_record");
        assertThat(defaults.getRegionalResources()).hasSize(defaults.getResourceAcronyms().size() - 9);
    }

    @Test
    void bucketConstraintMatchesS3Rules() {
        ResourceConstraint bucket = profile.defaults().getResourceConstraints().get("s3_bucket");

        assertThat(bucket.getMinLength()).isEqualTo(3);
        assertThat(bucket.getMaxLength()).isEqualTo(63);
        assertThat(bucket.getPattern().matcher("acme-prod-use1-s3bk-logs").find()).isTrue();
        assertThat(bucket.getPattern().matcher("Acme").find()).isFalse();
        assertThat(bucket.getForbiddenPrefixes()).containsExactly("xn--", "sthree-", "amzn-s3-demo-");
        assertThat(bucket.isDisallowIpAddress()).isTrue();
    }

    @Test
    void everyCallReturnsIndependentTables() {
        CloudDefaults first = profile.defaults();
        first.getRegionMap().clear();
        first.getResourceStyleOverrides().remove("s3");

        CloudDefaults second = profile.defaults();
        assertThat(second.getRegionMap()).containsEntry("us-east-1", "use1");
        assertThat(second.getResourceStyleOverrides()).containsKey("s3");
    }
}
