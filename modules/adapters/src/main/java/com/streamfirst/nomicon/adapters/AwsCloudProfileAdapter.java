package com.streamfirst.nomicon.adapters;

import com.streamfirst.nomicon.domain.CloudDefaults;
import com.streamfirst.nomicon.ports.CloudProfilePort;

/**
 * AWS profile backed by hard-coded tables. Tables are rebuilt on every call, so each caller gets
 * its own copy without any caching.
 */
public class AwsCloudProfileAdapter implements CloudProfilePort {

    public static final String CLOUD = "aws";

    @Override
    public String cloud() {
        return CLOUD;
    }

    @Override
    public CloudDefaults defaults() {
        return CloudDefaults.builder()
            .regionMap(AwsDefaults.regionMap())
            .resourceAcronyms(AwsDefaults.resourceAcronyms())
            .resourceStyleOverrides(AwsDefaults.resourceStyleOverrides())
            .resourceConstraints(AwsDefaults.resourceConstraints())
            .regionalResources(AwsDefaults.regionalResources())
            .build();
    }
}
