package com.streamfirst.nomicon.boot;

import com.streamfirst.nomicon.adapters.AwsCloudProfileAdapter;
import com.streamfirst.nomicon.adapters.AzureCafCloudProfileAdapter;
import com.streamfirst.nomicon.application.CloudProfileRegistry;
import com.streamfirst.nomicon.application.NamingEngine;
import com.streamfirst.nomicon.application.NamingSettingsResolver;
import com.streamfirst.nomicon.domain.NamingConfig;
import com.streamfirst.nomicon.ports.CloudProfilePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the naming engine and resolves the deployment's naming configuration from properties.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(NomiconProperties.class)
public class NomiconConfiguration {

    @Bean
    public AwsCloudProfileAdapter awsCloudProfile() {
        return new AwsCloudProfileAdapter();
    }

    @Bean
    public AzureCafCloudProfileAdapter azureCloudProfile() {
        return new AzureCafCloudProfileAdapter();
    }

    /**
     * Registers every {@link CloudProfilePort} bean in the context, so hosts can add clouds by
     * declaring another profile bean.
     */
    @Bean
    public CloudProfileRegistry cloudProfileRegistry(List<CloudProfilePort> profiles) {
        return new CloudProfileRegistry(profiles);
    }

    @Bean
    public NamingSettingsResolver namingSettingsResolver(CloudProfileRegistry registry) {
        return new NamingSettingsResolver(registry);
    }

    @Bean
    public NamingEngine namingEngine(CloudProfileRegistry registry) {
        return new NamingEngine(registry);
    }

    /**
     * The deployment-wide configuration every name is built from.
     */
    @Bean
    public NamingConfig namingConfig(NamingSettingsResolver resolver, NomiconProperties properties) {
        NamingConfig config = resolver.resolve(properties.toSettings());
        log.info("Resolved naming configuration for cloud '{}' org '{}' env '{}'",
            CloudProfileRegistry.normalizeCloud(config.getCloud()), config.getOrgPrefix(), config.getEnv());
        return config;
    }
}
