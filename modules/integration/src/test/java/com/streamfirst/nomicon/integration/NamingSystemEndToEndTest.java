package com.streamfirst.nomicon.integration;

import com.streamfirst.nomicon.adapters.AwsCloudProfileAdapter;
import com.streamfirst.nomicon.adapters.AzureCafCloudProfileAdapter;
import com.streamfirst.nomicon.application.CloudProfileRegistry;
import com.streamfirst.nomicon.application.NamingEngine;
import com.streamfirst.nomicon.application.NamingSettingsResolver;
import com.streamfirst.nomicon.domain.BuildInput;
import com.streamfirst.nomicon.domain.BuildResult;
import com.streamfirst.nomicon.domain.CloudDefaults;
import com.streamfirst.nomicon.domain.ConstraintViolationException;
import com.streamfirst.nomicon.domain.NamingConfig;
import com.streamfirst.nomicon.domain.NamingSettings;
import com.streamfirst.nomicon.domain.NamingStyle;
import com.streamfirst.nomicon.domain.ResourceConstraint;
import com.streamfirst.nomicon.domain.Result;
import com.streamfirst.nomicon.ports.CloudProfilePort;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end naming across every registered cloud: settings are layered over the cloud
 * profiles, resolved into a configuration and used to build names for a set of resources.
 *
 * <p>A third, statically defined profile is registered next to the built-in ones to check that
 * the registry accepts any {@link CloudProfilePort}.
 */
@Slf4j
public class NamingSystemEndToEndTest {

    private CloudProfileRegistry registry;
    private NamingSettingsResolver resolver;
    private NamingEngine engine;

    @BeforeEach
    void setupNamingSystem() {
        log.info("Setting up naming system with aws, azure and a static test cloud");
        registry = new CloudProfileRegistry(List.of(
            new AwsCloudProfileAdapter(),
            new AzureCafCloudProfileAdapter(),
            new StaticCloudProfile()));
        resolver = new NamingSettingsResolver(registry);
        engine = new NamingEngine(registry);
    }

    @Test
    void buildsNamesForAwsDeployment() {
        NamingConfig config = resolver.resolve(NamingSettings.builder()
            .orgPrefix("acme")
            .project("billing")
            .env("prod")
            .region("eu-west-1")
            .ignoreRegionForRegionalResources(true)
            .build());

        assertEquals("acme-billing-prod-s3bk-invoices",
            engine.buildName(config, BuildInput.of("s3_bucket", "invoices")).getName());
        assertEquals("acme-billing-prod-euw1-role-deployer",
            engine.buildName(config, BuildInput.of("iam_role", "deployer")).getName());

        BuildResult queue = engine.buildName(config, BuildInput.builder()
            .resource("sqs")
            .qualifier("events")
            .stylePriority(List.of("pascal"))
            .build());
        assertEquals("AcmeBillingProdSqsEvents", queue.getName());
        assertEquals(NamingStyle.PASCAL, queue.getStyle());
    }

    @Test
    void buildsNamesForAzureDeployment() {
        NamingConfig config = resolver.resolve(NamingSettings.builder()
            .cloud("azure")
            .orgPrefix("acme")
            .env("dev")
            .region("westeurope")
            .regionOverrides(Map.of("westeurope", "weu"))
            .build());

        assertEquals("acmedevweustazdata",
            engine.buildName(config, BuildInput.of("azurerm_storage_account", "data")).getName());
        assertEquals("acme-dev-weu-snet-app",
            engine.buildName(config, BuildInput.of("azurerm_subnet", "app")).getName());

        Result<BuildResult> tooLong = engine.tryBuildName(config,
            BuildInput.of("azurerm_storage_account", "diagnosticsarchive"));
        assertTrue(tooLong.isFailure());
        assertEquals("CONSTRAINT_VIOLATION", tooLong.getErrorCode().orElseThrow());
    }

    @Test
    void customProfileIsUsedLikeBuiltInOnes() {
        assertTrue(registry.isSupportedCloud("STATIC"));
        assertEquals(List.of("aws", "azure", "static"), new ArrayList<>(registry.supportedClouds()));

        NamingConfig config = resolver.resolve(NamingSettings.builder()
            .cloud("static")
            .orgPrefix("acme")
            .env("qa")
            .region("north")
            .build());

        BuildResult result = engine.buildName(config, BuildInput.of("bucket", "raw"));
        assertEquals("acme_qa_n1_bkt_raw", result.getName());
        assertEquals(NamingStyle.UNDERSCORE, result.getStyle());

        assertThrows(ConstraintViolationException.class,
            () -> engine.buildName(config, BuildInput.of("bucket", "far-too-long-for-this-bucket")));
    }

    @Test
    void concurrentCallersGetIdenticalNames() throws Exception {
        NamingConfig config = NamingConfig.builder()
            .cloud("azure")
            .orgPrefix("acme")
            .env("prod")
            .region("eastus")
            .build();

        List<CompletableFuture<String>> futures = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            String resource = i % 2 == 0 ? "azurerm_key_vault_secret" : "s3_bucket";
            NamingConfig callConfig = i % 2 == 0 ? config : config.toBuilder().cloud("aws").region("us-east-1").build();
            futures.add(CompletableFuture.supplyAsync(
                () -> engine.buildName(callConfig, BuildInput.of(resource, "db")).getName()));
        }

        Set<String> names = new HashSet<>();
        for (CompletableFuture<String> future : futures) {
            names.add(future.get(10, TimeUnit.SECONDS));
        }
        log.info("Concurrent callers produced {}", names);
        assertEquals(Set.of("acme-prod-eastus-kvsa-db", "acme-prod-use1-s3bk-db"), names);
    }

    /** A fixed profile with a single resource type. */
    private static final class StaticCloudProfile implements CloudProfilePort {

        @Override
        public String cloud() {
            return "static";
        }

        @Override
        public CloudDefaults defaults() {
            Map<String, List<String>> styles = new HashMap<>();
            styles.put("bucket", new ArrayList<>(List.of("underscore")));
            Map<String, ResourceConstraint> constraints = new HashMap<>();
            constraints.put("bucket", ResourceConstraint.of(3, 24, "^[a-z0-9_]+$", "lowercase words joined by underscores"));
            return CloudDefaults.builder()
                .regionMap(new HashMap<>(Map.of("north", "n1")))
                .resourceAcronyms(new HashMap<>(Map.of("bucket", "bkt")))
                .resourceStyleOverrides(styles)
                .resourceConstraints(constraints)
                .regionalResources(new HashSet<>(Set.of("bucket")))
                .build();
        }
    }
}
