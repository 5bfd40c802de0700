package com.streamfirst.nomicon.application;

import com.streamfirst.nomicon.domain.NamingStyle;
import com.streamfirst.nomicon.domain.UnsupportedStyleException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class NameFormatterTest {

    private static final List<String> PARTS = List.of("acme", "my_project", "use1", "s3bk", "Logs v2");

    @Test
    void formatsEveryStyle() {
        assertThat(NameFormatter.format(NamingStyle.DASHED, PARTS)).isEqualTo("acme-my-project-use1-s3bk-logs-v2");
        assertThat(NameFormatter.format(NamingStyle.UNDERSCORE, PARTS)).isEqualTo("acme_my_project_use1_s3bk_logs_v2");
        assertThat(NameFormatter.format(NamingStyle.STRAIGHT, PARTS)).isEqualTo("acmemyprojectuse1s3bklogsv2");
        assertThat(NameFormatter.format(NamingStyle.PASCAL, PARTS)).isEqualTo("AcmeMyProjectUse1S3bkLogsV2");
        assertThat(NameFormatter.format(NamingStyle.PASCAL_DASHED, PARTS)).isEqualTo("Acme-My-Project-Use1-S3bk-Logs-V2");
        assertThat(NameFormatter.format(NamingStyle.CAMEL, PARTS)).isEqualTo("acmeMyProjectUse1S3bkLogsV2");
    }

    @Test
    void camelLowercasesTheWholeFirstComponent() {
        assertThat(NameFormatter.format(NamingStyle.CAMEL, List.of("My Org", "PROD")))
            .isEqualTo("myorgProd");
    }

    @Test
    void singleCharacterRunsAreUppercased() {
        assertThat(NameFormatter.format(NamingStyle.PASCAL, List.of("a", "b2c"))).isEqualTo("AB2c");
    }

    @Test
    void componentsWithoutAlphanumericsLeaveNoSeparator() {
        assertThat(NameFormatter.format(NamingStyle.DASHED, List.of("acme", "--", "prod"))).isEqualTo("acme-prod");
        assertThat(NameFormatter.format(NamingStyle.PASCAL_DASHED, List.of("acme", "__", "prod")))
            .isEqualTo("Acme-Prod");
        assertThat(NameFormatter.format(NamingStyle.DASHED, List.of())).isEmpty();
    }

    @Test
    void wireNamesAreAccepted() {
        assertThat(NameFormatter.format(" Underscore ", List.of("a", "b"))).isEqualTo("a_b");
    }

    @Test
    void unknownWireNameIsRejected() {
        assertThatThrownBy(() -> NameFormatter.format("kebab", PARTS))
            .isInstanceOf(UnsupportedStyleException.class)
            .hasMessage("unsupported style \"kebab\"");
    }
}
