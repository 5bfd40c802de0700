package com.streamfirst.nomicon.adapters;

import com.streamfirst.nomicon.domain.NamingStyle;
import com.streamfirst.nomicon.domain.ResourceConstraint;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hard-coded AWS naming data: region short codes, resource acronyms, style restrictions,
 * naming constraints and the set of resources AWS treats as global.
 * Every method returns a new mutable collection.
 */
final class AwsDefaults {

    private static final String IAM_PATTERN = "^[a-zA-Z0-9+=,.@_-]+$";
    private static final String IAM_DESCRIPTION = "alphanumeric and the following: +=,.@_-";
    private static final String S3_PATTERN = "^[a-z0-9][a-z0-9.-]*[a-z0-9]$";
    private static final String S3_DESCRIPTION =
        "lowercase letters, numbers, dots, and hyphens; must start and end with a letter or number";
    private static final String MESSAGING_PATTERN = "^[a-zA-Z0-9_-]+(\\.fifo)?$";
    private static final String LOG_GROUP_PATTERN = "^[a-zA-Z0-9_\\-/.#]+$";
    private static final String LOG_GROUP_DESCRIPTION = "letters, numbers, underscore, hyphen, slash, period, and #";
    private static final String SECURITY_GROUP_PATTERN = "^[a-zA-Z0-9 ._\\-:/()#,@\\[\\]+=&;{}!$*]+$";
    private static final String SECURITY_GROUP_DESCRIPTION = "letters, numbers, spaces, and ._-:/()#,@[]+=&;{}!$*";

    /** IAM, DNS and CDN resources are account-wide; everything else with an acronym is regional */
    private static final Set<String> GLOBAL_RESOURCES = Set.of(
        "role", "role_policy", "iam_role", "iam_policy", "iam_user", "iam_group", "cloudfront", "route53_zone", "route53_record");

    private AwsDefaults() {
    }

    static Map<String, String> regionMap() {
        Map<String, String> regions = new HashMap<>();
        regions.put("us-east-1", "use1");
        regions.put("us-east-2", "use2");
        regions.put("us-west-1", "usw1");
        regions.put("us-west-2", "usw2");
        regions.put("af-south-1", "afs1");
        regions.put("ap-east-1", "ape1");
        regions.put("ap-south-1", "aps1");
        regions.put("ap-south-2", "aps2");
        regions.put("ap-southeast-1", "apse1");
        regions.put("ap-southeast-2", "apse2");
        regions.put("ap-southeast-3", "apse3");
        regions.put("ap-southeast-4", "apse4");
        regions.put("ap-northeast-1", "apne1");
        regions.put("ap-northeast-2", "apne2");
        regions.put("ap-northeast-3", "apne3");
        regions.put("ca-central-1", "cac1");
        regions.put("ca-west-1", "caw1");
        regions.put("cn-north-1", "cnn1");
        regions.put("cn-northwest-1", "cnnw1");
        regions.put("eu-central-1", "euc1");
        regions.put("eu-central-2", "euc2");
        regions.put("eu-west-1", "euw1");
        regions.put("eu-west-2", "euw2");
        regions.put("eu-west-3", "euw3");
        regions.put("eu-west-4", "euw4");
        regions.put("eu-north-1", "eun1");
        regions.put("eu-south-1", "eus1");
        regions.put("eu-south-2", "eus2");
        regions.put("il-central-1", "ilc1");
        regions.put("me-south-1", "mes1");
        regions.put("me-central-1", "mec1");
        regions.put("sa-east-1", "sae1");
        regions.put("us-gov-west-1", "usgw1");
        regions.put("us-gov-east-1", "usge1");
        return regions;
    }

    static Map<String, String> resourceAcronyms() {
        Map<String, String> acronyms = new HashMap<>();
        acronyms.put("role", "role");
        acronyms.put("role_policy", "rlpl");
        acronyms.put("iam_role", "role");
        acronyms.put("iam_policy", "iamp");
        acronyms.put("iam_user", "iamu");
        acronyms.put("iam_group", "iamg");
        acronyms.put("s3", "s3b");
        acronyms.put("s3_bucket", "s3bk");
        acronyms.put("s3_object", "s3ob");
        acronyms.put("s3_access_point", "s3ap");
        acronyms.put("s3_table", "s3tb");
        acronyms.put("s3_dir", "s3dr");
        acronyms.put("sns", "sns");
        acronyms.put("sqs", "sqs");
        acronyms.put("ecs_cluster", "ecsc");
        acronyms.put("ecs_service", "ecss");
        acronyms.put("ecs_task", "ecst");
        acronyms.put("eks", "eks");
        acronyms.put("eks_cluster", "eksc");
        acronyms.put("eks_node_group", "ekng");
        acronyms.put("msk_cluster", "mskc");
        acronyms.put("vpc", "vpcn");
        acronyms.put("subnet", "subn");
        acronyms.put("igw", "igtw");
        acronyms.put("nat_gw", "ngtw");
        acronyms.put("sec_group", "scgp");
        acronyms.put("nacl", "nacl");
        acronyms.put("route_table", "rttb");
        acronyms.put("elastic_ip", "elip");
        acronyms.put("wafv2_web_acl", "wfac");
        acronyms.put("wafv2_web_acl_rule", "wfar");
        acronyms.put("wafv2_ip_set", "wfis");
        acronyms.put("lambda", "lmbd");
        acronyms.put("api_gateway_rest_api", "agra");
        acronyms.put("api_gateway_model", "agmd");
        acronyms.put("api_gateway_v2", "agv2");
        acronyms.put("log_group", "logg");
        acronyms.put("cloudwatch_log_group", "cwlg");
        acronyms.put("cloudwatch_alarm", "cwal");
        acronyms.put("eventbridge_bus", "evbb");
        acronyms.put("eventbridge_rule", "evbr");
        acronyms.put("step_function", "stfn");
        acronyms.put("sfn", "stfn");
        acronyms.put("dynamodb", "dydb");
        acronyms.put("dynamodb_table", "dybt");
        acronyms.put("rds", "rds");
        acronyms.put("rds_cluster", "rdsc");
        acronyms.put("aurora_cluster", "arcl");
        acronyms.put("redshift", "rdsh");
        acronyms.put("elasticache", "elch");
        acronyms.put("opensearch", "opsr");
        acronyms.put("elasticsearch", "elsr");
        acronyms.put("ecr", "ecr");
        acronyms.put("ecs", "ecs");
        acronyms.put("ec2_instance", "ec2i");
        acronyms.put("launch_template", "lcht");
        acronyms.put("autoscaling_group", "asgr");
        acronyms.put("alb", "albl");
        acronyms.put("nlb", "nlbl");
        acronyms.put("elb", "elbl");
        acronyms.put("target_group", "tgpt");
        acronyms.put("cloudfront", "clfr");
        acronyms.put("route53_zone", "rt53");
        acronyms.put("route53_record", "r53r");
        acronyms.put("acm_cert", "acmc");
        acronyms.put("kms_key", "kmsk");
        acronyms.put("secretsmanager_secret", "smse");
        acronyms.put("ssm_parameter", "ssmp");
        acronyms.put("cloudtrail", "ctra");
        acronyms.put("guardduty", "gdty");
        acronyms.put("config_rule", "cfrl");
        acronyms.put("efs", "efs");
        acronyms.put("ebs", "ebs");
        acronyms.put("athena", "athn");
        acronyms.put("glue", "glue");
        acronyms.put("sagemaker", "sgmk");
        acronyms.put("codebuild", "cdbd");
        acronyms.put("codepipeline", "cdpl");
        acronyms.put("codedeploy", "cddp");
        acronyms.put("cloudformation_stack", "cfst");
        acronyms.put("appsync", "apsy");
        acronyms.put("snow_notification_integration", "snti");
        return acronyms;
    }

    static Set<String> regionalResources() {
        Set<String> regional = new HashSet<>(resourceAcronyms().keySet());
        regional.removeAll(GLOBAL_RESOURCES);
        return regional;
    }

    static Map<String, List<String>> resourceStyleOverrides() {
        Map<String, List<String>> overrides = new HashMap<>();
        List<String> bucketStyles = List.of(NamingStyle.DASHED.wireName(), NamingStyle.STRAIGHT.wireName());
        overrides.put("s3", bucketStyles);
        overrides.put("s3_bucket", bucketStyles);
        return overrides;
    }

    static Map<String, ResourceConstraint> resourceConstraints() {
        Map<String, ResourceConstraint> constraints = new HashMap<>();

        ResourceConstraint bucket = ResourceConstraint.of(3, 63, S3_PATTERN, S3_DESCRIPTION).toBuilder()
            .forbiddenPrefixes(List.of("xn--", "sthree-", "amzn-s3-demo-"))
            .forbiddenSuffixes(List.of("-s3alias", "--ol-s3"))
            .forbiddenSubstrings(List.of(".."))
            .disallowIpAddress(true)
            .build();
        constraints.put("s3", bucket);
        constraints.put("s3_bucket", bucket);

        ResourceConstraint shortIam = ResourceConstraint.of(1, 64, IAM_PATTERN, IAM_DESCRIPTION);
        ResourceConstraint longIam = ResourceConstraint.of(1, 128, IAM_PATTERN, IAM_DESCRIPTION);
        constraints.put("role", shortIam);
        constraints.put("iam_role", shortIam);
        constraints.put("iam_user", shortIam);
        constraints.put("iam_group", longIam);
        constraints.put("iam_policy", longIam);
        constraints.put("role_policy", longIam);

        ResourceConstraint topic = ResourceConstraint.of(1, 256, MESSAGING_PATTERN,
            "letters, numbers, underscores, and hyphens; FIFO topics must end with .fifo");
        constraints.put("sns", topic);
        constraints.put("sns_topic", topic);

        ResourceConstraint queue = ResourceConstraint.of(1, 80, MESSAGING_PATTERN,
            "letters, numbers, underscores, and hyphens; FIFO queues must end with .fifo");
        constraints.put("sqs", queue);
        constraints.put("sqs_queue", queue);

        constraints.put("lambda", ResourceConstraint.of(1, 64, "^[a-zA-Z0-9_-]+$",
            "letters, numbers, hyphens, and underscores"));

        constraints.put("kms_alias", ResourceConstraint.of(1, 256, "^alias/[a-zA-Z0-9/_-]+$",
                "must begin with alias/ and contain only letters, numbers, slashes, underscores, and hyphens")
            .toBuilder()
            .forbiddenPrefixes(List.of("alias/aws/"))
            .build());

        ResourceConstraint logGroup = ResourceConstraint.of(1, 512, LOG_GROUP_PATTERN, LOG_GROUP_DESCRIPTION)
            .toBuilder()
            .forbiddenPrefixes(List.of("aws/"))
            .build();
        constraints.put("log_group", logGroup);
        constraints.put("cloudwatch_log_group", logGroup);

        ResourceConstraint securityGroup = ResourceConstraint.of(1, 255, SECURITY_GROUP_PATTERN,
                SECURITY_GROUP_DESCRIPTION)
            .toBuilder()
            .forbiddenPrefixes(List.of("sg-"))
            .caseInsensitive(true)
            .build();
        constraints.put("sec_group", securityGroup);
        constraints.put("security_group", securityGroup);

        return constraints;
    }
}
