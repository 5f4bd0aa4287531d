/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import com.google.common.collect.ImmutableSet;
import lombok.Getter;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * The resource types known to the inventory. The token is the key under which the entities of a type appear in the
 * inventory document and is also what is accepted in the exclusion list. Aliases let a single token exclude a whole
 * service, e.g. <code>rds</code> excludes both instances and clusters.
 */
@Getter
public enum ResourceType {
    S3Bucket("s3_buckets", ReportSection.GLOBAL_RESOURCES, "AWS/S3", "s3"),
    DynamoDBTable("dynamodb_tables", ReportSection.REGION_WIDE, "AWS/DynamoDB", "dynamodb"),
    Subnet("subnets", ReportSection.NETWORK_COMPONENTS, "AWS/EC2", "network"),
    RouteTable("route_tables", ReportSection.NETWORK_COMPONENTS, "AWS/EC2", "network"),
    InternetGateway("internet_gateways", ReportSection.NETWORK_COMPONENTS, "AWS/EC2", "network"),
    NatGateway("nat_gateways", ReportSection.NETWORK_COMPONENTS, "AWS/NATGateway", "network"),
    SecurityGroup("security_groups", ReportSection.SECURITY_GROUPS, "AWS/EC2"),
    EC2Instance("ec2_instances", ReportSection.VPC_RESOURCES, "AWS/EC2", "ec2"),
    EBSVolume("ebs_volumes", ReportSection.INSTANCE_VOLUMES, "AWS/EBS", "ebs"),
    RDSInstance("rds_instances", ReportSection.VPC_RESOURCES, "AWS/RDS", "rds"),
    RDSCluster("rds_clusters", ReportSection.VPC_RESOURCES, "AWS/RDS", "rds"),
    EFSFileSystem("efs_filesystems", ReportSection.VPC_RESOURCES, "AWS/EFS", "efs"),
    FSxFileSystem("fsx_filesystems", ReportSection.VPC_RESOURCES, "AWS/FSx", "fsx"),
    RedshiftCluster("redshift_clusters", ReportSection.VPC_RESOURCES, "AWS/Redshift", "redshift");

    private final String token;
    private final ReportSection section;
    private final String namespace;
    private final Set<String> aliases;

    ResourceType(String token, ReportSection section, String namespace, String... aliases) {
        this.token = token;
        this.section = section;
        this.namespace = namespace;
        this.aliases = ImmutableSet.copyOf(aliases);
    }

    public static Optional<ResourceType> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.token.equals(normalized))
                .findFirst();
    }

    /**
     * Resolves an exclusion token, which is either a resource type token or a service alias.
     *
     * @return the matching types, empty if the token is not recognized
     */
    public static Set<ResourceType> resolve(String token) {
        Set<ResourceType> resolved = EnumSet.noneOf(ResourceType.class);
        if (token == null) {
            return resolved;
        }
        fromToken(token).ifPresent(resolved::add);
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        Arrays.stream(values())
                .filter(type -> type.aliases.contains(normalized))
                .forEach(resolved::add);
        return resolved;
    }

    public static Set<ResourceType> inSection(ReportSection section) {
        Set<ResourceType> types = EnumSet.noneOf(ResourceType.class);
        Arrays.stream(values())
                .filter(type -> type.section == section)
                .forEach(types::add);
        return types;
    }
}
