/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.SortedMap;

@Getter
@Builder
@EqualsAndHashCode
@ToString
public class VpcInfo {
    private final String vpcId;
    private final String cidrBlock;
    private final String state;
    @JsonProperty("is_default")
    private final Boolean defaultVpc;
    private final SortedMap<String, String> tags;
}
