/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class EbsVolume extends ResourceEntity {
    private final String deviceName;
    private final Boolean deleteOnTermination;
    private final String volumeType;
    private final Integer iops;
    private final Boolean encrypted;
    private final String state;

    @Override
    public ResourceType getResourceType() {
        return ResourceType.EBSVolume;
    }
}
