/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

@Getter
@SuperBuilder
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class DynamoDbTable extends ResourceEntity {
    private final String status;
    private final String billingMode;
    private final String arn;
    private final Instant creationDate;

    @Override
    public ResourceType getResourceType() {
        return ResourceType.DynamoDBTable;
    }
}
