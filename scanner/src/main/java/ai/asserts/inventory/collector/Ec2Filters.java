/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import software.amazon.awssdk.services.ec2.model.Filter;

final class Ec2Filters {
    private Ec2Filters() {
    }

    static Filter vpcFilter(ScanScope scope) {
        return Filter.builder()
                .name("vpc-id")
                .values(scope.getVpcId())
                .build();
    }
}
