/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory;

public final class MetricNameUtil {
    public static final String SCRAPE_LATENCY_METRIC = "aws_inventory_api_call_milliseconds";
    public static final String SCRAPE_ERROR_COUNT_METRIC = "aws_inventory_api_call_error_total";
    public static final String ERROR_TYPE_LABEL = "error_type";
    public static final String SCRAPE_OPERATION_LABEL = "operation";
    public static final String SCRAPE_REGION_LABEL = "region";
    public static final String SCRAPE_ACCOUNT_ID_LABEL = "account_id";

    private MetricNameUtil() {
    }
}
