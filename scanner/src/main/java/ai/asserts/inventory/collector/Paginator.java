/*
 *  Copyright © 2023.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory.collector;

import lombok.Getter;

import static org.springframework.util.StringUtils.hasLength;

/**
 * Tracks the continuation token of a paginated call. The first page is always requested. After that a page is
 * requested only while the service returns a token and the token differs from the previous one.
 */
@Getter
public class Paginator {
    private String lastToken;
    private String nextToken;
    private int pages;

    public void nextToken(String newNextToken) {
        pages++;
        lastToken = nextToken;
        nextToken = newNextToken;
    }

    public boolean hasNext() {
        return pages == 0 || (hasLength(nextToken) && !isRepeatedToken());
    }

    public boolean isRepeatedToken() {
        return hasLength(nextToken) && nextToken.equals(lastToken);
    }
}
