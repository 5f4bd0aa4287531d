/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.inventory;

import lombok.Getter;

import java.util.concurrent.Callable;

/**
 * A unit of work for one scope (account, region, VPC or a single collector within a VPC). The value returned from
 * {@link #onError(Throwable)} stands in for the result when the task fails, times out or is cancelled, so the parent
 * can always fold a result for every child it started.
 */
public abstract class ScopeTask<T> implements Callable<T> {
    @Getter
    private final String scope;

    protected ScopeTask(String scope) {
        this.scope = scope;
    }

    public abstract T onError(Throwable e);
}
