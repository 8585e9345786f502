package com.astrazeneca.tbltransfer.modules;

import com.astrazeneca.tbltransfer.data.scopedata.Scope;

/**
 * Functional interface for all Modules of TblTransfer (they can be the steps of pipeline in AbstractMode).
 * @param <T> means input data needed on step (module)
 * @param <R> means output data that step (module) produces
 */
@FunctionalInterface
public interface Module<T, R> {

    Scope<R> process(Scope<T> scope);
}
