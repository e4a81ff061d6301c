package com.spiderhub.api;

import com.spiderhub.common.error.BackendInitException;

/**
 * Turns a module reference (jar URL or path, possibly empty) into a handle
 * exposing that module's spider providers.
 */
public interface ModuleLoader extends AutoCloseable {

    ModuleHandle resolve(String moduleRef) throws BackendInitException;

    @Override
    void close();
}
