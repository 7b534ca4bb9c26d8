package com.tyron.snipj.api.service;

/**
 * Implemented by services that hold listeners or other resources released with their scope.
 */
public interface Disposable {
    void dispose();
}
