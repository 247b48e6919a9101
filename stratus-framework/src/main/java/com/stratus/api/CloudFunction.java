package com.stratus.api;

/**
 * Marker for every deployable function type.
 */
public interface CloudFunction {
}
