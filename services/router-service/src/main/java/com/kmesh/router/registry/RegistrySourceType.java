package com.kmesh.router.registry;

public enum RegistrySourceType {
    HTTP,
    STATIC
}
