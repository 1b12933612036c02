package com.kmesh.router.registry;

import java.util.ArrayList;
import java.util.List;

public class StaticRegistrySource implements RegistrySource {
    private final List<DomainRegistration> registrations;

    public StaticRegistrySource(List<DomainRegistration> registrations) {
        this.registrations = registrations == null ? List.of() : new ArrayList<>(registrations);
    }

    @Override
    public List<DomainRegistration> load() {
        return new ArrayList<>(registrations);
    }

    @Override
    public String name() {
        return "static";
    }
}
