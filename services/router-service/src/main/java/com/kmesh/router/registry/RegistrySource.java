package com.kmesh.router.registry;

import java.util.List;

/**
 * Where agent registrations come from. Implementations throw
 * {@link RegistryUnavailableException} when the source cannot be read.
 */
public interface RegistrySource {
    List<DomainRegistration> load();

    String name();
}
