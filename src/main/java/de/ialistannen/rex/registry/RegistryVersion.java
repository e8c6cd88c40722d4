package de.ialistannen.rex.registry;

import java.util.Optional;

/**
 * @param apiVersion the value of the {@code Docker-Distribution-API-Version} header, if the registry sent one
 */
public record RegistryVersion(Optional<String> apiVersion) {

}
