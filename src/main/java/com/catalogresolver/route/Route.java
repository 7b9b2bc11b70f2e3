package com.catalogresolver.route;

import com.catalogresolver.model.EntityType;

import java.util.Optional;

/**
 * Resource named by a catalog URL.
 *
 * @param type   kind of resource the provider API will be asked for
 * @param id     provider identifier of that resource
 * @param region locale or storefront segment from the URL, or null
 */
public record Route(
        EntityType type,
        String id,
        String region
) {

    public Optional<String> regionOpt() {
        return Optional.ofNullable(region);
    }
}
