package com.phillippitts.modelelector.service.registry;

import com.phillippitts.modelelector.domain.BackendTarget;

import java.util.List;

/**
 * Discovery seam that supplies the ordered set of prediction backends.
 *
 * <p>Implementations may read static configuration, probe the environment, or consult a
 * service registry. The elector consumes the output once at startup through
 * {@link BackendRegistry} and never inspects the environment itself.
 */
@FunctionalInterface
public interface BackendTargetResolver {

    /**
     * Resolves the backend targets, in dispatch order.
     *
     * @return ordered backend targets (validated by {@link BackendRegistry})
     */
    List<BackendTarget> resolveTargets();
}
