package com.repledger.engine.identity;

import com.repledger.core.error.UnauthorizedException;
import com.repledger.core.identity.IdentityNormalizer;
import com.repledger.engine.config.ReputationEngineProperties;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Role checks for admin and arbitrator operations. Admins can also arbitrate.
 */
@Component
public class AccessPolicy {

    private final Set<String> admins;
    private final Set<String> arbitrators;

    public AccessPolicy(ReputationEngineProperties properties) {
        this.admins = normalizeAll(properties.getSecurity().getAdmins());
        this.arbitrators = normalizeAll(properties.getSecurity().getArbitrators());
        this.arbitrators.addAll(admins);
    }

    public boolean isAdmin(String actorId) {
        return admins.contains(IdentityNormalizer.normalize(actorId));
    }

    public boolean isArbitrator(String actorId) {
        return arbitrators.contains(IdentityNormalizer.normalize(actorId));
    }

    public void requireAdmin(String actorId, String action) {
        if (!isAdmin(actorId)) {
            throw new UnauthorizedException("Only an admin may " + action + "; caller: " + actorId);
        }
    }

    public void requireArbitrator(String actorId) {
        if (!isArbitrator(actorId)) {
            throw new UnauthorizedException("Only an arbitrator may resolve disputes; caller: " + actorId);
        }
    }

    private static Set<String> normalizeAll(Collection<String> raw) {
        Set<String> result = new HashSet<>();
        if (raw != null) {
            for (String credential : raw) {
                String normalized = IdentityNormalizer.normalize(credential);
                if (!normalized.isEmpty()) {
                    result.add(normalized);
                }
            }
        }
        return result;
    }
}
