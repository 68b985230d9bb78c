package com.flagship.pos_core.context;

import lombok.Value;

import java.util.Objects;
import java.util.UUID;

/**
 * Acting scope of one operation: the business and storefront the caller is
 * authorized for, and the user performing it.
 *
 * Passed explicitly into every service call. Tenant resolution and
 * permission checks happen upstream; the core trusts what it receives.
 */
@Value
public class SaleContext {
    UUID businessId;
    UUID storefrontId;
    UUID actorId;

    private SaleContext(UUID businessId, UUID storefrontId, UUID actorId) {
        this.businessId = Objects.requireNonNull(businessId, "businessId");
        this.storefrontId = Objects.requireNonNull(storefrontId, "storefrontId");
        this.actorId = Objects.requireNonNull(actorId, "actorId");
    }

    public static SaleContext of(UUID businessId, UUID storefrontId, UUID actorId) {
        return new SaleContext(businessId, storefrontId, actorId);
    }
}
