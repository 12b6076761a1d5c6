package cadence.event;

import javax.annotation.Nonnull;

/**
 * Tenant lifecycle events, delivered by the platform binding. These are the only events that
 * create or destroy players.
 */
public interface TenantLifecycleListener {
    /**
     * The bot joined a tenant, or the tenant became available again.
     *
     * @param tenantId Tenant id.
     */
    void onTenantJoin(@Nonnull String tenantId);
    
    /**
     * The bot left a tenant, or the tenant became unavailable.
     *
     * @param tenantId Tenant id.
     */
    void onTenantLeave(@Nonnull String tenantId);
}
