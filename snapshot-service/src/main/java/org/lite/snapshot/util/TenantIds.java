package org.lite.snapshot.util;

import org.lite.snapshot.exception.ValidationException;

import java.util.regex.Pattern;

/**
 * Tenant ids are opaque UUID strings
 */
public final class TenantIds {

    private static final Pattern TENANT_ID = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private TenantIds() {
    }

    public static boolean isValid(String tenantId) {
        return tenantId != null && TENANT_ID.matcher(tenantId).matches();
    }

    /**
     * @throws ValidationException if the id is missing or not a UUID
     */
    public static void requireValid(String tenantId) {
        if (!isValid(tenantId)) {
            throw new ValidationException("Tenant id must be a UUID");
        }
    }
}
