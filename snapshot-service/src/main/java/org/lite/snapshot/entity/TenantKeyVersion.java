package org.lite.snapshot.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Key version metadata of a tenant. Holds no key material: the DEK for a
 * version is derived from the master secret whenever it is needed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "tenant_key_versions")
@CompoundIndex(name = "tenant_version_idx", def = "{'tenantId': 1, 'version': 1}", unique = true)
public class TenantKeyVersion {

    @Id
    private String id;

    @Indexed
    private String tenantId;

    private Integer version;

    private boolean active; // new writes use the active version

    private Instant createdAt;

    private String createdBy;
}
