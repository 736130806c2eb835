package org.lite.snapshot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of a tenant's audit entries, newest first
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogPageResponse {

    private String tenantId;
    private List<AuditLogResponse> content;
    private Integer page;
    private Integer size;
    private Long totalElements;
    private Integer totalPages;
    private Boolean hasNext;

    public static AuditLogPageResponse of(String tenantId, List<AuditLogResponse> content,
                                          int page, int size, long totalElements) {
        int totalPages = totalElements == 0 ? 0 : (int) ((totalElements + size - 1) / size);
        return AuditLogPageResponse.builder()
                .tenantId(tenantId)
                .content(content)
                .page(page)
                .size(size)
                .totalElements(totalElements)
                .totalPages(totalPages)
                .hasNext(page + 1 < totalPages)
                .build();
    }
}
