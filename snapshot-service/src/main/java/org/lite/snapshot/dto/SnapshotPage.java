package org.lite.snapshot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of a tenant's version history, newest first.
 * Pass {@code nextCursor} back to continue below the last returned version.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotPage {

    private List<SnapshotSummary> content;
    private Integer nextCursor;
    private boolean hasNext;

    public static SnapshotPage of(List<SnapshotSummary> fetched, int limit) {
        boolean more = fetched.size() > limit;
        List<SnapshotSummary> content = more ? List.copyOf(fetched.subList(0, limit)) : List.copyOf(fetched);
        Integer cursor = more ? content.get(content.size() - 1).getVersion() : null;
        return SnapshotPage.builder()
                .content(content)
                .nextCursor(cursor)
                .hasNext(more)
                .build();
    }
}
