package com.kmg.exporter.model;

import java.time.OffsetDateTime;

public record EventualRequest(
        long id,
        String exportName,
        String query,
        OffsetDateTime createdAt
) {
}
