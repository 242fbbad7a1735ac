package com.caselink.model;

import java.util.List;

public record IngestionStatus(
    SourceStatus adapterHealth,
    DataSource dataSource,
    IngestionLog lastRun,
    List<IngestionLog> recentRuns
) {}
