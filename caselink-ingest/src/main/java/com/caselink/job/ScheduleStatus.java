package com.caselink.job;

import java.time.ZonedDateTime;

public record ScheduleStatus(String key, String source, String cron, ZonedDateTime nextRun) {}
