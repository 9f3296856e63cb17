package com.rollcall.backend.modules.attendance.domain;

import java.time.LocalDate;

public record DailyTally(LocalDate date, int present, int late, int absent, int unmarked) {
}
