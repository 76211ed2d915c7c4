package com.example.milestoneservice.service;

import java.time.LocalDate;

/**
 * New dates for one milestone produced by a cascade.
 */
public record ScheduleWrite(Long milestoneId, LocalDate startDate, LocalDate endDate) {
}
