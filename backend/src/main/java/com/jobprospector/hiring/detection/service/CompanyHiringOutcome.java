package com.jobprospector.hiring.detection.service;

import com.jobprospector.hiring.detection.model.HiringResult;

public record CompanyHiringOutcome(CompanyHiringTarget target, HiringResult result) {
}
