package com.jobprospector.hiring.detection.service;

public record CompanyHiringTarget(String companyId, String companyName, String website) {
}
