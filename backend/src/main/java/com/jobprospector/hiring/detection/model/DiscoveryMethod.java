package com.jobprospector.hiring.detection.model;

public enum DiscoveryMethod {
    ATS_BACKDOOR("ATS_Backdoor"),
    SITEMAP_DISCOVERY("Sitemap_Discovery"),
    GOOGLE_ORGANIC("Google_Organic"),
    PATTERN_PROBE("Pattern_Probe"),
    HOMEPAGE_LINK("Homepage_Link"),
    NONE("none");

    private final String label;

    DiscoveryMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
