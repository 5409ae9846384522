package com.jobprospector.hiring.detection.ats;

import com.jobprospector.hiring.detection.model.AtsPlatform;
import com.jobprospector.hiring.detection.model.JobPosting;
import com.jobprospector.hiring.detection.model.PlatformLookup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlatformRegistryTest {

    @Mock private AtsBoardClient greenhouse;
    @Mock private AtsBoardClient lever;
    @Mock private AtsBoardClient ashby;

    private PlatformRegistry registry;

    @BeforeEach
    void setUp() {
        lenient().when(greenhouse.platform()).thenReturn(AtsPlatform.GREENHOUSE);
        lenient().when(lever.platform()).thenReturn(AtsPlatform.LEVER);
        lenient().when(ashby.platform()).thenReturn(AtsPlatform.ASHBY);
        registry = new PlatformRegistry(List.of(ashby, lever, greenhouse));
    }

    @Test
    void detectsPlatformByHostSuffix() {
        assertThat(registry.detectPlatform("https://boards.greenhouse.io/acme")).isEqualTo(AtsPlatform.GREENHOUSE);
        assertThat(registry.detectPlatform("https://jobs.lever.co/acme")).isEqualTo(AtsPlatform.LEVER);
        assertThat(registry.detectPlatform("https://jobs.ashbyhq.com/acme")).isEqualTo(AtsPlatform.ASHBY);
        assertThat(registry.detectPlatform("https://apply.workable.com/acme")).isEqualTo(AtsPlatform.WORKABLE);
        assertThat(registry.detectPlatform("https://clever.com/careers")).isEqualTo(AtsPlatform.NONE);
    }

    @Test
    void greenhouseHitStopsTheSweep() {
        when(greenhouse.fetchBoard("acme")).thenReturn(PlatformLookup.jobs(
            AtsPlatform.GREENHOUSE,
            "acme",
            List.of(new JobPosting("Backend Engineer", "Remote", "Eng", "https://boards.greenhouse.io/acme/jobs/1", AtsPlatform.GREENHOUSE))
        ));

        PlatformLookup result = registry.tryAllPlatforms("https://acme.com");

        assertThat(result.hasJobs()).isTrue();
        assertThat(result.titles()).containsExactly("Backend Engineer");
        verify(lever, never()).fetchBoard(anyString());
        verify(ashby, never()).fetchBoard(anyString());
    }

    @Test
    void fallsThroughInOrderToAshbySentinel() {
        when(greenhouse.fetchBoard("acme")).thenReturn(PlatformLookup.empty(AtsPlatform.GREENHOUSE, "acme"));
        when(lever.fetchBoard("acme")).thenReturn(PlatformLookup.error(AtsPlatform.LEVER, "acme", "lever_timeout"));
        when(ashby.fetchBoard("acme")).thenReturn(
            PlatformLookup.requiresRendering(AtsPlatform.ASHBY, "acme", "https://jobs.ashbyhq.com/acme"));

        PlatformLookup result = registry.tryAllPlatforms("acme.com");

        assertThat(result.requiresRendering()).isTrue();
        assertThat(result.boardUrl()).isEqualTo("https://jobs.ashbyhq.com/acme");
    }

    @Test
    void clientExceptionIsReportedAsError() {
        when(greenhouse.fetchBoard("acme")).thenThrow(new IllegalStateException("boom"));

        PlatformLookup result = registry.lookup(AtsPlatform.GREENHOUSE, "acme");

        assertThat(result.status()).isEqualTo(PlatformLookup.Status.ERROR);
    }

    @Test
    void platformWithoutClientIsUnsupported() {
        PlatformLookup result = registry.lookup(AtsPlatform.WORKABLE, "acme");

        assertThat(result.status()).isEqualTo(PlatformLookup.Status.UNSUPPORTED);
    }
}
