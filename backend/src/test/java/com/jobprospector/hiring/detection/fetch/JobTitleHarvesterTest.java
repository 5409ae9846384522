package com.jobprospector.hiring.detection.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JobTitleHarvesterTest {

    private final JobTitleHarvester harvester = new JobTitleHarvester(new ObjectMapper());

    @Test
    void collectsJsonLdAndListingMarkup() {
        String html = """
            <html><head>
            <script type="application/ld+json">
              {"@context": "https://schema.org", "@graph": [
                {"@type": "JobPosting", "title": "Staff Data Engineer"},
                {"@type": "Organization", "name": "Acme"}
              ]}
            </script>
            <script type="application/ld+json">{ not json</script>
            </head><body>
              <h3 class="job-title">Frontend Engineer</h3>
              <li data-position="x">Customer Success Lead</li>
              <div class="job-title">QA</div>
              <a class="opening-title">Frontend Engineer</a>
              <span class="job-title">Ignored Span Title</span>
            </body></html>
            """;

        List<String> titles = harvester.harvest(html);

        assertThat(titles).containsExactly("Staff Data Engineer", "Frontend Engineer", "Customer Success Lead");
    }

    @Test
    void emptyHtmlHasNoTitles() {
        assertThat(harvester.harvest("")).isEmpty();
        assertThat(harvester.harvest(null)).isEmpty();
    }
}
