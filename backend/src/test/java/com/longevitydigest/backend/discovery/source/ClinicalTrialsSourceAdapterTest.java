package com.longevitydigest.backend.discovery.source;

import static org.assertj.core.api.Assertions.assertThat;

import com.longevitydigest.backend.config.PipelineProperties;
import com.longevitydigest.backend.model.dto.Candidate;
import com.longevitydigest.backend.model.enums.SourceKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class ClinicalTrialsSourceAdapterTest {

    private static final String STUDIES = """
            {
              "studies": [
                {
                  "protocolSection": {
                    "identificationModule": {"nctId": "NCT05000001", "briefTitle": "Rapamycin in Older Adults"},
                    "statusModule": {"overallStatus": "RECRUITING", "startDateStruct": {"date": "2024-09"}},
                    "descriptionModule": {"briefSummary": "A randomized trial of low-dose rapamycin."},
                    "conditionsModule": {"conditions": ["Aging", "Frailty", "Sarcopenia", "Inflammation"]},
                    "designModule": {"phases": ["PHASE2", "PHASE3"]}
                  }
                },
                {
                  "protocolSection": {
                    "identificationModule": {"nctId": "NCT05000002", "briefTitle": "Observational Cohort"},
                    "statusModule": {"overallStatus": "RECRUITING"}
                  }
                }
              ]
            }
            """;

    private final ClinicalTrialsSourceAdapter adapter =
            new ClinicalTrialsSourceAdapter(new PipelineProperties.Sources(), "RECRUITING");

    @Test
    void parseStudies_shouldNormalizeTrialIntoCandidate() throws Exception {
        List<Candidate> candidates = adapter.parseStudies(STUDIES);

        assertThat(candidates).hasSize(2);
        Candidate trial = candidates.get(0);
        assertThat(trial.getTitle()).isEqualTo("[Clinical Trial] Rapamycin in Older Adults");
        assertThat(trial.getAbstractText()).isEqualTo("A randomized trial of low-dose rapamycin.");
        assertThat(trial.getVenue()).isEqualTo("ClinicalTrials.gov (PHASE2, PHASE3)");
        assertThat(trial.getIdentifier()).isEqualTo("NCT05000001");
        assertThat(trial.getPublishedDate()).isEqualTo("2024-09");
        assertThat(trial.getUrl()).isEqualTo("https://clinicaltrials.gov/study/NCT05000001");
        assertThat(trial.getTags()).containsExactly("clinical_trial", "Aging", "Frailty", "Sarcopenia");
        assertThat(trial.getSourceKind()).isEqualTo(SourceKind.CLINICAL_TRIAL);
    }

    @Test
    void parseStudies_shouldTolerateMissingModules() throws Exception {
        Candidate trial = adapter.parseStudies(STUDIES).get(1);

        assertThat(trial.getVenue()).isEqualTo("ClinicalTrials.gov ()");
        assertThat(trial.getAbstractText()).isEmpty();
        assertThat(trial.getTags()).containsExactly("clinical_trial");
    }

    @Test
    void parseStudies_shouldBeEmpty_whenNoStudies() throws Exception {
        assertThat(adapter.parseStudies("{\"studies\": []}")).isEmpty();
    }
}
