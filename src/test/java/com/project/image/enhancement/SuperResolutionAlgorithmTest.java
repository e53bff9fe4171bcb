package com.project.image.enhancement;

import com.project.image.enhancement.service.superres.SuperResolutionAlgorithm;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SuperResolutionAlgorithmTest {

    @Test
    void inferFrom_matchesFamilyCaseInsensitively() {
        assertThat(SuperResolutionAlgorithm.inferFrom("models/EDSR_x4.pb")).isEqualTo(SuperResolutionAlgorithm.EDSR);
        assertThat(SuperResolutionAlgorithm.inferFrom("LapSRN_x8.pb")).isEqualTo(SuperResolutionAlgorithm.LAPSRN);
        assertThat(SuperResolutionAlgorithm.inferFrom("ESPCN_x3.pb")).isEqualTo(SuperResolutionAlgorithm.ESPCN);
        assertThat(SuperResolutionAlgorithm.inferFrom("fsrcnn-small_x2.PB")).isEqualTo(SuperResolutionAlgorithm.FSRCNN);
    }

    @Test
    void inferFrom_defaultsToBaselineFamily() {
        assertThat(SuperResolutionAlgorithm.inferFrom("my_model.pb")).isEqualTo(SuperResolutionAlgorithm.BASELINE);
        assertThat(SuperResolutionAlgorithm.inferFrom((String) null)).isEqualTo(SuperResolutionAlgorithm.EDSR);
    }

    @Test
    void edsrTakesPrecedenceWhenBothNamesAppear() {
        assertThat(SuperResolutionAlgorithm.inferFrom("lapsrn_vs_edsr.pb")).isEqualTo(SuperResolutionAlgorithm.EDSR);
    }

    @Test
    void supportedScalesFollowTheModelFamilies() {
        assertThat(SuperResolutionAlgorithm.EDSR.supportsScale(3)).isTrue();
        assertThat(SuperResolutionAlgorithm.EDSR.supportsScale(8)).isFalse();
        assertThat(SuperResolutionAlgorithm.LAPSRN.supportsScale(8)).isTrue();
        assertThat(SuperResolutionAlgorithm.LAPSRN.supportsScale(3)).isFalse();
    }
}
