package fun.fengwk.msh.core.service.scrape;

import fun.fengwk.msh.core.configuration.ConfigurationException;
import fun.fengwk.msh.core.service.scrape.model.ScrapeMode;
import fun.fengwk.msh.core.service.scrape.model.ScrapeToggles;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class ScrapePropertiesTest {

    @Test
    public void shouldResolveModeValues() {
        assertThat(ScrapeMode.fromValue("deep")).isEqualTo(ScrapeMode.DEEP);
        assertThat(ScrapeMode.fromValue(" Text-Only ")).isEqualTo(ScrapeMode.TEXT_ONLY);
        assertThat(ScrapeMode.fromValue(null)).isEqualTo(ScrapeMode.STANDARD);
        assertThatThrownBy(() -> ScrapeMode.fromValue("everything"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("everything");
    }

    @Test
    public void shouldUseModeDefaultsWithoutOverrides() {
        ScrapeProperties properties = new ScrapeProperties();

        ScrapeToggles standard = properties.resolveToggles(ScrapeMode.STANDARD);
        ScrapeToggles textOnly = properties.resolveToggles(ScrapeMode.TEXT_ONLY);

        assertThat(standard.isSaveHtml()).isTrue();
        assertThat(standard.isFollowPdfLinks()).isFalse();
        assertThat(standard.getMaxImages()).isEqualTo(20);
        assertThat(textOnly.isSaveHtml()).isFalse();
        assertThat(textOnly.isSaveText()).isTrue();
        assertThat(textOnly.isSaveImages()).isFalse();
    }

    @Test
    public void shouldApplyOverridesWithoutTouchingModeDefaults() {
        ScrapeProperties properties = new ScrapeProperties();
        ScrapeProperties.ModeOverride override = new ScrapeProperties.ModeOverride();
        override.setMaxImages(3);
        override.setSaveFormulas(false);
        override.setMaxPdfLinks(-2);
        properties.getModes().put("deep", override);

        ScrapeToggles deep = properties.resolveToggles(ScrapeMode.DEEP);

        assertThat(deep.getMaxImages()).isEqualTo(3);
        assertThat(deep.isSaveFormulas()).isFalse();
        assertThat(deep.getMaxPdfLinks()).isZero();
        assertThat(deep.isFollowPdfLinks()).isTrue();
        assertThat(ScrapeMode.DEEP.getDefaults().getMaxImages()).isEqualTo(50);
    }

    @Test
    public void shouldRejectInvalidValues() {
        ScrapeProperties zeroConcurrency = new ScrapeProperties();
        zeroConcurrency.setMaxConcurrent(0);
        assertThatThrownBy(zeroConcurrency::validate)
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("max-concurrent");

        ScrapeProperties negativeDelay = new ScrapeProperties();
        negativeDelay.getRateLimit().setDelayMs(-1);
        assertThatThrownBy(negativeDelay::validate).isInstanceOf(ConfigurationException.class);

        ScrapeProperties unknownDefault = new ScrapeProperties();
        unknownDefault.setDefaultMode("turbo");
        assertThatThrownBy(unknownDefault::validate)
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("turbo");

        ScrapeProperties unknownOverride = new ScrapeProperties();
        unknownOverride.getModes().put("ultra", new ScrapeProperties.ModeOverride());
        assertThatThrownBy(unknownOverride::validate)
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("ultra");
    }

}
