package com.ryuqq.handover.application.config;

import com.ryuqq.handover.core.classify.ValidationGroup;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HandoverSettingsTest {

    private Properties required() {
        Properties properties = new Properties();
        properties.setProperty("handover.staging-uri", "mysql://rw@staging:3306/");
        properties.setProperty("handover.copy.web-uri", "http://copy/jobs/");
        properties.setProperty("handover.validation.production-uri", "mysql://ro@prod:3306/");
        properties.setProperty("handover.validation.compara-uri", "mysql://ro@compara:3306/compara_master");
        properties.setProperty("handover.validation.live-uri", "mysql://ro@live:3306/");
        properties.setProperty("handover.validation.web-uri", "http://hc/jobs/");
        return properties;
    }

    @Test
    void 필수_키만_있으면_기본값으로_채워진다() {
        // when
        HandoverSettings settings = HandoverSettings.fromProperties(required());

        // then
        assertThat(settings.stagingUri()).isEqualTo("mysql://rw@staging:3306/");
        assertThat(settings.pollDelayMs()).isEqualTo(HandoverSettings.DEFAULT_POLL_DELAY_MS);
        assertThat(settings.validation().groups().core()).isEqualTo(ValidationGroup.of("CoreHandover"));
        assertThat(settings.validation().dataFilesPath()).isNull();
        assertThat(settings.metadata().currentRelease()).isTrue();
        assertThat(settings.metadata().release()).isNull();
    }

    @Test
    void 선택_키는_기본값을_덮어쓴다() {
        // given
        Properties properties = required();
        properties.setProperty("handover.poll-delay-ms", "5000");
        properties.setProperty("handover.validation.group.variation", "VariationRelease");
        properties.setProperty("handover.metadata.release", "110");
        properties.setProperty("handover.metadata.current-release", "false");

        // when
        HandoverSettings settings = HandoverSettings.fromProperties(properties);

        // then
        assertThat(settings.pollDelayMs()).isEqualTo(5000);
        assertThat(settings.validation().groups().variation()).isEqualTo(ValidationGroup.of("VariationRelease"));
        assertThat(settings.metadata().release()).isEqualTo("110");
        assertThat(settings.metadata().currentRelease()).isFalse();
    }

    @Test
    void 필수_키가_없으면_실패한다() {
        // given
        Properties properties = required();
        properties.remove("handover.staging-uri");

        // when & then
        assertThatThrownBy(() -> HandoverSettings.fromProperties(properties))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("handover.staging-uri");
    }

    @Test
    void 숫자가_아닌_pollDelay는_실패한다() {
        // given
        Properties properties = required();
        properties.setProperty("handover.poll-delay-ms", "soon");

        // when & then
        assertThatThrownBy(() -> HandoverSettings.fromProperties(properties))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("handover.poll-delay-ms");
    }

    @Test
    void 음수_pollDelay는_허용되지_않는다() {
        assertThatThrownBy(() -> TestSettings.settings().withPollDelayMs(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
