package com.demo.underwriting.service.profile;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;

class ProfileSearchWiringTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withBean(RestTemplate.class, RestTemplate::new)
            .withUserConfiguration(DisabledProfileSearch.class, SonarProfileSearchClient.class);

    @Test
    @DisplayName("search flag missing: the disabled stand-in is the only port")
    void disabledByDefault() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(ProfileSearchPort.class);
            assertThat(ctx.getBean(ProfileSearchPort.class)).isInstanceOf(DisabledProfileSearch.class);
        });
    }

    @Test
    @DisplayName("search flag on: the HTTP client replaces the stand-in")
    void enabledSelectsHttpClient() {
        runner.withPropertyValues("profileSearch.enabled=true", "profileSearch.apiKey=k-test")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(ProfileSearchPort.class);
                    assertThat(ctx.getBean(ProfileSearchPort.class)).isInstanceOf(SonarProfileSearchClient.class);
                    assertThat(ctx.getBean(ProfileSearchPort.class).isEnabled()).isTrue();
                });
    }
}
