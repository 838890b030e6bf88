package alpha.onionhttp;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link Config} and its builder.
 */
class ConfigTest
{
    @Test
    void defaults() {
        Config c = Config.DEFAULT;
        assertThat(c.redirectTrailingSlash()).isFalse();
        assertThat(c.handleMethodNotAllowed()).isFalse();
        assertThat(c.maxPooledContexts()).isEqualTo(1_024);
        assertThat(c.trustForwardedFor()).isFalse();
    }
    
    @Test
    void builder_is_immutable() {
        Config.Builder base = Config.configuration();
        Config a = base.redirectTrailingSlash(true).build(),
               b = base.handleMethodNotAllowed(true).build();
        assertThat(a.redirectTrailingSlash()).isTrue();
        assertThat(a.handleMethodNotAllowed()).isFalse();
        assertThat(b.redirectTrailingSlash()).isFalse();
        assertThat(b.handleMethodNotAllowed()).isTrue();
        assertThat(Config.DEFAULT.redirectTrailingSlash()).isFalse();
    }
    
    @Test
    void to_builder_keeps_values() {
        Config c = Config.configuration()
                .maxPooledContexts(7)
                .trustForwardedFor(true)
                .build()
                .toBuilder()
                .redirectTrailingSlash(true)
                .build();
        assertThat(c.maxPooledContexts()).isEqualTo(7);
        assertThat(c.trustForwardedFor()).isTrue();
        assertThat(c.redirectTrailingSlash()).isTrue();
    }
    
    @Test
    void negative_pool_size() {
        assertThatThrownBy(() -> Config.configuration().maxPooledContexts(-1))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Negative pool size: -1");
    }
}
