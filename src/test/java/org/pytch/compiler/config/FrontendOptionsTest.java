package org.pytch.compiler.config;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link FrontendOptions}.
 */
public class FrontendOptionsTest {

    @Test
    @Tag("unit")
    void testDefaultsFromReferenceConf() {
        FrontendOptions options = FrontendOptions.defaults();

        assertThat(options).isEqualTo(new FrontendOptions(2, "<memory>", false, Path.of("build/frontend-dumps")));
    }

    @Test
    @Tag("unit")
    void testPartialSectionKeepsBuiltInFallbacks() {
        FrontendOptions options = FrontendOptions.fromConfig(ConfigFactory.parseResources(
                "org/pytch/compiler/config/partial-config.conf").resolve());

        assertThat(options.dumpTokens()).isTrue();
        assertThat(options.dumpDirectory()).isEqualTo(Path.of("out/dumps"));
        assertThat(options.verbosity()).isEqualTo(2);
        assertThat(options.defaultFileName()).isEqualTo("<memory>");
    }

    @Test
    @Tag("unit")
    void testMissingSection() {
        FrontendOptions options = FrontendOptions.fromConfig(ConfigFactory.empty());

        assertThat(options).isEqualTo(new FrontendOptions(2, "<memory>", false, Path.of("build/frontend-dumps")));
    }
}
