package org.pragmatica.reflow;

import java.util.Properties;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReflowConfigTest {

    @Test
    void defaultConfig_uses79ColumnsAndFourSpaces() {
        var config = ReflowConfig.defaultConfig();

        assertThat(config.maxLineLength())
                  .isEqualTo(79);
        assertThat(config.indentSize())
                  .isEqualTo(4);
    }

    @Test
    void fromProperties_readsKnownKeys() {
        var properties = new Properties();
        properties.setProperty("max-line-length", " 100 ");
        properties.setProperty("indent-size", "2");

        assertThat(ReflowConfig.fromProperties(properties))
                  .isEqualTo(new ReflowConfig(100, 2));
    }

    @Test
    void fromProperties_fallsBackToDefaults_forMissingKeys() {
        var properties = new Properties();
        properties.setProperty("indent-size", "8");

        assertThat(ReflowConfig.fromProperties(properties))
                  .isEqualTo(new ReflowConfig(79, 8));
    }

    @Test
    void fromProperties_fails_forInvalidNumber() {
        var properties = new Properties();
        properties.setProperty("max-line-length", "wide");

        assertThatThrownBy(() -> ReflowConfig.fromProperties(properties))
                  .isInstanceOf(IllegalArgumentException.class)
                  .hasMessage("Invalid value for 'max-line-length': wide");
    }

    @Test
    void constructor_rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> new ReflowConfig(0, 4))
                  .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReflowConfig.defaultConfig().withIndentSize(-1))
                  .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withMethods_returnModifiedCopies() {
        var config = ReflowConfig.defaultConfig()
                                 .withMaxLineLength(120)
                                 .withIndentSize(2);

        assertThat(config)
                  .isEqualTo(new ReflowConfig(120, 2));
        assertThat(ReflowConfig.defaultConfig().maxLineLength())
                  .isEqualTo(79);
    }
}
