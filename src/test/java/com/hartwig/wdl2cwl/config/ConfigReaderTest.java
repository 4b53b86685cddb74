package com.hartwig.wdl2cwl.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;

import org.junit.jupiter.api.Test;

class ConfigReaderTest {
    private final ConfigReader configReader = new ConfigReader();

    @Test
    void readsEveryOption() throws IOException {
        var config = configReader.read(getClass().getClassLoader().getResourceAsStream("converter-config.yaml"));
        var expected = ConverterConfig.builder()
                .cwlVersion("v1.2")
                .toolsDirectory("cwl-tools")
                .threads(2)
                .shell("sh")
                .scriptName("run.sh")
                .validatorCommand(List.of("cwltool", "--validate", "--strict"))
                .validatorTimeoutSeconds(30)
                .writeInputTemplates(false)
                .build();
        assertThat(config).isEqualTo(expected);
    }

    @Test
    void missingOptionsKeepTheirDefaults() throws IOException {
        var config = configReader.read(stream("threads: 8"));
        assertThat(config.threads()).isEqualTo(8);
        assertThat(config.cwlVersion()).isEqualTo("v1.2");
        assertThat(config.shell()).isEqualTo("bash");
        assertThat(config.validatorCommand()).containsExactly("cwltool", "--validate");
        assertThat(config.writeInputTemplates()).isTrue();
    }

    @Test
    void extraFieldThrows() {
        assertThrows(UnrecognizedPropertyException.class, () -> configReader.read(stream("threads: 2\nworkers: 4")));
    }

    @Test
    void invalidValuesAreRejected() {
        var e = assertThrows(IOException.class, () -> configReader.read(stream("threads: 0")));
        assertThat(e).hasStackTraceContaining("threads must be at least 1");
    }

    private static InputStream stream(String yaml) {
        return new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
    }
}
