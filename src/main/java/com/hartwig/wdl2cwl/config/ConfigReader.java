package com.hartwig.wdl2cwl.config;

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

public class ConfigReader {
    private final ObjectMapper objectMapper;

    public ConfigReader() {
        objectMapper = new ObjectMapper(new YAMLFactory());
        objectMapper.registerModule(new Jdk8Module());
        objectMapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public ConverterConfig read(InputStream config) throws IOException {
        return objectMapper.readValue(config, ConverterConfig.class);
    }
}
