package com.modelforge.generator.cli.input;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelforge.generator.codegen.model.core.context.GenerationOptions;
import com.modelforge.generator.codegen.model.input.Model;
import com.modelforge.generator.codegen.util.JsonSupport;

/**
 * Reads the models file and the optional options file.
 *
 * The models file holds either a JSON array of models or an object with a {@code models} array and an optional
 * {@code options} object. A separate options file takes precedence over embedded options.
 */
public class ModelInputReader {

    private static final Logger log = LoggerFactory.getLogger(ModelInputReader.class);

    private static final TypeReference<List<Model>> MODEL_LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public ModelInputReader() {
        this(JsonSupport.mapper());
    }

    public ModelInputReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ModelInput read(Path modelsFile, Path optionsFile) throws IOException {
        JsonNode root = mapper.readTree(Files.readString(modelsFile));
        List<Model> models;
        GenerationOptions options = GenerationOptions.defaults();

        if (root != null && root.isArray()) {
            models = mapper.convertValue(root, MODEL_LIST);
        } else if (root != null && root.isObject() && root.has("models")) {
            models = mapper.convertValue(root.get("models"), MODEL_LIST);
            if (root.hasNonNull("options")) {
                options = mapper.convertValue(root.get("options"), GenerationOptions.class);
            }
        } else {
            throw new IOException("Models file must hold a JSON array or an object with a \"models\" array: "
                    + modelsFile);
        }

        if (optionsFile != null) {
            options = mapper.readValue(Files.readString(optionsFile), GenerationOptions.class);
            log.debug("Generation options read from {}", optionsFile);
        }

        log.info("Read {} model(s) from {}", models.size(), modelsFile);
        return ModelInput.builder().models(models).options(options).build();
    }
}
