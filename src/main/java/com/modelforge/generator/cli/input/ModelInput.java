package com.modelforge.generator.cli.input;

import java.util.List;

import com.modelforge.generator.codegen.model.core.context.GenerationOptions;
import com.modelforge.generator.codegen.model.input.Model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Models and generation options read from the command-line input files.
 */
@Value
@Builder
public class ModelInput {

    @NonNull
    List<Model> models;

    @NonNull
    GenerationOptions options;
}
