package com.modelforge.generator.codegen.model.input;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A directed relationship originating at {@code sourceModel}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Relationship {

    RelationshipType type;

    String sourceModel;

    String targetModel;

    String sourceField;

    String targetField;

    boolean cascadeDelete;
}
