package com.modelforge.generator.codegen.util;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;

/**
 * Pretty printer matching the usual JavaScript tooling output: {@code "key": value}, one member per line,
 * arrays broken over lines like objects, empty containers as {@code {}} and {@code []}.
 */
public class CanonicalPrettyPrinter extends DefaultPrettyPrinter {

    private static final long serialVersionUID = 1L;

    private final String indentUnit;

    public CanonicalPrettyPrinter(String indentUnit) {
        this.indentUnit = indentUnit;
        DefaultIndenter indenter = new DefaultIndenter(indentUnit, "\n");
        indentObjectsWith(indenter);
        indentArraysWith(indenter);
    }

    @Override
    public DefaultPrettyPrinter createInstance() {
        return new CanonicalPrettyPrinter(indentUnit);
    }

    @Override
    public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
        g.writeRaw(": ");
    }

    @Override
    public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
        if (!_objectIndenter.isInline()) {
            --_nesting;
        }
        if (nrOfEntries > 0) {
            _objectIndenter.writeIndentation(g, _nesting);
        }
        g.writeRaw('}');
    }

    @Override
    public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
        if (!_arrayIndenter.isInline()) {
            --_nesting;
        }
        if (nrOfValues > 0) {
            _arrayIndenter.writeIndentation(g, _nesting);
        }
        g.writeRaw(']');
    }
}
