package io.ledgerrest.api.envelope;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import java.io.IOException;

/**
 * Two-space indentation with every array element and object member on its
 * own line, {@code ": "} after keys, and {@code []} / {@code {}} for empty
 * containers.
 */
final class EnvelopePrinter extends DefaultPrettyPrinter {

    private static final long serialVersionUID = 1L;

    EnvelopePrinter() {
        final DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        indentObjectsWith(indenter);
        indentArraysWith(indenter);
    }

    private EnvelopePrinter(final EnvelopePrinter base) {
        super(base);
    }

    @Override
    public EnvelopePrinter createInstance() {
        return new EnvelopePrinter(this);
    }

    @Override
    public void writeObjectFieldValueSeparator(final JsonGenerator g) throws IOException {
        g.writeRaw(": ");
    }

    @Override
    public void writeEndObject(final JsonGenerator g, final int nrOfEntries) throws IOException {
        if (!_objectIndenter.isInline()) {
            --_nesting;
        }
        if (nrOfEntries > 0) {
            _objectIndenter.writeIndentation(g, _nesting);
        }
        g.writeRaw('}');
    }

    @Override
    public void writeEndArray(final JsonGenerator g, final int nrOfValues) throws IOException {
        if (!_arrayIndenter.isInline()) {
            --_nesting;
        }
        if (nrOfValues > 0) {
            _arrayIndenter.writeIndentation(g, _nesting);
        }
        g.writeRaw(']');
    }
}
