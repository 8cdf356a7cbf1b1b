package beautify.web.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;

import java.io.IOException;

/**
 * Pretty printer producing the common two-level layout: {@code "key": value}, one entry per
 * line, and empty containers written as {@code {}} / {@code []}.
 */
public class StandardPrettyPrinter extends DefaultPrettyPrinter {

    public StandardPrettyPrinter(int indentSize) {
        DefaultIndenter indenter = new DefaultIndenter(" ".repeat(indentSize), "\n");
        indentObjectsWith(indenter);
        indentArraysWith(indenter);
    }

    protected StandardPrettyPrinter(StandardPrettyPrinter base) {
        super(base);
    }

    @Override
    public StandardPrettyPrinter createInstance() {
        return new StandardPrettyPrinter(this);
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
