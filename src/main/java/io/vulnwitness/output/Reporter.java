package io.vulnwitness.output;

import io.vulnwitness.model.Result;
import io.vulnwitness.witness.Witnesses;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders the witnesses found for a scan result.
 */
public interface Reporter {

    void write(Result result, Witnesses witnesses, Writer writer) throws IOException;

    /**
     * Writes the report as UTF-8, replacing the file if it exists.
     */
    default void write(Result result, Witnesses witnesses, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(result, witnesses, writer);
        }
    }

    default String render(Result result, Witnesses witnesses) {
        StringWriter writer = new StringWriter();
        try {
            write(result, witnesses, writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot render witness report", e);
        }
        return writer.toString();
    }
}
