package io.vulnwitness.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.vulnwitness.model.CallStack;
import io.vulnwitness.model.Result;
import io.vulnwitness.model.SourcePosition;
import io.vulnwitness.model.StackEntry;
import io.vulnwitness.model.Vuln;
import io.vulnwitness.witness.Witnesses;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Formats witnesses as JSON for machine processing.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this.mapper = createMapper(prettyPrint);
    }

    private static ObjectMapper createMapper(boolean prettyPrint) {
        ObjectMapper m = new ObjectMapper();
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public void write(Result result, Witnesses witnesses, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonReport(result, witnesses));
    }

    JsonReport toJsonReport(Result result, Witnesses witnesses) {
        List<JsonReport.Finding> findings = witnesses.vulns().stream()
                .map(vuln -> toJsonFinding(vuln, witnesses))
                .toList();
        return new JsonReport(
                new JsonReport.Summary(
                        result.vulns().size(),
                        witnesses.size(),
                        witnesses.reachable().size()
                ),
                findings
        );
    }

    private JsonReport.Finding toJsonFinding(Vuln vuln, Witnesses witnesses) {
        CallStack stack = witnesses.witness(vuln).orElse(null);
        return new JsonReport.Finding(
                vuln.osvId(),
                vuln.symbol().isEmpty() ? null : vuln.symbol(),
                vuln.importSink().orElse(null),
                vuln.callSink().map(f -> f.displayName()).orElse(null),
                stack != null,
                stack != null ? stack.weight() : null,
                stack != null ? stack.entries().stream().map(this::toJsonFrame).toList() : null
        );
    }

    private JsonReport.Frame toJsonFrame(StackEntry entry) {
        return new JsonReport.Frame(
                entry.function().displayName(),
                toJsonPosition(entry.function().position()),
                entry.call() != null ? new JsonReport.Call(
                        entry.call().qualifiedName(),
                        toJsonPosition(entry.call().position()),
                        entry.call().resolved()
                ) : null
        );
    }

    private static JsonReport.Position toJsonPosition(SourcePosition position) {
        if (position == null) {
            return null;
        }
        return new JsonReport.Position(position.filename(), position.line(), position.column());
    }

    /**
     * JSON structure for the report.
     */
    public record JsonReport(
            Summary summary,
            List<Finding> findings
    ) {
        public record Summary(
                int vulnerabilities,
                int searched,
                int reachable
        ) {}

        public record Finding(
                String osv,
                String symbol,
                String importSink,
                String callSink,
                boolean reachable,
                Integer weight,
                List<Frame> trace
        ) {}

        public record Frame(
                String function,
                Position position,
                Call call
        ) {}

        public record Call(
                String name,
                Position position,
                boolean resolved
        ) {}

        public record Position(
                String file,
                int line,
                int column
        ) {}
    }
}
