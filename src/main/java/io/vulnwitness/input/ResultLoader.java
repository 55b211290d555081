package io.vulnwitness.input;

import io.vulnwitness.model.CallGraph;
import io.vulnwitness.model.CallSite;
import io.vulnwitness.model.FuncNode;
import io.vulnwitness.model.Result;
import io.vulnwitness.model.SourcePosition;
import io.vulnwitness.model.Vuln;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads an analysis result (call graph, entry functions and vulnerabilities) from YAML.
 * <p>
 * Format:
 * <pre>
 * functions:
 *   - id: 1
 *     name: main
 *     package: example.com/app
 *     receiver: Server                # optional
 *     position: {file: main.go, line: 10, column: 6}   # optional
 * calls:
 *   - caller: 1
 *     callee: 2
 *     resolved: true                  # optional, default true
 *     position: {file: main.go, line: 12, column: 3}   # optional
 * entries: [1]
 * vulns:
 *   - osv: GO-2022-0001
 *     symbol: Parse
 *     callSink: 2                     # optional
 *     importSink: golang.org/x/text/language           # optional
 * </pre>
 */
public class ResultLoader {

    /**
     * Load a result from a YAML file.
     */
    public static Result load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, path.toString());
        }
    }

    /**
     * Load a result from a YAML string.
     */
    public static Result parse(String yaml) throws IOException {
        return load(new StringReader(yaml), "<string>");
    }

    @SuppressWarnings("unchecked")
    private static Result load(Reader reader, String origin) throws IOException {
        Object document;
        try {
            document = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new IOException("Invalid YAML in " + origin + ": " + e.getMessage(), e);
        }
        if (!(document instanceof Map)) {
            throw new IOException("Empty or invalid result file: " + origin);
        }
        Map<String, Object> data = (Map<String, Object>) document;

        try {
            CallGraph.Builder builder = CallGraph.builder();
            for (Map<String, Object> fn : maps(data.get("functions"), "functions")) {
                builder.addFunction(toFunction(fn));
            }
            // calls are added once every function is known, to name call sites after their callees
            CallGraph functionsOnly = builder.build();
            for (Map<String, Object> call : maps(data.get("calls"), "calls")) {
                builder.addCall(toCallSite(call, functionsOnly));
            }
            CallGraph graph = builder.build();

            List<FuncNode> entries = new ArrayList<>();
            for (Object id : list(data.get("entries"), "entries")) {
                entries.add(function(graph, id, "entries"));
            }

            List<Vuln> vulns = new ArrayList<>();
            for (Map<String, Object> v : maps(data.get("vulns"), "vulns")) {
                vulns.add(toVuln(v, graph));
            }
            return new Result(vulns, graph, entries);
        } catch (IllegalArgumentException | IllegalStateException | ClassCastException e) {
            throw new IOException("Invalid result file " + origin + ": " + e.getMessage(), e);
        }
    }

    private static FuncNode toFunction(Map<String, Object> fn) throws IOException {
        return FuncNode.builder()
                .id(requiredInt(fn, "id", "functions"))
                .name(requiredString(fn, "name", "functions"))
                .receiver((String) fn.get("receiver"))
                .packagePath((String) fn.get("package"))
                .position(toPosition(fn.get("position")))
                .build();
    }

    private static CallSite toCallSite(Map<String, Object> call, CallGraph graph) throws IOException {
        FuncNode caller = function(graph, call.get("caller"), "calls.caller");
        FuncNode callee = function(graph, call.get("callee"), "calls.callee");

        String name = (String) call.get("name");
        String receiverType = (String) call.get("receiverType");
        if (name == null || name.isBlank()) {
            name = callee.name();
            receiverType = callee.receiver();
        }
        Object resolved = call.get("resolved");
        return new CallSite(
                caller.id(),
                callee.id(),
                name,
                receiverType,
                toPosition(call.get("position")),
                resolved == null || Boolean.TRUE.equals(resolved)
        );
    }

    private static Vuln toVuln(Map<String, Object> v, CallGraph graph) throws IOException {
        Object sinkId = v.get("callSink");
        FuncNode sink = sinkId != null ? function(graph, sinkId, "vulns.callSink") : null;
        return new Vuln(
                requiredString(v, "osv", "vulns"),
                (String) v.get("symbol"),
                sink,
                (String) v.get("importSink")
        );
    }

    @SuppressWarnings("unchecked")
    private static SourcePosition toPosition(Object value) throws IOException {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new IOException("'position' must be a map with file, line and column");
        }
        Map<String, Object> pos = (Map<String, Object>) value;
        Object line = pos.get("line");
        Object column = pos.get("column");
        return new SourcePosition(
                (String) pos.get("file"),
                line instanceof Number l ? toInt(l, "line") : 0,
                column instanceof Number c ? toInt(c, "column") : 0
        );
    }

    private static FuncNode function(CallGraph graph, Object id, String key) throws IOException {
        if (!(id instanceof Number number)) {
            throw new IOException("'" + key + "' must be a function id, got: " + id);
        }
        return graph.function(toInt(number, key))
                .orElseThrow(() -> new IOException("'" + key + "' refers to unknown function id " + id));
    }

    private static List<Object> list(Object value, String key) throws IOException {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new IOException("'" + key + "' must be a list");
        }
        @SuppressWarnings("unchecked")
        List<Object> items = (List<Object>) value;
        return items;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> maps(Object value, String key) throws IOException {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : list(value, key)) {
            if (!(item instanceof Map)) {
                throw new IOException("Entries of '" + key + "' must be maps, got: " + item);
            }
            result.add((Map<String, Object>) item);
        }
        return result;
    }

    private static int requiredInt(Map<String, Object> map, String field, String key) throws IOException {
        Object value = map.get(field);
        if (!(value instanceof Number number)) {
            throw new IOException("Entries of '" + key + "' must specify numeric '" + field + "'");
        }
        return toInt(number, field);
    }

    private static int toInt(Number number, String field) throws IOException {
        long value = number.longValue();
        if ((number instanceof BigInteger big && big.bitLength() > 31)
                || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IOException("'" + field + "' is out of range: " + number);
        }
        return (int) value;
    }

    private static String requiredString(Map<String, Object> map, String field, String key) throws IOException {
        Object value = map.get(field);
        if (value == null || value.toString().isBlank()) {
            throw new IOException("Entries of '" + key + "' must specify '" + field + "'");
        }
        return value.toString();
    }
}
