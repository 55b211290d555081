package io.vulnwitness.input;

import io.vulnwitness.model.CallSite;
import io.vulnwitness.model.FuncNode;
import io.vulnwitness.model.Result;
import io.vulnwitness.model.Vuln;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultLoaderTest {

    @TempDir
    Path tempDir;

    private static final String SAMPLE = """
            functions:
              - id: 1
                name: main
                package: example.com/app
                position: {file: main.go, line: 10, column: 6}
              - id: 2
                name: Parse
                receiver: "*Decoder"
                package: golang.org/x/text/language
            calls:
              - caller: 1
                callee: 2
                resolved: false
                position: {file: main.go, line: 12, column: 3}
            entries: [1]
            vulns:
              - osv: GO-2022-1059
                symbol: Decoder.Parse
                callSink: 2
                importSink: golang.org/x/text/language
              - osv: GO-2022-1060
                importSink: golang.org/x/text/language
            """;

    @Test
    void load_readsGraphEntriesAndVulns() throws IOException {
        Path file = tempDir.resolve("result.yaml");
        Files.writeString(file, SAMPLE);

        Result result = ResultLoader.load(file);

        assertThat(result.callGraph().functionCount()).isEqualTo(2);
        assertThat(result.entryFunctions()).extracting(FuncNode::displayName)
                .containsExactly("example.com/app.main");

        FuncNode parse = result.callGraph().requireFunction(2);
        assertThat(parse.displayName()).isEqualTo("golang.org/x/text/language.*Decoder.Parse");
        assertThat(parse.position()).isNull();

        CallSite site = result.callGraph().callersOf(parse).get(0);
        assertThat(site.qualifiedName()).isEqualTo("*Decoder.Parse");
        assertThat(site.resolved()).isFalse();
        assertThat(site.position()).hasToString("main.go:12:3");

        assertThat(result.vulns()).hasSize(2);
        Vuln first = result.vulns().get(0);
        assertThat(first.osvId()).isEqualTo("GO-2022-1059");
        assertThat(first.callSink()).contains(parse);
        assertThat(result.vulns().get(1).hasCallSink()).isFalse();
    }

    @Test
    void parse_defaultsCallsToResolved() throws IOException {
        Result result = ResultLoader.parse("""
                functions:
                  - {id: 1, name: a}
                  - {id: 2, name: b}
                calls:
                  - {caller: 1, callee: 2}
                """);

        assertThat(result.callGraph().calleesOf(1).get(0).resolved()).isTrue();
        assertThat(result.vulns()).isEmpty();
        assertThat(result.entryFunctions()).isEmpty();
    }

    @Test
    void parse_rejectsIdsOutsideIntRange() {
        assertThatThrownBy(() -> ResultLoader.parse("""
                functions:
                  - {id: 1, name: a}
                  - {id: 4294967297, name: b}
                """))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("'id' is out of range: 4294967297");

        assertThatThrownBy(() -> ResultLoader.parse("""
                functions:
                  - {id: 1, name: a}
                calls:
                  - {caller: 1, callee: 4294967297}
                """))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("'calls.callee' is out of range: 4294967297");
    }

    @Test
    void parse_rejectsUnknownFunctionIds() {
        assertThatThrownBy(() -> ResultLoader.parse("""
                functions:
                  - {id: 1, name: a}
                calls:
                  - {caller: 1, callee: 5}
                """))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("unknown function id 5");
    }

    @Test
    void parse_rejectsDuplicateFunctionIds() {
        assertThatThrownBy(() -> ResultLoader.parse("""
                functions:
                  - {id: 1, name: a}
                  - {id: 1, name: b}
                """))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Duplicate function id 1");
    }

    @Test
    void parse_rejectsVulnWithoutId() {
        assertThatThrownBy(() -> ResultLoader.parse("""
                functions:
                  - {id: 1, name: a}
                vulns:
                  - {callSink: 1}
                """))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("'osv'");
    }

    @Test
    void parse_rejectsEmptyDocument() {
        assertThatThrownBy(() -> ResultLoader.parse(""))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Empty or invalid");
    }

    @Test
    void parse_rejectsMalformedYaml() {
        assertThatThrownBy(() -> ResultLoader.parse("functions: [1, 2"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid YAML");
    }
}
