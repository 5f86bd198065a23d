package org.pragmatica.aether;

import org.pragmatica.aether.analysis.DiagnosticEngine;
import org.pragmatica.aether.document.FrontendConfig;
import org.pragmatica.aether.document.ParseProblem;
import org.pragmatica.aether.document.ParsedDocument;
import org.pragmatica.aether.error.Diagnostic;
import org.pragmatica.aether.symbols.SymbolExtractor;
import org.pragmatica.aether.syntax.ParseResult;
import org.pragmatica.aether.syntax.ScriptParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Entry point of the Aether front end.
 *
 * <p>Example usage:
 * <pre>{@code
 * var frontend = AetherFrontend.create();
 * var document = frontend.parse("""
 *     Func ADD(A, B) {
 *         Return A + B
 *     }
 *     """);
 * var diagnostics = frontend.diagnose(document);
 * }</pre>
 *
 * <p>Instances hold no mutable state and may be shared between threads.
 */
public final class AetherFrontend {
    private static final Logger log = LoggerFactory.getLogger(AetherFrontend.class);

    private final FrontendConfig config;
    private final DiagnosticEngine diagnostics;

    private AetherFrontend(FrontendConfig config) {
        this.config = config;
        this.diagnostics = DiagnosticEngine.create(config.namingLint());
    }

    public static AetherFrontend create() {
        return create(FrontendConfig.DEFAULT);
    }

    public static AetherFrontend create(FrontendConfig config) {
        checkNotNull(config, "config");
        return new AetherFrontend(config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public FrontendConfig config() {
        return config;
    }

    /**
     * Parse a script to its program or its first error.
     */
    public ParseResult parseProgram(String text) {
        checkSize(text);
        return ScriptParser.parse(text);
    }

    /**
     * Parse a full document text, extracting symbols when the parse succeeds.
     */
    public ParsedDocument parse(String text) {
        var result = parseProgram(text);
        if (result instanceof ParseResult.Failure failure) {
            var problem = ParseProblem.of(failure.error());
            log.debug("Parse failed: {}", problem.message());
            return ParsedDocument.failure(text, problem);
        }
        var program = result.programOrEmpty();
        var symbols = SymbolExtractor.extract(program, text, config.documentationComments());
        log.debug("Parsed {} statements, {} symbols", program.size(), symbols.size());
        return ParsedDocument.success(text, program, symbols);
    }

    public List<Diagnostic> diagnose(ParsedDocument document) {
        return diagnostics.analyze(document, document.text());
    }

    /**
     * Parse and diagnose in one step.
     */
    public List<Diagnostic> analyze(String text) {
        return diagnose(parse(text));
    }

    private void checkSize(String text) {
        checkNotNull(text, "text");
        checkArgument(text.length() <= config.maxSourceLength(),
                      "source of %s characters exceeds the limit of %s", text.length(), config.maxSourceLength());
    }

    public static final class Builder {
        private int maxSourceLength = FrontendConfig.DEFAULT.maxSourceLength();
        private boolean namingLint = FrontendConfig.DEFAULT.namingLint();
        private boolean documentationComments = FrontendConfig.DEFAULT.documentationComments();

        private Builder() {}

        public Builder maxSourceLength(int maxSourceLength) {
            this.maxSourceLength = maxSourceLength;
            return this;
        }

        public Builder namingLint(boolean enabled) {
            this.namingLint = enabled;
            return this;
        }

        public Builder documentationComments(boolean enabled) {
            this.documentationComments = enabled;
            return this;
        }

        public AetherFrontend build() {
            return create(new FrontendConfig(maxSourceLength, namingLint, documentationComments));
        }
    }
}
