package com.pinebridge.dsl.program;

import com.pinebridge.config.ConverterConfig;
import com.pinebridge.dsl.TokenStream;
import com.pinebridge.dsl.Tokenizer;
import com.pinebridge.model.ProgramAst;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a scored {@link ProgramAst} from a token stream.
 *
 * Holds no per-script state; one instance can parse any number of scripts,
 * from any number of threads.
 */
public class ProgramParser {

    private static final Logger log = LoggerFactory.getLogger(ProgramParser.class);

    private final ComplexityScorer scorer;

    public ProgramParser() {
        this(ConverterConfig.defaults());
    }

    public ProgramParser(ConverterConfig config) {
        this.scorer = new ComplexityScorer(config.getComplexity());
    }

    /**
     * Parse a token stream. Pass the full stream to keep the version comment;
     * a clean stream parses the same statements with the default version.
     */
    public ProgramAst parse(TokenStream tokens) {
        ProgramAst ast = scorer.score(new StatementReader(tokens).read());
        if (!ast.warnings().isEmpty()) {
            log.debug("Parsed '{}' with {} skipped statements", ast.name(), ast.warnings().size());
        }
        log.debug("Complexity of '{}': {} {}", ast.name(), ast.complexityScore(), ast.complexityFactors());
        return ast;
    }

    /**
     * Tokenize and parse source text.
     *
     * @throws com.pinebridge.dsl.LexException on an unterminated string or block comment
     */
    public ProgramAst parse(String source) {
        return parse(Tokenizer.tokenize(source));
    }
}
