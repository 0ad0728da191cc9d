package com.pinebridge.convert;

import com.pinebridge.config.ConverterConfig;
import com.pinebridge.dsl.Tokenizer;
import com.pinebridge.dsl.program.ProgramParser;
import com.pinebridge.indicators.registry.IndicatorRegistry;
import com.pinebridge.indicators.registry.IndicatorRegistryInitializer;
import com.pinebridge.model.ProgramAst;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tokenize, parse, gate and generate in one call.
 *
 * Scripts the gate rejects, or whose expressions cannot be transformed, come back as a
 * {@link ConversionOutcome.Handoff} for the fallback converter instead of partial code.
 */
public class RuleBasedConverter {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedConverter.class);

    private final ProgramParser parser;
    private final ComplexityGate gate;
    private final RuleBasedGenerator generator;

    public RuleBasedConverter() {
        this(ConverterConfig.load(), IndicatorRegistryInitializer.shared());
    }

    public RuleBasedConverter(ConverterConfig config, IndicatorRegistry registry) {
        this.parser = new ProgramParser(config);
        this.gate = new ComplexityGate(config.getGate(), registry);
        this.generator = new RuleBasedGenerator(gate, new ExpressionTransformer(registry), registry);
    }

    /**
     * @throws com.pinebridge.dsl.LexException if the source cannot be tokenized
     */
    public ConversionOutcome convert(String source) {
        ProgramAst ast = parser.parse(Tokenizer.tokenize(source));
        ValidationResult validation = gate.validate(ast);
        if (!validation.valid()) {
            log.info("Handing off '{}' ({})", ast.name(), validation.recommendation());
            return new ConversionOutcome.Handoff(ast, validation, validation.errors());
        }
        try {
            return new ConversionOutcome.Generated(generator.generate(ast), ast, validation);
        } catch (ConversionException e) {
            log.info("Handing off '{}' after generation failed: {}", ast.name(), e.getCauses());
            ValidationResult downgraded = new ValidationResult(false, validation.complexityScore(),
                e.getCauses(), validation.warnings(), Recommendation.USE_FALLBACK_CONVERTER);
            return new ConversionOutcome.Handoff(ast, downgraded, e.getCauses());
        }
    }
}
