package io.hearthwarrio.locatium.core;

import io.hearthwarrio.locatium.core.classify.TagClassifier;

import java.util.List;
import java.util.Objects;

/**
 * High-level entry point: path text to tokens to steps to locators to declarations.
 * <p>
 * Each stage is an injected interface, so any of them can be replaced. The pipeline is
 * immutable and keeps nothing between calls: every {@link #locate(String)} returns a fresh
 * list, and {@code with...} methods return a new pipeline. One instance may be shared
 * between threads as long as the injected stages are stateless.
 */
public final class LocatorPipeline {

    private final Tokenizer tokenizer;
    private final StepParser parser;
    private final LocatorConverter converter;
    private final LocatorRenderer renderer;
    private final ConversionLogger logger;

    public LocatorPipeline(
            Tokenizer tokenizer,
            StepParser parser,
            LocatorConverter converter,
            LocatorRenderer renderer
    ) {
        this(tokenizer, parser, converter, renderer, null);
    }

    public LocatorPipeline(
            Tokenizer tokenizer,
            StepParser parser,
            LocatorConverter converter,
            LocatorRenderer renderer,
            ConversionLogger logger
    ) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.converter = Objects.requireNonNull(converter, "converter must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.logger = logger;
    }

    /**
     * Pipeline with the built-in lexer, parser, Qt classifier and object-map renderer,
     * without logging.
     */
    public static LocatorPipeline defaults() {
        return new LocatorPipeline(
                new XPathLexer(),
                new XPathParser(),
                new QtLocatorConverter(),
                new ObjectMapRenderer()
        );
    }

    // ----------- configuration -----------

    public LocatorPipeline withTokenizer(Tokenizer tokenizer) {
        return new LocatorPipeline(tokenizer, parser, converter, renderer, logger);
    }

    public LocatorPipeline withParser(StepParser parser) {
        return new LocatorPipeline(tokenizer, parser, converter, renderer, logger);
    }

    public LocatorPipeline withConverter(LocatorConverter converter) {
        return new LocatorPipeline(tokenizer, parser, converter, renderer, logger);
    }

    /**
     * Replaces the converter with a {@link QtLocatorConverter} using the given classifier.
     */
    public LocatorPipeline withClassifier(TagClassifier classifier) {
        return withConverter(new QtLocatorConverter(classifier));
    }

    public LocatorPipeline withRenderer(LocatorRenderer renderer) {
        return new LocatorPipeline(tokenizer, parser, converter, renderer, logger);
    }

    /**
     * @param logger conversion logger, or null to disable logging
     */
    public LocatorPipeline withLogger(ConversionLogger logger) {
        return new LocatorPipeline(tokenizer, parser, converter, renderer, logger);
    }

    public LocatorPipeline withLoggingToStdOut(LogDetail detail) {
        return withLogger(new StdOutConversionLogger(detail));
    }

    public ConversionLogger getLogger() {
        return logger;
    }

    // ----------- operations -----------

    /**
     * Tokenize and parse only.
     *
     * @throws XPathLexicalException on an unterminated literal
     * @throws XPathSyntaxException  on a malformed path
     */
    public List<LocationStep> parse(String xpath) {
        Objects.requireNonNull(xpath, "xpath must not be null");
        return parser.parse(tokenizer.tokenize(xpath));
    }

    /**
     * Converts a path to locators, one per parsed step.
     *
     * @throws XPathLexicalException on an unterminated literal
     * @throws XPathSyntaxException  on a malformed path
     */
    public List<Locator> locate(String xpath) {
        List<Locator> locators = converter.convert(parse(xpath));
        if (logger != null) {
            String declarations = logger.detail().needsDeclarations() ? renderer.render(locators) : null;
            logger.logConversion(xpath, locators, declarations);
        }
        return locators;
    }

    /**
     * Converts a path and renders the result.
     *
     * @throws XPathLexicalException on an unterminated literal
     * @throws XPathSyntaxException  on a malformed path
     */
    public String declare(String xpath) {
        List<Locator> locators = converter.convert(parse(xpath));
        String declarations = renderer.render(locators);
        if (logger != null) {
            logger.logConversion(xpath, locators, declarations);
        }
        return declarations;
    }

    /**
     * Renders already converted locators with this pipeline's renderer.
     */
    public String render(List<Locator> locators) {
        return renderer.render(locators);
    }
}
