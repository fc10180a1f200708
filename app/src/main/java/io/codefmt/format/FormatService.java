package io.codefmt.format;

import io.codefmt.align.SameCallParamAligner;
import io.codefmt.config.FormatterConfig;
import io.codefmt.lex.SourceTokenizer;
import io.codefmt.parens.BoolParenInserter;
import io.codefmt.render.TokenRenderer;
import io.codefmt.token.TokenList;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the formatting rules over one source text.
 *
 * <p>Parentheses are inserted before call arguments are aligned, so the alignment measures the
 * columns the inserted parentheses produce.
 */
public class FormatService {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormatService.class);

    private final SourceTokenizer tokenizer;
    private final BoolParenInserter parenInserter;
    private final SameCallParamAligner callAligner;
    private final TokenRenderer renderer;

    public FormatService(FormatterConfig config) {
        this(new SourceTokenizer(config.tabSize()),
                new BoolParenInserter(config.parens()),
                new SameCallParamAligner(config.callAlign()),
                new TokenRenderer());
    }

    public FormatService(SourceTokenizer tokenizer,
                         BoolParenInserter parenInserter,
                         SameCallParamAligner callAligner,
                         TokenRenderer renderer) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.parenInserter = Objects.requireNonNull(parenInserter, "parenInserter");
        this.callAligner = Objects.requireNonNull(callAligner, "callAligner");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public FormatResult format(String source, FormatContext context) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(context, "context");
        TokenList tokens = tokenizer.tokenize(source, context.language());
        LOGGER.debug("Tokenized {} into {} tokens", context.sourceName(), tokens.size());

        parenInserter.apply(tokens, context);
        callAligner.align(tokens, context);

        String text = renderer.render(tokens);
        FormatStats stats = context.stats();
        boolean changed = stats.anyChange();
        LOGGER.info("Formatted {} ({}): {} parens inserted, {} regions skipped, {} call groups aligned",
                context.sourceName(), context.language(), stats.parensInserted(),
                stats.regionsAbandoned(), stats.callGroupsAligned());
        return new FormatResult(context.sourceName(), text, changed, stats);
    }
}
