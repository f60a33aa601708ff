package org.pragmatica.kakapo.format;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.kakapo.tree.Node;

import java.util.List;

/**
 * Runs the fixed pipeline of formatting passes over a tree, in place.
 *
 * <p>Each pass is idempotent and so is the pipeline as a whole on trees produced by the parser.
 */
public final class Formatter {
    private static final Logger logger = LogManager.getLogger(Formatter.class);

    private final FormatterConfig config;
    private final List<FormattingPass> passes;

    private Formatter(FormatterConfig config, List<FormattingPass> passes) {
        this.config = config;
        this.passes = passes;
    }

    public static Formatter create(FormatterConfig config) {
        return new Formatter(config, List.of(new DelimiterSpacing(),
                                             new ParenthesizedSpacing(),
                                             new AssignmentSpacing(),
                                             new SemicolonCleanup(),
                                             new Reindentation(),
                                             new FunctionTerminator(),
                                             new FileBoundary(),
                                             new CommentSpacing(),
                                             new LongStatementWrapping()));
    }

    public static Formatter create() {
        return create(FormatterConfig.DEFAULT);
    }

    public FormatterConfig config() {
        return config;
    }

    public List<FormattingPass> passes() {
        return passes;
    }

    /**
     * Format the tree rooted at {@code root} and return it.
     */
    public <T extends Node> T format(T root) {
        for (var pass : passes) {
            logger.debug("Running pass '{}'", pass.name());
            pass.apply(root, config);
        }
        return root;
    }
}
