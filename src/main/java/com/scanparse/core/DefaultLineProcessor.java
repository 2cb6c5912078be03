package com.scanparse.core;

import com.scanparse.exception.LexicalException;
import com.scanparse.exception.ParseException;
import com.scanparse.grammar.ExpressionTreeParser;
import com.scanparse.tree.ParseNode;
import com.scanparse.tree.TreeRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Default implementation of LineProcessor.
 * <p>
 * Each line gets a fresh scanner, parser and tree; nothing is shared between lines.
 */
public class DefaultLineProcessor implements LineProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultLineProcessor.class);

    // Unicode White_Space only; U+001C..U+001F are not blank
    private static final Pattern BLANK = Pattern.compile("\\p{IsWhite_Space}*");

    private final TreeRenderer renderer;

    public DefaultLineProcessor(TreeRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    @Override
    public LineResult process(int lineNumber, String line) {
        if (line == null || BLANK.matcher(line).matches()) {
            log.trace("Line {} is blank, skipping", lineNumber);
            return LineResult.skipped(lineNumber, line);
        }

        ParseNode root;
        try {
            root = ExpressionTreeParser.parse(line);
        } catch (LexicalException e) {
            log.debug("Line {} failed to scan: {}", lineNumber, e.getMessage());
            return LineResult.lexicalError(lineNumber, line, e);
        } catch (ParseException e) {
            log.debug("Line {} failed to parse: {}", lineNumber, e.getMessage());
            return LineResult.parseError(lineNumber, line, e);
        }

        String rendered = renderer.render(root);
        log.debug("Line {} rendered {} levels", lineNumber, rendered.lines().count());
        return LineResult.rendered(lineNumber, line, rendered);
    }
}
