package com.scanparse.adapter.file;

import com.scanparse.core.LineProcessor;
import com.scanparse.core.LineResult;
import com.scanparse.exception.ScanParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs every line of an input file through a {@link LineProcessor}.
 * <p>
 * Rendered trees are echoed to the output stream as soon as each line is done and
 * collected for a sibling output file, written once at the end. Failing lines are
 * logged and never stop the run; the output file is written even when some (or all)
 * lines failed.
 */
public class ExpressionFileProcessor {

    private static final Logger log = LoggerFactory.getLogger(ExpressionFileProcessor.class);

    private final LineProcessor lineProcessor;
    private final PrintStream out;
    private final boolean echo;
    private final String outputExtension;
    private final Charset charset;

    public ExpressionFileProcessor(LineProcessor lineProcessor, PrintStream out, boolean echo,
                                   String outputExtension, Charset charset) {
        this.lineProcessor = Objects.requireNonNull(lineProcessor, "lineProcessor");
        this.out = Objects.requireNonNull(out, "out");
        this.echo = echo;
        this.outputExtension = Objects.requireNonNull(outputExtension, "outputExtension");
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    /**
     * Process a file and write its trees next to it.
     *
     * @param input Input file, one expression per line
     * @return Run summary
     * @throws ScanParseException if the input cannot be read
     */
    public ProcessingReport process(Path input) {
        Path absoluteInput = input.toAbsolutePath().normalize();
        log.info("Reading expressions from: {}", absoluteInput);

        List<String> lines;
        try {
            lines = splitLines(Files.readString(absoluteInput, charset));
        } catch (IOException e) {
            throw new ScanParseException("Failed to read input file: " + absoluteInput, e);
        }

        ProcessingReport report = processLines(lines);
        Path output = OutputPaths.siblingWithExtension(absoluteInput, outputExtension);

        boolean written = write(output, report.accumulated());
        return report.withFiles(absoluteInput, output, written);
    }

    /**
     * Process lines without touching the file system.
     *
     * @param lines Lines in input order
     * @return Run summary with null input and output paths
     */
    public ProcessingReport processLines(List<String> lines) {
        StringBuilder accumulated = new StringBuilder();
        int rendered = 0;
        int skipped = 0;
        int lexicalFailures = 0;
        int parseFailures = 0;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            LineResult result = lineProcessor.process(i + 1, line);

            switch (result.status()) {
                case RENDERED -> {
                    String block = result.rendered();
                    if (echo) {
                        out.print(block);
                    }
                    accumulated.append(block);
                    rendered++;
                }
                case SKIPPED_BLANK -> skipped++;
                case LEXICAL_ERROR -> {
                    log.error("Scanning error on line {}: '{}': {}",
                            result.lineNumber(), line, result.error().getMessage());
                    lexicalFailures++;
                }
                case PARSE_ERROR -> {
                    log.error("Parse error on line {}: '{}': {}",
                            result.lineNumber(), line, result.error().getMessage());
                    parseFailures++;
                }
                default -> throw new IllegalStateException("Unhandled line status: " + result.status());
            }
        }
        out.flush();

        log.info("Processed {} lines: {} rendered, {} blank, {} scanning errors, {} parse errors",
                lines.size(), rendered, skipped, lexicalFailures, parseFailures);

        return new ProcessingReport(null, null, lines.size(), rendered, skipped,
                lexicalFailures, parseFailures, accumulated.toString(), false);
    }

    /**
     * Split on LF only, dropping one trailing CR per line. A lone CR stays inside its line
     * so later line numbers are not shifted; a final terminator does not open an empty line.
     */
    static List<String> splitLines(String content) {
        String[] parts = content.split("\n", -1);
        int count = parts[parts.length - 1].isEmpty() ? parts.length - 1 : parts.length;

        List<String> lines = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String line = parts[i];
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            lines.add(line);
        }
        return lines;
    }

    private boolean write(Path output, String content) {
        try {
            Files.writeString(output, content, charset);
            log.info("Wrote parse trees to: {}", output);
            return true;
        } catch (IOException e) {
            log.error("Failed to write output to {}", output, e);
            return false;
        }
    }
}
