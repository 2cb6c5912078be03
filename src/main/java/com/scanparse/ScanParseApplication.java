package com.scanparse;

import com.scanparse.adapter.file.ExpressionFileProcessor;
import com.scanparse.adapter.file.ProcessingReport;
import com.scanparse.exception.ScanParseException;
import com.scanparse.spring.EnableScanParse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line entry point: {@code scanparse <input_filename>}.
 * <p>
 * Prints the level-order parse tree of every valid line and writes them all to
 * {@code <input_basename>.output} next to the input.
 */
@SpringBootApplication
@EnableScanParse
public class ScanParseApplication {

    private static final Logger log = LoggerFactory.getLogger(ScanParseApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ScanParseApplication.class, args);
    }

    @Bean
    public CommandLineRunner scanParseRunner(ExpressionFileProcessor processor) {
        return args -> {
            // Spring's own --key=value options are not input files
            List<String> inputs = Arrays.stream(args)
                    .filter(arg -> !arg.startsWith("--"))
                    .toList();

            if (inputs.size() != 1) {
                log.error("Usage: scanparse <input_filename>");
                return;
            }

            try {
                ProcessingReport report = processor.process(Path.of(inputs.get(0)));
                log.info("Finished {}: {} trees, {} failed lines, output {}",
                        report.input(), report.renderedLines(), report.failedLines(),
                        report.outputWritten() ? report.output() : "not written");
            } catch (ScanParseException e) {
                log.error(e.getMessage(), e.getCause());
            }
        };
    }
}
