package com.scanparse.adapter.spring;

import com.scanparse.adapter.file.ExpressionFileProcessor;
import com.scanparse.core.DefaultLineProcessor;
import com.scanparse.core.LineProcessor;
import com.scanparse.exception.ScanParseException;
import com.scanparse.tree.LevelOrderTreeRenderer;
import com.scanparse.tree.TreeRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;

/**
 * Spring Boot auto-configuration for scanparse.
 */
@Configuration
@ConditionalOnProperty(prefix = "scanparse", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ScanParseProperties.class)
public class ScanParseAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ScanParseAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public TreeRenderer treeRenderer() {
        return new LevelOrderTreeRenderer();
    }

    @Bean
    @ConditionalOnMissingBean
    public LineProcessor lineProcessor(TreeRenderer treeRenderer) {
        return new DefaultLineProcessor(treeRenderer);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExpressionFileProcessor expressionFileProcessor(LineProcessor lineProcessor,
                                                           ScanParseProperties properties) {
        log.info("Creating ExpressionFileProcessor: extension={}, charset={}, echo={}",
                properties.getOutputExtension(), properties.getCharset(), properties.isEchoToStdout());
        return new ExpressionFileProcessor(
                lineProcessor,
                System.out,
                properties.isEchoToStdout(),
                properties.getOutputExtension(),
                resolveCharset(properties.getCharset()));
    }

    static Charset resolveCharset(String name) {
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ScanParseException("Unsupported charset configured: " + name, e);
        }
    }
}
