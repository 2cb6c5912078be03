package com.scanparse.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for scanparse.
 */
@ConfigurationProperties(prefix = "scanparse")
public class ScanParseProperties {

    /**
     * Whether scanparse beans are created.
     */
    private boolean enabled = true;

    /**
     * Extension of the file written next to the input, without the dot.
     */
    private String outputExtension = "output";

    /**
     * Charset for reading input and writing output.
     */
    private String charset = "UTF-8";

    /**
     * Whether rendered trees are also printed to standard output.
     */
    private boolean echoToStdout = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getOutputExtension() {
        return outputExtension;
    }

    public void setOutputExtension(String outputExtension) {
        this.outputExtension = outputExtension;
    }

    public String getCharset() {
        return charset;
    }

    public void setCharset(String charset) {
        this.charset = charset;
    }

    public boolean isEchoToStdout() {
        return echoToStdout;
    }

    public void setEchoToStdout(boolean echoToStdout) {
        this.echoToStdout = echoToStdout;
    }
}
