package io.github.vishalmysore.loggraph.config;

import lombok.Builder;
import lombok.Value;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Settings for analyses and exports, read from a properties file on the
 * classpath. Missing keys and a missing file fall back to the defaults.
 */
@Value
@Builder
public class AnalyzerSettings {
    private static final Logger log = Logger.getLogger(AnalyzerSettings.class.getName());

    public static final String DEFAULT_RESOURCE = "loggraph.properties";

    @Builder.Default
    boolean allowSelfEdges = true;   // quotient.allowSelfEdges
    @Builder.Default
    String exportFormat = "dot";     // export.format: dot or json
    @Builder.Default
    String dotGraphName = "loggraph"; // dot.graphName

    public static AnalyzerSettings load() {
        return load(DEFAULT_RESOURCE);
    }

    public static AnalyzerSettings load(String resource) {
        Properties props = new Properties();
        try (InputStream is = AnalyzerSettings.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                props.load(is);
            } else {
                log.info("No " + resource + " on the classpath, using default settings");
            }
        } catch (IOException e) {
            log.warning("Could not load " + resource + ": " + e.getMessage());
        }
        return fromProperties(props);
    }

    public static AnalyzerSettings fromProperties(Properties props) {
        AnalyzerSettings defaults = AnalyzerSettings.builder().build();
        return AnalyzerSettings.builder()
                .allowSelfEdges(Boolean.parseBoolean(props.getProperty("quotient.allowSelfEdges",
                        String.valueOf(defaults.isAllowSelfEdges()))))
                .exportFormat(props.getProperty("export.format", defaults.getExportFormat()).trim())
                .dotGraphName(props.getProperty("dot.graphName", defaults.getDotGraphName()).trim())
                .build();
    }
}
