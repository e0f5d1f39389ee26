package io.github.vishalmysore.loggraph.ast;

/**
 * Names and tags shared by analyzers that label graphs with file-system,
 * network and time information.
 */
public final class AstTags {
    public static final String DIRECTORY = "Directory";
    public static final String FILENAME = "Filename";
    public static final String FILE_PATH_PART = "File Path";
    public static final String FILE = "File";
    public static final String IP_ADDRESS = "IP-Address";
    public static final String TIME = "Time";
    public static final String URL = "URL";

    // Edge tags
    public static final String PRECEDES = "Precedes";
    public static final String USES = "Uses";

    private AstTags() {
    }
}
