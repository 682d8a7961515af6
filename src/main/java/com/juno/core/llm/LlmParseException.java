package com.juno.core.llm;

/**
 * Thrown when model output cannot be read as the requested type. Keeps the
 * target type and the start of the offending content for logs and reports.
 */
public class LlmParseException extends RuntimeException {

    static final int CONTENT_PREVIEW = 300;

    private final String outputType;
    private final String content;

    public LlmParseException(Class<?> outputType, String content, Throwable cause) {
        super("Could not read the model output as " + outputType.getSimpleName()
                + (cause == null ? "" : ": " + cause.getMessage()), cause);
        this.outputType = outputType.getSimpleName();
        this.content = preview(content);
    }

    public String outputType() {
        return outputType;
    }

    /** The unparsed content, cut to {@value #CONTENT_PREVIEW} characters. */
    public String content() {
        return content;
    }

    private static String preview(String content) {
        if (content == null) {
            return "";
        }
        return content.length() > CONTENT_PREVIEW ? content.substring(0, CONTENT_PREVIEW) + "..." : content;
    }
}
