package io.lighting.quill.view;

/**
 * Structural render failure: a missing or unparseable template, partial or layout.
 */
public class TemplateRenderException extends IllegalStateException {
    private final String templateName;

    public TemplateRenderException(String templateName, String message) {
        super(message);
        this.templateName = templateName;
    }

    public TemplateRenderException(String templateName, String message, Throwable cause) {
        super(message, cause);
        this.templateName = templateName;
    }

    public String templateName() {
        return templateName;
    }
}
