package org.pragmatica.verge.error;

/**
 * Unchecked carrier for an {@link AnalysisError}. Every stage of the pipeline fails fast
 * by throwing it; nothing inside the engine catches it.
 */
public final class AnalysisException extends RuntimeException {
    private final AnalysisError error;

    public AnalysisException(AnalysisError error) {
        super(error.message());
        this.error = error;
    }

    public AnalysisError error() {
        return error;
    }

    /**
     * Render the failure against the source it was raised for.
     */
    public String format(String source) {
        return Diagnostic.of(error).format(source);
    }
}
