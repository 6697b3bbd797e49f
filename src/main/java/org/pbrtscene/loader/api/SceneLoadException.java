package org.pbrtscene.loader.api;

/**
 * An exception that is thrown when loading a scene fails.
 * <p>
 * Loading is fail-fast: the first error aborts the whole operation and no partial scene
 * is returned. The exception carries a stable {@link SceneErrorCode} and, when the error can be
 * attributed to a token, the {@link SourceInfo} of that token.
 */
public class SceneLoadException extends Exception {

    private final SceneErrorCode errorCode;
    private final transient SourceInfo sourceInfo;

    /**
     * Constructs a new exception without source information.
     * @param errorCode The error code.
     * @param message The detail message.
     */
    public SceneLoadException(SceneErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    /**
     * Constructs a new exception located at a specific position.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The location of the offending token, may be null.
     */
    public SceneLoadException(SceneErrorCode errorCode, String message, SourceInfo sourceInfo) {
        this(errorCode, message, sourceInfo, null);
    }

    /**
     * Constructs a new exception with a cause.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param sourceInfo The location of the offending token, may be null.
     * @param cause The cause.
     */
    public SceneLoadException(SceneErrorCode errorCode, String message, SourceInfo sourceInfo, Throwable cause) {
        super(format(errorCode, message, sourceInfo), cause);
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
    }

    /**
     * @return The error code of this failure.
     */
    public SceneErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The location of the failure, or null if it is not tied to a token.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }

    /**
     * Returns a copy of this exception with its location replaced.
     * Used to attach the position of the directive being applied, or to fill in the line content
     * from the retained source buffers.
     *
     * @param location The location to attach.
     * @return A copy of this exception located at {@code location}.
     */
    public SceneLoadException withSourceInfo(SourceInfo location) {
        return new SceneLoadException(errorCode, rawMessage(), location, getCause());
    }

    private String rawMessage() {
        String message = getMessage();
        String prefix = "[" + errorCode + "] ";
        if (message.startsWith(prefix)) {
            message = message.substring(prefix.length());
        }
        if (sourceInfo != null) {
            String suffix = " at " + sourceInfo;
            if (message.endsWith(suffix)) {
                message = message.substring(0, message.length() - suffix.length());
            }
        }
        return message;
    }

    private static String format(SceneErrorCode errorCode, String message, SourceInfo sourceInfo) {
        if (sourceInfo == null) {
            return String.format("[%s] %s", errorCode, message);
        }
        return String.format("[%s] %s at %s", errorCode, message, sourceInfo);
    }
}
