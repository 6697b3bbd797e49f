package org.pbrtscene.loader.api;

/**
 * Defines unique, testable error codes for all errors that can occur while loading a scene.
 * This decouples the test logic from the error messages.
 */
public enum SceneErrorCode {
    // region Lexical & syntactic errors
    /** A token failed the basic shape checks (empty, unbalanced quotes, embedded space). */
    INVALID_TOKEN,
    /** The leading token of a statement is not a known directive keyword. */
    UNKNOWN_DIRECTIVE,
    /** A token of the wrong kind was found, e.g. a missing bracket or a directive inside a value list. */
    UNEXPECTED_TOKEN,
    /** A directive required another token, but the stream ended. */
    UNEXPECTED_END_OF_STREAM,
    /** A quoted string was expected. */
    INVALID_STRING,
    /** A token could not be parsed as a float or integer. */
    INVALID_NUMBER,
    /** A token could not be parsed as a boolean. */
    INVALID_BOOLEAN,
    // endregion

    // region Parameter errors
    /** The type keyword of a {@code "type name"} header is not part of the type vocabulary. */
    INVALID_PARAM_TYPE,
    /** A {@code "type name"} header is missing its type or its name. */
    INVALID_PARAM_NAME,
    /** Two parameters with the same name in one parameter list. */
    DUPLICATE_PARAMETER,
    /** A parameter has the wrong number of values for the entity that consumes it. */
    INVALID_PARAMETER_VALUE,
    // endregion

    // region Semantic errors
    /** CoordSysTransform referenced a name that was never recorded. */
    UNKNOWN_COORDINATE_SYSTEM,
    /** AttributeEnd without a matching AttributeBegin, or open scopes at end of input. */
    UNBALANCED_ATTRIBUTES,
    /** WorldBegin appeared more than once. */
    DUPLICATE_WORLD_BEGIN,
    /** The input ended without a WorldBegin. */
    MISSING_WORLD_BEGIN,
    /** Attribute was given a category other than shape, light, material, medium or texture. */
    UNKNOWN_ATTRIBUTE_TARGET,
    /** Option named an unknown global option. */
    UNKNOWN_OPTION,
    /** Option had a value that is not valid for that option. */
    INVALID_OPTION_VALUE,
    // endregion

    // region Unsupported features
    /** The directive is recognized but deliberately not supported by this loader. */
    UNSUPPORTED_DIRECTIVE,
    /** An Include pointed at a gzip-compressed file. */
    UNSUPPORTED_COMPRESSED_INCLUDE,
    /** An entity type name (camera, shape, material, ...) is not known to the entity factory. */
    UNSUPPORTED_TYPE,
    // endregion

    // region I/O errors
    /** Includes were nested deeper than the configured limit. */
    INCLUDE_DEPTH_EXCEEDED,
    /** An I/O error occurred while reading a file. */
    IO_ERROR_READING_FILE
    // endregion
}
