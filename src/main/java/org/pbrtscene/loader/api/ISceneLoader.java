package org.pbrtscene.loader.api;

import org.pbrtscene.loader.scene.Scene;

import java.nio.file.Path;

/**
 * Defines the public interface for loading scene description files.
 */
public interface ISceneLoader {

    /**
     * Loads a scene from an in-memory buffer.
     *
     * @param text The scene description.
     * @param baseDirectory The directory against which relative {@code Include} paths are resolved.
     * @return The loaded scene.
     * @throws SceneLoadException if the text or any included file is malformed or cannot be read.
     */
    Scene load(String text, Path baseDirectory) throws SceneLoadException;

    /**
     * Loads a scene from a file. Relative includes are resolved against the file's directory.
     *
     * @param file The top-level scene file.
     * @return The loaded scene.
     * @throws SceneLoadException if any file is malformed or cannot be read.
     */
    Scene load(Path file) throws SceneLoadException;
}
