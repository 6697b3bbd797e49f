package org.pbrtscene.loader;

import org.pbrtscene.loader.api.ISceneLoader;
import org.pbrtscene.loader.api.SceneErrorCode;
import org.pbrtscene.loader.api.SceneLoadException;
import org.pbrtscene.loader.api.SourceInfo;
import org.pbrtscene.loader.frontend.directive.Directive;
import org.pbrtscene.loader.frontend.directive.DirectiveHandlerRegistry;
import org.pbrtscene.loader.frontend.parser.DirectiveParser;
import org.pbrtscene.loader.scene.Scene;
import org.pbrtscene.loader.scene.SceneBuilder;
import org.pbrtscene.loader.scene.types.DefaultSceneEntityFactory;
import org.pbrtscene.loader.scene.types.ISceneEntityFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The main implementation of the {@link ISceneLoader} interface.
 * <p>
 * Drives the pipeline lexer → directive parser → scene builder. {@code Include} directives push
 * a new {@link DirectiveParser} frame onto an explicit stack; the outer file resumes once the
 * included one is exhausted, and the load ends when the stack is empty. Relative include paths
 * always resolve against the top-level base directory, however deep the nesting.
 * <p>
 * Instances are stateless between calls and may be reused.
 */
public class SceneLoader implements ISceneLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SceneLoader.class);

    static final String MEMORY_FILE_NAME = "<memory>";

    private final LoaderOptions options;
    private final ISceneEntityFactory entityFactory;
    private final DirectiveHandlerRegistry directiveRegistry = DirectiveHandlerRegistry.initialize();

    /**
     * Creates a loader with the options from the classpath configuration.
     */
    public SceneLoader() {
        this(LoaderOptions.defaults());
    }

    public SceneLoader(LoaderOptions options) {
        this(options, new DefaultSceneEntityFactory());
    }

    /**
     * @param options The loader tunables.
     * @param entityFactory Converts resource directives into typed entities.
     */
    public SceneLoader(LoaderOptions options, ISceneEntityFactory entityFactory) {
        this.options = options;
        this.entityFactory = entityFactory;
    }

    /**
     * Loads a scene file with default options.
     * @param file The top-level scene file.
     * @return The loaded scene.
     * @throws SceneLoadException if loading fails.
     */
    public static Scene fromFile(Path file) throws SceneLoadException {
        return new SceneLoader().load(file);
    }

    @Override
    public Scene load(String text, Path baseDirectory) throws SceneLoadException {
        return run(text, MEMORY_FILE_NAME, baseDirectory);
    }

    @Override
    public Scene load(Path file) throws SceneLoadException {
        Path absolute = file.toAbsolutePath().normalize();
        String text = read(absolute, null);
        Path baseDirectory = absolute.getParent() != null ? absolute.getParent() : absolute;
        return run(text, absolute.toString(), baseDirectory);
    }

    private Scene run(String text, String fileName, Path baseDirectory) throws SceneLoadException {
        Map<String, String> sources = new HashMap<>();
        Deque<DirectiveParser> frames = new ArrayDeque<>();
        SceneBuilder builder = new SceneBuilder(entityFactory);

        sources.put(fileName, text);
        frames.push(new DirectiveParser(text, fileName, directiveRegistry));
        LOG.debug("Opened '{}' (base directory '{}')", fileName, baseDirectory);

        try {
            while (!frames.isEmpty()) {
                DirectiveParser frame = frames.peek();
                Optional<Directive> next = frame.parseNext();
                if (next.isEmpty()) {
                    frames.pop();
                    LOG.debug("Finished '{}', include depth now {}", frame.fileName(), frames.size());
                    continue;
                }
                try {
                    if (next.get() instanceof Directive.Include include) {
                        frames.push(openInclude(include, baseDirectory, frames.size(), sources));
                    } else {
                        builder.apply(next.get());
                    }
                } catch (SceneLoadException e) {
                    if (e.getSourceInfo() == null && frame.lastKeyword() != null) {
                        throw e.withSourceInfo(frame.lastKeyword().sourceInfo());
                    }
                    throw e;
                }
            }

            Scene scene = builder.build();
            if (options.logSummary()) {
                LOG.info("Loaded scene '{}': {}", fileName, scene.summary());
            }
            return scene;
        } catch (SceneLoadException e) {
            throw withLineContent(e, sources);
        }
    }

    private DirectiveParser openInclude(Directive.Include include, Path baseDirectory, int depth,
                                        Map<String, String> sources) throws SceneLoadException {
        if (include.path().endsWith(".gz")) {
            throw new SceneLoadException(SceneErrorCode.UNSUPPORTED_COMPRESSED_INCLUDE,
                    "Compressed include '" + include.path() + "' is not supported");
        }
        if (depth >= options.maxIncludeDepth()) {
            throw new SceneLoadException(SceneErrorCode.INCLUDE_DEPTH_EXCEEDED,
                    "Include depth limit of " + options.maxIncludeDepth() + " exceeded by '" + include.path()
                            + "' (include cycle?)");
        }

        Path resolved;
        try {
            resolved = baseDirectory.resolve(include.path()).normalize();
        } catch (InvalidPathException e) {
            throw new SceneLoadException(SceneErrorCode.IO_ERROR_READING_FILE,
                    "Invalid include path '" + include.path() + "': " + e.getReason(), null, e);
        }
        String fileName = resolved.toString();
        String text = read(resolved, include.path());
        sources.put(fileName, text);
        LOG.debug("Including '{}' at depth {}", fileName, depth + 1);
        return new DirectiveParser(text, fileName, directiveRegistry);
    }

    private String read(Path file, String includePath) throws SceneLoadException {
        try {
            return Files.readString(file, options.charset());
        } catch (IOException e) {
            String what = includePath != null ? "included file '" + includePath + "' (" + file + ")" : "'" + file + "'";
            throw new SceneLoadException(SceneErrorCode.IO_ERROR_READING_FILE,
                    "Unable to read " + what + ": " + e.getMessage(), null, e);
        }
    }

    /**
     * Fills in the text of the offending line from the retained source buffers.
     */
    private static SceneLoadException withLineContent(SceneLoadException e, Map<String, String> sources) {
        SourceInfo location = e.getSourceInfo();
        if (location == null || (location.lineContent() != null && !location.lineContent().isEmpty())) {
            return e;
        }
        String source = sources.get(location.fileName());
        if (source == null) {
            return e;
        }
        String[] lines = source.split("\\r\\n|\\r|\\n", -1);
        int index = location.lineNumber() - 1;
        if (index < 0 || index >= lines.length) {
            return e;
        }
        return e.withSourceInfo(new SourceInfo(location.fileName(), location.lineNumber(),
                location.columnNumber(), lines[index]));
    }
}
