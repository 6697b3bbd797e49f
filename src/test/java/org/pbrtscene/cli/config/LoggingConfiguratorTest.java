package org.pbrtscene.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private static final String LOADER_LOGGER = "org.pbrtscene.loader.SceneLoader";
    private static final String PARSER_LOGGER = "org.pbrtscene.loader.frontend.parser";
    private static final String BASE_LOGGER = "org.pbrtscene";

    private LoggerContext context;
    private Level rootLevel;
    private Level loaderLevel;
    private Level parserLevel;
    private Level baseLevel;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        loaderLevel = context.getLogger(LOADER_LOGGER).getLevel();
        parserLevel = context.getLogger(PARSER_LOGGER).getLevel();
        baseLevel = context.getLogger(BASE_LOGGER).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger(LOADER_LOGGER).setLevel(loaderLevel);
        context.getLogger(PARSER_LOGGER).setLevel(parserLevel);
        context.getLogger(BASE_LOGGER).setLevel(baseLevel);
    }

    @Test
    void configure_withDefaultLevelAndOverrides_shouldSetLoggerLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.pbrtscene.loader.SceneLoader" = "DEBUG"
                "org.pbrtscene.loader.frontend.parser" = "TRACE"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger(LOADER_LOGGER).getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger(PARSER_LOGGER).getLevel()).isEqualTo(Level.TRACE);
        assertThat(context.getLogger(PARSER_LOGGER + ".DirectiveParser").getEffectiveLevel())
                .isEqualTo(Level.TRACE);
    }

    @Test
    void configure_withReferenceDefaults_shouldApplyShippedLevels() {
        // When
        LoggingConfigurator.configure(ConfigFactory.load());

        // Then
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.WARN);
        assertThat(context.getLogger(BASE_LOGGER).getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void configure_withUnknownLevel_shouldLeaveLoggerUnchanged() {
        // Given
        context.getLogger(LOADER_LOGGER).setLevel(Level.WARN);
        final Config config = ConfigFactory.parseString("""
            logging.levels { "org.pbrtscene.loader.SceneLoader" = "LOUD" }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertThat(context.getLogger(LOADER_LOGGER).getLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void configure_withoutLoggingBlock_shouldDoNothing() {
        // Given
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.INFO);

        // When
        LoggingConfigurator.configure(ConfigFactory.parseString("pbrt-scene.loader.seed = 1"));

        // Then
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.INFO);
    }
}
