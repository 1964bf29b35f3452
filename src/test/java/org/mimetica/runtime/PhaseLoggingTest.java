package org.mimetica.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mimetica.runtime.dynamics.AbstractSpread;
import org.mimetica.runtime.dynamics.DecayEngine;
import org.mimetica.runtime.dynamics.DesireUpdateEngine;
import org.mimetica.runtime.dynamics.ObjectRivalrySource;
import org.mimetica.runtime.dynamics.StatusRivalrySource;
import org.mimetica.runtime.dynamics.StatusUpdateEngine;
import org.mimetica.runtime.metrics.MetricsEngine;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

/**
 * Every phase of a step reports through its own logger at DEBUG.
 */
@Tag("unit")
class PhaseLoggingTest {

    private static final List<Class<?>> PHASES = List.of(
        DesireUpdateEngine.class, ObjectRivalrySource.class, StatusRivalrySource.class,
        AbstractSpread.class, DecayEngine.class, StatusUpdateEngine.class, MetricsEngine.class);

    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attachAppender() {
        appender.start();
        for (Class<?> phase : PHASES) {
            Logger logger = (Logger) LoggerFactory.getLogger(phase);
            logger.setLevel(Level.DEBUG);
            logger.addAppender(appender);
        }
    }

    @AfterEach
    void detachAppender() {
        for (Class<?> phase : PHASES) {
            Logger logger = (Logger) LoggerFactory.getLogger(phase);
            logger.detachAppender(appender);
            logger.setLevel(null);
        }
        appender.stop();
    }

    @Test
    void everyPhaseLogsOncePerStep() {
        SimulationConfig config = SimulationConfig.builder()
            .agents(12)
            .neighbors(4)
            .steps(1)
            .seed(7L)
            .build();

        new Simulation(config, SourceMode.OBJECT, SpreadMode.ATTENTION).step();
        new Simulation(config, SourceMode.STATUS, SpreadMode.LINEAR).step();

        Set<String> loggers = appender.list.stream()
            .filter(e -> e.getLevel() == Level.DEBUG)
            .map(ILoggingEvent::getLoggerName)
            .collect(Collectors.toSet());
        assertThat(loggers).containsExactlyInAnyOrderElementsOf(
            PHASES.stream().map(Class::getName).collect(Collectors.toList()));
        assertThat(appender.list)
            .filteredOn(e -> e.getLoggerName().equals(DecayEngine.class.getName()))
            .hasSize(2);
    }
}
