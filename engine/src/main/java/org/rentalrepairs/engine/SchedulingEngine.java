package org.rentalrepairs.engine;

import org.rentalrepairs.engine.api.SnapshotCodec;
import org.rentalrepairs.engine.api.dto.ExistingBookingSnapshot;
import org.rentalrepairs.engine.config.EngineConfig;
import org.rentalrepairs.engine.domain.model.AssignmentProposal;
import org.rentalrepairs.engine.domain.model.Specialization;
import org.rentalrepairs.engine.domain.model.ValidationOutcome;
import org.rentalrepairs.engine.domain.model.RepairRequest;
import org.rentalrepairs.engine.domain.model.Worker;
import org.rentalrepairs.engine.domain.service.AssignmentValidator;
import org.rentalrepairs.engine.domain.service.AssignmentValidatorImpl;
import org.rentalrepairs.engine.domain.service.KeywordSpecializationClassifier;
import org.rentalrepairs.engine.domain.service.RosterService;
import org.rentalrepairs.engine.domain.service.RosterServiceImpl;
import org.rentalrepairs.engine.domain.service.SpecializationClassifier;
import org.rentalrepairs.engine.domain.service.WorkerFitnessService;
import org.rentalrepairs.engine.domain.service.WorkerFitnessServiceImpl;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Wires the scheduling services from an {@link EngineConfig}.
 */
public final class SchedulingEngine {

    private static final Logger LOG = Logger.getLogger(SchedulingEngine.class.getName());

    private static final String LOGGING_PROPERTIES = "/logging.properties";

    private final EngineConfig config;
    private final Clock clock;
    private final SpecializationClassifier classifier;
    private final WorkerFitnessService fitnessService;
    private final AssignmentValidator assignmentValidator;
    private final RosterService rosterService;
    private final SnapshotCodec snapshotCodec;

    public SchedulingEngine(EngineConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.classifier = new KeywordSpecializationClassifier();
        this.fitnessService = new WorkerFitnessServiceImpl(config.getScoringConfig(), classifier, clock,
                config.getWorkloadHorizonDays());
        this.assignmentValidator = new AssignmentValidatorImpl();
        this.rosterService = new RosterServiceImpl(fitnessService, config, clock);
        this.snapshotCodec = new SnapshotCodec();
    }

    public SchedulingEngine(EngineConfig config) {
        this(config, Clock.system(config.getZoneId()));
    }

    /**
     * Engine configured from the environment, with file logging applied when enabled.
     */
    public static SchedulingEngine fromEnvironment() {
        EngineConfig config = EngineConfig.fromEnvironment();
        configureLogging(config);
        LOG.info(() -> "Scheduling engine configured: " + config);
        return new SchedulingEngine(config);
    }

    /**
     * Full check of one assignment: worker fitness first, then unit conflicts against the snapshot.
     * Warnings from both stages are kept.
     */
    public ValidationOutcome validateAssignment(Worker worker, RepairRequest request, LocalDate scheduledDate,
                                                List<ExistingBookingSnapshot> existingBookings) {
        ValidationOutcome fitness = fitnessService.validateAssignment(worker, request, scheduledDate);
        if (!fitness.isValid()) {
            return fitness;
        }

        Specialization required = fitnessService.requiredSpecialization(request);
        AssignmentProposal proposal = AssignmentProposal.of(request, worker, scheduledDate, required);
        ValidationOutcome conflicts = assignmentValidator.validate(proposal, existingBookings);
        if (!conflicts.isValid() || fitness.getWarnings().isEmpty()) {
            return conflicts;
        }

        ValidationOutcome.Builder merged = ValidationOutcome.builder();
        fitness.getWarnings().forEach(merged::warning);
        conflicts.getWarnings().forEach(merged::warning);
        conflicts.getConflictingBookings().forEach(merged::conflictingBooking);
        conflicts.getAssignmentsToCancelForEmergency().forEach(merged::cancelForEmergency);
        conflicts.getEmergencyConflicts().forEach(merged::emergencyConflict);
        return merged.build();
    }

    public ValidationOutcome validateAssignment(Worker worker, RepairRequest request, LocalDate scheduledDate,
                                                String existingBookingsJson) {
        return validateAssignment(worker, request, scheduledDate, snapshotCodec.readList(existingBookingsJson));
    }

    public EngineConfig getConfig() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }

    public SpecializationClassifier getClassifier() {
        return classifier;
    }

    public WorkerFitnessService getFitnessService() {
        return fitnessService;
    }

    public AssignmentValidator getAssignmentValidator() {
        return assignmentValidator;
    }

    public RosterService getRosterService() {
        return rosterService;
    }

    public SnapshotCodec getSnapshotCodec() {
        return snapshotCodec;
    }

    /**
     * Applies the bundled {@code logging.properties}, then adds a rotating file handler (5 MB x 3)
     * to the root logger when file logging is enabled.
     */
    public static void configureLogging(EngineConfig config) {
        try (InputStream in = SchedulingEngine.class.getResourceAsStream(LOGGING_PROPERTIES)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to read " + LOGGING_PROPERTIES, e);
        }

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        Logger root = Logger.getLogger("");
        Path target = Paths.get(config.getLogFilePath()).toAbsolutePath();
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            LOG.info(() -> "File logging enabled: " + target);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to setup file logging", e);
        }
    }
}
